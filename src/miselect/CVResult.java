package miselect;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Cross-validated error curves over the grid of a full-data path, with the
 * minimum-error and one-standard-error selections.
 */
public final class CVResult {
  final SolutionPath _path;
  final double [][]  _cvm;    // [alpha][lambda]
  final double [][]  _cvse;
  final int []       _foldIds;
  public final int   _nfolds;
  /** Fold fits that reported non-convergence at some grid point. */
  public final int   _foldWarnings;

  final int _aMin;
  final int _lMin;
  final int _l1se;
  public final double _lambdaMin;
  public final double _alphaMin;
  public final double _lambda1se;
  public final double _alpha1se;

  CVResult(SolutionPath path, double [][] cvm, double [][] cvse, int [] foldIds, int nfolds, int foldWarnings){
    _path = path;
    _cvm = cvm;
    _cvse = cvse;
    _foldIds = foldIds;
    _nfolds = nfolds;
    _foldWarnings = foldWarnings;
    int aMin = -1, lMin = -1;
    double best = Double.POSITIVE_INFINITY;
    for(int a = 0; a < cvm.length; ++a)
      for(int l = 0; l < cvm[a].length; ++l)
        if(cvm[a][l] < best){
          best = cvm[a][l];
          aMin = a;
          lMin = l;
        }
    if(aMin == -1)
      throw new MIException("cross-validation produced no finite error");
    // lambdas descend, so the first point under the bar has the largest lambda
    final double bar = cvm[aMin][lMin] + cvse[aMin][lMin];
    int l1se = lMin;
    for(int l = 0; l < lMin; ++l)
      if(cvm[aMin][l] <= bar){
        l1se = l;
        break;
      }
    _aMin = aMin;
    _lMin = lMin;
    _l1se = l1se;
    _alphaMin = path.alpha(aMin);
    _lambdaMin = path.point(aMin, lMin)._lambda;
    _alpha1se = _alphaMin;
    _lambda1se = path.point(aMin, l1se)._lambda;
  }

  public SolutionPath path(){return _path;}
  public double [] cvm(int a){return _cvm[a].clone();}
  public double [] cvse(int a){return _cvse[a].clone();}
  public int [] foldIds(){return _foldIds.clone();}

  public PathPoint minPoint(){return _path.point(_aMin, _lMin);}
  public PathPoint oneSePoint(){return _path.point(_aMin, _l1se);}

  public double minError(){return _cvm[_aMin][_lMin];}

  public JsonObject toJson(){
    JsonObject res = new JsonObject();
    res.addProperty("solver", _path._solver.toString());
    res.addProperty("family", _path._family.toString());
    res.addProperty("nfolds", _nfolds);
    res.addProperty("lambdaMin", _lambdaMin);
    res.addProperty("alphaMin", _alphaMin);
    res.addProperty("lambda1se", _lambda1se);
    res.addProperty("alpha1se", _alpha1se);
    res.addProperty("foldWarnings", _foldWarnings);
    JsonArray curves = new JsonArray();
    for(int a = 0; a < _cvm.length; ++a){
      JsonObject c = new JsonObject();
      c.addProperty("alpha", _path.alpha(a));
      c.add("lambda", PathPoint.toJsonArray(_path.lambdas(a)));
      c.add("cvm", PathPoint.toJsonArray(_cvm[a]));
      c.add("cvse", PathPoint.toJsonArray(_cvse[a]));
      curves.add(c);
    }
    res.add("curves", curves);
    res.add("min", minPoint().toJson());
    res.add("path", _path.toJson());
    return res;
  }
}

package miselect;

import java.util.ArrayList;
import java.util.List;

import miselect.MIException.NotFoundException;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Fitted path: for every alpha, the points of its descending lambda sequence.
 */
public final class SolutionPath {
  public enum Solver {
    saenet,
    galasso
  }

  public final Solver _solver;
  public final Family _family;
  final double []     _alphas;
  final double [][]   _lambdas;   // [alpha][lambda], descending
  final PathPoint [][] _points;   // [alpha][lambda]
  public final int    _ncols;
  public final int    _nimp;
  public final long   _time;

  SolutionPath(Solver solver, Family family, double [] alphas, PathPoint [][] points, int ncols, int nimp, long time){
    _solver = solver;
    _family = family;
    _alphas = alphas;
    _points = points;
    _ncols = ncols;
    _nimp = nimp;
    _time = time;
    _lambdas = new double[points.length][];
    for(int a = 0; a < points.length; ++a){
      _lambdas[a] = new double[points[a].length];
      for(int l = 0; l < points[a].length; ++l)
        _lambdas[a][l] = points[a][l]._lambda;
    }
  }

  public int nalpha(){return _alphas.length;}
  public int nlambda(int a){return _lambdas[a].length;}
  public double alpha(int a){return _alphas[a];}
  public double [] alphas(){return _alphas.clone();}
  public double [] lambdas(int a){return _lambdas[a].clone();}
  public PathPoint point(int a, int l){return _points[a][l];}

  /** Index of alpha {@code alpha}, exact match. */
  public int alphaIndex(double alpha){
    for(int a = 0; a < _alphas.length; ++a)
      if(_alphas[a] == alpha)return a;
    throw new NotFoundException("alpha=" + alpha + " is not on the computed grid");
  }

  public int lambdaIndex(int a, double lambda){
    final double [] ls = _lambdas[a];
    for(int l = 0; l < ls.length; ++l)
      if(ls[l] == lambda)return l;
    throw new NotFoundException("lambda=" + lambda + " was not computed for alpha=" + _alphas[a]);
  }

  /** Exact grid lookup, no interpolation. */
  public PathPoint find(double lambda, double alpha){
    int a = alphaIndex(alpha);
    return _points[a][lambdaIndex(a, lambda)];
  }

  public boolean converged(){
    for(PathPoint [] ps:_points)
      for(PathPoint p:ps)
        if(!p._converged)return false;
    return true;
  }

  public List<String> warnings(){
    List<String> res = new ArrayList<String>();
    for(PathPoint [] ps:_points)
      for(PathPoint p:ps)
        if(p._warning != null)res.add(p._warning);
    return res;
  }

  public JsonObject toJson(){
    JsonObject res = new JsonObject();
    res.addProperty("solver", _solver.toString());
    res.addProperty("family", _family.toString());
    res.addProperty("ncols", _ncols);
    res.addProperty("nimputations", _nimp);
    res.addProperty("time", _time);
    JsonArray paths = new JsonArray();
    for(int a = 0; a < _alphas.length; ++a){
      JsonObject path = new JsonObject();
      path.addProperty("alpha", _alphas[a]);
      JsonArray pts = new JsonArray();
      for(PathPoint p:_points[a])
        pts.add(p.toJson());
      path.add("points", pts);
      paths.add(path);
    }
    res.add("paths", paths);
    List<String> warns = warnings();
    if(!warns.isEmpty()){
      JsonArray arr = new JsonArray();
      for(String w:warns)arr.add(w);
      res.add("warnings", arr);
    }
    return res;
  }
}

package miselect;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Solution at one (lambda, alpha) grid point.
 *
 * Coefficients are on the original covariate scale with the intercept stored
 * last. For the grouped lasso the pooled vector is the mean of the
 * per-imputation vectors, which share one zero pattern.
 */
public final class PathPoint {
  public final double  _lambda;
  public final double  _alpha;
  final double []      _beta;
  final double [][]    _perImp;
  final Family         _family;
  /** Non-zero variables (intercept excluded). */
  public final int     _df;
  /** Weighted training deviance, normalised by total weight. */
  public final double  _deviance;
  /** Coordinate descent sweeps spent, summed over IRLS steps. */
  public final int     _iterations;
  public final boolean _converged;
  public final String  _warning;

  PathPoint(double lambda, double alpha, Family family, double [] beta, double [][] perImp,
            double deviance, int iterations, boolean converged, String warning){
    _lambda = lambda;
    _alpha = alpha;
    _family = family;
    _beta = beta;
    _perImp = perImp;
    _deviance = deviance;
    _iterations = iterations;
    _converged = converged;
    _warning = warning;
    int df = 0;
    for(int j = 0; j < beta.length-1; ++j)
      if(beta[j] != 0)++df;
    _df = df;
  }

  public int ncols(){return _beta.length-1;}

  /** Copy of the coefficient vector, intercept last. */
  public double [] beta(){return _beta.clone();}

  public double intercept(){return _beta[_beta.length-1];}

  public boolean isSelected(int j){return _beta[j] != 0;}

  public boolean hasPerImputation(){return _perImp != null;}

  public int nimp(){return (_perImp == null)?1:_perImp.length;}

  /** Coefficients of imputation {@code m}; the pooled vector for the stacked fit. */
  public double [] beta(int m){
    if(_perImp == null){
      if(m != 0)throw new MIException.NotFoundException("stacked fit has a single coefficient vector, no imputation " + m);
      return beta();
    }
    if(m < 0 || m >= _perImp.length)throw new MIException.NotFoundException("no imputation " + m);
    return _perImp[m].clone();
  }

  public double [][] perImputation(){
    if(_perImp == null)return null;
    double [][] res = new double[_perImp.length][];
    for(int m = 0; m < res.length; ++m)
      res[m] = _perImp[m].clone();
    return res;
  }

  public double linearPredictor(double [] row){
    return eta(_beta, row);
  }

  /** Fitted mean (probability for binomial) for one original-scale row. */
  public double predict(double [] row){
    return _family.linkInv(eta(_beta, row));
  }

  public double predict(double [] row, int m){
    double [] b = (_perImp == null)?_beta:_perImp[m];
    return _family.linkInv(eta(b, row));
  }

  static double eta(double [] beta, double [] row){
    if(row.length != beta.length-1)
      throw new MIException.DimensionException("row has " + row.length + " columns, expected " + (beta.length-1));
    double res = beta[beta.length-1];
    for(int j = 0; j < row.length; ++j)
      res += beta[j]*row[j];
    return res;
  }

  public JsonObject toJson(){
    JsonObject res = new JsonObject();
    res.addProperty("lambda", _lambda);
    res.addProperty("alpha", _alpha);
    res.addProperty("df", _df);
    res.addProperty("deviance", _deviance);
    res.addProperty("iterations", _iterations);
    res.addProperty("converged", _converged);
    if(_warning != null)
      res.addProperty("warning", _warning);
    res.add("coefs", toJsonArray(_beta));
    if(_perImp != null){
      JsonArray arr = new JsonArray();
      for(double [] b:_perImp)
        arr.add(toJsonArray(b));
      res.add("imputationCoefs", arr);
    }
    return res;
  }

  static JsonArray toJsonArray(double [] ds){
    JsonArray arr = new JsonArray();
    for(double d:ds)
      arr.add(new JsonPrimitive(d));
    return arr;
  }
}

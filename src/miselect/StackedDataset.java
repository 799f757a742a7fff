package miselect;

/**
 * Owned, column-major buffer of a (possibly stacked) design.
 *
 * Rows are the n observations of imputation 0, then those of imputation 1 and
 * so on. Columns are centred by their weighted mean ({@code _normSub}) and, when
 * standardizing, multiplied by the inverse weighted standard deviation
 * ({@code _normMul}). Nothing here aliases caller arrays.
 */
public final class StackedDataset {
  /** Number of imputations stacked. */
  public final int _nimp;
  /** Observations per imputation. */
  public final int _nobs;
  /** Total rows, _nobs*_nimp. */
  public final int _rows;
  public final int _ncols;

  final double [][] _x;       // [column][row], standardized
  final double []   _y;
  /** Observation weights repeated per imputation, each divided by _nimp. */
  public final double [] _weights;
  /** _weights normalised to sum 1. */
  final double [] _w;
  public final double [] _normSub;
  public final double [] _normMul;
  final boolean [] _constant;
  /** Weighted mean of the response. */
  public final double _ymu;

  StackedDataset(int nimp, int nobs, double [][] xcols, double [] y, double [] weights, boolean standardize){
    _nimp = nimp;
    _nobs = nobs;
    _rows = y.length;
    _ncols = xcols.length;
    _x = xcols;
    _y = y;
    _weights = weights;
    _w = new double[_rows];
    double wsum = 0;
    for(double d:weights)wsum += d;
    double ymu = 0;
    for(int i = 0; i < _rows; ++i){
      _w[i] = weights[i]/wsum;
      ymu += _w[i]*y[i];
    }
    _ymu = ymu;
    _normSub = new double[_ncols];
    _normMul = new double[_ncols];
    _constant = new boolean[_ncols];
    for(int j = 0; j < _ncols; ++j){
      final double [] col = _x[j];
      double mean = 0;
      for(int i = 0; i < _rows; ++i)
        mean += _w[i]*col[i];
      double var = 0;
      for(int i = 0; i < _rows; ++i){
        double d = col[i] - mean;
        var += _w[i]*d*d;
      }
      double sigma = Math.sqrt(var);
      _constant[j] = !(sigma > 1e-12*Math.max(1.0, Math.abs(mean)));
      _normSub[j] = mean;
      _normMul[j] = (standardize && !_constant[j])?1.0/sigma:1.0;
      for(int i = 0; i < _rows; ++i)
        col[i] = _constant[j]?0:(col[i] - mean)*_normMul[j];
    }
  }

  public boolean isConstant(int j){return _constant[j];}

  /**
   * Coefficients on the original covariate scale.
   *
   * @param beta standardized coefficients
   * @param icpt intercept of the standardized fit
   * @return vector of length p+1, intercept last
   */
  public double [] denormalize(double [] beta, double icpt){
    double [] res = new double[_ncols+1];
    double norm = 0.0;        // Reverse any normalization on the intercept
    for(int j = 0; j < _ncols; ++j){
      double b = beta[j]*_normMul[j];
      norm += b*_normSub[j];
      res[j] = b;
    }
    res[_ncols] = icpt - norm;
    return res;
  }

  /** Standardized coefficients of an original-scale vector (intercept last). */
  public double [] normalize(double [] beta){
    double [] res = new double[_ncols+1];
    double icpt = beta[_ncols];
    for(int j = 0; j < _ncols; ++j){
      res[j] = beta[j]/_normMul[j];
      icpt += beta[j]*_normSub[j];
    }
    res[_ncols] = icpt;
    return res;
  }
}

package miselect;

import java.util.Arrays;

/**
 * Stacked adaptive elastic net for one (lambda, alpha) at a time.
 *
 * Minimises, over standardized coefficients b and an unpenalized intercept,
 * <pre>
 *   loss(b) + lambda * ( alpha * sum_j pf_j*adw_j*|b_j| + (1-alpha)/2 * sum_j pf_j*b_j^2 )
 * </pre>
 * where loss is half the weighted residual sum of squares (gaussian) or the
 * weighted negative log-likelihood (binomial, through IRLS), weights
 * normalised to sum 1.
 *
 * The solver keeps its coefficients between calls, so solving a descending
 * lambda sequence one value after the other warm-starts each fit from the
 * previous one. Instances are not thread safe; the dataset may be shared.
 */
public final class ElasticNetSolver implements Irls.Problem {
  final StackedDataset _data;
  final PenaltyContext _penalty;
  final MIParams       _params;
  final Family         _family;

  // state, standardized scale
  final double [] _beta;
  double          _icpt;

  // working quantities of the current quadratic approximation
  final double [] _ww;      // working weights
  final double [] _r;       // working residual z - eta
  final double [] _xv;      // sum_i ww_i x_ij^2
  double          _wwsum;

  // current problem
  double  _l1;
  double  _l2;
  boolean _nullModel;
  String  _nullWarning;   // reported with the next solved point

  public ElasticNetSolver(StackedDataset data, PenaltyContext penalty, MIParams params){
    if(penalty.ncols() != data._ncols)
      throw new MIException.DimensionException("penalty covers " + penalty.ncols() + " variables, data has " + data._ncols);
    _data = data;
    _penalty = penalty;
    _params = params;
    _family = params._family;
    _beta = new double[data._ncols];
    _ww = new double[data._rows];
    _r = new double[data._rows];
    _xv = new double[data._ncols];
    reset();
  }

  /** Back to the model with intercept only. */
  public void reset(){
    Arrays.fill(_beta, 0);
    _icpt = _family.nullIntercept(_data._ymu);
  }

  /**
   * Smallest lambda at which every L1-penalized coefficient is zero for the
   * given alpha. Leaves the solver at the null model (intercept and
   * unpenalized variables fitted), which is the warm start of a path.
   */
  public double lambdaMax(double alpha){
    reset();
    _nullModel = true;
    _l1 = 0;
    _l2 = 0;
    try {
      Irls.Result r = Irls.run(this, _family, _params);
      _nullWarning = (r._warning == null)?null:"null model: " + r._warning;
    } finally {
      _nullModel = false;
    }
    final double a = Math.max(alpha, 1e-3);
    double res = 0;
    for(int j = 0; j < _data._ncols; ++j){
      if(_data._constant[j] || _penalty.l1(j) == 0)continue;
      res = Math.max(res, Math.abs(gradient(j))/(a*_penalty.l1(j)));
    }
    if(!(res > 0))return 1.0;
    // guard against rounding in the threshold comparison of the first point
    return res*(1 + 1e-9);
  }

  public PathPoint solve(double lambda, double alpha){
    _l1 = lambda*alpha;
    _l2 = lambda*(1 - alpha);
    Irls.Result r = Irls.run(this, _family, _params);
    String warn = Irls.warning("lambda=" + lambda + ", alpha=" + alpha, _nullWarning, r._warning);
    boolean converged = r._converged && _nullWarning == null;
    _nullWarning = null;
    return new PathPoint(lambda, alpha, _family, coefficients(), null, r._deviance, r._iterations, converged, warn);
  }

  /** Current coefficients on the original scale, intercept last. */
  public double [] coefficients(){
    return _data.denormalize(_beta, _icpt);
  }

  @Override public double reweight(){
    final int N = _data._rows;
    final double [] eta = new double[N];
    Arrays.fill(eta, _icpt);
    for(int j = 0; j < _data._ncols; ++j){
      final double b = _beta[j];
      if(b == 0)continue;
      final double [] x = _data._x[j];
      for(int i = 0; i < N; ++i)
        eta[i] += b*x[i];
    }
    final double [] y = _data._y;
    final double [] w = _data._w;
    double dev = 0;
    _wwsum = 0;
    for(int i = 0; i < N; ++i){
      final double mu = _family.linkInv(eta[i]);
      dev += w[i]*_family.deviance(y[i], mu);
      if(_family == Family.gaussian){
        _ww[i] = w[i];
        _r[i] = y[i] - eta[i];
      } else {
        final double p = _family.clip(mu);
        final double var = _family.variance(p);
        _ww[i] = w[i]*var;
        _r[i] = (y[i] - p)/var;
      }
      _wwsum += _ww[i];
    }
    for(int j = 0; j < _data._ncols; ++j){
      final double [] x = _data._x[j];
      double s = 0;
      for(int i = 0; i < N; ++i)
        s += _ww[i]*x[i]*x[i];
      _xv[j] = s;
    }
    return dev;
  }

  final double gradient(int j){
    final double [] x = _data._x[j];
    double g = 0;
    for(int i = 0; i < _r.length; ++i)
      g += _ww[i]*x[i]*_r[i];
    return g;
  }

  static double shrinkage(double x, double kappa){
    return Math.max(0, x - kappa) - Math.max(0, -x - kappa);
  }

  @Override public int innerSolve(){
    boolean full = true;
    for(int sweep = 1; sweep <= _params._maxIter; ++sweep){
      double dmax = sweep(full);
      if(dmax < _params._eps){
        if(full)return sweep;
        full = true;          // confirm on all variables
      } else
        full = false;         // iterate on the active set
    }
    return -_params._maxIter;
  }

  private double sweep(boolean full){
    double dmax = 0;
    for(int j = 0; j < _data._ncols; ++j){
      final double bj = _beta[j];
      if(!full && bj == 0)continue;
      if(_data._constant[j] || _xv[j] == 0)continue;
      if(_nullModel && !_penalty.isFree(j))continue;
      final double g = gradient(j) + _xv[j]*bj;
      final double nb = shrinkage(g, _l1*_penalty.l1(j))/(_xv[j] + _l2*_penalty.l2(j));
      if(nb == bj)continue;
      final double d = nb - bj;
      final double [] x = _data._x[j];
      for(int i = 0; i < _r.length; ++i)
        _r[i] -= d*x[i];
      _beta[j] = nb;
      dmax = Math.max(dmax, Math.abs(d)/Math.max(Math.abs(nb), 1.0));
    }
    // intercept, unpenalized
    double s = 0;
    for(int i = 0; i < _r.length; ++i)
      s += _ww[i]*_r[i];
    final double d0 = s/_wwsum;
    if(d0 != 0){
      for(int i = 0; i < _r.length; ++i)
        _r[i] -= d0;
      _icpt += d0;
      dmax = Math.max(dmax, Math.abs(d0)/Math.max(Math.abs(_icpt), 1.0));
    }
    return dmax;
  }
}

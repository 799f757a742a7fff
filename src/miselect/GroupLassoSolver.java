package miselect;

import java.util.Arrays;

/**
 * Grouped adaptive lasso across imputations.
 *
 * Each imputation m has its own coefficients b_{.,m} and intercept, fitted on
 * its own design. The penalty couples the M copies of every variable:
 * <pre>
 *   (1/M) sum_m loss_m(b_m) + lambda * sum_j pf_j*adw_j*||b_{j,.}||_2
 * </pre>
 * so a variable is either in the model for every imputation or for none. An
 * optional ridge term lambda*(1-alpha)/2*sum_j pf_j*||b_{j,.}||^2 is supported
 * for alpha below 1.
 *
 * Groups are updated by a majorised group soft-threshold whose step constant
 * is the largest curvature of the group over imputations. A variable that is
 * constant in any imputation stays at zero in all of them.
 */
public final class GroupLassoSolver implements Irls.Problem {
  final StackedDataset [] _data;   // one per imputation
  final PenaltyContext    _penalty;
  final MIParams          _params;
  final Family            _family;
  final int _nimp;
  final int _ncols;
  // constant in at least one imputation: the whole group stays at zero
  final boolean [] _pinned;

  // state, standardized scale per imputation
  final double [][] _beta;    // [variable][imputation]
  final double []   _icpt;

  final double [][] _ww;      // [imputation][row]
  final double [][] _r;
  final double [][] _xv;      // [variable][imputation], includes the 1/M factor
  final double []   _wwsum;

  double  _l1;
  double  _l2;
  boolean _nullModel;
  String  _nullWarning;   // reported with the next solved point

  public GroupLassoSolver(StackedDataset [] data, PenaltyContext penalty, MIParams params){
    _nimp = data.length;
    _ncols = data[0]._ncols;
    for(StackedDataset d:data)
      if(d._ncols != _ncols || d._nimp != 1)
        throw new MIException.DimensionException("grouped lasso expects one single-imputation design per imputation with " + _ncols + " columns");
    if(penalty.ncols() != _ncols)
      throw new MIException.DimensionException("penalty covers " + penalty.ncols() + " variables, data has " + _ncols);
    _data = data;
    _penalty = penalty;
    _params = params;
    _family = params._family;
    _beta = new double[_ncols][_nimp];
    _icpt = new double[_nimp];
    _ww = new double[_nimp][];
    _r = new double[_nimp][];
    for(int m = 0; m < _nimp; ++m){
      _ww[m] = new double[data[m]._rows];
      _r[m] = new double[data[m]._rows];
    }
    _xv = new double[_ncols][_nimp];
    _wwsum = new double[_nimp];
    _pinned = new boolean[_ncols];
    for(int j = 0; j < _ncols; ++j)
      for(StackedDataset d:data)
        _pinned[j] |= d._constant[j];
    reset();
  }

  public void reset(){
    for(double [] b:_beta)Arrays.fill(b, 0);
    for(int m = 0; m < _nimp; ++m)
      _icpt[m] = _family.nullIntercept(_data[m]._ymu);
  }

  /**
   * Smallest lambda zeroing every L1-penalized group. Leaves the solver at the
   * null model.
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
    for(int j = 0; j < _ncols; ++j){
      if(_pinned[j] || _penalty.l1(j) == 0)continue;
      double s = 0;
      for(int m = 0; m < _nimp; ++m){
        double g = gradient(j, m);
        s += g*g;
      }
      res = Math.max(res, Math.sqrt(s)/(a*_penalty.l1(j)));
    }
    if(!(res > 0))return 1.0;
    // guard against rounding in the threshold comparison of the first point
    return res*(1 + 1e-9);
  }

  public PathPoint solve(double lambda, double alpha){
    _l1 = lambda*alpha;
    _l2 = lambda*(1 - alpha);
    Irls.Result r = Irls.run(this, _family, _params);
    String warn = Irls.warning("lambda=" + lambda, _nullWarning, r._warning);
    boolean converged = r._converged && _nullWarning == null;
    _nullWarning = null;
    double [][] perImp = new double[_nimp][];
    double [] pooled = new double[_ncols+1];
    for(int m = 0; m < _nimp; ++m){
      perImp[m] = coefficients(m);
      for(int j = 0; j <= _ncols; ++j)
        pooled[j] += perImp[m][j]/_nimp;
    }
    return new PathPoint(lambda, alpha, _family, pooled, perImp, r._deviance, r._iterations, converged, warn);
  }

  public double [] coefficients(int m){
    double [] b = new double[_ncols];
    for(int j = 0; j < _ncols; ++j)
      b[j] = _beta[j][m];
    return _data[m].denormalize(b, _icpt[m]);
  }

  private boolean isZeroGroup(int j){
    for(double d:_beta[j])
      if(d != 0)return false;
    return true;
  }

  @Override public double reweight(){
    double dev = 0;
    for(int m = 0; m < _nimp; ++m)
      dev += reweight(m);
    return dev/_nimp;
  }

  private double reweight(int m){
    final StackedDataset d = _data[m];
    final int N = d._rows;
    final double [] eta = new double[N];
    Arrays.fill(eta, _icpt[m]);
    for(int j = 0; j < _ncols; ++j){
      final double b = _beta[j][m];
      if(b == 0)continue;
      final double [] x = d._x[j];
      for(int i = 0; i < N; ++i)
        eta[i] += b*x[i];
    }
    final double [] ww = _ww[m];
    final double [] r = _r[m];
    double dev = 0;
    double wwsum = 0;
    for(int i = 0; i < N; ++i){
      final double mu = _family.linkInv(eta[i]);
      dev += d._w[i]*_family.deviance(d._y[i], mu);
      if(_family == Family.gaussian){
        ww[i] = d._w[i];
        r[i] = d._y[i] - eta[i];
      } else {
        final double p = _family.clip(mu);
        final double var = _family.variance(p);
        ww[i] = d._w[i]*var;
        r[i] = (d._y[i] - p)/var;
      }
      wwsum += ww[i];
    }
    _wwsum[m] = wwsum;
    for(int j = 0; j < _ncols; ++j){
      final double [] x = d._x[j];
      double s = 0;
      for(int i = 0; i < N; ++i)
        s += ww[i]*x[i]*x[i];
      _xv[j][m] = s/_nimp;
    }
    return dev;
  }

  final double gradient(int j, int m){
    final double [] x = _data[m]._x[j];
    final double [] ww = _ww[m];
    final double [] r = _r[m];
    double g = 0;
    for(int i = 0; i < r.length; ++i)
      g += ww[i]*x[i]*r[i];
    return g/_nimp;
  }

  @Override public int innerSolve(){
    boolean full = true;
    for(int sweep = 1; sweep <= _params._maxIter; ++sweep){
      double dmax = sweep(full);
      if(dmax < _params._eps){
        if(full)return sweep;
        full = true;
      } else
        full = false;
    }
    return -_params._maxIter;
  }

  private double sweep(boolean full){
    double dmax = 0;
    final double [] u = new double[_nimp];
    for(int j = 0; j < _ncols; ++j){
      final double [] bj = _beta[j];
      if(_pinned[j])continue;
      if(!full && isZeroGroup(j))continue;
      if(_nullModel && !_penalty.isFree(j))continue;
      if(_penalty.isFree(j)){
        // no coupling: exact update per imputation
        for(int m = 0; m < _nimp; ++m){
          if(_xv[j][m] == 0)continue;
          dmax = Math.max(dmax, move(j, m, bj[m] + gradient(j, m)/_xv[j][m]));
        }
        continue;
      }
      double L = 0;
      for(int m = 0; m < _nimp; ++m)
        L = Math.max(L, _xv[j][m]);
      if(L == 0)continue;
      double norm = 0;
      for(int m = 0; m < _nimp; ++m){
        u[m] = bj[m] + gradient(j, m)/L;
        norm += u[m]*u[m];
      }
      norm = Math.sqrt(norm);
      final double kappa = _l1*_penalty.l1(j);
      final double f = (L*norm <= kappa)?0:(1 - kappa/(L*norm))*L/(L + _l2*_penalty.l2(j));
      for(int m = 0; m < _nimp; ++m)
        dmax = Math.max(dmax, move(j, m, u[m]*f));
    }
    // intercepts, one per imputation and not coupled
    for(int m = 0; m < _nimp; ++m){
      final double [] r = _r[m];
      final double [] ww = _ww[m];
      double s = 0;
      for(int i = 0; i < r.length; ++i)
        s += ww[i]*r[i];
      final double d0 = s/_wwsum[m];
      if(d0 == 0)continue;
      for(int i = 0; i < r.length; ++i)
        r[i] -= d0;
      _icpt[m] += d0;
      dmax = Math.max(dmax, Math.abs(d0)/Math.max(Math.abs(_icpt[m]), 1.0));
    }
    return dmax;
  }

  private double move(int j, int m, double nb){
    final double b = _beta[j][m];
    if(nb == b)return 0;
    final double d = nb - b;
    final double [] x = _data[m]._x[j];
    final double [] r = _r[m];
    for(int i = 0; i < r.length; ++i)
      r[i] -= d*x[i];
    _beta[j][m] = nb;
    return Math.abs(d)/Math.max(Math.abs(nb), 1.0);
  }
}

package miselect;

/**
 * Outer iteratively reweighted least squares loop shared by both engines.
 *
 * The engine supplies the two halves: {@link Problem#reweight()} forms the
 * quadratic approximation around the current coefficients and
 * {@link Problem#innerSolve()} minimises the penalized quadratic by coordinate
 * descent. For gaussian data the approximation is exact and one pass suffices.
 */
final class Irls {
  private Irls(){}

  interface Problem {
    /**
     * Recomputes working weights, working response and residuals for the
     * current coefficients.
     *
     * @return deviance of the current coefficients
     */
    double reweight();

    /**
     * Coordinate descent on the current quadratic approximation.
     *
     * @return number of sweeps, negated when the sweep cap was hit
     */
    int innerSolve();
  }

  static final class Result {
    final int     _iterations;
    final boolean _converged;
    final double  _deviance;
    final String  _warning;
    Result(int iterations, boolean converged, double deviance, String warning){
      _iterations = iterations;
      _converged = converged;
      _deviance = deviance;
      _warning = warning;
    }
  }

  static Result run(Problem p, Family family, MIParams params){
    double dev = p.reweight();
    int sweeps = 0;
    boolean innerOk = true;
    for(int iter = 0; iter < params._irlsMaxIter; ++iter){
      int s = p.innerSolve();
      if(s < 0){
        innerOk = false;
        s = -s;
      }
      sweeps += s;
      double newDev = p.reweight();
      if(family == Family.gaussian)
        return result(sweeps, innerOk, true, newDev, params);
      boolean done = Math.abs(newDev - dev)/(Math.abs(newDev) + 0.1) < params._eps;
      dev = newDev;
      if(done)return result(sweeps, innerOk, true, dev, params);
    }
    return result(sweeps, innerOk, false, dev, params);
  }

  /** Joins the warnings of one grid point, or null when there are none. */
  static String warning(String where, String nullModel, String point){
    if(nullModel == null && point == null)return null;
    if(nullModel == null)return where + ": " + point;
    if(point == null)return where + ": " + nullModel;
    return where + ": " + nullModel + "; " + point;
  }

  private static Result result(int sweeps, boolean innerOk, boolean outerOk, double dev, MIParams params){
    String warn = null;
    if(!innerOk)
      warn = "coordinate descent did not converge in " + params._maxIter + " sweeps";
    else if(!outerOk)
      warn = "IRLS did not converge in " + params._irlsMaxIter + " iterations";
    return new Result(sweeps, innerOk && outerOk, dev, warn);
  }
}

package miselect;

import miselect.MIException.InvalidParameterException;

/**
 * Picks the coefficient vector of one grid point out of a fitted path.
 *
 * Lookups are exact: a (lambda, alpha) that was not computed is an error,
 * nothing is interpolated. {@code Double.NaN} stands for "not given".
 */
public final class CoefficientSelector {
  private CoefficientSelector(){}

  /** Selection rules of a cross-validated fit. */
  public enum Selection {
    /** lambda.min / alpha.min */
    min,
    /** lambda.1se at alpha.min */
    oneSe
  }

  public static PathPoint point(SolutionPath path, double lambda, double alpha){
    if(Double.isNaN(lambda))
      throw new InvalidParameterException("lambda is required to select from a path without cross-validation");
    if(Double.isNaN(alpha)){
      if(path.nalpha() != 1)
        throw new InvalidParameterException("path has " + path.nalpha() + " alphas, alpha must be given");
      alpha = path.alpha(0);
    }
    return path.find(lambda, alpha);
  }

  public static PathPoint point(CVResult cv, double lambda, double alpha){
    if(Double.isNaN(lambda) && Double.isNaN(alpha))return cv.minPoint();
    if(Double.isNaN(lambda))lambda = cv._lambdaMin;
    if(Double.isNaN(alpha))alpha = cv._alphaMin;
    return cv.path().find(lambda, alpha);
  }

  public static PathPoint point(CVResult cv, Selection s){
    switch(s){
    case min:
      return cv.minPoint();
    case oneSe:
      return cv.oneSePoint();
    default:
      throw new Error("unexpected selection " + s);
    }
  }

  /** Stored coefficients at (lambda, alpha), intercept last. */
  public static double [] select(SolutionPath path, double lambda, double alpha){
    return point(path, lambda, alpha).beta();
  }

  public static double [] select(CVResult cv, double lambda, double alpha){
    return point(cv, lambda, alpha).beta();
  }

  public static double [] select(CVResult cv){
    return select(cv, Selection.min);
  }

  public static double [] select(CVResult cv, Selection s){
    return point(cv, s).beta();
  }
}

package miselect;

import java.util.Arrays;

/**
 * Entry points of the fitting engine.
 *
 * <p>Every call validates shapes and parameters before solving anything and
 * either returns a complete result, possibly carrying convergence warnings on
 * individual grid points, or throws an {@link MIException}.
 *
 * <p>Coefficient vectors have length p+1 with the intercept last and are on the
 * original covariate scale.
 */
public final class MISelect {
  private MISelect(){}

  public static final double [] DEFAULT_ALPHAS = new double[]{1.0};

  // ---
  // Stacked adaptive elastic net

  public static SolutionPath fitSaenet(double [][][] x, double [][] y, double [] penaltyFactors, double [] adaptiveWeights,
                                       double [] obsWeights, Family family, double [] alphaGrid, double [] lambdaGrid){
    return fitSaenet(x, y, penaltyFactors, adaptiveWeights, obsWeights, alphaGrid, lambdaGrid, new MIParams(family));
  }

  public static SolutionPath fitSaenet(double [][][] x, double [][] y, double [] penaltyFactors, double [] adaptiveWeights,
                                       double [] obsWeights, double [] alphaGrid, double [] lambdaGrid, MIParams params){
    ImputedDataset data = new ImputedDataset(x, y);
    PenaltyContext pen = new PenaltyContext(penaltyFactors, adaptiveWeights, data.ncols());
    return PathDriver.saenet(data, obsWeights, pen, alphas(alphaGrid), lambdaGrid, params);
  }

  public static CVResult cvSaenet(double [][][] x, double [][] y, double [] penaltyFactors, double [] adaptiveWeights,
                                  double [] obsWeights, Family family, double [] alphaGrid, double [] lambdaGrid,
                                  int nfolds, long seed){
    MIParams params = new MIParams(family);
    params._nfolds = nfolds;
    params._seed = seed;
    return cvSaenet(x, y, penaltyFactors, adaptiveWeights, obsWeights, alphaGrid, lambdaGrid, params, null);
  }

  /**
   * @param foldIds 0-based fold of each observation, or null to draw folds
   *                from the parameters' seed
   */
  public static CVResult cvSaenet(double [][][] x, double [][] y, double [] penaltyFactors, double [] adaptiveWeights,
                                  double [] obsWeights, double [] alphaGrid, double [] lambdaGrid, MIParams params,
                                  int [] foldIds){
    ImputedDataset data = new ImputedDataset(x, y);
    PenaltyContext pen = new PenaltyContext(penaltyFactors, adaptiveWeights, data.ncols());
    return CrossValidator.saenet(data, obsWeights, pen, alphas(alphaGrid), lambdaGrid, params, foldIds);
  }

  // ---
  // Grouped adaptive lasso

  public static SolutionPath fitGalasso(double [][][] x, double [][] y, double [] penaltyFactors, double [] adaptiveWeights,
                                        Family family, double [] lambdaGrid){
    return fitGalasso(x, y, penaltyFactors, adaptiveWeights, lambdaGrid, new MIParams(family));
  }

  public static SolutionPath fitGalasso(double [][][] x, double [][] y, double [] penaltyFactors, double [] adaptiveWeights,
                                        double [] lambdaGrid, MIParams params){
    ImputedDataset data = new ImputedDataset(x, y);
    PenaltyContext pen = new PenaltyContext(penaltyFactors, adaptiveWeights, data.ncols());
    return PathDriver.galasso(data, pen, lambdaGrid, params);
  }

  public static CVResult cvGalasso(double [][][] x, double [][] y, double [] penaltyFactors, double [] adaptiveWeights,
                                   Family family, double [] lambdaGrid, int nfolds, long seed){
    MIParams params = new MIParams(family);
    params._nfolds = nfolds;
    params._seed = seed;
    return cvGalasso(x, y, penaltyFactors, adaptiveWeights, lambdaGrid, params, null);
  }

  public static CVResult cvGalasso(double [][][] x, double [][] y, double [] penaltyFactors, double [] adaptiveWeights,
                                   double [] lambdaGrid, MIParams params, int [] foldIds){
    ImputedDataset data = new ImputedDataset(x, y);
    PenaltyContext pen = new PenaltyContext(penaltyFactors, adaptiveWeights, data.ncols());
    return CrossValidator.galasso(data, pen, lambdaGrid, params, foldIds);
  }

  // ---
  // Selection

  /** Exact grid lookup; alpha may be NaN when the path has a single alpha. */
  public static double [] selectCoefficients(SolutionPath path, double lambda, double alpha){
    return CoefficientSelector.select(path, lambda, alpha);
  }

  /** NaN lambda and/or alpha default to lambda.min / alpha.min. */
  public static double [] selectCoefficients(CVResult cv, double lambda, double alpha){
    return CoefficientSelector.select(cv, lambda, alpha);
  }

  public static double [] selectCoefficients(CVResult cv){
    return CoefficientSelector.select(cv);
  }

  private static double [] alphas(double [] alphaGrid){
    return (alphaGrid == null)?Arrays.copyOf(DEFAULT_ALPHAS, 1):alphaGrid;
  }
}

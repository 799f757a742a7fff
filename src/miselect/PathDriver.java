package miselect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.RecursiveAction;

import miselect.MIException.DimensionException;
import miselect.SolutionPath.Solver;
import miselect.util.Check;
import miselect.util.Jobs;
import miselect.util.Timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the regularization grid and walks an engine along it.
 *
 * Each alpha gets its own descending lambda sequence, fitted in isolation
 * with warm starts from one lambda to the next. Different alphas run as
 * separate jobs.
 */
public final class PathDriver {
  private static final Logger log = LoggerFactory.getLogger(PathDriver.class);

  private PathDriver(){}

  /**
   * {@code n} values log-spaced from {@code lmax} down to {@code lmax*ratio}.
   */
  public static double [] lambdaSequence(double lmax, double ratio, int n){
    double [] res = new double[n];
    res[0] = lmax;
    if(n == 1)return res;
    final double step = Math.log(ratio)/(n - 1);
    for(int i = 1; i < n; ++i)
      res[i] = lmax*Math.exp(step*i);
    return res;
  }

  static double [] descending(double [] grid){
    double [] res = grid.clone();
    Arrays.sort(res);
    for(int i = 0, j = res.length-1; i < j; ++i, --j){
      double t = res[i];
      res[i] = res[j];
      res[j] = t;
    }
    return res;
  }

  static void checkInputs(ImputedDataset data, PenaltyContext penalty, MIParams params){
    params.validate();
    if(penalty.ncols() != data.ncols())
      throw new DimensionException("penalty covers " + penalty.ncols() + " variables, data has " + data.ncols());
    data.checkResponse(params._family);
  }

  // ---
  // Stacked adaptive elastic net

  /**
   * @param lambdaGrid caller supplied lambdas used for every alpha, or null to
   *                   derive one sequence per alpha
   */
  public static SolutionPath saenet(ImputedDataset data, double [] obsWeights, PenaltyContext penalty,
                                    double [] alphas, double [] lambdaGrid, MIParams params){
    checkInputs(data, penalty, params);
    Check.alphaGrid(alphas);
    Check.lambdaGrid(lambdaGrid);
    double [][] lambdas = null;
    if(lambdaGrid != null){
      lambdas = new double[alphas.length][];
      Arrays.fill(lambdas, descending(lambdaGrid));
    }
    StackedDataset stacked = Stacker.stack(data, obsWeights, params._standardize);
    return saenet(stacked, penalty, alphas.clone(), lambdas, params);
  }

  static SolutionPath saenet(final StackedDataset data, final PenaltyContext penalty, final double [] alphas,
                             final double [][] lambdas, final MIParams params){
    Timer t = new Timer();
    final PathPoint [][] points = new PathPoint[alphas.length][];
    List<RecursiveAction> jobs = new ArrayList<RecursiveAction>();
    for(int a = 0; a < alphas.length; ++a){
      final int A = a;
      jobs.add(new RecursiveAction() {
        @Override protected void compute() {
          points[A] = saenetPath(data, penalty, alphas[A], (lambdas == null)?null:lambdas[A], params);
        }
      });
    }
    Jobs.invokeAll(jobs, params.nthreads());
    SolutionPath res = new SolutionPath(Solver.saenet, params._family, alphas, points, data._ncols, data._nimp, t.time());
    log.info("saenet path: {} alpha(s) x {} lambda(s) on {} rows x {} columns ({} imputations) in {}",
        alphas.length, points[0].length, data._rows, data._ncols, data._nimp, t);
    return res;
  }

  static PathPoint [] saenetPath(StackedDataset data, PenaltyContext penalty, double alpha, double [] lambdas, MIParams params){
    ElasticNetSolver solver = new ElasticNetSolver(data, penalty, params);
    double lmax = solver.lambdaMax(alpha);
    if(lambdas == null)
      lambdas = lambdaSequence(lmax, params.lambdaMinRatio(penalty._adw), params._nlambda);
    PathPoint [] res = new PathPoint[lambdas.length];
    for(int l = 0; l < lambdas.length; ++l){
      res[l] = solver.solve(lambdas[l], alpha);
      report(res[l]);
    }
    return res;
  }

  // ---
  // Grouped adaptive lasso

  public static SolutionPath galasso(ImputedDataset data, PenaltyContext penalty, double [] lambdaGrid, MIParams params){
    return galasso(data, penalty, 1.0, lambdaGrid, params);
  }

  /**
   * Grouped lasso path with an optional ridge share, {@code alpha < 1}.
   */
  public static SolutionPath galasso(ImputedDataset data, PenaltyContext penalty, double alpha, double [] lambdaGrid, MIParams params){
    checkInputs(data, penalty, params);
    Check.alpha(alpha);
    Check.lambdaGrid(lambdaGrid);
    Timer t = new Timer();
    StackedDataset [] designs = designs(data, params);
    PathPoint [] pts = galassoPath(designs, penalty, alpha, (lambdaGrid == null)?null:descending(lambdaGrid), params);
    SolutionPath res = new SolutionPath(Solver.galasso, params._family, new double[]{alpha}, new PathPoint[][]{pts},
        data.ncols(), data.nimp(), t.time());
    log.info("galasso path: {} lambda(s) on {} imputations of {} rows x {} columns in {}",
        pts.length, data.nimp(), data.nobs(), data.ncols(), t);
    return res;
  }

  static StackedDataset [] designs(ImputedDataset data, MIParams params){
    StackedDataset [] res = new StackedDataset[data.nimp()];
    for(int m = 0; m < res.length; ++m)
      res[m] = Stacker.single(data, m, params._standardize);
    return res;
  }

  static PathPoint [] galassoPath(StackedDataset [] designs, PenaltyContext penalty, double alpha, double [] lambdas, MIParams params){
    GroupLassoSolver solver = new GroupLassoSolver(designs, penalty, params);
    double lmax = solver.lambdaMax(alpha);
    if(lambdas == null)
      lambdas = lambdaSequence(lmax, params.lambdaMinRatio(penalty._adw), params._nlambda);
    PathPoint [] res = new PathPoint[lambdas.length];
    for(int l = 0; l < lambdas.length; ++l){
      res[l] = solver.solve(lambdas[l], alpha);
      report(res[l]);
    }
    return res;
  }

  private static void report(PathPoint p){
    if(p._warning != null)
      log.warn(p._warning);
    else if(log.isDebugEnabled())
      log.debug("lambda={} alpha={} df={} deviance={} sweeps={}", p._lambda, p._alpha, p._df, p._deviance, p._iterations);
  }
}

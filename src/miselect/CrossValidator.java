package miselect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.RecursiveAction;

import miselect.MIException.DimensionException;
import miselect.MIException.InsufficientFoldsException;
import miselect.util.Check;
import miselect.util.Jobs;
import miselect.util.Timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * k-fold cross-validation of either engine.
 *
 * Folds are made of original observations: holding out observation i removes
 * its row from every imputation. The full-data path fixes the lambda grid and
 * every fold is fitted on that same grid, one job per fold and alpha. Each job
 * writes its own slot of the error table, which is aggregated once all jobs
 * are done.
 */
public final class CrossValidator {
  private static final Logger log = LoggerFactory.getLogger(CrossValidator.class);

  private CrossValidator(){}

  /**
   * Reproducible fold assignment: a seeded permutation of the observations
   * dealt round-robin into {@code nfolds} folds.
   */
  public static int [] foldIds(int nobs, int nfolds, long seed){
    if(nfolds < 2)throw new InsufficientFoldsException("nfolds must be >= 2, got " + nfolds);
    if(nfolds > nobs)throw new InsufficientFoldsException("nfolds=" + nfolds + " leaves empty folds with " + nobs + " observations");
    int [] perm = new int[nobs];
    for(int i = 0; i < nobs; ++i)perm[i] = i;
    Random rnd = new Random(seed);
    for(int i = nobs-1; i > 0; --i){
      int j = rnd.nextInt(i+1);
      int t = perm[i]; perm[i] = perm[j]; perm[j] = t;
    }
    int [] res = new int[nobs];
    for(int i = 0; i < nobs; ++i)
      res[perm[i]] = i % nfolds;
    return res;
  }

  /** @return number of folds described by {@code foldIds} */
  static int checkFolds(int [] foldIds, int nobs){
    if(foldIds.length != nobs)
      throw new DimensionException("fold ids have length " + foldIds.length + ", expected " + nobs);
    int k = 0;
    for(int f:foldIds){
      if(f < 0)throw new MIException.InvalidParameterException("fold ids must be >= 0, got " + f);
      k = Math.max(k, f+1);
    }
    if(k < 2)throw new InsufficientFoldsException("need at least 2 folds, got " + k);
    int [] counts = new int[k];
    for(int f:foldIds)++counts[f];
    for(int f = 0; f < k; ++f)
      if(counts[f] == 0)throw new InsufficientFoldsException("fold " + f + " is empty");
    return k;
  }

  private static boolean [] trainMask(int [] foldIds, int f){
    boolean [] res = new boolean[foldIds.length];
    for(int i = 0; i < res.length; ++i)
      res[i] = foldIds[i] != f;
    return res;
  }

  private static double [] subset(double [] w, boolean [] keep){
    int n = 0;
    for(boolean b:keep)if(b)++n;
    double [] res = new double[n];
    for(int i = 0, r = 0; i < w.length; ++i)
      if(keep[i])res[r++] = w[i];
    return res;
  }

  // ---
  // Stacked adaptive elastic net

  /**
   * @param foldIds fold of every observation (0-based), or null to draw
   *                {@code params._nfolds} folds from {@code params._seed}
   */
  public static CVResult saenet(final ImputedDataset data, final double [] obsWeights, final PenaltyContext penalty,
                                double [] alphas, double [] lambdaGrid, final MIParams params, int [] foldIds){
    PathDriver.checkInputs(data, penalty, params);
    Check.alphaGrid(alphas);
    Check.lambdaGrid(lambdaGrid);
    Check.length("observation weights", obsWeights, data.nobs());
    Check.positive("observation weights", obsWeights);
    final int [] folds = (foldIds == null)?foldIds(data.nobs(), params._nfolds, params._seed):foldIds.clone();
    final int k = checkFolds(folds, data.nobs());
    Timer t = new Timer();

    final SolutionPath full = PathDriver.saenet(data, obsWeights, penalty, alphas, lambdaGrid, params);
    final int A = full.nalpha();
    final StackedDataset [] train = new StackedDataset[k];
    for(int f = 0; f < k; ++f){
      boolean [] keep = trainMask(folds, f);
      train[f] = Stacker.stack(data.subset(keep), subset(obsWeights, keep), params._standardize);
    }
    final double [][][] err = new double[k][A][];
    final boolean [][] warned = new boolean[k][A];
    List<RecursiveAction> jobs = new ArrayList<RecursiveAction>();
    for(int f = 0; f < k; ++f)
      for(int a = 0; a < A; ++a){
        final int F = f, AA = a;
        jobs.add(new RecursiveAction() {
          @Override protected void compute() {
            PathPoint [] pts = PathDriver.saenetPath(train[F], penalty, full.alpha(AA), full.lambdas(AA), params);
            err[F][AA] = new double[pts.length];
            for(int l = 0; l < pts.length; ++l){
              err[F][AA][l] = heldOutStacked(data, obsWeights, folds, F, pts[l]);
              if(!pts[l]._converged)warned[F][AA] = true;
            }
          }
        });
      }
    Jobs.invokeAll(jobs, params.nthreads());

    double [] foldWeight = new double[k];
    for(int i = 0; i < folds.length; ++i)
      foldWeight[folds[i]] += obsWeights[i];
    CVResult res = aggregate(full, err, foldWeight, folds, warned);
    log.info("cv saenet: {} folds, lambda.min={} alpha.min={} lambda.1se={} (cvm={}) in {}",
        k, res._lambdaMin, res._alphaMin, res._lambda1se, res.minError(), t);
    return res;
  }

  /** Weighted held-out loss of the stacked coefficients over all imputations. */
  static double heldOutStacked(ImputedDataset data, double [] obsWeights, int [] folds, int f, PathPoint p){
    final int M = data.nimp();
    double loss = 0, wsum = 0;
    for(int i = 0; i < folds.length; ++i){
      if(folds[i] != f)continue;
      wsum += obsWeights[i];
      for(int m = 0; m < M; ++m)
        loss += obsWeights[i]/M*p._family.deviance(data.y(m)[i], p.predict(data.x(m)[i]));
    }
    return loss/wsum;
  }

  // ---
  // Grouped adaptive lasso

  public static CVResult galasso(final ImputedDataset data, final PenaltyContext penalty, double [] lambdaGrid,
                                 final MIParams params, int [] foldIds){
    PathDriver.checkInputs(data, penalty, params);
    Check.lambdaGrid(lambdaGrid);
    final int [] folds = (foldIds == null)?foldIds(data.nobs(), params._nfolds, params._seed):foldIds.clone();
    final int k = checkFolds(folds, data.nobs());
    Timer t = new Timer();

    final SolutionPath full = PathDriver.galasso(data, penalty, lambdaGrid, params);
    final double [][][] err = new double[k][1][];
    final boolean [][] warned = new boolean[k][1];
    List<RecursiveAction> jobs = new ArrayList<RecursiveAction>();
    for(int f = 0; f < k; ++f){
      final int F = f;
      jobs.add(new RecursiveAction() {
        @Override protected void compute() {
          ImputedDataset train = data.subset(trainMask(folds, F));
          PathPoint [] pts = PathDriver.galassoPath(PathDriver.designs(train, params), penalty, full.alpha(0), full.lambdas(0), params);
          err[F][0] = new double[pts.length];
          for(int l = 0; l < pts.length; ++l){
            err[F][0][l] = heldOutGrouped(data, folds, F, pts[l]);
            if(!pts[l]._converged)warned[F][0] = true;
          }
        }
      });
    }
    Jobs.invokeAll(jobs, params.nthreads());

    double [] foldWeight = new double[k];
    for(int f:folds)
      foldWeight[f] += 1;
    CVResult res = aggregate(full, err, foldWeight, folds, warned);
    log.info("cv galasso: {} folds, lambda.min={} lambda.1se={} (cvm={}) in {}",
        k, res._lambdaMin, res._lambda1se, res.minError(), t);
    return res;
  }

  /** Held-out loss of each imputation's own coefficients, averaged over imputations. */
  static double heldOutGrouped(ImputedDataset data, int [] folds, int f, PathPoint p){
    final int M = data.nimp();
    double loss = 0;
    int n = 0;
    for(int i = 0; i < folds.length; ++i){
      if(folds[i] != f)continue;
      ++n;
      for(int m = 0; m < M; ++m)
        loss += p._family.deviance(data.y(m)[i], p.predict(data.x(m)[i], m))/M;
    }
    return loss/n;
  }

  // ---

  static CVResult aggregate(SolutionPath full, double [][][] err, double [] foldWeight, int [] folds, boolean [][] warned){
    final int k = err.length;
    final int A = full.nalpha();
    double wsum = 0;
    for(double w:foldWeight)wsum += w;
    double [][] cvm = new double[A][];
    double [][] cvse = new double[A][];
    for(int a = 0; a < A; ++a){
      final int L = full.nlambda(a);
      cvm[a] = new double[L];
      cvse[a] = new double[L];
      for(int l = 0; l < L; ++l){
        double mean = 0;
        for(int f = 0; f < k; ++f)
          mean += foldWeight[f]*err[f][a][l];
        mean /= wsum;
        double var = 0;
        for(int f = 0; f < k; ++f){
          double d = err[f][a][l] - mean;
          var += foldWeight[f]*d*d;
        }
        var /= wsum;
        cvm[a][l] = mean;
        cvse[a][l] = Math.sqrt(var/(k - 1));
      }
    }
    int nwarn = 0;
    for(boolean [] ws:warned)
      for(boolean w:ws)
        if(w)++nwarn;
    if(nwarn > 0)
      log.warn("{} fold path(s) contain points that did not converge", nwarn);
    return new CVResult(full, cvm, cvse, Arrays.copyOf(folds, folds.length), k, nwarn);
  }
}

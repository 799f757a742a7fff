package test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Random;

import miselect.PathPoint;

import org.junit.Ignore;

import Jama.Matrix;

// Synthetic multiply-imputed data and reference computations shared by the
// solver tests.
@Ignore
public class TestUtil {

  public static double [] ones(int n){
    double [] res = new double[n];
    Arrays.fill(res, 1.0);
    return res;
  }

  public static double [] fill(int n, double v){
    double [] res = new double[n];
    Arrays.fill(res, v);
    return res;
  }

  /** Complete covariates, standard normal. */
  public static double [][] design(Random R, int n, int p){
    double [][] x = new double[n][p];
    for(int i = 0; i < n; ++i)
      for(int j = 0; j < p; ++j)
        x[i][j] = R.nextGaussian();
    return x;
  }

  /**
   * M completions of {@code x}: in each copy about {@code missing} of the
   * entries are re-drawn around their true value, as an imputation would.
   */
  public static double [][][] impute(Random R, double [][] x, int M, double missing, double sd){
    final int n = x.length, p = x[0].length;
    boolean [][] miss = new boolean[n][p];
    for(int i = 0; i < n; ++i)
      for(int j = 0; j < p; ++j)
        miss[i][j] = R.nextDouble() < missing;
    double [][][] res = new double[M][n][p];
    for(int m = 0; m < M; ++m)
      for(int i = 0; i < n; ++i)
        for(int j = 0; j < p; ++j)
          res[m][i][j] = miss[i][j]?x[i][j] + sd*R.nextGaussian():x[i][j];
    return res;
  }

  /** 1 - fraction of entries of each row re-drawn in the first imputation vs {@code x}. */
  public static double [] completeness(double [][] x, double [][][] imputed){
    double [] res = new double[x.length];
    for(int i = 0; i < x.length; ++i){
      int miss = 0;
      for(int j = 0; j < x[i].length; ++j)
        if(imputed[0][i][j] != x[i][j])++miss;
      res[i] = 1.0 - (double)miss/x[i].length;
      if(res[i] == 0)res[i] = 0.05;
    }
    return res;
  }

  public static double [] gaussianResponse(Random R, double [][] x, double [] beta, double icpt, double sd){
    double [] y = new double[x.length];
    for(int i = 0; i < x.length; ++i){
      double s = icpt;
      for(int j = 0; j < beta.length; ++j)
        s += beta[j]*x[i][j];
      y[i] = s + sd*R.nextGaussian();
    }
    return y;
  }

  public static double [] binomialResponse(Random R, double [][] x, double [] beta, double icpt){
    double [] y = new double[x.length];
    for(int i = 0; i < x.length; ++i){
      double s = icpt;
      for(int j = 0; j < beta.length; ++j)
        s += beta[j]*x[i][j];
      y[i] = (R.nextDouble() < 1.0/(1.0 + Math.exp(-s)))?1:0;
    }
    return y;
  }

  /** The same response for each of the M imputations. */
  public static double [][] replicate(double [] y, int M){
    double [][] res = new double[M][];
    for(int m = 0; m < M; ++m)
      res[m] = y.clone();
    return res;
  }

  public static double [] sparseBeta(int p, double ... informative){
    double [] res = new double[p];
    System.arraycopy(informative, 0, res, 0, informative.length);
    return res;
  }

  // ---
  // Reference computations on raw, stacked rows

  /** Rows of all imputations concatenated, with weights w_i/M. */
  public static double [][] stackRows(double [][][] x){
    final int M = x.length, n = x[0].length;
    double [][] res = new double[n*M][];
    for(int m = 0; m < M; ++m)
      for(int i = 0; i < n; ++i)
        res[m*n+i] = x[m][i];
    return res;
  }

  public static double [] stackResponse(double [][] y){
    final int M = y.length, n = y[0].length;
    double [] res = new double[n*M];
    for(int m = 0; m < M; ++m)
      System.arraycopy(y[m], 0, res, m*n, n);
    return res;
  }

  public static double [] stackWeights(double [] w, int M){
    double [] res = new double[w.length*M];
    for(int m = 0; m < M; ++m)
      for(int i = 0; i < w.length; ++i)
        res[m*w.length+i] = w[i]/M;
    return res;
  }

  public static double [] normalise(double [] w){
    double s = 0;
    for(double d:w)s += d;
    double [] res = new double[w.length];
    for(int i = 0; i < w.length; ++i)res[i] = w[i]/s;
    return res;
  }

  public static double weightedMean(double [] v, double [] w){
    double s = 0, ws = 0;
    for(int i = 0; i < v.length; ++i){
      s += w[i]*v[i];
      ws += w[i];
    }
    return s/ws;
  }

  /** Weighted population standard deviation of column j. */
  public static double weightedSd(double [][] rows, int j, double [] w){
    double [] col = new double[rows.length];
    for(int i = 0; i < rows.length; ++i)col[i] = rows[i][j];
    double mu = weightedMean(col, w);
    double s = 0, ws = 0;
    for(int i = 0; i < rows.length; ++i){
      s += w[i]*(col[i] - mu)*(col[i] - mu);
      ws += w[i];
    }
    return Math.sqrt(s/ws);
  }

  /**
   * Karush-Kuhn-Tucker conditions of the standardized elastic net problem,
   * checked from original-scale coefficients (intercept last).
   */
  public static void assertKKT(double [][] rows, double [] y, double [] w, boolean binomial, PathPoint pt,
                               double [] pf, double [] adw, double tol){
    final double [] beta = pt.beta();
    final int p = beta.length-1;
    final double [] ws = normalise(w);
    final double lambda = pt._lambda, alpha = pt._alpha;
    double [] r = new double[rows.length];
    double rsum = 0;
    for(int i = 0; i < rows.length; ++i){
      double eta = beta[p];
      for(int j = 0; j < p; ++j)eta += beta[j]*rows[i][j];
      double mu = binomial?1.0/(1.0 + Math.exp(-eta)):eta;
      r[i] = y[i] - mu;
      rsum += ws[i]*r[i];
    }
    assertEquals("intercept stationarity", 0, rsum, tol);
    for(int j = 0; j < p; ++j){
      double sd = weightedSd(rows, j, w);
      double c = 0;
      for(int i = 0; i < rows.length; ++i)c += ws[i]*rows[i][j];
      double g = 0;
      for(int i = 0; i < rows.length; ++i)g += ws[i]*(rows[i][j] - c)*r[i];
      g /= sd;
      double bs = beta[j]*sd;
      double l1 = lambda*alpha*pf[j]*adw[j];
      if(bs != 0)
        assertEquals("stationarity of variable " + j, l1*Math.signum(bs), g - lambda*(1 - alpha)*pf[j]*bs, tol);
      else
        assertTrue("variable " + j + " should be active: |g|=" + Math.abs(g) + " > " + l1, Math.abs(g) <= l1 + tol);
    }
  }

  /** Unpenalized least squares with intercept, intercept last. */
  public static double [] ols(double [][] x, double [] y){
    final int n = x.length, p = x[0].length;
    Matrix X = new Matrix(n, p+1);
    for(int i = 0; i < n; ++i){
      for(int j = 0; j < p; ++j)X.set(i, j, x[i][j]);
      X.set(i, p, 1.0);
    }
    return X.solve(new Matrix(y, n)).getColumnPackedCopy();
  }
}

package test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Random;

import miselect.Family;
import miselect.ImputedDataset;
import miselect.MIParams;
import miselect.MISelect;
import miselect.PathDriver;
import miselect.PathPoint;
import miselect.PenaltyContext;
import miselect.SolutionPath;

import org.junit.Test;

public class GroupLassoSolverTest extends TestUtil {

  static MIParams tight(Family f){
    MIParams p = new MIParams(f);
    p._eps = 1e-12;
    p._nthreads = 1;
    return p;
  }

  static void assertJointSelection(PathPoint pt){
    final int p = pt.ncols();
    for(int j = 0; j < p; ++j){
      int nz = 0;
      for(int m = 0; m < pt.nimp(); ++m)
        if(pt.beta(m)[j] != 0)++nz;
      assertTrue("variable " + j + " selected in " + nz + " of " + pt.nimp() + " imputations at lambda=" + pt._lambda,
          nz == 0 || nz == pt.nimp());
      assertEquals(nz > 0, pt.isSelected(j));
    }
  }

  /**
   * Group optimality conditions, evaluated per imputation on the standardized
   * scale with uniform observation weights.
   */
  static void assertGroupKKT(double [][][] x, double [][] y, boolean binomial, PathPoint pt, double [] pf, double [] adw, double tol){
    final int M = x.length, n = x[0].length, p = x[0][0].length;
    final double [] w = ones(n);
    final double lambda = pt._lambda, alpha = pt._alpha;
    double [][] g = new double[p][M];
    double [][] bs = new double[p][M];
    for(int m = 0; m < M; ++m){
      double [] beta = pt.beta(m);
      double [] r = new double[n];
      double rsum = 0;
      for(int i = 0; i < n; ++i){
        double eta = beta[p];
        for(int j = 0; j < p; ++j)eta += beta[j]*x[m][i][j];
        r[i] = y[m][i] - (binomial?1.0/(1.0 + Math.exp(-eta)):eta);
        rsum += r[i]/n;
      }
      assertEquals("intercept of imputation " + m, 0, rsum, tol);
      for(int j = 0; j < p; ++j){
        double sd = weightedSd(x[m], j, w);
        double c = 0;
        for(int i = 0; i < n; ++i)c += x[m][i][j]/n;
        double s = 0;
        for(int i = 0; i < n; ++i)s += (x[m][i][j] - c)*r[i]/n;
        g[j][m] = s/sd/M;
        bs[j][m] = beta[j]*sd;
      }
    }
    for(int j = 0; j < p; ++j){
      double norm = 0, gnorm = 0;
      for(int m = 0; m < M; ++m){
        norm += bs[j][m]*bs[j][m];
        gnorm += g[j][m]*g[j][m];
      }
      norm = Math.sqrt(norm);
      gnorm = Math.sqrt(gnorm);
      double l1 = lambda*alpha*pf[j]*adw[j];
      if(norm == 0){
        assertTrue("group " + j + " should be active: " + gnorm + " > " + l1, gnorm <= l1 + tol);
      } else {
        for(int m = 0; m < M; ++m)
          assertEquals("stationarity of group " + j + ", imputation " + m,
              l1*bs[j][m]/norm, g[j][m] - lambda*(1 - alpha)*pf[j]*bs[j][m], tol);
      }
    }
  }

  @Test public void testJointSelectionGaussian() {
    Random R = new Random(21);
    double [][] base = design(R, 60, 10);
    double [][][] x = impute(R, base, 5, 0.3, 0.8);
    double [] yb = gaussianResponse(R, base, sparseBeta(10, 1.5, -1, 0.7, 0.3), 1, 1);
    double [][] y = new double[5][];
    for(int m = 0; m < 5; ++m){
      y[m] = yb.clone();
      // the response is imputed too
      for(int i = 0; i < 60; i += 7)y[m][i] += 0.5*R.nextGaussian();
    }
    MIParams p = tight(Family.gaussian);
    p._nlambda = 15;
    p._lambdaMinRatio = 0.01;
    SolutionPath path = MISelect.fitGalasso(x, y, ones(10), ones(10), null, p);
    assertEquals(1, path.nalpha());
    assertEquals(15, path.nlambda(0));
    for(int l = 0; l < path.nlambda(0); ++l){
      PathPoint pt = path.point(0, l);
      assertTrue(pt.hasPerImputation());
      assertEquals(5, pt.nimp());
      assertJointSelection(pt);
      assertGroupKKT(x, y, false, pt, ones(10), ones(10), 1e-6);
    }
    assertEquals(0, path.point(0, 0)._df);
    assertTrue(path.point(0, 14)._df > 0);
  }

  @Test public void testJointSelectionBinomial() {
    Random R = new Random(22);
    double [][] base = design(R, 150, 6);
    double [][][] x = impute(R, base, 4, 0.2, 0.6);
    double [][] y = replicate(binomialResponse(R, base, sparseBeta(6, 1.5, 0, -1), 0.2), 4);
    double [] adw = new double[]{0.5, 1, 1, 2, 1, 1};
    MIParams p = tight(Family.binomial);
    p._nlambda = 12;
    p._lambdaMinRatio = 0.05;
    SolutionPath path = MISelect.fitGalasso(x, y, ones(6), adw, null, p);
    assertTrue(path.converged());
    for(int l = 0; l < path.nlambda(0); ++l){
      assertJointSelection(path.point(0, l));
      assertGroupKKT(x, y, true, path.point(0, l), ones(6), adw, 1e-5);
    }
  }

  // The pooled vector is the mean of the imputation-specific vectors.
  @Test public void testPooledIsMean() {
    Random R = new Random(23);
    double [][] base = design(R, 50, 4);
    double [][][] x = impute(R, base, 3, 0.3, 0.5);
    double [][] y = replicate(gaussianResponse(R, base, sparseBeta(4, 1, 1), 0, 1), 3);
    SolutionPath path = MISelect.fitGalasso(x, y, ones(4), ones(4), Family.gaussian, new double[]{0.05});
    PathPoint pt = path.point(0, 0);
    double [] mean = new double[5];
    for(int m = 0; m < 3; ++m)
      for(int j = 0; j < 5; ++j)mean[j] += pt.beta(m)[j]/3;
    assertArrayEquals(mean, pt.beta(), 1e-12);
    double [][] all = pt.perImputation();
    assertEquals(3, all.length);
    assertArrayEquals(pt.beta(2), all[2], 0);
    all[2][0] = 1e9;
    assertEquals(pt.beta(2)[0], pt.perImputation()[2][0], 0);
    double [] row = x[1][4];
    double eta = mean[4];
    for(int j = 0; j < 4; ++j)eta += mean[j]*row[j];
    assertEquals(eta, pt.linearPredictor(row), 1e-12);
    double eta1 = pt.beta(1)[4];
    for(int j = 0; j < 4; ++j)eta1 += pt.beta(1)[j]*row[j];
    assertEquals(eta1, pt.predict(row, 1), 1e-12);
  }

  // Unpenalized variables at lambda 0: each imputation gets its own least squares fit.
  @Test public void testUnpenalizedMatchesLeastSquares() {
    Random R = new Random(24);
    double [][] base = design(R, 40, 3);
    double [][][] x = impute(R, base, 3, 0.3, 1.0);
    double [][] y = new double[3][];
    for(int m = 0; m < 3; ++m)
      y[m] = gaussianResponse(R, x[m], new double[]{1, -2, 0.5}, 3, 0.5);
    MIParams p = tight(Family.gaussian);
    p._maxIter = 100000;
    SolutionPath path = MISelect.fitGalasso(x, y, new double[3], ones(3), new double[]{0}, p);
    assertTrue(path.converged());
    for(int m = 0; m < 3; ++m)
      assertArrayEquals(ols(x[m], y[m]), path.point(0, 0).beta(m), 1e-6);
  }

  // Ridge share: alpha 0 with positive lambda is imputation-wise ridge; with
  // lambda 0 it is least squares again.
  @Test public void testRidgeShare() {
    Random R = new Random(25);
    double [][] base = design(R, 40, 3);
    double [][][] x = impute(R, base, 2, 0.3, 1.0);
    double [][] y = replicate(gaussianResponse(R, base, new double[]{1, 1, 0}, 0, 0.5), 2);
    MIParams p = tight(Family.gaussian);
    p._maxIter = 100000;
    SolutionPath ls = MISelect.fitGalasso(x, y, ones(3), ones(3), new double[]{0}, p);
    for(int m = 0; m < 2; ++m)
      assertArrayEquals(ols(x[m], y[m]), ls.point(0, 0).beta(m), 1e-6);
    PathPoint ridge = PathDriver.galasso(new ImputedDataset(x, y), PenaltyContext.uniform(3), 0.0, new double[]{0.5}, p).point(0, 0);
    assertEquals(0.0, ridge._alpha, 0);
    assertGroupKKT(x, y, false, ridge, ones(3), ones(3), 1e-7);
    for(int j = 0; j < 3; ++j)assertTrue(ridge.isSelected(j));
  }

  @Test public void testFreeVariableAlwaysSelected() {
    Random R = new Random(26);
    double [][] base = design(R, 60, 5);
    double [][][] x = impute(R, base, 3, 0.2, 0.5);
    double [][] y = replicate(gaussianResponse(R, base, sparseBeta(5, 0, 0, 0, 0, 0.4), 0, 1), 3);
    double [] pf = new double[]{1, 1, 1, 1, 0};
    MIParams p = tight(Family.gaussian);
    p._nlambda = 8;
    SolutionPath path = MISelect.fitGalasso(x, y, pf, ones(5), null, p);
    for(int l = 0; l < 8; ++l){
      assertTrue(path.point(0, l).isSelected(4));
      assertGroupKKT(x, y, false, path.point(0, l), pf, ones(5), 1e-6);
    }
  }

  // A rare indicator observed all zero, imputed to 1 in some copies only: it is
  // constant in imputation 0, so no copy may select it.
  @Test public void testConstantInOneImputation() {
    Random R = new Random(27);
    double [][] base = design(R, 80, 4);
    for(double [] row:base)row[3] = 0;
    double [][][] x = impute(R, base, 3, 0.2, 0.5);
    for(int m = 0; m < 3; ++m)
      for(int i = 0; i < 80; ++i)x[m][i][3] = 0;
    x[1][5][3] = 1;
    x[2][5][3] = 1;
    x[2][17][3] = 1;
    double [] yb = gaussianResponse(R, base, sparseBeta(4, 1, -1, 0.5), 0, 1);
    double [][] y = replicate(yb, 3);
    // the imputed indicator carries signal where it is set
    y[1][5] += 3;
    y[2][5] += 3;
    y[2][17] += 3;
    MIParams p = tight(Family.gaussian);
    p._nlambda = 30;
    SolutionPath path = MISelect.fitGalasso(x, y, ones(4), ones(4), null, p);
    for(int l = 0; l < path.nlambda(0); ++l){
      PathPoint pt = path.point(0, l);
      assertJointSelection(pt);
      for(int m = 0; m < 3; ++m)
        assertEquals(0, pt.beta(m)[3], 0);
    }
    assertTrue(path.point(0, 29).isSelected(0));
  }
}

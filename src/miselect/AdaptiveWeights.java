package miselect;

import miselect.util.Check;
import Jama.CholeskyDecomposition;
import Jama.Matrix;

/**
 * Adaptive weights from an initial ridge fit on the stacked data.
 *
 * Returns 1/(|b_j| + 1/n) where b are the standardized ridge coefficients, so
 * variables with a weak initial signal receive a heavier L1 penalty.
 */
public final class AdaptiveWeights {
  private AdaptiveWeights(){}

  public static double [] fromRidge(ImputedDataset data, double [] obsWeights, double lambda){
    Check.lambda(lambda);
    StackedDataset d = Stacker.stack(data, obsWeights, true);
    final int p = d._ncols;
    Matrix xx = new Matrix(p, p);
    Matrix xy = new Matrix(p, 1);
    for(int i = 0; i < p; ++i){
      final double [] xi = d._x[i];
      double s = 0;
      for(int r = 0; r < d._rows; ++r)
        s += d._w[r]*xi[r]*(d._y[r] - d._ymu);
      xy.set(i, 0, s);
      for(int j = 0; j <= i; ++j){
        final double [] xj = d._x[j];
        double g = 0;
        for(int r = 0; r < d._rows; ++r)
          g += d._w[r]*xi[r]*xj[r];
        xx.set(i, j, g);
        xx.set(j, i, g);
      }
    }
    double [] beta = solve(xx, xy, lambda);
    double [] res = new double[p];
    for(int j = 0; j < p; ++j)
      res[j] = 1.0/(Math.abs(beta[j]) + 1.0/d._nobs);
    return res;
  }

  // Ridge solve; bumps the diagonal until the system is positive definite.
  static double [] solve(Matrix xx, Matrix xy, double lambda){
    final int N = xx.getRowDimension();
    double rho = 0;
    for(int iter = 0; iter < 20; ++iter){
      Matrix m = xx.copy();
      for(int i = 0; i < N; ++i)
        m.set(i, i, m.get(i, i) + lambda + rho);
      CholeskyDecomposition chol = new CholeskyDecomposition(m);
      if(chol.isSPD())
        return chol.solve(xy).getColumnPackedCopy();
      rho = (rho == 0)?1e-8:10*rho;
    }
    throw new MIException("ridge system is not positive definite, even with a diagonal bump of " + rho);
  }
}

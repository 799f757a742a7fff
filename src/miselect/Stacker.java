package miselect;

import java.util.Arrays;

import miselect.MIException.DimensionException;
import miselect.util.Check;

/**
 * Builds the weighted design the stacked elastic net is fitted on.
 */
public final class Stacker {
  private Stacker(){}

  /**
   * Concatenates the M imputations row-wise. Every copy of observation i gets
   * weight {@code obsWeights[i]/M}.
   */
  public static StackedDataset stack(ImputedDataset data, double [] obsWeights, boolean standardize){
    final int M = data.nimp();
    final int n = data.nobs();
    final int p = data.ncols();
    if(obsWeights == null)throw new DimensionException("observation weights are missing");
    Check.length("observation weights", obsWeights, n);
    Check.positive("observation weights", obsWeights);
    final int N = n*M;
    double [][] x = new double[p][N];
    double [] y = new double[N];
    double [] w = new double[N];
    for(int m = 0; m < M; ++m){
      final double [][] xm = data.x(m);
      final double [] ym = data.y(m);
      final int off = m*n;
      for(int i = 0; i < n; ++i){
        final double [] row = xm[i];
        for(int j = 0; j < p; ++j)
          x[j][off+i] = row[j];
        y[off+i] = ym[i];
        w[off+i] = obsWeights[i]/M;
      }
    }
    return new StackedDataset(M, n, x, y, w, standardize);
  }

  /** Design of imputation {@code m} alone with unit observation weights. */
  public static StackedDataset single(ImputedDataset data, int m, boolean standardize){
    double [] ones = new double[data.nobs()];
    Arrays.fill(ones, 1.0);
    return stack(data.imputation(m), ones, standardize);
  }
}

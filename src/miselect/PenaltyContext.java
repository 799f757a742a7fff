package miselect;

import java.util.Arrays;

import miselect.util.Check;

/**
 * Per variable penalty factors and adaptive weights.
 *
 * The L1 part of the penalty on variable j is scaled by pf_j*adw_j, the ridge
 * part by pf_j alone. A zero penalty factor leaves the variable unpenalized.
 */
public final class PenaltyContext {
  final double [] _pf;
  final double [] _adw;

  public PenaltyContext(double [] penaltyFactors, double [] adaptiveWeights, int ncols){
    Check.length("penalty factors", penaltyFactors, ncols);
    Check.length("adaptive weights", adaptiveWeights, ncols);
    Check.nonNegative("penalty factors", penaltyFactors);
    Check.nonNegative("adaptive weights", adaptiveWeights);
    _pf = penaltyFactors.clone();
    _adw = adaptiveWeights.clone();
  }

  /** Plain elastic net: every factor and weight equal to 1. */
  public static PenaltyContext uniform(int ncols){
    double [] ones = new double[ncols];
    Arrays.fill(ones, 1.0);
    return new PenaltyContext(ones, ones, ncols);
  }

  public int ncols(){return _pf.length;}

  public final double l1(int j){return _pf[j]*_adw[j];}
  public final double l2(int j){return _pf[j];}

  public final boolean isPenalized(int j){return _pf[j] > 0;}

  /** Variables that stay in the null model: no penalty at all. */
  public final boolean isFree(int j){return _pf[j] == 0;}

  public double [] penaltyFactors(){return _pf.clone();}
  public double [] adaptiveWeights(){return _adw.clone();}
}

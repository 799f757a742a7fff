package miselect;

import miselect.MIException.InvalidParameterException;

// supported families
public enum Family {
  gaussian,
  binomial;

  /** Fitted probabilities are kept this far away from 0 and 1 inside IRLS. */
  public static final double MU_EPS = 1e-5;

  // helper function
  static final double y_log_y(double y, double mu){
    mu = Math.max(Double.MIN_NORMAL, mu);
    return (y != 0) ? (y * Math.log(y/mu)) : 0;
  }

  public final double linkInv(double eta){
    switch(this){
    case gaussian:
      return eta;
    case binomial:
      return 1.0 / (Math.exp(-eta) + 1.0);
    default:
      throw new Error("unexpected family " + this);
    }
  }

  public final double link(double mu){
    switch(this){
    case gaussian:
      return mu;
    case binomial:
      mu = clip(mu);
      return Math.log(mu/(1 - mu));
    default:
      throw new Error("unexpected family " + this);
    }
  }

  /** Probability clipped into [MU_EPS, 1-MU_EPS]; identity for gaussian. */
  public final double clip(double mu){
    if(this != binomial)return mu;
    if(mu < MU_EPS)return MU_EPS;
    if(mu > 1 - MU_EPS)return 1 - MU_EPS;
    return mu;
  }

  public double variance(double mu){
    switch(this){
    case gaussian:
      return 1;
    case binomial:
      assert 0 <= mu && mu <= 1:"unexpected mu:" + mu;
      return mu*(1-mu);
    default:
      throw new Error("unknown family " + this);
    }
  }

  /**
   * Per observation deviance.
   *
   * @param yr observed response
   * @param ym fitted mean (probability for binomial)
   */
  public double deviance(double yr, double ym){
    switch(this){
    case gaussian:
      return (yr - ym)*(yr - ym);
    case binomial:
      return 2*((y_log_y(yr, ym)) + y_log_y(1-yr, 1-ym));
    default:
      throw new Error("unknown family " + this);
    }
  }

  /** Intercept of the model without covariates for a weighted response mean. */
  public double nullIntercept(double ymu){
    return link(ymu);
  }

  public void checkResponse(double y){
    if(Double.isNaN(y) || Double.isInfinite(y))
      throw new InvalidParameterException("response contains non-finite value " + y);
    if(this == binomial && y != 0 && y != 1)
      throw new InvalidParameterException("response variable value out of {0,1} for family=binomial: " + y);
  }

  public static Family parse(String s){
    if(s == null)throw new InvalidParameterException("missing family");
    for(Family f:values())
      if(f.name().equalsIgnoreCase(s.trim()))return f;
    throw new InvalidParameterException("unknown family '" + s + "', expected gaussian or binomial");
  }
}

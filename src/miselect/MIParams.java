package miselect;

import miselect.MIException.InsufficientFoldsException;
import miselect.MIException.InvalidParameterException;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

/**
 * Tunables shared by both engines, the path driver and cross-validation.
 */
public class MIParams implements Cloneable {
  public static final int    DEFAULT_MAX_ITER = 10000;
  public static final int    DEFAULT_IRLS_MAX_ITER = 100;
  public static final double DEFAULT_EPS = 1e-7;
  public static final int    DEFAULT_NLAMBDA = 100;
  public static final int    DEFAULT_NFOLDS = 5;
  public static final long   DEFAULT_SEED = 1234;

  public Family  _family = Family.gaussian;
  /** Cap on coordinate descent sweeps per (lambda, alpha) and IRLS step. */
  public int     _maxIter = DEFAULT_MAX_ITER;
  public int     _irlsMaxIter = DEFAULT_IRLS_MAX_ITER;
  public double  _eps = DEFAULT_EPS;
  public int     _nlambda = DEFAULT_NLAMBDA;
  /** NaN picks 1e-3 when all adaptive weights are 1, 1e-6 otherwise. */
  public double  _lambdaMinRatio = Double.NaN;
  public boolean _standardize = true;
  public int     _nfolds = DEFAULT_NFOLDS;
  public long    _seed = DEFAULT_SEED;
  /** Worker threads for alpha paths and folds, 0 means all processors. */
  public int     _nthreads = 0;

  public MIParams(){}
  public MIParams(Family f){_family = f;}

  public double lambdaMinRatio(double [] adWeights){
    if(!Double.isNaN(_lambdaMinRatio))return _lambdaMinRatio;
    for(double d:adWeights)
      if(d != 1)return 1e-6;
    return 1e-3;
  }

  public int nthreads(){
    return (_nthreads <= 0)?Runtime.getRuntime().availableProcessors():_nthreads;
  }

  public MIParams validate(){
    if(_family == null)throw new InvalidParameterException("family is not set");
    if(_maxIter < 1)throw new InvalidParameterException("maxIter must be >= 1, got " + _maxIter);
    if(_irlsMaxIter < 1)throw new InvalidParameterException("irlsMaxIter must be >= 1, got " + _irlsMaxIter);
    if(!(_eps > 0))throw new InvalidParameterException("eps must be > 0, got " + _eps);
    if(_nlambda < 1)throw new InvalidParameterException("nlambda must be >= 1, got " + _nlambda);
    if(!Double.isNaN(_lambdaMinRatio) && !(_lambdaMinRatio > 0 && _lambdaMinRatio < 1))
      throw new InvalidParameterException("lambdaMinRatio must be in (0,1), got " + _lambdaMinRatio);
    if(_nfolds < 2)throw new InsufficientFoldsException("nfolds must be >= 2, got " + _nfolds);
    return this;
  }

  @Override public MIParams clone(){
    try {
      return (MIParams)super.clone();
    } catch( CloneNotSupportedException e ) {
      throw new AssertionError(e);
    }
  }

  public JsonObject toJson(){
    JsonObject res = new JsonObject();
    res.addProperty("family", _family.toString());
    res.addProperty("maxIter", _maxIter);
    res.addProperty("irlsMaxIter", _irlsMaxIter);
    res.addProperty("eps", _eps);
    res.addProperty("nlambda", _nlambda);
    if(!Double.isNaN(_lambdaMinRatio))
      res.addProperty("lambdaMinRatio", _lambdaMinRatio);
    res.addProperty("standardize", _standardize);
    res.addProperty("nfolds", _nfolds);
    res.addProperty("seed", _seed);
    res.addProperty("nthreads", _nthreads);
    return res;
  }

  /**
   * Reads parameters from the json produced by {@link #toJson()}. Missing keys
   * keep their defaults.
   */
  public static MIParams fromJson(String json){
    JsonObject o;
    try {
      JsonElement e = JsonParser.parseString(json);
      if(!e.isJsonObject())throw new InvalidParameterException("parameters must be a json object");
      o = e.getAsJsonObject();
    } catch( JsonSyntaxException e ) {
      throw new InvalidParameterException("malformed parameters: " + e.getMessage());
    }
    MIParams res = new MIParams();
    try {
      if(o.has("family"))res._family = Family.parse(o.get("family").getAsString());
      if(o.has("maxIter"))res._maxIter = o.get("maxIter").getAsInt();
      if(o.has("irlsMaxIter"))res._irlsMaxIter = o.get("irlsMaxIter").getAsInt();
      if(o.has("eps"))res._eps = o.get("eps").getAsDouble();
      if(o.has("nlambda"))res._nlambda = o.get("nlambda").getAsInt();
      if(o.has("lambdaMinRatio"))res._lambdaMinRatio = o.get("lambdaMinRatio").getAsDouble();
      if(o.has("standardize"))res._standardize = o.get("standardize").getAsBoolean();
      if(o.has("nfolds"))res._nfolds = o.get("nfolds").getAsInt();
      if(o.has("seed"))res._seed = o.get("seed").getAsLong();
      if(o.has("nthreads"))res._nthreads = o.get("nthreads").getAsInt();
    } catch( NumberFormatException | UnsupportedOperationException | IllegalStateException e ) {
      throw new InvalidParameterException("malformed parameter value: " + e.getMessage());
    }
    return res.validate();
  }
}

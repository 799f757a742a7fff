package miselect.util;

import miselect.MIException.DimensionException;
import miselect.MIException.InvalidParameterException;

import com.google.common.primitives.Doubles;

/**
 * Eager argument validation. Every check throws before any solving starts.
 */
public class Check {

  public static void length(String what, double [] v, int expected){
    if(v == null)throw new DimensionException(what + " is missing");
    if(v.length != expected)
      throw new DimensionException(what + " has length " + v.length + ", expected " + expected);
  }

  public static void finite(String what, double [] v){
    for(int i = 0; i < v.length; ++i)
      if(!Doubles.isFinite(v[i]))
        throw new InvalidParameterException(what + "[" + i + "] is not finite: " + v[i]);
  }

  public static void nonNegative(String what, double [] v){
    finite(what, v);
    for(int i = 0; i < v.length; ++i)
      if(v[i] < 0)throw new InvalidParameterException(what + "[" + i + "] is negative: " + v[i]);
  }

  public static void positive(String what, double [] v){
    finite(what, v);
    for(int i = 0; i < v.length; ++i)
      if(v[i] <= 0)throw new InvalidParameterException(what + "[" + i + "] must be > 0, got " + v[i]);
  }

  public static void alpha(double a){
    if(!(0 <= a && a <= 1))throw new InvalidParameterException("alpha must be in [0,1], got " + a);
  }

  public static void lambda(double l){
    if(Double.isNaN(l) || l < 0)throw new InvalidParameterException("lambda must be >= 0, got " + l);
  }

  public static void alphaGrid(double [] alphas){
    if(alphas == null || alphas.length == 0)throw new InvalidParameterException("alpha grid is empty");
    for(double a:alphas)alpha(a);
  }

  public static void lambdaGrid(double [] lambdas){
    if(lambdas == null)return;
    if(lambdas.length == 0)throw new InvalidParameterException("lambda grid is empty");
    for(double l:lambdas){
      lambda(l);
      if(Double.isInfinite(l))throw new InvalidParameterException("lambda must be finite");
    }
  }
}

package miselect;

/**
 * Root of the errors raised by the fitting engine.
 *
 * Shape and parameter problems are detected before any solving starts, so a
 * fit either completes or fails with one of these and nothing computed.
 */
public class MIException extends RuntimeException {
  public MIException(String msg){super(msg);}
  public MIException(String msg, Throwable cause){super(msg, cause);}

  /** Matrices, vectors or weights whose shapes disagree. */
  public static class DimensionException extends MIException {
    public DimensionException(String msg){super(msg);}
  }

  /** alpha outside [0,1], negative lambda, bad family response, bad fold count... */
  public static class InvalidParameterException extends MIException {
    public InvalidParameterException(String msg){super(msg);}
  }

  /** Fewer than two folds, more folds than observations, or an empty fold. */
  public static class InsufficientFoldsException extends InvalidParameterException {
    public InsufficientFoldsException(String msg){super(msg);}
  }

  /** Requested (lambda, alpha) is not a point of the computed grid. */
  public static class NotFoundException extends MIException {
    public NotFoundException(String msg){super(msg);}
  }
}

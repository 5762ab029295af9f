package hlsc.errors;

/**
 * Category of a compile error. Both categories abort the compilation of the affected scope.
 */
public enum ErrorKind {
  /** Malformed input graph or a broken invariant between passes. */
  STRUCTURAL("structural"),
  /** A construct of the input program that cannot be lowered to hardware. */
  UNSUPPORTED("unsupported");

  public final String serialName;

  private ErrorKind(String serialName) { this.serialName = serialName; }
}

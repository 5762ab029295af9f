package hlsc.errors;

import java.util.Optional;

/**
 * Fatal compile error. Thrown by every pass on a structural inconsistency or an unsupported construct;
 * compilation of the affected scope stops.
 */
public class CompileException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Errors error;
  private final Optional<String> scopeName;
  private final int lineno;

  public CompileException(Errors error, Optional<String> scopeName, int lineno, Object... args) {
    super(error.format(args));
    this.error = error;
    this.scopeName = scopeName;
    this.lineno = lineno;
  }

  /** Error without a source line (lineno -1). */
  public static CompileException of(Errors error, String scopeName, Object... args) {
    return new CompileException(error, Optional.ofNullable(scopeName), -1, args);
  }

  public static CompileException at(Errors error, String scopeName, int lineno, Object... args) {
    return new CompileException(error, Optional.ofNullable(scopeName), lineno, args);
  }

  public Errors getError() { return error; }
  public ErrorKind getKind() { return error.kind; }
  public Optional<String> getScopeName() { return scopeName; }
  public int getLineno() { return lineno; }

  /** Location string {@code scope:line}, omitting unknown parts. */
  public String getLocation() {
    String loc = scopeName.orElse("<unknown>");
    if (lineno >= 0)
      loc += ":" + lineno;
    return loc;
  }

  @Override
  public String toString() {
    return String.format("%s error E%d at %s: %s", error.kind.serialName, error.code, getLocation(), getMessage());
  }
}

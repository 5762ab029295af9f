package hlsc.ir;

/**
 * An IR expression. Expressions are owned by exactly one statement.
 */
public abstract class IRExp extends IR {
  /** Deep copy of this expression tree. Symbols are shared. */
  public abstract IRExp copy();

  protected <T extends IRExp> T withLine(T exp) {
    exp.setLineno(lineno);
    return exp;
  }
}

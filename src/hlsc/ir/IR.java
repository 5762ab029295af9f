package hlsc.ir;

/**
 * Common base of IR expressions and statements.
 */
public abstract class IR {
  protected int lineno = -1;

  public int getLineno() { return lineno; }
  public void setLineno(int lineno) { this.lineno = lineno; }

  public abstract <R> R accept(IRVisitor<R> visitor);
}

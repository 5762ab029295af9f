package hlsc.ir;

/** Expression evaluated for its side effect. */
public class Expr extends IRStm {
  private IRExp exp;

  public Expr(IRExp exp) { this.exp = exp; }

  public IRExp getExp() { return exp; }
  public void setExp(IRExp exp) { this.exp = exp; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitExpr(this);
  }
  @Override
  public IRStm copy() {
    return withLine(new Expr(exp.copy()));
  }
  @Override
  public String toString() {
    return exp.toString();
  }
}

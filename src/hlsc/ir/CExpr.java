package hlsc.ir;

/** Expression statement executed only when {@code cond} holds. */
public class CExpr extends Expr {
  private IRExp cond;

  public CExpr(IRExp cond, IRExp exp) {
    super(exp);
    this.cond = cond;
  }

  public IRExp getCond() { return cond; }
  public void setCond(IRExp cond) { this.cond = cond; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitCExpr(this);
  }
  @Override
  public IRStm copy() {
    return withLine(new CExpr(cond.copy(), getExp().copy()));
  }
  @Override
  public String toString() {
    return String.format("%s ? %s", cond, super.toString());
  }
}

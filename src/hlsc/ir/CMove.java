package hlsc.ir;

/** Move executed only when {@code cond} holds. */
public class CMove extends Move {
  private IRExp cond;

  public CMove(IRExp cond, Temp dst, IRExp src) {
    super(dst, src);
    this.cond = cond;
  }

  public IRExp getCond() { return cond; }
  public void setCond(IRExp cond) { this.cond = cond; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitCMove(this);
  }
  @Override
  public IRStm copy() {
    return withLine(new CMove(cond.copy(), getDst().copy(), getSrc().copy()));
  }
  @Override
  public String toString() {
    return String.format("%s ? %s", cond, super.toString());
  }
}

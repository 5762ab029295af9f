package hlsc.ir;

public class UnOp extends IRExp {
  private final Op op;
  private IRExp exp;

  public UnOp(Op op, IRExp exp) {
    assert (op.isUnary());
    this.op = op;
    this.exp = exp;
  }

  public Op getOp() { return op; }
  public IRExp getExp() { return exp; }
  public void setExp(IRExp exp) { this.exp = exp; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitUnOp(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new UnOp(op, exp.copy()));
  }
  @Override
  public String toString() {
    return op.symbol + exp;
  }
}

package hlsc.ir;

/**
 * Arithmetic or relational binary operation.
 */
public class BinOp extends IRExp {
  private final Op op;
  private IRExp left;
  private IRExp right;

  public BinOp(Op op, IRExp left, IRExp right) {
    assert (!op.isUnary());
    this.op = op;
    this.left = left;
    this.right = right;
  }

  public Op getOp() { return op; }
  public IRExp getLeft() { return left; }
  public IRExp getRight() { return right; }
  public void setLeft(IRExp left) { this.left = left; }
  public void setRight(IRExp right) { this.right = right; }
  public boolean isRelational() { return op.isRelational(); }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitBinOp(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new BinOp(op, left.copy(), right.copy()));
  }
  @Override
  public String toString() {
    return String.format("(%s %s %s)", left, op.symbol, right);
  }
}

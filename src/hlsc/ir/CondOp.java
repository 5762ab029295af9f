package hlsc.ir;

public class CondOp extends IRExp {
  private IRExp cond;
  private IRExp left;
  private IRExp right;

  public CondOp(IRExp cond, IRExp left, IRExp right) {
    this.cond = cond;
    this.left = left;
    this.right = right;
  }

  public IRExp getCond() { return cond; }
  public IRExp getLeft() { return left; }
  public IRExp getRight() { return right; }
  public void setCond(IRExp cond) { this.cond = cond; }
  public void setLeft(IRExp left) { this.left = left; }
  public void setRight(IRExp right) { this.right = right; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitCondOp(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new CondOp(cond.copy(), left.copy(), right.copy()));
  }
  @Override
  public String toString() {
    return String.format("(%s ? %s : %s)", cond, left, right);
  }
}

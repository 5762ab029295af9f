package hlsc.ir;

public class Const extends IRExp {
  private final long value;

  public Const(long value) { this.value = value; }

  public long getValue() { return value; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitConst(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new Const(value));
  }
  @Override
  public String toString() {
    return Long.toString(value);
  }
}

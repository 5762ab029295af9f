package hlsc.ahdl;

public class AHDLConst extends AHDLExp {
  private final long value;

  public AHDLConst(long value) { this.value = value; }

  public long getValue() { return value; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitConst(this);
  }
  @Override
  public AHDLExp copy() {
    return new AHDLConst(value);
  }
  @Override
  public String toString() {
    return Long.toString(value);
  }
}

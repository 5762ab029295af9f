package hlsc.ahdl;

public class AHDLNop extends AHDLStm {
  private final String info;

  public AHDLNop(String info) { this.info = info; }

  public String getInfo() { return info; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitNop(this);
  }
  @Override
  public String toString() {
    return "nop // " + info;
  }
}

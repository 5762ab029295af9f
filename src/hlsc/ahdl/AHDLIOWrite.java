package hlsc.ahdl;

public class AHDLIOWrite extends AHDLStm {
  private final AHDLVar io;
  private final AHDLExp src;

  public AHDLIOWrite(AHDLVar io, AHDLExp src) {
    this.io = io;
    this.src = src;
  }

  public AHDLVar getIo() { return io; }
  public AHDLExp getSrc() { return src; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitIOWrite(this);
  }
  @Override
  public String toString() {
    return String.format("%s.wr(%s)", io, src);
  }
}

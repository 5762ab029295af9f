package hlsc.ahdl;

/** RAM read through the memory interface. */
public class AHDLLoad extends AHDLStm {
  private final AHDLMemVar mem;
  private final AHDLVar dst;
  private final AHDLExp offset;

  public AHDLLoad(AHDLMemVar mem, AHDLVar dst, AHDLExp offset) {
    this.mem = mem;
    this.dst = dst;
    this.offset = offset;
  }

  public AHDLMemVar getMem() { return mem; }
  public AHDLVar getDst() { return dst; }
  public AHDLExp getOffset() { return offset; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitLoad(this);
  }
  @Override
  public String toString() {
    return String.format("%s <= %s[%s]", dst, mem, offset);
  }
}

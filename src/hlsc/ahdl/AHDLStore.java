package hlsc.ahdl;

/** RAM write through the memory interface. */
public class AHDLStore extends AHDLStm {
  private final AHDLMemVar mem;
  private final AHDLExp src;
  private final AHDLExp offset;

  public AHDLStore(AHDLMemVar mem, AHDLExp src, AHDLExp offset) {
    this.mem = mem;
    this.src = src;
    this.offset = offset;
  }

  public AHDLMemVar getMem() { return mem; }
  public AHDLExp getSrc() { return src; }
  public AHDLExp getOffset() { return offset; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitStore(this);
  }
  @Override
  public String toString() {
    return String.format("%s[%s] <= %s", mem, offset, src);
  }
}

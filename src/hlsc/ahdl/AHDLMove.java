package hlsc.ahdl;

/** Assignment; {@code dst} is an {@link AHDLVar} or an {@link AHDLSubscript}. */
public class AHDLMove extends AHDLStm {
  private final AHDLExp dst;
  private final AHDLExp src;

  public AHDLMove(AHDLExp dst, AHDLExp src) {
    assert (dst instanceof AHDLVar || dst instanceof AHDLSubscript);
    this.dst = dst;
    this.src = src;
  }

  public AHDLExp getDst() { return dst; }
  public AHDLExp getSrc() { return src; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitMove(this);
  }
  @Override
  public String toString() {
    if (dst instanceof AHDLVar && ((AHDLVar)dst).getSig().isNet())
      return String.format("assign %s = %s", dst, src);
    return String.format("%s <= %s", dst, src);
  }
}

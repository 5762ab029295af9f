package hlsc.ahdl;

/** Element of a register array. */
public class AHDLSubscript extends AHDLExp {
  private final AHDLMemVar memvar;
  private final AHDLExp offset;

  public AHDLSubscript(AHDLMemVar memvar, AHDLExp offset) {
    this.memvar = memvar;
    this.offset = offset;
  }

  public AHDLMemVar getMemvar() { return memvar; }
  public AHDLExp getOffset() { return offset; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitSubscript(this);
  }
  @Override
  public AHDLExp copy() {
    return new AHDLSubscript((AHDLMemVar)memvar.copy(), offset.copy());
  }
  @Override
  public String toString() {
    return String.format("%s[%s]", memvar, offset);
  }
}

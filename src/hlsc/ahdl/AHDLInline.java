package hlsc.ahdl;

/** HDL text emitted verbatim. */
public class AHDLInline extends AHDLStm {
  private final String code;

  public AHDLInline(String code) { this.code = code; }

  public String getCode() { return code; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitInline(this);
  }
  @Override
  public String toString() {
    return code;
  }
}

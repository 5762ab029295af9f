package hlsc.ahdl;

/** Return handshake of a callable region: signal completion and present the return value. */
public class AHDLCalleeEpilog extends AHDLStm {
  private final String stgName;

  public AHDLCalleeEpilog(String stgName) { this.stgName = stgName; }

  public String getStgName() { return stgName; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitCalleeEpilog(this);
  }
  @Override
  public String toString() {
    return "callee_epilog(" + stgName + ")";
  }
}

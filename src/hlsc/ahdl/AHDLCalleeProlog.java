package hlsc.ahdl;

/** Entry handshake of a callable region: wait for the caller's request and latch the arguments. */
public class AHDLCalleeProlog extends AHDLStm {
  private final String stgName;

  public AHDLCalleeProlog(String stgName) { this.stgName = stgName; }

  public String getStgName() { return stgName; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitCalleeProlog(this);
  }
  @Override
  public String toString() {
    return "callee_prolog(" + stgName + ")";
  }
}

package hlsc.ahdl;

public class AHDLIfExp extends AHDLExp {
  private final AHDLExp cond;
  private final AHDLExp lexp;
  private final AHDLExp rexp;

  public AHDLIfExp(AHDLExp cond, AHDLExp lexp, AHDLExp rexp) {
    this.cond = cond;
    this.lexp = lexp;
    this.rexp = rexp;
  }

  public AHDLExp getCond() { return cond; }
  public AHDLExp getLexp() { return lexp; }
  public AHDLExp getRexp() { return rexp; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitIfExp(this);
  }
  @Override
  public AHDLExp copy() {
    return new AHDLIfExp(cond.copy(), lexp.copy(), rexp.copy());
  }
  @Override
  public String toString() {
    return String.format("(%s ? %s : %s)", cond, lexp, rexp);
  }
}

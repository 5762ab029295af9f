package hlsc.ir;

public class Ret extends IRStm {
  private IRExp exp;

  public Ret(IRExp exp) { this.exp = exp; }

  public IRExp getExp() { return exp; }
  public void setExp(IRExp exp) { this.exp = exp; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitRet(this);
  }
  @Override
  public IRStm copy() {
    return withLine(new Ret(exp.copy()));
  }
  @Override
  public String toString() {
    return "return " + exp;
  }
}

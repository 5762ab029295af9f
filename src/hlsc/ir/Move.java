package hlsc.ir;

public class Move extends IRStm {
  private Temp dst;
  private IRExp src;

  public Move(Temp dst, IRExp src) {
    assert (dst.isStore());
    this.dst = dst;
    this.src = src;
  }

  public Temp getDst() { return dst; }
  public IRExp getSrc() { return src; }
  public void setDst(Temp dst) { this.dst = dst; }
  public void setSrc(IRExp src) { this.src = src; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitMove(this);
  }
  @Override
  public IRStm copy() {
    return withLine(new Move(dst.copy(), src.copy()));
  }
  @Override
  public String toString() {
    return String.format("%s = %s", dst, src);
  }
}

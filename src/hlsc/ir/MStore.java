package hlsc.ir;

/** Memory write {@code mem[offset] = exp}, evaluating to the updated memory. */
public class MStore extends IRExp {
  private Temp mem;
  private IRExp offset;
  private IRExp exp;

  public MStore(Temp mem, IRExp offset, IRExp exp) {
    this.mem = mem;
    this.offset = offset;
    this.exp = exp;
  }

  public Temp getMem() { return mem; }
  public IRExp getOffset() { return offset; }
  public IRExp getExp() { return exp; }
  public void setMem(Temp mem) { this.mem = mem; }
  public void setOffset(IRExp offset) { this.offset = offset; }
  public void setExp(IRExp exp) { this.exp = exp; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitMStore(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new MStore(mem.copy(), offset.copy(), exp.copy()));
  }
  @Override
  public String toString() {
    return String.format("mstore(%s[%s], %s)", mem, offset, exp);
  }
}

package hlsc.ir;

/** Memory read {@code mem[offset]}. */
public class MRef extends IRExp {
  private Temp mem;
  private IRExp offset;

  public MRef(Temp mem, IRExp offset) {
    this.mem = mem;
    this.offset = offset;
  }

  public Temp getMem() { return mem; }
  public IRExp getOffset() { return offset; }
  public void setMem(Temp mem) { this.mem = mem; }
  public void setOffset(IRExp offset) { this.offset = offset; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitMRef(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new MRef(mem.copy(), offset.copy()));
  }
  @Override
  public String toString() {
    return String.format("%s[%s]", mem, offset);
  }
}

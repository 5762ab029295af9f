package hlsc.ir;

public class Jump extends IRStm {
  private Block target;
  private final boolean loopBack;

  public Jump(Block target, boolean loopBack) {
    this.target = target;
    this.loopBack = loopBack;
  }
  public Jump(Block target) { this(target, false); }

  public Block getTarget() { return target; }
  public void setTarget(Block target) { this.target = target; }
  public boolean isLoopBack() { return loopBack; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitJump(this);
  }
  @Override
  public IRStm copy() {
    return withLine(new Jump(target, loopBack));
  }
  @Override
  public String toString() {
    return (loopBack ? "jump(L) " : "jump ") + target.getName();
  }
}

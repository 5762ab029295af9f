package hlsc.ir;

public class CJump extends IRStm {
  private IRExp cond;
  private Block trueBlock;
  private Block falseBlock;

  public CJump(IRExp cond, Block trueBlock, Block falseBlock) {
    this.cond = cond;
    this.trueBlock = trueBlock;
    this.falseBlock = falseBlock;
  }

  public IRExp getCond() { return cond; }
  public void setCond(IRExp cond) { this.cond = cond; }
  public Block getTrue() { return trueBlock; }
  public Block getFalse() { return falseBlock; }
  public void setTrue(Block trueBlock) { this.trueBlock = trueBlock; }
  public void setFalse(Block falseBlock) { this.falseBlock = falseBlock; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitCJump(this);
  }
  @Override
  public IRStm copy() {
    return withLine(new CJump(cond.copy(), trueBlock, falseBlock));
  }
  @Override
  public String toString() {
    return String.format("cjump %s ? %s : %s", cond, trueBlock.getName(), falseBlock.getName());
  }
}

package hlsc.ir;

/**
 * An IR statement. Defines zero or one symbol and uses any number of symbols.
 */
public abstract class IRStm extends IR {
  protected Block block = null;

  public Block getBlock() { return block; }
  void setBlock(Block block) { this.block = block; }

  /** Deep copy of the statement, not attached to any block. Block references are shared. */
  public abstract IRStm copy();

  protected <T extends IRStm> T withLine(T stm) {
    stm.setLineno(lineno);
    return stm;
  }
}

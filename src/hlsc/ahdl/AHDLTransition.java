package hlsc.ahdl;

import hlsc.ir.Block;
import hlsc.stg.State;
import java.util.Optional;

/**
 * Unconditional state transition. Built with a pending target (a block, or none for "the next state") that the
 * STG builder later resolves to a concrete state.
 */
public class AHDLTransition extends AHDLStm {
  private Block targetBlock;
  private State targetState = null;

  /** Transition to the state following the current one. */
  public AHDLTransition() { this.targetBlock = null; }
  public AHDLTransition(Block targetBlock) { this.targetBlock = targetBlock; }
  public AHDLTransition(State targetState) {
    this.targetBlock = null;
    this.targetState = targetState;
  }

  public Optional<Block> getTargetBlock() { return Optional.ofNullable(targetBlock); }
  public void setTargetBlock(Block targetBlock) {
    this.targetBlock = targetBlock;
    this.targetState = null;
  }
  public Optional<State> getTargetState() { return Optional.ofNullable(targetState); }

  public boolean isResolved() { return targetState != null; }

  public void resolve(State state) {
    this.targetState = state;
    this.targetBlock = null;
  }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitTransition(this);
  }
  @Override
  public String toString() {
    if (targetState != null)
      return "(next state: " + targetState.getName() + ")";
    if (targetBlock != null)
      return "(next block: " + targetBlock.getName() + ")";
    return "(next state: <fall-through>)";
  }
}

package hlsc.stg;

import hlsc.ahdl.AHDLMetaWait;
import hlsc.ahdl.AHDLStm;
import hlsc.ahdl.AHDLTransition;
import hlsc.ahdl.AHDLTransitionIf;
import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Block;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A control state: the operations executed in one cycle plus the terminal transition.
 */
public class State {
  private String name;
  private final int step;
  private final List<AHDLStm> codes;
  private final STG stg;

  public State(String name, int step, List<AHDLStm> codes, STG stg) {
    this.name = name;
    this.step = step;
    this.codes = new ArrayList<>(codes);
    this.stg = stg;
  }

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }
  public int getStep() { return step; }
  /** Mutable list of operations. */
  public List<AHDLStm> getCodes() { return codes; }
  public STG getStg() { return stg; }

  /** The list whose last element is this state's terminal operation. */
  protected List<AHDLStm> terminalCodes() { return codes; }

  /**
   * Replaces pending transition targets: no target means {@code nextState}, a block target means the first state
   * built for that block. A wait construct in the state takes over the transition.
   * @return {@code nextState}
   * @throws CompileException if a target block has no state
   */
  public State resolveTransition(State nextState, Map<Block, List<State>> blk2states) {
    List<AHDLStm> terminal = terminalCodes();
    if (terminal.isEmpty())
      return nextState;
    AHDLStm last = terminal.get(terminal.size() - 1);
    if (last instanceof AHDLTransitionIf) {
      for (List<AHDLStm> branch : ((AHDLTransitionIf)last).getCodesList()) {
        AHDLStm branchLast = branch.get(branch.size() - 1);
        assert (branchLast instanceof AHDLTransition);
        resolve((AHDLTransition)branchLast, nextState, blk2states);
      }
    } else if (last instanceof AHDLTransition) {
      resolve((AHDLTransition)last, nextState, blk2states);
      AHDLMetaWait wait = terminal.stream()
                              .filter(code -> code instanceof AHDLMetaWait)
                              .map(code -> (AHDLMetaWait)code)
                              .reduce((first, second) -> second)
                              .orElse(null);
      if (wait != null) {
        terminal.remove(terminal.size() - 1);
        wait.setTransition((AHDLTransition)last);
        terminal.remove(wait);
        terminal.add(wait);
      }
    } else if (last instanceof AHDLMetaWait) {
      AHDLMetaWait wait = (AHDLMetaWait)last;
      if (wait.getTransition().isEmpty())
        wait.setTransition(new AHDLTransition(nextState));
      else
        resolve(wait.getTransition().get(), nextState, blk2states);
    }
    return nextState;
  }

  private void resolve(AHDLTransition transition, State nextState, Map<Block, List<State>> blk2states) {
    if (transition.isResolved())
      return;
    if (transition.getTargetBlock().isPresent()) {
      Block target = transition.getTargetBlock().get();
      List<State> states = blk2states.get(target);
      if (states == null || states.isEmpty())
        throw CompileException.of(Errors.UNRESOLVED_TRANSITION, stg.getScope().getName(), name, target.getName());
      transition.resolve(states.get(0));
    } else {
      transition.resolve(nextState);
    }
  }

  @Override
  public String toString() {
    var sb = new StringBuilder("---------------------------------\n");
    sb.append(name).append(":").append(step).append("\n");
    for (AHDLStm code : codes)
      sb.append("  ").append(code).append("\n");
    return sb.toString();
  }
}

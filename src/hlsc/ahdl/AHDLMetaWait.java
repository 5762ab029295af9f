package hlsc.ahdl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Blocks the state's transition until an event occurs. The transition is attached when the STG is resolved.
 */
public class AHDLMetaWait extends AHDLStm {
  public enum WaitKind {
    /** All argument conditions hold. */
    WAIT_COND,
    /** Argument 2 changes from argument 0 to argument 1. */
    WAIT_EDGE,
    /** Argument 1 equals argument 0. */
    WAIT_VALUE
  }

  private final WaitKind waitKind;
  private final List<AHDLExp> args;
  private AHDLTransition transition = null;

  public AHDLMetaWait(WaitKind waitKind, List<AHDLExp> args) {
    this.waitKind = waitKind;
    this.args = new ArrayList<>(args);
  }

  public WaitKind getWaitKind() { return waitKind; }
  public List<AHDLExp> getArgs() { return args; }
  public Optional<AHDLTransition> getTransition() { return Optional.ofNullable(transition); }
  public void setTransition(AHDLTransition transition) { this.transition = transition; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitMetaWait(this);
  }
  @Override
  public String toString() {
    return String.format("%s(%s) %s", waitKind.name().toLowerCase(),
                         args.stream().map(Object::toString).collect(Collectors.joining(", ")),
                         transition == null ? "" : transition.toString());
  }
}

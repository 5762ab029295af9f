package hlsc.ahdl;

import java.util.List;

/**
 * Conditional multi-way transition; every branch ends with an {@link AHDLTransition}.
 */
public class AHDLTransitionIf extends AHDLIf {
  public AHDLTransitionIf(List<AHDLExp> conds, List<List<AHDLStm>> codesList) { super(conds, codesList); }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitTransitionIf(this);
  }
  @Override
  protected String keyword() {
    return "transition if";
  }
}

package hlsc.ahdl;

import java.util.List;

/**
 * Wraps the side-effecting operations of one pipeline stage so they only apply while the stage executes.
 */
public class AHDLPipelineGuard extends AHDLIf {
  public AHDLPipelineGuard(AHDLExp cond, List<AHDLStm> codes) { super(List.of(cond), List.of(codes)); }

  public AHDLExp getCond() { return getConds().get(0); }
  public List<AHDLStm> getCodes() { return getCodesList().get(0); }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitPipelineGuard(this);
  }
  @Override
  protected String keyword() {
    return "guard";
  }
}

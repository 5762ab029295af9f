package hlsc.ahdl;

/**
 * Sub-step {@code step} of {@code stepN} of a multi-cycle operation.
 */
public class AHDLSeq extends AHDLStm {
  private final AHDLStm factor;
  private final int step;
  private final int stepN;

  public AHDLSeq(AHDLStm factor, int step, int stepN) {
    assert (step >= 0 && step < Math.max(stepN, 1));
    this.factor = factor;
    this.step = step;
    this.stepN = stepN;
  }

  public AHDLStm getFactor() { return factor; }
  public int getStep() { return step; }
  public int getStepN() { return stepN; }
  public boolean isLastStep() { return step == stepN - 1; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitSeq(this);
  }
  @Override
  public String toString() {
    return String.format("Sequence %d/%d : %s", step, stepN, factor);
  }
}

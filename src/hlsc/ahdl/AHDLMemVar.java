package hlsc.ahdl;

import hlsc.ir.Temp.Ctx;

/** Reference to a memory (RAM, ROM or register array) signal. */
public class AHDLMemVar extends AHDLVar {
  public AHDLMemVar(Signal sig, Ctx ctx) { super(sig, ctx); }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitMemVar(this);
  }
  @Override
  public AHDLExp copy() {
    return new AHDLMemVar(getSig(), getCtx());
  }
}

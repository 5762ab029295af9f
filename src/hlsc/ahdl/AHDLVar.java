package hlsc.ahdl;

import hlsc.ir.Temp.Ctx;

/**
 * Read or write of a signal.
 */
public class AHDLVar extends AHDLExp {
  private Signal sig;
  private final Ctx ctx;

  public AHDLVar(Signal sig, Ctx ctx) {
    this.sig = sig;
    this.ctx = ctx;
  }

  public static AHDLVar load(Signal sig) { return new AHDLVar(sig, Ctx.LOAD); }
  public static AHDLVar store(Signal sig) { return new AHDLVar(sig, Ctx.STORE); }

  public Signal getSig() { return sig; }
  public void setSig(Signal sig) { this.sig = sig; }
  public Ctx getCtx() { return ctx; }
  public boolean isStore() { return ctx == Ctx.STORE; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitVar(this);
  }
  @Override
  public AHDLExp copy() {
    return new AHDLVar(sig, ctx);
  }
  @Override
  public String toString() {
    return sig.getName();
  }
}

package hlsc.ir;

/**
 * A reference to a symbol, either read ({@link Ctx#LOAD}) or written ({@link Ctx#STORE}).
 */
public class Temp extends IRExp {
  public enum Ctx { LOAD, STORE }

  private Symbol sym;
  private final Ctx ctx;

  public Temp(Symbol sym, Ctx ctx) {
    this.sym = sym;
    this.ctx = ctx;
  }

  public static Temp load(Symbol sym) { return new Temp(sym, Ctx.LOAD); }
  public static Temp store(Symbol sym) { return new Temp(sym, Ctx.STORE); }

  public Symbol getSym() { return sym; }
  public void setSym(Symbol sym) { this.sym = sym; }
  public Ctx getCtx() { return ctx; }
  public boolean isStore() { return ctx == Ctx.STORE; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitTemp(this);
  }
  @Override
  public Temp copy() {
    return withLine(new Temp(sym, ctx));
  }
  @Override
  public String toString() {
    return sym.getName();
  }
}

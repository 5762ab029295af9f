package hlsc.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Merge of the versions of one variable arriving over different predecessor edges.
 * Selection predicates ({@link #getPs()}) are attached by a later phase and are required for lowering.
 */
public class Phi extends IRStm {
  /** One incoming version together with the predecessor it arrives from. */
  public record PhiArg(Temp var, Block pred) {
    @Override
    public String toString() {
      return String.format("%s:%s", var, pred.getName());
    }
  }

  private Temp var;
  private final List<PhiArg> args = new ArrayList<>();
  private final List<IRExp> ps = new ArrayList<>();

  public Phi(Temp var) {
    assert (var.isStore());
    this.var = var;
  }

  public Temp getVar() { return var; }
  public void setVar(Temp var) { this.var = var; }

  public List<PhiArg> getArgs() { return args; }
  public void addArg(Temp arg, Block pred) { args.add(new PhiArg(arg, pred)); }
  public void removeArg(PhiArg arg) { args.remove(arg); }

  public List<IRExp> getPs() { return ps; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitPhi(this);
  }
  @Override
  public IRStm copy() {
    Phi phi = withLine(new Phi(var.copy()));
    args.forEach(arg -> phi.addArg(arg.var().copy(), arg.pred()));
    ps.forEach(p -> phi.ps.add(p.copy()));
    return phi;
  }
  @Override
  public String toString() {
    return String.format("%s = phi(%s)", var, args.stream().map(Object::toString).collect(Collectors.joining(", ")));
  }
}

package hlsc.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Call of another scope. Lowered to a hardware sub-call occupying {@code latency} cycles.
 */
public class Call extends IRExp {
  private final Scope callee;
  private final List<IRExp> args;

  public Call(Scope callee, List<IRExp> args) {
    this.callee = callee;
    this.args = new ArrayList<>(args);
  }

  public Scope getCallee() { return callee; }
  public List<IRExp> getArgs() { return args; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitCall(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new Call(callee, args.stream().map(IRExp::copy).collect(Collectors.toList())));
  }
  @Override
  public String toString() {
    return String.format("%s(%s)", callee.getName(), args.stream().map(Object::toString).collect(Collectors.joining(", ")));
  }
}

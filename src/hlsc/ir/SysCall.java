package hlsc.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Call of a builtin ({@code print}, {@code assert}, {@code clksleep}, {@code wait_*}, {@code len}).
 */
public class SysCall extends IRExp {
  private final String name;
  private final List<IRExp> args;

  public SysCall(String name, List<IRExp> args) {
    this.name = name;
    this.args = new ArrayList<>(args);
  }

  public String getName() { return name; }
  public List<IRExp> getArgs() { return args; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitSysCall(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new SysCall(name, args.stream().map(IRExp::copy).collect(Collectors.toList())));
  }
  @Override
  public String toString() {
    return String.format("!%s(%s)", name, args.stream().map(Object::toString).collect(Collectors.joining(", ")));
  }
}

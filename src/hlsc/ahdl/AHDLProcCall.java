package hlsc.ahdl;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Side-effecting HDL task call such as {@code $display}. */
public class AHDLProcCall extends AHDLStm {
  private final String name;
  private final List<AHDLExp> args;

  public AHDLProcCall(String name, List<AHDLExp> args) {
    this.name = name;
    this.args = new ArrayList<>(args);
  }

  public String getName() { return name; }
  public List<AHDLExp> getArgs() { return args; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitProcCall(this);
  }
  @Override
  public String toString() {
    return String.format("%s(%s)", name, args.stream().map(Object::toString).collect(Collectors.joining(", ")));
  }
}

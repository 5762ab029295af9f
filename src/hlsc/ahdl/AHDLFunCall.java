package hlsc.ahdl;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Call of a combinational HDL function, e.g. a ROM lookup. */
public class AHDLFunCall extends AHDLExp {
  private final String name;
  private final List<AHDLExp> args;

  public AHDLFunCall(String name, List<AHDLExp> args) {
    this.name = name;
    this.args = new ArrayList<>(args);
  }

  public String getName() { return name; }
  public List<AHDLExp> getArgs() { return args; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitFunCall(this);
  }
  @Override
  public AHDLExp copy() {
    return new AHDLFunCall(name, args.stream().map(AHDLExp::copy).collect(Collectors.toList()));
  }
  @Override
  public String toString() {
    return String.format("%s(%s)", name, args.stream().map(Object::toString).collect(Collectors.joining(", ")));
  }
}

package hlsc.ahdl;

import hlsc.ir.Scope;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Call of a sub-module instance using the call/accept/done handshake.
 */
public class AHDLModuleCall extends AHDLStm {
  private final Scope callee;
  private final List<AHDLExp> args;
  private final String instanceName;
  private final String prefix;
  private final List<AHDLExp> returns;

  /**
   * @param instanceName name of the hardware instance of {@code callee}
   * @param prefix prefix of the handshake signals of that instance
   * @param returns destinations of the return values, empty if they are discarded
   */
  public AHDLModuleCall(Scope callee, List<AHDLExp> args, String instanceName, String prefix, List<AHDLExp> returns) {
    this.callee = callee;
    this.args = new ArrayList<>(args);
    this.instanceName = instanceName;
    this.prefix = prefix;
    this.returns = new ArrayList<>(returns);
  }

  public Scope getCallee() { return callee; }
  public List<AHDLExp> getArgs() { return args; }
  public String getInstanceName() { return instanceName; }
  public String getPrefix() { return prefix; }
  public List<AHDLExp> getReturns() { return returns; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitModuleCall(this);
  }
  @Override
  public String toString() {
    return String.format("%s(%s)%s", instanceName, args.stream().map(Object::toString).collect(Collectors.joining(", ")),
                         returns.isEmpty() ? ""
                                           : " -> " + returns.stream().map(Object::toString).collect(Collectors.joining(", ")));
  }
}

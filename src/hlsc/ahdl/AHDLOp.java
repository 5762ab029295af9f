package hlsc.ahdl;

import hlsc.ir.Op;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator application. Binary operators may take more than two operands, which are folded left to right.
 */
public class AHDLOp extends AHDLExp {
  private final Op op;
  private final List<AHDLExp> args;

  public AHDLOp(Op op, List<AHDLExp> args) {
    if (op.isUnary() ? args.size() != 1 : args.size() < 2)
      throw new IllegalArgumentException(String.format("wrong operand count %d for %s", args.size(), op.serialName));
    this.op = op;
    this.args = new ArrayList<>(args);
  }
  public AHDLOp(Op op, AHDLExp... args) { this(op, Arrays.asList(args)); }

  public Op getOp() { return op; }
  public List<AHDLExp> getArgs() { return args; }
  public boolean isUnary() { return op.isUnary(); }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitOp(this);
  }
  @Override
  public AHDLExp copy() {
    return new AHDLOp(op, args.stream().map(AHDLExp::copy).collect(Collectors.toList()));
  }
  @Override
  public String toString() {
    if (isUnary())
      return op.symbol + args.get(0);
    return "(" + args.stream().map(Object::toString).collect(Collectors.joining(" " + op.symbol + " ")) + ")";
  }
}

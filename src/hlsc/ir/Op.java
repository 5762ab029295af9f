package hlsc.ir;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Operators shared by IR expressions and the low-level hardware operations.
 */
public enum Op {
  Add("Add", "+", 2),
  Sub("Sub", "-", 2),
  Mult("Mult", "*", 2),
  FloorDiv("FloorDiv", "/", 2),
  Mod("Mod", "%", 2),
  LShift("LShift", "<<", 2),
  RShift("RShift", ">>>", 2),
  BitOr("BitOr", "|", 2),
  BitXor("BitXor", "^", 2),
  BitAnd("BitAnd", "&", 2),
  And("And", "&&", 2),
  Or("Or", "||", 2),
  Eq("Eq", "==", 2),
  NotEq("NotEq", "!=", 2),
  Lt("Lt", "<", 2),
  LtE("LtE", "<=", 2),
  Gt("Gt", ">", 2),
  GtE("GtE", ">=", 2),
  USub("USub", "-", 1),
  UAdd("UAdd", "+", 1),
  Not("Not", "!", 1),
  Invert("Invert", "~", 1);

  public final String serialName;
  public final String symbol;
  public final int arity;

  private Op(String serialName, String symbol, int arity) {
    this.serialName = serialName;
    this.symbol = symbol;
    this.arity = arity;
  }

  public boolean isUnary() { return arity == 1; }
  public boolean isRelational() {
    switch (this) {
    case And:
    case Or:
    case Eq:
    case NotEq:
    case Lt:
    case LtE:
    case Gt:
    case GtE:
      return true;
    default:
      return false;
    }
  }

  public static Optional<Op> fromSerialName(String serialName) {
    return Stream.of(Op.values()).filter(op -> op.serialName.equals(serialName)).findAny();
  }
}

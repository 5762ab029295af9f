package hlsc.ir;

import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Semantic type metadata of a symbol, reduced to what is needed to size and tag hardware signals.
 */
public class Type {
  public enum Kind {
    INT("int"),
    BOOL("bool"),
    LIST("list"),
    PORT("port"),
    OBJECT("object"),
    FUNCTION("function"),
    NONE("none");

    public final String serialName;

    private Kind(String serialName) { this.serialName = serialName; }
    public static Optional<Kind> fromSerialName(String serialName) {
      return Stream.of(Kind.values()).filter(kind -> kind.serialName.equals(serialName)).findAny();
    }
  }

  /** How a list is implemented in hardware. */
  public enum MemKind {
    RAM("ram"),
    REGISTER_ARRAY("regarray"),
    ROM("rom");

    public final String serialName;

    private MemKind(String serialName) { this.serialName = serialName; }
    public static Optional<MemKind> fromSerialName(String serialName) {
      return Stream.of(MemKind.values()).filter(kind -> kind.serialName.equals(serialName)).findAny();
    }
  }

  public enum PortDirection {
    IN("in"),
    OUT("out"),
    INOUT("inout");

    public final String serialName;

    private PortDirection(String serialName) { this.serialName = serialName; }
    public static Optional<PortDirection> fromSerialName(String serialName) {
      return Stream.of(PortDirection.values()).filter(dir -> dir.serialName.equals(serialName)).findAny();
    }
  }

  public static final int DEFAULT_INT_WIDTH = 32;
  public static final int UNKNOWN_LENGTH = -1;

  private final Kind kind;
  private final int width;
  private final boolean signed;
  private final Type element;
  private final int length;
  private final MemKind memKind;
  private final PortDirection direction;
  private final String protocol;
  private final boolean internal;
  private final int init;
  private final int maxsize;

  private Type(Kind kind, int width, boolean signed, Type element, int length, MemKind memKind, PortDirection direction,
               String protocol, boolean internal, int init, int maxsize) {
    this.kind = kind;
    this.width = width;
    this.signed = signed;
    this.element = element;
    this.length = length;
    this.memKind = memKind;
    this.direction = direction;
    this.protocol = protocol;
    this.internal = internal;
    this.init = init;
    this.maxsize = maxsize;
  }

  public static Type intType(int width, boolean signed) {
    return new Type(Kind.INT, width, signed, null, 0, null, null, "none", false, 0, 0);
  }
  public static Type intType() { return intType(DEFAULT_INT_WIDTH, true); }
  public static Type boolType() { return new Type(Kind.BOOL, 1, false, null, 0, null, null, "none", false, 0, 0); }
  public static Type noneType() { return new Type(Kind.NONE, 0, false, null, 0, null, null, "none", false, 0, 0); }
  public static Type functionType() { return new Type(Kind.FUNCTION, 0, false, null, 0, null, null, "none", false, 0, 0); }
  public static Type objectType() { return new Type(Kind.OBJECT, 0, false, null, 0, null, null, "none", false, 0, 0); }
  public static Type listType(Type element, int length, MemKind memKind) {
    return new Type(Kind.LIST, element.width, element.signed, element, length, memKind, null, "none", false, 0, 0);
  }
  /**
   * @param dtype type of the value carried by the port
   * @param protocol "none", "valid" or "ready_valid"
   * @param internal true for ports connecting workers of the same module
   * @param maxsize queue depth, 0 for a plain port
   */
  public static Type portType(Type dtype, PortDirection direction, String protocol, boolean internal, int init, int maxsize) {
    return new Type(Kind.PORT, dtype.width, dtype.signed, dtype, 0, null, direction, protocol, internal, init, maxsize);
  }

  public Kind getKind() { return kind; }
  public boolean isInt() { return kind == Kind.INT; }
  public boolean isBool() { return kind == Kind.BOOL; }
  public boolean isList() { return kind == Kind.LIST; }
  public boolean isPort() { return kind == Kind.PORT; }
  public boolean isFunction() { return kind == Kind.FUNCTION; }
  public boolean isObject() { return kind == Kind.OBJECT; }
  public boolean isScalar() { return kind == Kind.INT || kind == Kind.BOOL; }

  public int getWidth() { return width; }
  public boolean isSigned() { return signed; }
  public Optional<Type> getElement() { return Optional.ofNullable(element); }
  public int getLength() { return length; }
  public Optional<MemKind> getMemKind() { return Optional.ofNullable(memKind); }
  public Optional<PortDirection> getDirection() { return Optional.ofNullable(direction); }
  public String getProtocol() { return protocol; }
  public boolean isInternal() { return internal; }
  public int getInit() { return init; }
  public int getMaxsize() { return maxsize; }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Type))
      return false;
    Type other = (Type)o;
    return kind == other.kind && width == other.width && signed == other.signed && length == other.length &&
        Objects.equals(element, other.element) && memKind == other.memKind && direction == other.direction &&
        protocol.equals(other.protocol) && internal == other.internal && init == other.init && maxsize == other.maxsize;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, width, signed, element, length, memKind, direction, protocol, internal, init, maxsize);
  }

  @Override
  public String toString() {
    switch (kind) {
    case INT:
      return String.format("%sint%d", signed ? "" : "u", width);
    case LIST:
      return String.format("list<%s>[%d]", element, length);
    case PORT:
      return String.format("port<%s, %s>", element, direction.serialName);
    default:
      return kind.serialName;
    }
  }
}

package hlsc.ahdl;

/** Raw HDL token, e.g. {@code 'bz} or {@code $time}. */
public class AHDLSymbol extends AHDLExp {
  private final String name;

  public AHDLSymbol(String name) { this.name = name; }

  public String getName() { return name; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitSymbol(this);
  }
  @Override
  public AHDLExp copy() {
    return new AHDLSymbol(name);
  }
  @Override
  public String toString() {
    return name;
  }
}

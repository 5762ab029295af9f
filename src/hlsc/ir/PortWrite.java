package hlsc.ir;

/** Write of a value to a port symbol. */
public class PortWrite extends IRExp {
  private Temp port;
  private IRExp value;

  public PortWrite(Temp port, IRExp value) {
    this.port = port;
    this.value = value;
  }

  public Temp getPort() { return port; }
  public IRExp getValue() { return value; }
  public void setPort(Temp port) { this.port = port; }
  public void setValue(IRExp value) { this.value = value; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitPortWrite(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new PortWrite(port.copy(), value.copy()));
  }
  @Override
  public String toString() {
    return String.format("%s.wr(%s)", port, value);
  }
}

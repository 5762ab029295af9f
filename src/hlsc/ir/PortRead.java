package hlsc.ir;

/** Read of a port symbol, possibly blocking on its protocol. */
public class PortRead extends IRExp {
  private Temp port;

  public PortRead(Temp port) { this.port = port; }

  public Temp getPort() { return port; }
  public void setPort(Temp port) { this.port = port; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitPortRead(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new PortRead(port.copy()));
  }
  @Override
  public String toString() {
    return port + ".rd()";
  }
}

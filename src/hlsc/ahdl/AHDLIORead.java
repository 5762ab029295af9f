package hlsc.ahdl;

import java.util.Optional;

/** Read of a port; the value is discarded when there is no destination. */
public class AHDLIORead extends AHDLStm {
  private final AHDLVar io;
  private final AHDLVar dst;

  public AHDLIORead(AHDLVar io, Optional<AHDLVar> dst) {
    this.io = io;
    this.dst = dst.orElse(null);
  }

  public AHDLVar getIo() { return io; }
  public Optional<AHDLVar> getDst() { return Optional.ofNullable(dst); }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitIORead(this);
  }
  @Override
  public String toString() {
    return dst == null ? io + ".rd()" : String.format("%s <= %s.rd()", dst, io);
  }
}

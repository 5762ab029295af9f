package hlsc.ahdl;

public abstract class AHDLExp extends AHDL {
  /** Deep copy; signals are shared. */
  public abstract AHDLExp copy();
}

package hlsc.ahdl;

/**
 * Base of the low-level hardware operations states and pipeline stages are made of.
 * The node set is closed; {@link AHDLVisitor} dispatches over it.
 */
public abstract class AHDL {
  public abstract <R> R accept(AHDLVisitor<R> visitor);
}

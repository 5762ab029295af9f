package hlsc.ahdl;

/**
 * Redirects signal reads to another signal, keeping an {@link AHDLUseDefTable} current.
 */
public class AHDLVarReplacer {
  private AHDLVarReplacer() {}

  /**
   * Replaces the reads of {@code oldSig} in {@code stm} (not in nested statements) by reads of {@code newSig}.
   * @return the number of replaced reads
   */
  public static int replaceUses(AHDLUseDefTable table, AHDLStm stm, Signal oldSig, Signal newSig) {
    int replaced = 0;
    for (AHDLVar var : table.getUseVars(stm)) {
      if (var.getSig() != oldSig)
        continue;
      var.setSig(newSig);
      table.moveUse(var, stm, oldSig);
      ++replaced;
    }
    return replaced;
  }
}

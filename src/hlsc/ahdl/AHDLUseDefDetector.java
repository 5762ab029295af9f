package hlsc.ahdl;

import java.util.List;

/**
 * Collects the signal definitions and uses of a list of operations.
 */
public class AHDLUseDefDetector extends AHDLWalker {
  private final AHDLUseDefTable table;

  private AHDLUseDefDetector(AHDLUseDefTable table) { this.table = table; }

  public static AHDLUseDefTable process(List<List<AHDLStm>> codeLists) {
    var detector = new AHDLUseDefDetector(new AHDLUseDefTable());
    codeLists.forEach(detector::walkCodes);
    return detector.table;
  }

  @Override
  public Void visitVar(AHDLVar ahdl) {
    if (currentStm == null)
      return null;
    if (ahdl.isStore())
      table.addDef(ahdl, currentStm);
    else
      table.addUse(ahdl, currentStm);
    return null;
  }
}

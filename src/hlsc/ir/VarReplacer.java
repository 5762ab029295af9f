package hlsc.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites every use of a symbol to another symbol and keeps a {@link UseDefTable} up to date.
 */
public class VarReplacer {
  private VarReplacer() {}

  /**
   * @return the statements that had at least one use replaced, in table order
   */
  public static List<IRStm> replaceUses(UseDefTable table, Symbol sym, Symbol newSym) {
    var replaced = new ArrayList<IRStm>();
    if (sym == newSym)
      return replaced;
    for (IRStm stm : new ArrayList<>(table.getStmsUsingSym(sym))) {
      boolean any = false;
      for (Temp var : new ArrayList<>(table.getUseVars(stm))) {
        if (var.getSym() != sym)
          continue;
        table.removeVarUse(var, stm);
        var.setSym(newSym);
        table.addVarUse(var, stm);
        any = true;
      }
      if (any)
        replaced.add(stm);
    }
    return replaced;
  }
}

package hlsc.ahdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Signals defined and used by operations.
 */
public class AHDLUseDefTable {
  private final Map<Signal, LinkedHashSet<AHDLStm>> defStms = new LinkedHashMap<>();
  private final Map<Signal, LinkedHashSet<AHDLStm>> useStms = new LinkedHashMap<>();
  private final Map<AHDLStm, List<AHDLVar>> stmUseVars = new LinkedHashMap<>();

  void addDef(AHDLVar var, AHDLStm stm) { defStms.computeIfAbsent(var.getSig(), s -> new LinkedHashSet<>()).add(stm); }

  void addUse(AHDLVar var, AHDLStm stm) {
    useStms.computeIfAbsent(var.getSig(), s -> new LinkedHashSet<>()).add(stm);
    stmUseVars.computeIfAbsent(stm, s -> new ArrayList<>()).add(var);
  }

  void moveUse(AHDLVar var, AHDLStm stm, Signal oldSig) {
    var vars = stmUseVars.get(stm);
    if (vars.stream().noneMatch(v -> v != var && v.getSig() == oldSig))
      useStms.get(oldSig).remove(stm);
    useStms.computeIfAbsent(var.getSig(), s -> new LinkedHashSet<>()).add(stm);
  }

  public Set<AHDLStm> getDefStms(Signal sig) {
    var stms = defStms.get(sig);
    return stms == null ? Collections.emptySet() : Collections.unmodifiableSet(stms);
  }
  public Set<AHDLStm> getUseStms(Signal sig) {
    var stms = useStms.get(sig);
    return stms == null ? Collections.emptySet() : Collections.unmodifiableSet(stms);
  }
  public List<AHDLVar> getUseVars(AHDLStm stm) {
    var vars = stmUseVars.get(stm);
    return vars == null ? Collections.emptyList() : Collections.unmodifiableList(vars);
  }

  public Set<Signal> getDefinedSignals() { return Collections.unmodifiableSet(defStms.keySet()); }
  public Set<Signal> getUsedSignals() { return Collections.unmodifiableSet(useStms.keySet()); }
}

package hlsc.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Definitions and uses of symbols, indexed by symbol, statement and block.
 */
public class UseDefTable {
  private final Map<Symbol, LinkedHashSet<IRStm>> defStms = new LinkedHashMap<>();
  private final Map<Symbol, LinkedHashSet<IRStm>> useStms = new LinkedHashMap<>();
  private final Map<Symbol, LinkedHashSet<Block>> defBlks = new LinkedHashMap<>();
  private final Map<Symbol, LinkedHashSet<Block>> useBlks = new LinkedHashMap<>();
  private final Map<Block, LinkedHashSet<Symbol>> blkDefSyms = new LinkedHashMap<>();
  private final Map<Block, LinkedHashSet<Symbol>> blkUseSyms = new LinkedHashMap<>();
  private final Map<IRStm, List<Temp>> stmDefVars = new LinkedHashMap<>();
  private final Map<IRStm, List<Temp>> stmUseVars = new LinkedHashMap<>();

  private static <K, V> void put(Map<K, LinkedHashSet<V>> map, K key, V value) {
    map.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(value);
  }
  private static <K, V> Set<V> get(Map<K, LinkedHashSet<V>> map, K key) {
    var values = map.get(key);
    return values == null ? Collections.emptySet() : Collections.unmodifiableSet(values);
  }

  public void addVarDef(Temp var, IRStm stm) {
    Symbol sym = var.getSym();
    put(defStms, sym, stm);
    stmDefVars.computeIfAbsent(stm, s -> new ArrayList<>()).add(var);
    if (stm.getBlock() != null) {
      put(defBlks, sym, stm.getBlock());
      put(blkDefSyms, stm.getBlock(), sym);
    }
  }

  public void addVarUse(Temp var, IRStm stm) {
    Symbol sym = var.getSym();
    put(useStms, sym, stm);
    stmUseVars.computeIfAbsent(stm, s -> new ArrayList<>()).add(var);
    if (stm.getBlock() != null) {
      put(useBlks, sym, stm.getBlock());
      put(blkUseSyms, stm.getBlock(), sym);
    }
  }

  /** Removes one use of {@code var} in {@code stm}, keeping the per-block indices consistent. */
  public void removeVarUse(Temp var, IRStm stm) {
    Symbol sym = var.getSym();
    var vars = stmUseVars.get(stm);
    if (vars != null)
      vars.remove(var);
    boolean stillUsedInStm = vars != null && vars.stream().anyMatch(v -> v.getSym() == sym);
    if (!stillUsedInStm) {
      var stms = useStms.get(sym);
      if (stms != null)
        stms.remove(stm);
      Block block = stm.getBlock();
      if (block != null && get(useStms, sym).stream().noneMatch(s -> s.getBlock() == block)) {
        var blks = useBlks.get(sym);
        if (blks != null)
          blks.remove(block);
        var syms = blkUseSyms.get(block);
        if (syms != null)
          syms.remove(sym);
      }
    }
  }

  /** Drops every definition and use recorded for {@code stm}. */
  public void removeStm(IRStm stm) {
    for (Temp var : new ArrayList<>(getUseVars(stm)))
      removeVarUse(var, stm);
    var defs = stmDefVars.remove(stm);
    if (defs != null) {
      for (Temp var : defs) {
        var stms = defStms.get(var.getSym());
        if (stms != null)
          stms.remove(stm);
      }
    }
  }

  public Set<IRStm> getStmsDefiningSym(Symbol sym) { return get(defStms, sym); }
  public Set<IRStm> getStmsUsingSym(Symbol sym) { return get(useStms, sym); }
  public Set<Block> getBlksDefiningSym(Symbol sym) { return get(defBlks, sym); }
  public Set<Block> getBlksUsingSym(Symbol sym) { return get(useBlks, sym); }
  public Set<Symbol> getSymsDefinedInBlk(Block block) { return get(blkDefSyms, block); }
  public Set<Symbol> getSymsUsedInBlk(Block block) { return get(blkUseSyms, block); }

  public List<Temp> getDefVars(IRStm stm) {
    var vars = stmDefVars.get(stm);
    return vars == null ? Collections.emptyList() : Collections.unmodifiableList(vars);
  }
  public List<Temp> getUseVars(IRStm stm) {
    var vars = stmUseVars.get(stm);
    return vars == null ? Collections.emptyList() : Collections.unmodifiableList(vars);
  }

  public Set<Symbol> getAllDefinedSyms() { return Collections.unmodifiableSet(defStms.keySet()); }
  public Set<Symbol> getAllUsedSyms() { return Collections.unmodifiableSet(useStms.keySet()); }
}

package hlsc.ir;

import hlsc.ahdl.Signal;
import hlsc.ahdl.Signal.SignalTag;
import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Symbol.SymbolTag;
import hlsc.schedule.SchedulingRegion;
import hlsc.stg.STG;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A lexical scope: owns symbols, a control-flow graph (block arena with entry and exit), signals and the STGs
 * built for it. Scopes are created through a {@link ScopeRegistry}.
 */
public class Scope {
  protected static final Logger logger = LogManager.getLogger();

  public enum ScopeTag {
    Global("global"),
    Function("function"),
    Class("class"),
    Method("method"),
    Ctor("ctor"),
    Callable("callable"),
    Returnable("returnable"),
    Testbench("testbench"),
    Module("module"),
    Worker("worker"),
    Port("port"),
    Lib("lib"),
    Namespace("namespace");

    public final String serialName;

    private ScopeTag(String serialName) { this.serialName = serialName; }
    public static Optional<ScopeTag> fromSerialName(String serialName) {
      return Stream.of(ScopeTag.values()).filter(tag -> tag.serialName.equals(serialName)).findAny();
    }
  }

  private final ScopeRegistry registry;
  private final String name;
  private final String origName;
  private final Scope parent;
  private final EnumSet<ScopeTag> tags;
  private final int lineno;

  private final List<Scope> children = new ArrayList<>();
  private final LinkedHashMap<String, Symbol> symbols = new LinkedHashMap<>();
  private final List<Symbol> params = new ArrayList<>();
  private Symbol returnSym = null;

  private final List<Block> blocks = new ArrayList<>();
  private Block entryBlock = null;
  private Block exitBlock = null;

  private final LinkedHashSet<Scope> calleeScopes = new LinkedHashSet<>();
  private final LinkedHashSet<Scope> callerScopes = new LinkedHashSet<>();
  private final LinkedHashMap<Scope, LinkedHashSet<String>> calleeInstances = new LinkedHashMap<>();
  private final List<Scope> workers = new ArrayList<>();

  private final LinkedHashMap<String, Signal> signals = new LinkedHashMap<>();
  private final List<SchedulingRegion> regions = new ArrayList<>();
  private final List<STG> stgs = new ArrayList<>();

  Scope(ScopeRegistry registry, Scope parent, String origName, EnumSet<ScopeTag> tags, int lineno) {
    this.registry = registry;
    this.parent = parent;
    this.origName = origName;
    this.name = (parent == null) ? origName : parent.name + "." + origName;
    this.tags = tags.clone();
    this.lineno = lineno;
    if (parent != null)
      parent.children.add(this);
  }

  public ScopeRegistry getRegistry() { return registry; }
  /** Qualified name, e.g. {@code @top.M.worker}. */
  public String getName() { return name; }
  public String getOrigName() { return origName; }
  public Optional<Scope> getParent() { return Optional.ofNullable(parent); }
  public List<Scope> getChildren() { return Collections.unmodifiableList(children); }
  public int getLineno() { return lineno; }

  public Set<ScopeTag> getTags() { return Collections.unmodifiableSet(tags); }
  public boolean hasTag(ScopeTag tag) { return tags.contains(tag); }
  public void addTag(ScopeTag tag) { tags.add(tag); }

  public boolean isGlobal() { return tags.contains(ScopeTag.Global); }
  public boolean isFunction() { return tags.contains(ScopeTag.Function); }
  public boolean isClass() { return tags.contains(ScopeTag.Class); }
  public boolean isMethod() { return tags.contains(ScopeTag.Method); }
  public boolean isCtor() { return tags.contains(ScopeTag.Ctor); }
  public boolean isCallable() { return tags.contains(ScopeTag.Callable); }
  public boolean isReturnable() { return tags.contains(ScopeTag.Returnable); }
  public boolean isTestbench() { return tags.contains(ScopeTag.Testbench); }
  public boolean isModule() { return tags.contains(ScopeTag.Module); }
  public boolean isWorker() { return tags.contains(ScopeTag.Worker); }
  public boolean isPort() { return tags.contains(ScopeTag.Port); }
  public boolean isLib() { return tags.contains(ScopeTag.Lib); }
  public boolean isNamespace() { return tags.contains(ScopeTag.Namespace); }

  /** The nearest enclosing scope (including this) tagged as module, if any. */
  public Optional<Scope> getModuleScope() {
    for (Scope s = this; s != null; s = s.parent) {
      if (s.isModule())
        return Optional.of(s);
    }
    return Optional.empty();
  }

  //////////   symbols   //////////

  /**
   * Adds a new symbol.
   * @throws CompileException if a symbol with this name already exists in this scope
   */
  public Symbol addSym(String name, EnumSet<SymbolTag> tags, Type type) {
    if (symbols.containsKey(name))
      throw CompileException.of(Errors.DUPLICATE_SYMBOL, this.name, name, this.name);
    Symbol sym = new Symbol(this, name, tags, type);
    symbols.put(name, sym);
    return sym;
  }

  /** Returns the symbol of that name in this scope, creating it if absent. */
  public Symbol genSym(String name, EnumSet<SymbolTag> tags, Type type) {
    Symbol sym = symbols.get(name);
    if (sym != null)
      return sym;
    return addSym(name, tags, type);
  }

  /** Creates (or returns) a versioned copy of {@code orig} named {@code newName}, with {@code orig} as ancestor. */
  public Symbol inheritSym(Symbol orig, String newName) {
    Symbol sym = symbols.get(newName);
    if (sym == null) {
      sym = addSym(newName, orig.copyTags(), orig.getType());
      sym.setAncestor(orig);
    }
    return sym;
  }

  public boolean hasSym(String name) { return symbols.containsKey(name); }
  public Optional<Symbol> findSymLocal(String name) { return Optional.ofNullable(symbols.get(name)); }

  /** Looks the name up in this scope and then in the enclosing scopes. */
  public Optional<Symbol> findSym(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Symbol sym = s.symbols.get(name);
      if (sym != null)
        return Optional.of(sym);
    }
    return Optional.empty();
  }

  public void delSym(Symbol sym) {
    assert (sym.getScope() == this);
    symbols.remove(sym.getName());
  }

  public void renameSym(Symbol sym, String newName) {
    if (symbols.containsKey(newName))
      throw CompileException.of(Errors.DUPLICATE_SYMBOL, this.name, newName, this.name);
    symbols.remove(sym.getName());
    sym.setName(newName);
    symbols.put(newName, sym);
  }

  public Collection<Symbol> getSymbols() { return Collections.unmodifiableCollection(symbols.values()); }

  public void addParam(Symbol sym) {
    sym.addTag(SymbolTag.Param);
    params.add(sym);
  }
  public List<Symbol> getParams() { return Collections.unmodifiableList(params); }

  public Optional<Symbol> getReturnSym() { return Optional.ofNullable(returnSym); }
  public void setReturnSym(Symbol sym) {
    sym.addTag(SymbolTag.Return);
    this.returnSym = sym;
  }

  //////////   blocks   //////////

  public Block newBlock(String nametag) {
    Block block = new Block(this, blocks.size(), nametag);
    blocks.add(block);
    return block;
  }

  /** The block arena in creation order. */
  public List<Block> getBlocks() { return Collections.unmodifiableList(blocks); }

  public Block getEntryBlock() { return entryBlock; }
  public void setEntryBlock(Block entryBlock) { this.entryBlock = entryBlock; }
  public Block getExitBlock() { return exitBlock; }
  public void setExitBlock(Block exitBlock) { this.exitBlock = exitBlock; }

  /** Blocks reachable from the entry, in depth-first preorder along successors. */
  public List<Block> traverseBlocks() {
    var order = new ArrayList<Block>();
    if (entryBlock == null)
      return order;
    var visited = new HashSet<Block>();
    Deque<Block> stack = new ArrayDeque<>();
    stack.push(entryBlock);
    while (!stack.isEmpty()) {
      Block block = stack.pop();
      if (!visited.add(block))
        continue;
      order.add(block);
      var succs = block.getSuccs();
      for (int i = succs.size() - 1; i >= 0; --i) {
        if (!visited.contains(succs.get(i)))
          stack.push(succs.get(i));
      }
    }
    return order;
  }

  //////////   call graph   //////////

  public void addCallee(Scope callee) {
    calleeScopes.add(callee);
    callee.callerScopes.add(this);
  }
  public Set<Scope> getCallees() { return Collections.unmodifiableSet(calleeScopes); }
  public Set<Scope> getCallers() { return Collections.unmodifiableSet(callerScopes); }

  public void appendCalleeInstance(Scope callee, String instName) {
    calleeInstances.computeIfAbsent(callee, c -> new LinkedHashSet<>()).add(instName);
  }
  public Map<Scope, Set<String>> getCalleeInstances() { return Collections.unmodifiableMap(calleeInstances); }

  public void appendWorker(Scope worker) {
    if (!workers.contains(worker))
      workers.add(worker);
  }
  public List<Scope> getWorkers() { return Collections.unmodifiableList(workers); }

  //////////   signals   //////////

  /**
   * Creates a signal or, if one of that name exists, updates its width and merges the tags.
   */
  public Signal genSig(String name, int width, Set<SignalTag> tags, Optional<Symbol> sym) {
    Signal sig = signals.get(name);
    if (sig != null) {
      sig.setWidth(width);
      sig.addTags(tags);
      if (sig.getSym().isEmpty() && sym.isPresent())
        sig.setSym(sym.get());
      return sig;
    }
    sig = new Signal(name, width, tags, sym);
    signals.put(name, sig);
    return sig;
  }
  public Signal genSig(String name, int width, Set<SignalTag> tags) { return genSig(name, width, tags, Optional.empty()); }

  public Optional<Signal> signal(String name) { return Optional.ofNullable(signals.get(name)); }

  public void renameSig(String oldName, String newName) {
    Signal sig = signals.remove(oldName);
    assert (sig != null);
    sig.setName(newName);
    signals.put(newName, sig);
  }
  public void removeSig(Signal sig) { signals.remove(sig.getName()); }

  public Collection<Signal> getSignals() { return Collections.unmodifiableCollection(signals.values()); }
  /** Signals carrying all of the given tags. */
  public List<Signal> getSignals(Set<SignalTag> withTags) {
    return signals.values().stream().filter(sig -> sig.getTags().containsAll(withTags)).collect(Collectors.toList());
  }

  //////////   scheduling and STGs   //////////

  /** Top-level scheduling regions (nested ones hang off their parent region). */
  public List<SchedulingRegion> getRegions() { return Collections.unmodifiableList(regions); }
  public void addRegion(SchedulingRegion region) { regions.add(region); }

  /** All regions, parents before children. */
  public List<SchedulingRegion> collectRegions() {
    var result = new ArrayList<SchedulingRegion>();
    Deque<SchedulingRegion> stack = new ArrayDeque<>();
    for (int i = regions.size() - 1; i >= 0; --i)
      stack.push(regions.get(i));
    while (!stack.isEmpty()) {
      SchedulingRegion region = stack.pop();
      result.add(region);
      var children = region.getChildren();
      for (int i = children.size() - 1; i >= 0; --i)
        stack.push(children.get(i));
    }
    return result;
  }

  public List<STG> getStgs() { return Collections.unmodifiableList(stgs); }
  public void setStgs(List<STG> newStgs) {
    stgs.clear();
    stgs.addAll(newStgs);
  }
  /** The STG of the top-level region, if built. */
  public Optional<STG> getMainStg() { return stgs.stream().filter(STG::isMain).findFirst(); }

  //////////   cloning   //////////

  /**
   * Deep copies this scope (symbols, parameters, blocks and statements) into a new sibling scope named
   * {@code [prefix_]origName[_postfix]}. Scheduling data and STGs are not copied.
   */
  public Scope cloneScope(String prefix, String postfix) {
    String newName = (prefix.isEmpty() ? "" : prefix + "_") + origName + (postfix.isEmpty() ? "" : "_" + postfix);
    Scope clone = registry.createScope(parent, newName, tags, lineno);
    logger.debug("Cloning scope {} as {}", name, clone.getName());

    var symbolMap = new HashMap<Symbol, Symbol>();
    for (Symbol sym : symbols.values()) {
      Symbol newSym = clone.addSym(sym.getName(), sym.copyTags(), sym.getType());
      symbolMap.put(sym, newSym);
    }
    for (Symbol sym : symbols.values())
      sym.getAncestor().map(anc -> symbolMap.getOrDefault(anc, anc)).ifPresent(anc -> symbolMap.get(sym).setAncestor(anc));
    params.forEach(p -> clone.params.add(symbolMap.get(p)));
    if (returnSym != null)
      clone.returnSym = symbolMap.get(returnSym);

    var blockMap = new HashMap<Block, Block>();
    for (Block block : blocks)
      blockMap.put(block, clone.newBlock(block.getNametag()));
    var remapper = new CloneRemapper(symbolMap, blockMap);
    for (Block block : blocks) {
      Block newBlock = blockMap.get(block);
      newBlock.copyEdges(block, blockMap);
      for (IRStm stm : block.getStms()) {
        IRStm newStm = stm.copy();
        newBlock.appendStm(newStm);
        remapper.walkStm(newStm);
      }
    }
    if (entryBlock != null)
      clone.entryBlock = blockMap.get(entryBlock);
    if (exitBlock != null)
      clone.exitBlock = blockMap.get(exitBlock);
    calleeScopes.forEach(clone::addCallee);
    return clone;
  }

  /** Points the symbols and blocks referenced by a copied statement to their clones. */
  private static class CloneRemapper extends IRWalker {
    private final Map<Symbol, Symbol> symbolMap;
    private final Map<Block, Block> blockMap;

    CloneRemapper(Map<Symbol, Symbol> symbolMap, Map<Block, Block> blockMap) {
      this.symbolMap = symbolMap;
      this.blockMap = blockMap;
    }

    private Block map(Block block) { return blockMap.getOrDefault(block, block); }

    @Override
    public Void visitTemp(Temp ir) {
      ir.setSym(symbolMap.getOrDefault(ir.getSym(), ir.getSym()));
      return null;
    }
    @Override
    public Void visitCJump(CJump ir) {
      ir.setTrue(map(ir.getTrue()));
      ir.setFalse(map(ir.getFalse()));
      return super.visitCJump(ir);
    }
    @Override
    public Void visitMCJump(MCJump ir) {
      ir.getTargets().replaceAll(this::map);
      return super.visitMCJump(ir);
    }
    @Override
    public Void visitJump(Jump ir) {
      ir.setTarget(map(ir.getTarget()));
      return null;
    }
    @Override
    public Void visitPhi(Phi ir) {
      var args = new ArrayList<>(ir.getArgs());
      ir.getArgs().clear();
      args.forEach(arg -> ir.addArg(arg.var(), map(arg.pred())));
      return super.visitPhi(ir);
    }
  }

  @Override
  public String toString() {
    var sb = new StringBuilder();
    sb.append(String.format("Scope %s %s\n", name, tags.stream().map(t -> t.serialName).collect(Collectors.toList())));
    for (Block block : traverseBlocks())
      sb.append(block);
    return sb.toString();
  }
}

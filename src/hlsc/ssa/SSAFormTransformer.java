package hlsc.ssa;

import hlsc.analysis.DominanceFrontier;
import hlsc.analysis.DominanceFrontierBuilder;
import hlsc.analysis.DominatorTree;
import hlsc.analysis.DominatorTreeBuilder;
import hlsc.ir.Block;
import hlsc.ir.IRStm;
import hlsc.ir.Phi;
import hlsc.ir.Phi.PhiArg;
import hlsc.ir.Scope;
import hlsc.ir.Symbol;
import hlsc.ir.Temp;
import hlsc.ir.UseDefDetector;
import hlsc.ir.UseDefTable;
import hlsc.ir.VarReplacer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Converts a scope into SSA form in place: phi placement at dominance frontiers, renaming along the dominator
 * tree, pruning of dead and trivial phis and removal of self arguments.
 * Symbols tagged as single-assignment ({@link Symbol#isSingleAssignment()}) are left untouched.
 */
public class SSAFormTransformer {
  protected static final Logger logger = LogManager.getLogger();

  private final Scope scope;
  private UseDefTable usedef;
  private DominatorTree tree;
  private DominanceFrontier frontier;

  // renaming state
  private final Map<Symbol, Integer> count = new HashMap<>();
  private final Map<Symbol, Deque<Integer>> stack = new HashMap<>();
  private final List<Rename> renames = new ArrayList<>();

  private record Rename(Temp var, Symbol newSym) {}

  private SSAFormTransformer(Scope scope) { this.scope = scope; }

  public static void process(Scope scope) {
    logger.debug("Building SSA form of {}", scope.getName());
    var transformer = new SSAFormTransformer(scope);
    transformer.usedef = UseDefDetector.process(scope);
    transformer.tree = DominatorTreeBuilder.process(scope);
    transformer.frontier = DominanceFrontierBuilder.process(scope, transformer.tree);
    transformer.insertPhis();
    transformer.rename();
    pruneUselessPhis(scope);
    cleanupPhis(scope);
  }

  private void insertPhis() {
    Map<Block, Set<Symbol>> phiSyms = new HashMap<>();
    // Snapshot: the phis inserted below add to the table while iterating.
    var defSyms = new ArrayList<>(usedef.getAllDefinedSyms());
    for (Symbol sym : defSyms) {
      if (sym.isSingleAssignment())
        continue;
      Deque<Block> worklist = new ArrayDeque<>(usedef.getBlksDefiningSym(sym));
      while (!worklist.isEmpty()) {
        Block defBlock = worklist.pop();
        for (Block dfBlock : frontier.get(defBlock)) {
          if (!phiSyms.computeIfAbsent(dfBlock, b -> new HashSet<>()).add(sym))
            continue;
          Temp var = Temp.store(sym);
          Phi phi = new Phi(var);
          dfBlock.insertStm(0, phi);
          // The phi defines the symbol in dfBlock, which matters only if nothing else did before.
          if (!usedef.getSymsDefinedInBlk(dfBlock).contains(sym))
            worklist.push(dfBlock);
          usedef.addVarDef(var, phi);
          logger.trace("Inserted phi for {} in {}", sym, dfBlock.getName());
        }
      }
    }
  }

  private void rename() {
    var usingSyms = new LinkedHashSet<Symbol>();
    for (Block block : scope.getBlocks()) {
      usingSyms.addAll(usedef.getSymsDefinedInBlk(block));
      usingSyms.addAll(usedef.getSymsUsedInBlk(block));
    }
    for (Symbol sym : usingSyms) {
      count.put(sym, 0);
      var versions = new ArrayDeque<Integer>();
      versions.push(0);
      stack.put(sym, versions);
    }
    renameRec(tree.getRoot());
    for (Rename rename : renames)
      rename.var().setSym(rename.newSym());
  }

  private Symbol versioned(Symbol sym, int version) { return scope.inheritSym(sym, sym.getName() + "#" + version); }

  private void renameRec(Block block) {
    for (IRStm stm : block.getStms()) {
      if (!(stm instanceof Phi)) {
        for (Temp use : usedef.getUseVars(stm)) {
          if (use.getSym().isSingleAssignment())
            continue;
          renames.add(new Rename(use, versioned(use.getSym(), stack.get(use.getSym()).peek())));
        }
      }
      for (Temp def : usedef.getDefVars(stm)) {
        Symbol sym = def.getSym();
        int i = count.get(sym) + 1;
        count.put(sym, i);
        stack.get(sym).push(i);
        if (!sym.isSingleAssignment())
          renames.add(new Rename(def, versioned(sym, i)));
      }
    }
    for (Block succ : block.getSuccs()) {
      for (Phi phi : succ.collectPhis()) {
        Symbol sym = phi.getVar().getSym();
        int i = stack.get(sym).peek();
        if (i > 0) {
          Temp arg = Temp.load(versioned(sym, i));
          arg.setLineno(phi.getLineno());
          phi.addArg(arg, block);
        }
      }
    }
    for (Block child : tree.getChildren(block))
      renameRec(child);
    for (IRStm stm : block.getStms()) {
      for (Temp def : usedef.getDefVars(stm))
        stack.get(def.getSym()).pop();
    }
  }

  /** The one symbol named by all non-self arguments, if there is exactly one. */
  private static Optional<Symbol> soleArgSym(Phi phi) {
    Symbol self = phi.getVar().getSym();
    Symbol found = null;
    for (PhiArg arg : phi.getArgs()) {
      Symbol sym = arg.var().getSym();
      if (sym == self)
        continue;
      if (found != null && found != sym)
        return Optional.empty();
      found = sym;
    }
    return Optional.ofNullable(found);
  }

  private static boolean hasNonSelfArg(Phi phi) {
    return phi.getArgs().stream().anyMatch(arg -> arg.var().getSym() != phi.getVar().getSym());
  }

  /**
   * Removes phis without (non-self) arguments and collapses phis whose non-self arguments name a single symbol,
   * until no phi changes. Running it again on its own output changes nothing.
   */
  public static void pruneUselessPhis(Scope scope) {
    UseDefTable usedef = UseDefDetector.process(scope);
    Deque<Phi> worklist = new ArrayDeque<>();
    for (Block block : scope.getBlocks())
      worklist.addAll(block.collectPhis());
    while (!worklist.isEmpty()) {
      Phi phi = worklist.poll();
      Block block = phi.getBlock();
      if (block == null || !block.containsStm(phi))
        continue;
      if (!hasNonSelfArg(phi)) {
        logger.trace("Removing dead {}", phi);
        block.removeStm(phi);
        usedef.removeStm(phi);
        continue;
      }
      Optional<Symbol> sole = soleArgSym(phi);
      if (sole.isEmpty())
        continue;
      logger.trace("Collapsing {} into {}", phi, sole.get());
      block.removeStm(phi);
      usedef.removeStm(phi);
      for (IRStm replaced : VarReplacer.replaceUses(usedef, phi.getVar().getSym(), sole.get())) {
        if (replaced instanceof Phi)
          worklist.add((Phi)replaced);
      }
    }
  }

  /** Strips phi arguments that refer to the phi's own destination. */
  public static void cleanupPhis(Scope scope) {
    for (Block block : scope.getBlocks()) {
      for (Phi phi : block.collectPhis()) {
        Symbol self = phi.getVar().getSym();
        for (PhiArg arg : new ArrayList<>(phi.getArgs())) {
          if (arg.var().getSym() == self)
            phi.removeArg(arg);
        }
      }
    }
  }

  /** Phis of the scope grouped by block, for inspection. */
  public static Map<Block, List<Phi>> collectPhis(Scope scope) {
    var result = new LinkedHashMap<Block, List<Phi>>();
    for (Block block : scope.getBlocks()) {
      var phis = block.collectPhis();
      if (!phis.isEmpty())
        result.put(block, phis);
    }
    return result;
  }
}

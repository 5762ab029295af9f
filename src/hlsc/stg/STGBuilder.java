package hlsc.stg;

import hlsc.ahdl.AHDLMetaWait;
import hlsc.ahdl.AHDLStm;
import hlsc.ahdl.AHDLTransition;
import hlsc.ahdl.AHDLTransitionIf;
import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Block;
import hlsc.ir.Scope;
import hlsc.schedule.SchedulingMode;
import hlsc.schedule.SchedulingRegion;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the state-transition graphs of a scope, one per scheduling region. Regions are built innermost first so
 * that every block of the scope has its states before transitions are resolved; the resulting list starts with the
 * STG of the top-level region.
 */
public class STGBuilder {
  protected static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_MEM_LOAD_LATENCY = 3;
  public static final int DEFAULT_MEM_STORE_LATENCY = 2;

  private final int memLoadLatency;
  private final int memStoreLatency;
  private final boolean verify;

  public STGBuilder(int memLoadLatency, int memStoreLatency, boolean verify) {
    this.memLoadLatency = memLoadLatency;
    this.memStoreLatency = memStoreLatency;
    this.verify = verify;
  }
  public STGBuilder() { this(DEFAULT_MEM_LOAD_LATENCY, DEFAULT_MEM_STORE_LATENCY, true); }

  /**
   * Builds, links, resolves and verifies the STGs of {@code scope} and stores them in the scope.
   * Namespaces, classes and library scopes have no control structure and are skipped.
   * @throws CompileException on an unresolved transition target or a state without a terminal
   */
  public void process(Scope scope) {
    if (scope.isNamespace() || scope.isClass() || scope.isLib())
      return;
    List<SchedulingRegion> regions = scope.collectRegions();
    if (regions.isEmpty())
      throw CompileException.of(Errors.MISSING_SCHEDULE, scope.getName(), scope.getName());

    Map<Block, List<State>> blk2states = new HashMap<>();
    Map<SchedulingRegion, STG> region2stg = new LinkedHashMap<>();
    for (int i = 0; i < regions.size(); ++i) {
      SchedulingRegion region = regions.get(i);
      region2stg.put(region, new STG(stgName(scope, region, i), scope, region));
    }
    for (int i = regions.size() - 1; i >= 0; --i) {
      SchedulingRegion region = regions.get(i);
      if (region.getBlocks().isEmpty())
        throw CompileException.of(Errors.UNSCHEDULED_REGION, scope.getName(), region.getName());
      STG stg = region2stg.get(region);
      logger.debug("building STG {} ({})", stg.getName(), region.getMode().serialName);
      newBuilder(scope, stg, region, blk2states).build(region);
    }
    for (var entry : region2stg.entrySet())
      entry.getKey().getParent().ifPresent(parent -> entry.getValue().setParent(region2stg.get(parent)));

    var stgs = new ArrayList<>(region2stg.values());
    for (STG stg : stgs)
      resolveTransitions(stg, blk2states);
    if (verify)
      stgs.forEach(STGBuilder::verify);
    scope.setStgs(stgs);
    stgs.forEach(stg -> logger.trace("{}", stg));
  }

  private STGItemBuilder newBuilder(Scope scope, STG stg, SchedulingRegion region, Map<Block, List<State>> blk2states) {
    if (region.getMode() == SchedulingMode.PIPELINED_LOOP)
      return new LoopPipelineStageBuilder(scope, stg, blk2states, memLoadLatency, memStoreLatency);
    if (region.getMode() == SchedulingMode.PIPELINED_WORKER)
      return new WorkerPipelineStageBuilder(scope, stg, blk2states, memLoadLatency, memStoreLatency);
    return new StateBuilder(scope, stg, blk2states, memLoadLatency, memStoreLatency);
  }

  /**
   * Main STG: the scope's name, or the module name for a callable method of a module. Nested regions append
   * {@code _L<index>}; other methods are prefixed with their class name.
   */
  static String stgName(Scope scope, SchedulingRegion region, int index) {
    var parent = scope.getParent();
    if (parent.isPresent() && parent.get().isModule() && scope.isCallable()) {
      String moduleName = parent.get().getOrigName();
      return region.isTop() ? moduleName : String.format("%s_L%d", moduleName, index);
    }
    String name = region.isTop() ? scope.getOrigName() : String.format("%s_L%d", scope.getOrigName(), index);
    if (scope.isMethod() && parent.isPresent())
      name = parent.get().getOrigName() + "_" + name;
    return name;
  }

  /**
   * Links the states of {@code stg} in emission order. The last state of the main STG returns to the first one
   * (a testbench stays in its finish state); the last state of a nested STG returns to its first state.
   */
  static void resolveTransitions(STG stg, Map<Block, List<State>> blk2states) {
    List<State> states = stg.getStates();
    if (states.isEmpty())
      return;
    for (int i = 0; i < states.size() - 1; ++i)
      states.get(i).resolveTransition(states.get(i + 1), blk2states);
    State last = states.get(states.size() - 1);
    if (stg.isMain() && stg.getScope().isTestbench())
      last.resolveTransition(last, blk2states);
    else
      last.resolveTransition(states.get(0), blk2states);
  }

  /**
   * Checks that every state ends in exactly one terminal operation whose targets are all resolved.
   * @throws CompileException otherwise
   */
  public static void verify(STG stg) {
    String scopeName = stg.getScope().getName();
    if (stg.getInitState() == null || stg.getFinishState() == null)
      throw CompileException.of(Errors.MISSING_TERMINAL, scopeName, stg.getName());
    for (State state : stg.getStates()) {
      List<AHDLStm> codes = state.terminalCodes();
      if (codes.isEmpty() || !StateBuilder.isTerminal(codes.get(codes.size() - 1)))
        throw CompileException.of(Errors.MISSING_TERMINAL, scopeName, state.getName());
      long terminals = codes.stream().filter(code -> code instanceof AHDLTransition || code instanceof AHDLTransitionIf).count();
      if (terminals > 1)
        throw CompileException.of(Errors.MISSING_TERMINAL, scopeName, state.getName());
      if (!isResolved(codes.get(codes.size() - 1)))
        throw CompileException.of(Errors.UNRESOLVED_IN_STG, scopeName, state.getName());
    }
  }

  private static boolean isResolved(AHDLStm terminal) {
    if (terminal instanceof AHDLTransition)
      return ((AHDLTransition)terminal).isResolved();
    if (terminal instanceof AHDLTransitionIf) {
      for (List<AHDLStm> branch : ((AHDLTransitionIf)terminal).getCodesList()) {
        if (branch.isEmpty() || !isResolved(branch.get(branch.size() - 1)))
          return false;
      }
      return true;
    }
    var wait = (AHDLMetaWait)terminal;
    return wait.getTransition().map(AHDLTransition::isResolved).orElse(false);
  }
}

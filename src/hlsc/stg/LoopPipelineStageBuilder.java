package hlsc.stg;

import hlsc.ahdl.AHDLConst;
import hlsc.ahdl.AHDLExp;
import hlsc.ahdl.AHDLIf;
import hlsc.ahdl.AHDLMove;
import hlsc.ahdl.AHDLOp;
import hlsc.ahdl.AHDLStm;
import hlsc.ahdl.AHDLTransition;
import hlsc.ahdl.AHDLTransitionIf;
import hlsc.ahdl.AHDLVar;
import hlsc.ahdl.Signal;
import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Block;
import hlsc.ir.CJump;
import hlsc.ir.IRStm;
import hlsc.ir.Move;
import hlsc.ir.Op;
import hlsc.ir.Scope;
import hlsc.ir.Temp.Ctx;
import hlsc.ir.UseDefDetector;
import hlsc.schedule.LoopInfo;
import hlsc.schedule.ScheduledNode;
import hlsc.schedule.SchedulingRegion;
import hlsc.stg.PipelineStage.StageTag;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pipelines a counted loop. Stage 0 issues a new iteration while the loop condition holds; a chain of {@code last}
 * flags follows the final iteration through the stages so the pipeline leaves to the loop exit only once it is
 * drained.
 */
public class LoopPipelineStageBuilder extends PipelineStageBuilder {
  private Signal condSig;

  public LoopPipelineStageBuilder(Scope scope, STG stg, Map<Block, List<State>> blk2states, int memLoadLatency,
                                  int memStoreLatency) {
    super(scope, stg, blk2states, memLoadLatency, memStoreLatency);
  }

  @Override
  public void build(SchedulingRegion region) {
    LoopInfo loop = region.getLoopInfo().orElseThrow(
        () -> CompileException.of(Errors.MISSING_LOOP_INFO, scope.getName(), region.getName()));
    Block head = loop.getHead();
    var pstate = new PipelineState(String.format("%s_%s_P", stg.getName(), head.getName()), stg);
    condSig = translator.symToSig(loop.getCond(), Ctx.LOAD);

    Map<Block, List<ScheduledNode>> blockNodes = region.getBlockNodesMap();
    var nodes = new ArrayList<ScheduledNode>(blockNodes.getOrDefault(head, List.of()));
    for (Block body : loop.getBodies()) {
      if (body != head)
        nodes.addAll(blockNodes.getOrDefault(body, List.of()));
    }
    nodes.sort(Comparator.comparingInt(ScheduledNode::getBegin));
    List<IRStm> loopBranch = new ArrayList<>();
    head.getLastStm().filter(stm -> stm instanceof CJump).ifPresent(loopBranch::add);

    scheduledItems = new ScheduledItemQueue();
    buildScheduledItems(withoutBranches(nodes, loopBranch));
    buildPipelineStages(pstate);

    blk2states.put(head, List.of(pstate));
    loop.getBodies().forEach(body -> blk2states.put(body, List.of(pstate)));
    region.getBlocks().forEach(block -> blk2states.put(block, List.of(pstate)));

    addExitProtocol(pstate, loop);
    stg.addState(pstate);
    stg.setInitState(pstate);
    stg.setFinishState(pstate);
    logger.debug("pipelined loop {} with {} stages", pstate.getName(), pstate.getStages().size());
  }

  @Override
  protected void tagStage(PipelineStage stage) {
    if (stage.getStep() != 0)
      return;
    stage.addTag(StageTag.HasEnable);
    PipelineState pstate = stage.getParentState();
    AHDLExp src = AHDLVar.load(condSig);
    if (stage.getEnable().isPresent())
      src = new AHDLOp(Op.BitAnd, stage.getEnable().get().getSrc(), src);
    stage.setEnable(new AHDLMove(AHDLVar.store(pstate.enableSignal(0)), src));
  }

  /** Loop condition evaluated with the initial value of the counter. */
  private AHDLExp initialCondition(LoopInfo loop) {
    Set<IRStm> defs = UseDefDetector.process(scope).getStmsDefiningSym(loop.getCond());
    if (defs.size() != 1 || !(defs.iterator().next() instanceof Move))
      throw CompileException.of(Errors.MISSING_CONDITION_DEF, scope.getName(), loop.getCond().getName());
    Move condDef = (Move)defs.iterator().next();
    AHDLExp cond = translator.translateExp(condDef.getSrc());
    Signal counterSig = translator.symToSig(loop.getCounter(), Ctx.LOAD);
    AHDLExp init = translator.translateExp(loop.getInit());
    return substitute(cond, counterSig, init);
  }

  private static AHDLExp substitute(AHDLExp exp, Signal sig, AHDLExp replacement) {
    if (exp instanceof AHDLVar && ((AHDLVar)exp).getSig() == sig)
      return replacement.copy();
    if (exp instanceof AHDLOp) {
      List<AHDLExp> args = ((AHDLOp)exp).getArgs();
      args.replaceAll(arg -> substitute(arg, sig, replacement));
    }
    return exp;
  }

  private void addExitProtocol(PipelineState pstate, LoopInfo loop) {
    List<PipelineStage> stages = pstate.getStages();
    int n = stages.size() - 1;
    Signal exit = pstate.exitSignal(n);

    stages.get(0).getCodes().add(new AHDLMove(AHDLVar.store(pstate.lastSignal(0)), new AHDLOp(Op.Not, AHDLVar.load(condSig))));
    for (int i = 1; i < n; ++i) {
      var lastRhs = new AHDLOp(Op.BitAnd, AHDLVar.load(pstate.lastSignal(i - 1)), AHDLVar.load(pstate.readySignal(i)));
      stages.get(i).getCodes().add(new AHDLMove(AHDLVar.store(pstate.lastSignal(i)), lastRhs));
    }

    AHDLExp drained;
    if (n == 0)
      drained = AHDLVar.load(pstate.lastSignal(0));
    else
      drained = new AHDLOp(Op.BitAnd, AHDLVar.load(pstate.lastSignal(n - 1)), AHDLVar.load(pstate.readySignal(n)));
    AHDLExp exitCond = new AHDLOp(Op.Or, drained, new AHDLOp(Op.Not, initialCondition(loop)));
    PipelineStage lastStage = stages.get(n);
    lastStage.getCodes().add(new AHDLIf(List.of(exitCond), List.of(List.of(new AHDLMove(AHDLVar.store(exit), new AHDLConst(1))))));

    var leave = new ArrayList<AHDLStm>();
    for (int i = 0; i < Math.max(n, 1); ++i)
      leave.add(new AHDLMove(AHDLVar.store(pstate.lastSignal(i)), new AHDLConst(0)));
    leave.add(new AHDLMove(AHDLVar.store(exit), new AHDLConst(0)));
    leave.add(new AHDLTransition(loop.getExit()));
    setTerminal(pstate, new AHDLTransitionIf(List.of(AHDLVar.load(exit)), List.of(leave)));
  }
}

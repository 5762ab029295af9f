package hlsc.stg;

import hlsc.ahdl.AHDLTransition;
import hlsc.ir.Block;
import hlsc.ir.CJump;
import hlsc.ir.IRStm;
import hlsc.ir.Scope;
import hlsc.schedule.ScheduledNode;
import hlsc.schedule.SchedulingRegion;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Pipelines the body of a worker that runs forever: the pipeline never drains and its state loops to itself.
 */
public class WorkerPipelineStageBuilder extends PipelineStageBuilder {

  public WorkerPipelineStageBuilder(Scope scope, STG stg, Map<Block, List<State>> blk2states, int memLoadLatency,
                                    int memStoreLatency) {
    super(scope, stg, blk2states, memLoadLatency, memStoreLatency);
  }

  @Override
  public void build(SchedulingRegion region) {
    Block head = region.getLoopInfo().map(loop -> loop.getHead()).orElse(region.getBlocks().get(0));
    var pstate = new PipelineState(String.format("%s_%s_P", stg.getName(), head.getName()), stg);

    var nodes = new ArrayList<ScheduledNode>();
    region.getBlockNodesMap().values().forEach(nodes::addAll);
    nodes.sort(Comparator.comparingInt(ScheduledNode::getBegin));
    List<IRStm> loopBranch = new ArrayList<>();
    if (region.getLoopInfo().isPresent())
      head.getLastStm().filter(stm -> stm instanceof CJump).ifPresent(loopBranch::add);

    scheduledItems = new ScheduledItemQueue();
    buildScheduledItems(withoutBranches(nodes, loopBranch));
    buildPipelineStages(pstate);

    region.getBlocks().forEach(block -> blk2states.put(block, List.of(pstate)));
    setTerminal(pstate, new AHDLTransition(pstate));

    stg.addState(pstate);
    stg.setInitState(pstate);
    stg.setFinishState(pstate);
    logger.debug("pipelined worker {} with {} stages", pstate.getName(), pstate.getStages().size());
  }
}

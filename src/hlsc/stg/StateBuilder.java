package hlsc.stg;

import hlsc.ahdl.AHDLCalleeEpilog;
import hlsc.ahdl.AHDLCalleeProlog;
import hlsc.ahdl.AHDLInline;
import hlsc.ahdl.AHDLMetaWait;
import hlsc.ahdl.AHDLSeq;
import hlsc.ahdl.AHDLStm;
import hlsc.ahdl.AHDLTransition;
import hlsc.ahdl.AHDLTransitionIf;
import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Block;
import hlsc.ir.IRStm;
import hlsc.ir.Jump;
import hlsc.ir.Scope;
import hlsc.schedule.ScheduledNode;
import hlsc.schedule.SchedulingRegion;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds one state per cycle of every block of a state-machine region.
 */
public class StateBuilder extends STGItemBuilder {

  public StateBuilder(Scope scope, STG stg, Map<Block, List<State>> blk2states, int memLoadLatency, int memStoreLatency) {
    super(scope, stg, blk2states, memLoadLatency, memStoreLatency);
  }

  static boolean isTerminal(AHDLStm code) {
    return code instanceof AHDLTransition || code instanceof AHDLTransitionIf || code instanceof AHDLMetaWait;
  }

  @Override
  public void build(SchedulingRegion region) {
    Map<Block, List<ScheduledNode>> blockNodes = region.getBlockNodesMap();
    List<Block> blocks = region.getBlocks();
    for (int i = 0; i < blocks.size(); ++i) {
      Block block = blocks.get(i);
      scheduledItems = new ScheduledItemQueue();
      buildScheduledItems(blockNodes.getOrDefault(block, List.of()));

      String prefix = String.format("%s_%s", stg.getName(), block.getName());
      logger.debug("building states of block {}", prefix);
      List<State> states = buildStatesForBlock(prefix, block, stg.isMain(), i == 0, i == blocks.size() - 1);
      assert (!states.isEmpty());
      states.forEach(stg::addState);
      blk2states.put(block, states);
    }
  }

  private List<State> buildStatesForBlock(String prefix, Block block, boolean isMain, boolean isFirst, boolean isLast) {
    var states = new ArrayList<State>();
    for (var entry : scheduledItems.drain()) {
      var codes = new ArrayList<>(entry.getValue());
      if (!isTerminal(codes.get(codes.size() - 1)))
        codes.add(new AHDLTransition());
      states.add(stg.newState(String.format("%s_S%d", prefix, entry.getKey()), entry.getKey(), codes));
    }
    if (states.isEmpty())
      states.add(stg.newState(String.format("%s_S0", prefix), 0, List.of(new AHDLTransition())));

    Optional<IRStm> lastStm = block.getLastStm();
    if (lastStm.isPresent() && lastStm.get() instanceof Jump) {
      Block target = ((Jump)lastStm.get()).getTarget();
      List<AHDLStm> codes = states.get(states.size() - 1).getCodes();
      AHDLStm terminal = codes.get(codes.size() - 1);
      if (terminal instanceof AHDLTransition)
        ((AHDLTransition)terminal).setTargetBlock(target);
      else if (terminal instanceof AHDLMetaWait)
        codes.add(new AHDLTransition(target));
    }

    if (!isMain) {
      if (isFirst)
        stg.setInitState(states.get(0));
      if (isLast)
        stg.setFinishState(states.get(0));
    } else if (scope.isWorker() || scope.isTestbench()) {
      if (isFirst) {
        State init = states.get(0);
        init.setName(String.format("%s_INIT", prefix));
        stg.setInitState(init);
      }
      if (isLast) {
        State last = states.get(states.size() - 1);
        List<AHDLStm> codes;
        if (scope.isWorker())
          codes = List.of(new AHDLTransition());
        else
          codes = List.of(new AHDLInline("$display(\"%5t:finish\", $time)"), new AHDLInline("$finish()"), new AHDLTransition());
        State finish = stg.newState(String.format("%s_FINISH", prefix), last.getStep() + 1, codes);
        states.add(finish);
        stg.setFinishState(finish);
      }
    } else {
      if (isFirst) {
        State first = states.get(0);
        if (!isTerminal(first.getCodes().get(first.getCodes().size() - 1)))
          throw CompileException.of(Errors.BAD_REGION_ENTRY, scope.getName(), first.getName(), stg.getName());
        if (!(states.size() <= 1 && isLast)) {
          var prolog = new AHDLSeq(new AHDLCalleeProlog(stg.getName()), 0, 1);
          states.add(0, stg.newState(String.format("%s_INIT", prefix), 0, List.of(prolog, new AHDLTransition())));
        }
        stg.setInitState(states.get(0));
      }
      if (isLast) {
        State finish = states.get(states.size() - 1);
        finish.setName(String.format("%s_FINISH", prefix));
        List<AHDLStm> codes = finish.getCodes();
        codes.add(codes.size() - 1, new AHDLSeq(new AHDLCalleeEpilog(stg.getName()), 0, 1));
        stg.setFinishState(finish);
      }
    }
    return states;
  }
}

package hlsc.stg;

import hlsc.ahdl.AHDLStm;
import hlsc.ir.Block;
import hlsc.ir.Scope;
import hlsc.schedule.ScheduledNode;
import hlsc.schedule.SchedulingRegion;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Common part of the builders that turn the scheduled nodes of one region into states: groups nodes by begin
 * cycle, hands them to the {@link AHDLTranslator} and collects the emitted operations in a
 * {@link ScheduledItemQueue}.
 */
public abstract class STGItemBuilder {
  protected static final Logger logger = LogManager.getLogger();

  protected final Scope scope;
  protected final STG stg;
  protected final Map<Block, List<State>> blk2states;
  protected final AHDLTranslator translator;
  protected ScheduledItemQueue scheduledItems = new ScheduledItemQueue();

  protected STGItemBuilder(Scope scope, STG stg, Map<Block, List<State>> blk2states, int memLoadLatency,
                           int memStoreLatency) {
    this.scope = scope;
    this.stg = stg;
    this.blk2states = blk2states;
    this.translator = new AHDLTranslator(scope, this, memLoadLatency, memStoreLatency);
  }

  /** Fills {@link #stg} with the states of {@code region} and registers them in the block map. */
  public abstract void build(SchedulingRegion region);

  /**
   * Translates {@code nodes} (ordered by begin cycle) cycle group by cycle group into {@link #scheduledItems}.
   */
  protected void buildScheduledItems(List<ScheduledNode> nodes) {
    var groups = new LinkedHashMap<Integer, List<ScheduledNode>>();
    for (ScheduledNode node : nodes)
      groups.computeIfAbsent(node.getBegin(), k -> new ArrayList<>()).add(node);
    groups.forEach((schedTime, group) -> {
      for (ScheduledNode node : group)
        translator.translate(node, schedTime);
    });
  }

  /** Queues {@code item} for cycle {@code schedTime}. */
  void emit(AHDLStm item, int schedTime) {
    logger.trace("emit {} at {}", item, schedTime);
    scheduledItems.push(schedTime, item);
  }
}

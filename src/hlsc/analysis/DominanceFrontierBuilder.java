package hlsc.analysis;

import hlsc.ir.Block;
import hlsc.ir.Scope;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes dominance frontiers with the runner walk of Cooper, Harvey and Kennedy.
 * All predecessors take part, so loop headers end up in the frontier of their latches.
 */
public class DominanceFrontierBuilder {
  protected static final Logger logger = LogManager.getLogger();

  private DominanceFrontierBuilder() {}

  public static DominanceFrontier process(Scope scope, DominatorTree tree) {
    var df = new DominanceFrontier();
    for (Block block : scope.getBlocks()) {
      if (block.getPreds().size() < 2)
        continue;
      Block idom = tree.getParent(block).orElse(null);
      for (Block pred : block.getPreds()) {
        Block runner = pred;
        while (runner != null && runner != idom) {
          df.add(runner, block);
          runner = tree.getParent(runner).orElse(null);
        }
      }
    }
    logger.trace("{}: {}", scope.getName(), df);
    return df;
  }
}

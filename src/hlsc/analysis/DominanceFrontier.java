package hlsc.analysis;

import hlsc.ir.Block;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dominance frontier sets of the blocks of one scope.
 */
public class DominanceFrontier {
  private final Map<Block, LinkedHashSet<Block>> frontiers = new LinkedHashMap<>();

  void add(Block block, Block frontierBlock) { frontiers.computeIfAbsent(block, b -> new LinkedHashSet<>()).add(frontierBlock); }

  public Set<Block> get(Block block) {
    var set = frontiers.get(block);
    return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
  }

  @Override
  public String toString() {
    return frontiers.entrySet()
        .stream()
        .map(e -> String.format("%s: {%s}", e.getKey().getName(),
                                e.getValue().stream().map(Block::getName).collect(Collectors.joining(", "))))
        .collect(Collectors.joining("\n", "DominanceFrontier\n", "\n"));
  }
}

package hlsc.schedule;

import hlsc.ir.Block;
import hlsc.ir.Scope;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Part of a scope's control flow that is timed as one unit: the whole scope (top-level region) or a loop nested
 * in it. Regions own disjoint block lists.
 */
public class SchedulingRegion {
  private final Scope scope;
  private final String name;
  private final SchedulingRegion parent;
  private final List<SchedulingRegion> children = new ArrayList<>();
  private final List<Block> blocks;
  private final SchedulingMode mode;
  private final LoopInfo loopInfo;
  private final List<ScheduledNode> nodes = new ArrayList<>();

  private SchedulingRegion(Scope scope, String name, SchedulingRegion parent, List<Block> blocks, SchedulingMode mode,
                           LoopInfo loopInfo) {
    this.scope = scope;
    this.name = name;
    this.parent = parent;
    this.blocks = new ArrayList<>(blocks);
    this.mode = mode;
    this.loopInfo = loopInfo;
  }

  /** Creates the top-level region of {@code scope} and registers it there. */
  public static SchedulingRegion createTop(Scope scope, List<Block> blocks, SchedulingMode mode) {
    var region = new SchedulingRegion(scope, scope.getOrigName(), null, blocks, mode, null);
    scope.addRegion(region);
    return region;
  }

  /** Creates a region nested in this one. */
  public SchedulingRegion createChild(String name, List<Block> blocks, SchedulingMode mode, Optional<LoopInfo> loopInfo) {
    var region = new SchedulingRegion(scope, name, this, blocks, mode, loopInfo.orElse(null));
    children.add(region);
    return region;
  }

  public Scope getScope() { return scope; }
  public String getName() { return name; }
  public Optional<SchedulingRegion> getParent() { return Optional.ofNullable(parent); }
  public boolean isTop() { return parent == null; }
  public List<SchedulingRegion> getChildren() { return Collections.unmodifiableList(children); }
  /** Index of this region among its parent's children, 0 for the top-level region. */
  public int getChildIndex() { return parent == null ? 0 : parent.children.indexOf(this); }
  public List<Block> getBlocks() { return Collections.unmodifiableList(blocks); }
  public SchedulingMode getMode() { return mode; }
  public Optional<LoopInfo> getLoopInfo() { return Optional.ofNullable(loopInfo); }

  public void addNode(ScheduledNode node) { nodes.add(node); }
  public List<ScheduledNode> getNodes() { return Collections.unmodifiableList(nodes); }

  /** Scheduled nodes of each block of the region, ordered by begin cycle; unscheduled nodes are dropped. */
  public Map<Block, List<ScheduledNode>> getBlockNodesMap() {
    var map = new LinkedHashMap<Block, List<ScheduledNode>>();
    blocks.forEach(b -> map.put(b, new ArrayList<>()));
    for (ScheduledNode node : nodes) {
      if (!node.isScheduled())
        continue;
      var list = map.get(node.getStm().getBlock());
      if (list != null)
        list.add(node);
    }
    map.values().forEach(list -> list.sort(Comparator.comparingInt(ScheduledNode::getBegin)));
    return map;
  }

  /** All scheduled nodes of the region, ordered by begin cycle. */
  public List<ScheduledNode> getScheduledNodes() {
    return nodes.stream()
        .filter(ScheduledNode::isScheduled)
        .sorted(Comparator.comparingInt(ScheduledNode::getBegin))
        .collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return String.format("SchedulingRegion %s (%s, %d blocks)", name, mode.serialName, blocks.size());
  }
}

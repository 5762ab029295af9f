package hlsc.analysis;

import hlsc.ir.Block;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immediate-dominator tree of a scope's blocks. The root is the scope's entry block.
 */
public class DominatorTree {
  private final Block root;
  private final Map<Block, Block> idoms = new HashMap<>();
  private final Map<Block, List<Block>> children = new HashMap<>();

  DominatorTree(Block root) {
    this.root = root;
    children.put(root, new ArrayList<>());
  }

  /** Records {@code idom} as the immediate dominator of {@code block}. Children keep insertion order. */
  void add(Block block, Block idom) {
    idoms.put(block, idom);
    children.computeIfAbsent(block, b -> new ArrayList<>());
    children.computeIfAbsent(idom, b -> new ArrayList<>()).add(block);
  }

  public Block getRoot() { return root; }

  /** The immediate dominator, empty for the root. */
  public Optional<Block> getParent(Block block) { return Optional.ofNullable(idoms.get(block)); }

  public List<Block> getChildren(Block block) {
    var list = children.get(block);
    return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
  }

  public boolean contains(Block block) { return children.containsKey(block); }

  /** True if every path from the root to {@code b} passes through {@code a} (reflexive). */
  public boolean dominates(Block a, Block b) {
    for (Block cur = b; cur != null; cur = idoms.get(cur)) {
      if (cur == a)
        return true;
    }
    return false;
  }

  public boolean strictlyDominates(Block a, Block b) { return a != b && dominates(a, b); }

  public int getDepth(Block block) {
    int depth = 0;
    for (Block cur = idoms.get(block); cur != null; cur = idoms.get(cur))
      ++depth;
    return depth;
  }

  /** All nodes in depth-first preorder, children in insertion order. */
  public List<Block> preorder() {
    var result = new ArrayList<Block>();
    Deque<Block> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Block cur = stack.pop();
      result.add(cur);
      var kids = getChildren(cur);
      for (int i = kids.size() - 1; i >= 0; --i)
        stack.push(kids.get(i));
    }
    return result;
  }

  @Override
  public String toString() {
    var sb = new StringBuilder("DominatorTree\n");
    for (Block block : preorder())
      sb.append("  ".repeat(getDepth(block) + 1)).append(block.getName()).append("\n");
    return sb.toString();
  }
}

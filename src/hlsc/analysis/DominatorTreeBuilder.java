package hlsc.analysis;

import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Block;
import hlsc.ir.Scope;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes the dominator tree over the forward edges of a scope (loop-back edges are ignored).
 * Uses the iterative algorithm of Cooper, Harvey and Kennedy over reverse postorder.
 */
public class DominatorTreeBuilder {
  protected static final Logger logger = LogManager.getLogger();

  private DominatorTreeBuilder() {}

  /**
   * @throws CompileException if the entry block has predecessors or some block of the scope is unreachable
   */
  public static DominatorTree process(Scope scope) {
    Block entry = scope.getEntryBlock();
    if (!entry.getPreds().isEmpty())
      throw CompileException.of(Errors.ENTRY_HAS_PREDECESSORS, scope.getName(), entry.getName());

    List<Block> rpo = reversePostorder(entry);
    var rpoIdx = new HashMap<Block, Integer>();
    for (int i = 0; i < rpo.size(); ++i)
      rpoIdx.put(rpo.get(i), i);
    for (Block block : scope.getBlocks()) {
      if (!rpoIdx.containsKey(block))
        throw CompileException.of(Errors.UNREACHABLE_BLOCK, scope.getName(), block.getName());
    }

    Map<Block, Block> idom = new HashMap<>();
    idom.put(entry, entry);
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Block block : rpo) {
        if (block == entry)
          continue;
        Block newIdom = null;
        for (Block pred : block.getNormalPreds()) {
          if (!idom.containsKey(pred))
            continue;
          newIdom = (newIdom == null) ? pred : intersect(pred, newIdom, idom, rpoIdx);
        }
        assert (newIdom != null);
        if (idom.get(block) != newIdom) {
          idom.put(block, newIdom);
          changed = true;
        }
      }
    }

    var tree = new DominatorTree(entry);
    // Children in block arena order keep the renaming walk deterministic.
    for (Block block : scope.getBlocks()) {
      if (block != entry)
        tree.add(block, idom.get(block));
    }
    logger.trace("{}: {}", scope.getName(), tree);
    return tree;
  }

  private static Block intersect(Block b1, Block b2, Map<Block, Block> idom, Map<Block, Integer> rpoIdx) {
    Block finger1 = b1;
    Block finger2 = b2;
    while (finger1 != finger2) {
      while (rpoIdx.get(finger1) > rpoIdx.get(finger2))
        finger1 = idom.get(finger1);
      while (rpoIdx.get(finger2) > rpoIdx.get(finger1))
        finger2 = idom.get(finger2);
    }
    return finger1;
  }

  private static List<Block> reversePostorder(Block entry) {
    var postorder = new ArrayList<Block>();
    var visited = new HashSet<Block>();
    record Frame(Block block, List<Block> succs, int next) {}
    Deque<Frame> stack = new ArrayDeque<>();
    visited.add(entry);
    stack.push(new Frame(entry, entry.getNormalSuccs(), 0));
    while (!stack.isEmpty()) {
      Frame top = stack.pop();
      if (top.next() < top.succs().size()) {
        stack.push(new Frame(top.block(), top.succs(), top.next() + 1));
        Block succ = top.succs().get(top.next());
        if (visited.add(succ))
          stack.push(new Frame(succ, succ.getNormalSuccs(), 0));
      } else {
        postorder.add(top.block());
      }
    }
    var rpo = new ArrayList<Block>(postorder.size());
    for (int i = postorder.size() - 1; i >= 0; --i)
      rpo.add(postorder.get(i));
    return rpo;
  }
}

package hlsc.analysis;

import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Block;
import hlsc.ir.Scope;
import hlsc.ir.Scope.ScopeTag;
import hlsc.ir.ScopeRegistry;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DominatorTreeBuilderTest {

  @RepeatedTest(64)
  void testRandom() {
    long seed = new Random().nextLong();
    try {
      testAgainstReachability(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testAgainstReachability with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 42, 68392, 5893163784830298700L, -6733423670758169604L})
  void testAgainstReachability(long seed) {
    Scope scope = new TestCFGBuilder(new Random(seed)).build(1, 14);
    DominatorTree tree = DominatorTreeBuilder.process(scope);
    List<Block> blocks = scope.getBlocks();

    Assertions.assertSame(blocks.get(0), tree.getRoot());
    Assertions.assertTrue(tree.getParent(tree.getRoot()).isEmpty());
    for (Block a : blocks) {
      for (Block b : blocks)
        Assertions.assertEquals(TestCFGBuilder.dominates(scope, a, b), tree.dominates(a, b), a.getName() + " dom " + b.getName());
    }
    // the immediate dominator is the closest strict dominator
    for (Block b : blocks) {
      if (b == tree.getRoot())
        continue;
      Block idom = tree.getParent(b).orElseThrow();
      Assertions.assertTrue(tree.strictlyDominates(idom, b));
      for (Block other : blocks) {
        if (tree.strictlyDominates(other, b))
          Assertions.assertTrue(tree.dominates(other, idom), other.getName() + " above idom of " + b.getName());
      }
      Assertions.assertEquals(tree.getDepth(idom) + 1, tree.getDepth(b));
    }
    List<Block> preorder = tree.preorder();
    Assertions.assertEquals(blocks.size(), preorder.size());
    Assertions.assertEquals(blocks.size(), new HashSet<>(preorder).size());
    for (int i = 1; i < preorder.size(); ++i)
      Assertions.assertTrue(preorder.indexOf(tree.getParent(preorder.get(i)).orElseThrow()) < i);
  }

  private static Scope newScope() { return new ScopeRegistry().createScope(null, "f", EnumSet.of(ScopeTag.Function), 1); }

  @Test
  void testDiamondWithLoop() {
    Scope scope = newScope();
    Block b0 = scope.newBlock("b");
    Block b1 = scope.newBlock("b");
    Block b2 = scope.newBlock("b");
    Block b3 = scope.newBlock("b");
    Block b4 = scope.newBlock("b");
    scope.setEntryBlock(b0);
    b0.connect(b1);
    b1.connect(b2);
    b1.connect(b3);
    b2.connect(b4);
    b3.connect(b4);
    b4.connectLoop(b1);

    DominatorTree tree = DominatorTreeBuilder.process(scope);
    Assertions.assertEquals(b0, tree.getParent(b1).orElseThrow());
    Assertions.assertEquals(List.of(b2, b3, b4), tree.getChildren(b1));
    Assertions.assertEquals(List.of(b0, b1, b2, b3, b4), tree.preorder());
    Assertions.assertTrue(tree.dominates(b1, b4));
    Assertions.assertFalse(tree.dominates(b2, b4));
    Assertions.assertFalse(tree.strictlyDominates(b4, b4));
    Assertions.assertTrue(tree.dominates(b4, b4));
  }

  @Test
  void testEntryWithPredecessor() {
    Scope scope = newScope();
    Block b0 = scope.newBlock("b");
    Block b1 = scope.newBlock("b");
    scope.setEntryBlock(b0);
    b0.connect(b1);
    b1.connectLoop(b0);
    var e = Assertions.assertThrows(CompileException.class, () -> DominatorTreeBuilder.process(scope));
    Assertions.assertEquals(Errors.ENTRY_HAS_PREDECESSORS, e.getError());
  }

  @Test
  void testUnreachableBlock() {
    Scope scope = newScope();
    Block b0 = scope.newBlock("b");
    Block b1 = scope.newBlock("b");
    Block b2 = scope.newBlock("b");
    scope.setEntryBlock(b0);
    b0.connect(b1);
    b2.connect(b1);
    var e = Assertions.assertThrows(CompileException.class, () -> DominatorTreeBuilder.process(scope));
    Assertions.assertEquals(Errors.UNREACHABLE_BLOCK, e.getError());
    Assertions.assertTrue(e.getMessage().contains(b2.getName()));
  }
}

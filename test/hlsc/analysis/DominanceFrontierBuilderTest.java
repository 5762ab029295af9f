package hlsc.analysis;

import hlsc.ir.Block;
import hlsc.ir.Scope;
import hlsc.ir.Scope.ScopeTag;
import hlsc.ir.ScopeRegistry;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DominanceFrontierBuilderTest {

  @RepeatedTest(64)
  void testRandom() {
    long seed = new Random().nextLong();
    try {
      testAgainstDefinition(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testAgainstDefinition with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {3, 1234, 68392, 5893163784830298700L, -6733423670758169604L})
  void testAgainstDefinition(long seed) {
    Scope scope = new TestCFGBuilder(new Random(seed)).build(1, 14);
    DominatorTree tree = DominatorTreeBuilder.process(scope);
    DominanceFrontier df = DominanceFrontierBuilder.process(scope, tree);
    for (Block x : scope.getBlocks()) {
      // y is in DF(x) if x dominates a predecessor of y but does not strictly dominate y
      Set<Block> expected = new HashSet<>();
      for (Block y : scope.getBlocks()) {
        if (tree.strictlyDominates(x, y))
          continue;
        if (y.getPreds().stream().anyMatch(p -> tree.dominates(x, p)))
          expected.add(y);
      }
      Assertions.assertEquals(expected, new HashSet<>(df.get(x)), "DF(" + x.getName() + ")");
    }
  }

  @Test
  void testLoopHeadIsInItsOwnFrontier() {
    Scope scope = new ScopeRegistry().createScope(null, "f", EnumSet.of(ScopeTag.Function), 1);
    Block b0 = scope.newBlock("b");
    Block b1 = scope.newBlock("b");
    Block b2 = scope.newBlock("b");
    Block b3 = scope.newBlock("b");
    scope.setEntryBlock(b0);
    b0.connect(b1);
    b1.connect(b2);
    b1.connect(b3);
    b2.connectLoop(b1);

    DominanceFrontier df = DominanceFrontierBuilder.process(scope, DominatorTreeBuilder.process(scope));
    Assertions.assertEquals(Set.of(b1), df.get(b2));
    Assertions.assertEquals(Set.of(b1), df.get(b1));
    Assertions.assertTrue(df.get(b0).isEmpty());
    Assertions.assertTrue(df.get(b3).isEmpty());
  }
}

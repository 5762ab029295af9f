package hlsc.ui;

import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Block;
import hlsc.ir.Call;
import hlsc.ir.CondOp;
import hlsc.ir.Const;
import hlsc.ir.Expr;
import hlsc.ir.Jump;
import hlsc.ir.MCJump;
import hlsc.ir.MStore;
import hlsc.ir.Move;
import hlsc.ir.PortWrite;
import hlsc.ir.Scope;
import hlsc.ir.ScopeRegistry;
import hlsc.ir.Symbol;
import hlsc.ir.Type;
import hlsc.schedule.LoopInfo;
import hlsc.schedule.ScheduledNode;
import hlsc.schedule.SchedulingMode;
import hlsc.schedule.SchedulingRegion;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ProgramReaderTest {
  static ScopeRegistry registry;

  @BeforeAll
  static void readProgram() {
    registry = ProgramReader.read(ProgramReaderTest.class.getResourceAsStream("/ui/program.yaml"));
  }

  static Scope scope(String name) { return registry.find(name).orElseThrow(); }

  @Test
  void testScopes() {
    Scope module = scope("@top.M");
    Scope worker = scope("@top.M.w");
    Assertions.assertTrue(module.isModule());
    Assertions.assertEquals(1, module.getLineno());
    Assertions.assertEquals(List.of(worker), module.getWorkers());
    Assertions.assertTrue(worker.isWorker());
    Assertions.assertEquals("w0", worker.getEntryBlock().getName());

    // unknown tags are skipped
    Scope g = scope("@top.g");
    Assertions.assertEquals(3, g.getTags().size());
    Assertions.assertTrue(g.getReturnSym().orElseThrow().isReturn());
    Assertions.assertTrue(g.getReturnSym().get().isParam());

    Scope f = scope("@top.f");
    Assertions.assertEquals(List.of(g), List.copyOf(f.getCallees()));
    Assertions.assertEquals("a", f.getParams().get(0).getName());
  }

  @Test
  void testTypes() {
    Symbol p = scope("@top.M").findSymLocal("p").orElseThrow();
    Type port = p.getType();
    Assertions.assertTrue(port.isPort());
    Assertions.assertEquals(Type.PortDirection.OUT, port.getDirection().orElseThrow());
    Assertions.assertEquals("valid", port.getProtocol());
    Assertions.assertEquals(3, port.getInit());
    Assertions.assertEquals(8, port.getWidth());
    Assertions.assertFalse(port.isSigned());
    // symbols of an enclosing scope are visible
    Assertions.assertSame(p, scope("@top.M.w").findSym("p").orElseThrow());

    Scope f = scope("@top.f");
    Type xs = f.findSymLocal("xs").orElseThrow().getType();
    Assertions.assertTrue(xs.isList());
    Assertions.assertEquals(4, xs.getLength());
    Assertions.assertEquals(Type.MemKind.REGISTER_ARRAY, xs.getMemKind().orElseThrow());
    Assertions.assertEquals(Type.intType(8, true), xs.getElement().orElseThrow());
    Assertions.assertEquals(16, f.findSymLocal("r").orElseThrow().getType().getWidth());
    Assertions.assertTrue(f.findSymLocal("a").orElseThrow().getType().isBool());
    Assertions.assertTrue(f.findSymLocal("i").orElseThrow().isInduction());
  }

  @Test
  void testBlocksAndStatements() {
    Scope f = scope("@top.f");
    List<Block> blocks = f.getBlocks();
    Assertions.assertEquals(4, blocks.size());
    Assertions.assertSame(blocks.get(0), f.getEntryBlock());
    Assertions.assertSame(blocks.get(3), f.getExitBlock());
    Assertions.assertEquals(List.of(blocks.get(1), blocks.get(3)), blocks.get(0).getSuccs());
    Assertions.assertEquals(List.of(blocks.get(1)), blocks.get(2).getSuccsLoop());
    Assertions.assertEquals(List.of(blocks.get(0)), blocks.get(1).getNormalPreds());

    var call = (Call)((Move)blocks.get(0).getStms().get(1)).getSrc();
    Assertions.assertSame(scope("@top.g"), call.getCallee());
    Assertions.assertEquals(11, blocks.get(0).getStms().get(1).getLineno());
    var mcjump = (MCJump)blocks.get(0).getStms().get(2);
    Assertions.assertEquals(1, ((Const)mcjump.getConds().get(1)).getValue());
    Assertions.assertTrue(((Expr)blocks.get(2).getStms().get(0)).getExp() instanceof MStore);
    Assertions.assertTrue(((Jump)blocks.get(2).getStms().get(2)).isLoopBack());
    Assertions.assertTrue(((Move)blocks.get(3).getStms().get(0)).getSrc() instanceof CondOp);

    Block workerEntry = scope("@top.M.w").getEntryBlock();
    Assertions.assertTrue(((Expr)workerEntry.getStms().get(0)).getExp() instanceof PortWrite);
  }

  @Test
  void testRegions() {
    Scope f = scope("@top.f");
    List<SchedulingRegion> regions = f.collectRegions();
    Assertions.assertEquals(2, regions.size());
    SchedulingRegion top = regions.get(0);
    SchedulingRegion loopRegion = regions.get(1);
    Assertions.assertEquals(SchedulingMode.STATE_MACHINE, top.getMode());
    Assertions.assertEquals("L1", loopRegion.getName());
    Assertions.assertEquals(SchedulingMode.PIPELINED_LOOP, loopRegion.getMode());

    LoopInfo loop = loopRegion.getLoopInfo().orElseThrow();
    List<Block> blocks = f.getBlocks();
    Assertions.assertSame(blocks.get(1), loop.getHead());
    Assertions.assertEquals(List.of(blocks.get(2)), loop.getBodies());
    Assertions.assertSame(blocks.get(3), loop.getExit());
    Assertions.assertEquals("c", loop.getCond().getName());
    Assertions.assertEquals(0, ((Const)loop.getInit()).getValue());

    // statements go to the innermost region holding their block; unscheduled ones to none
    Assertions.assertEquals(4, top.getNodes().size());
    Assertions.assertEquals(5, loopRegion.getNodes().size());
    ScheduledNode callNode = top.getNodes().get(1);
    Assertions.assertEquals(2, callNode.getLatency());
    Assertions.assertEquals(1, callNode.getInstanceNum());
    Assertions.assertEquals(2, callNode.getEnd());

    // without a region the schedule of the worker is dropped
    Assertions.assertTrue(scope("@top.M.w").getRegions().isEmpty());
  }

  @ParameterizedTest
  @ValueSource(strings = {"/ui/error_unknown_block.yaml", "/ui/error_parent_order.yaml", "/ui/error_unknown_symbol.yaml",
                          "/ui/error_two_kinds.yaml", "/ui/error_syntax.yaml", "/ui/error_not_a_map.yaml"})
  void testMalformed(String resource) {
    var e = Assertions.assertThrows(CompileException.class,
                                    () -> ProgramReader.read(ProgramReaderTest.class.getResourceAsStream(resource)));
    Assertions.assertEquals(Errors.MALFORMED_INPUT, e.getError());
  }

  @Test
  void testUnknownOperator() {
    var e = Assertions.assertThrows(
        CompileException.class,
        () -> ProgramReader.read(ProgramReaderTest.class.getResourceAsStream("/ui/error_unknown_operator.yaml")));
    Assertions.assertEquals(Errors.UNSUPPORTED_OPERATOR, e.getError());
    Assertions.assertEquals("@top.g", e.getScopeName().orElseThrow());
  }

  @Test
  void testEmptyProgram() {
    var in = new ByteArrayInputStream("scopes: []\n".getBytes(StandardCharsets.UTF_8));
    ScopeRegistry empty = ProgramReader.read(in);
    Assertions.assertEquals(1, empty.getAll().size());
  }
}

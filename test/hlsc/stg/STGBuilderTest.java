package hlsc.stg;

import hlsc.ahdl.AHDLInline;
import hlsc.ahdl.AHDLMetaWait;
import hlsc.ahdl.AHDLMove;
import hlsc.ahdl.AHDLNop;
import hlsc.ahdl.AHDLProcCall;
import hlsc.ahdl.AHDLSeq;
import hlsc.ahdl.AHDLCalleeEpilog;
import hlsc.ahdl.AHDLCalleeProlog;
import hlsc.ahdl.AHDLStm;
import hlsc.ahdl.AHDLTransition;
import hlsc.ahdl.AHDLTransitionIf;
import hlsc.ahdl.AHDLVar;
import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Block;
import hlsc.ir.Scope;
import hlsc.ir.Scope.ScopeTag;
import hlsc.ir.ScopeRegistry;
import hlsc.schedule.SchedulingMode;
import hlsc.schedule.SchedulingRegion;
import hlsc.ui.ProgramReader;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class STGBuilderTest {

  static ScopeRegistry load(String resource) { return ProgramReader.read(STGBuilderTest.class.getResourceAsStream(resource)); }

  static Scope build(String resource, String scopeName) {
    ScopeRegistry registry = load(resource);
    Scope scope = registry.find(scopeName).orElseThrow();
    new STGBuilder().process(scope);
    return scope;
  }

  static List<String> stateNames(STG stg) { return stg.getStates().stream().map(State::getName).collect(Collectors.toList()); }

  static State state(STG stg, String name) {
    return stg.getStates().stream().filter(s -> s.getName().equals(name)).findAny().orElseThrow();
  }

  static AHDLStm lastCode(State state) { return state.getCodes().get(state.getCodes().size() - 1); }
  static AHDLStm lastCode(PipelineStage stage) { return stage.getCodes().get(stage.getCodes().size() - 1); }

  static State target(AHDLStm transition) { return ((AHDLTransition)transition).getTargetState().orElseThrow(); }

  @Test
  void testBranchStates() {
    Scope scope = build("/stg/branch.yaml", "@top.f");
    Assertions.assertEquals(1, scope.getStgs().size());
    STG stg = scope.getStgs().get(0);
    Assertions.assertEquals("f", stg.getName());
    Assertions.assertTrue(stg.isMain());
    Assertions.assertEquals(List.of("f_b0_INIT", "f_b0_S0", "f_b0_S1", "f_b1_S0", "f_b2_S0", "f_b3_FINISH"), stateNames(stg));
    Assertions.assertSame(state(stg, "f_b0_INIT"), stg.getInitState());
    Assertions.assertSame(state(stg, "f_b3_FINISH"), stg.getFinishState());

    // prolog in the init state, epilog right before the transition of the finish state
    State init = stg.getInitState();
    Assertions.assertTrue(((AHDLSeq)init.getCodes().get(0)).getFactor() instanceof AHDLCalleeProlog);
    Assertions.assertSame(state(stg, "f_b0_S0"), target(lastCode(init)));
    State finish = stg.getFinishState();
    Assertions.assertEquals(2, finish.getCodes().size());
    Assertions.assertTrue(((AHDLSeq)finish.getCodes().get(0)).getFactor() instanceof AHDLCalleeEpilog);
    Assertions.assertSame(init, target(lastCode(finish)));

    // the conditional branch is resolved to the first states of both targets
    var branch = (AHDLTransitionIf)lastCode(state(stg, "f_b0_S1"));
    Assertions.assertEquals(2, branch.getConds().size());
    Assertions.assertSame(state(stg, "f_b1_S0"), target(branch.getCodesList().get(0).get(0)));
    Assertions.assertSame(state(stg, "f_b2_S0"), target(branch.getCodesList().get(1).get(0)));

    // the jumps of both arms are resolved to the join block
    for (String arm : List.of("f_b1_S0", "f_b2_S0")) {
      State armState = state(stg, arm);
      Assertions.assertSame(finish, target(lastCode(armState)));
      var move = (AHDLMove)armState.getCodes().get(0);
      Assertions.assertEquals("f_out_0", ((AHDLVar)move.getDst()).getSig().getName());
    }
    Assertions.assertTrue(scope.signal("f_a").orElseThrow().isInput());
    Assertions.assertEquals(1, scope.signal("c").orElseThrow().getWidth());
  }

  @Test
  void testTestbenchFinishesWithSelfLoop() {
    Scope scope = build("/stg/testbench.yaml", "@top.t");
    STG stg = scope.getMainStg().orElseThrow();
    Assertions.assertEquals(List.of("t_b0_INIT", "t_b0_S1", "t_b0_S2", "t_b0_S3", "t_b0_S4", "t_b0_FINISH"), stateNames(stg));
    Assertions.assertTrue(stg.getInitState().getCodes().get(0) instanceof AHDLProcCall);
    Assertions.assertTrue(state(stg, "t_b0_S1").getCodes().get(0) instanceof AHDLNop);
    Assertions.assertTrue(state(stg, "t_b0_S2").getCodes().get(0) instanceof AHDLNop);

    // the wait construct ends its state and takes the transition to the next one
    var wait = (AHDLMetaWait)lastCode(state(stg, "t_b0_S3"));
    Assertions.assertEquals(AHDLMetaWait.WaitKind.WAIT_EDGE, wait.getWaitKind());
    Assertions.assertSame(state(stg, "t_b0_S4"), wait.getTransition().orElseThrow().getTargetState().orElseThrow());

    State finish = stg.getFinishState();
    Assertions.assertEquals(5, finish.getStep());
    Assertions.assertEquals("$display(\"%5t:finish\", $time)", ((AHDLInline)finish.getCodes().get(0)).getCode());
    Assertions.assertEquals("$finish()", ((AHDLInline)finish.getCodes().get(1)).getCode());
    Assertions.assertSame(finish, target(lastCode(finish)));
  }

  @Test
  void testLoopPipelineIsNestedStg() {
    Scope scope = build("/stg/loop_pipeline.yaml", "@top.f");
    List<STG> stgs = scope.getStgs();
    Assertions.assertEquals(2, stgs.size());
    STG main = stgs.get(0);
    STG loop = stgs.get(1);
    Assertions.assertEquals("f", main.getName());
    Assertions.assertEquals("f_L1", loop.getName());
    Assertions.assertSame(main, loop.getParent().orElseThrow());
    Assertions.assertSame(loop.getInitState(), loop.getFinishState());

    var pstate = (PipelineState)loop.getInitState();
    Assertions.assertEquals("f_L1_b1_P", pstate.getName());
    Assertions.assertEquals(List.of("f_b0_INIT", "f_b0_S0", "f_b3_FINISH"), stateNames(main));
    // entering the loop goes to the pipeline state, leaving it to the exit block
    Assertions.assertSame(pstate, target(lastCode(state(main, "f_b0_S0"))));
    var exit = (AHDLTransitionIf)lastCode(pstate.getStages().get(pstate.getStages().size() - 1));
    List<AHDLStm> leave = exit.getCodesList().get(0);
    Assertions.assertSame(main.getFinishState(), target(leave.get(leave.size() - 1)));
  }

  @ParameterizedTest
  @CsvSource({"/stg/worker_pipeline.yaml, @top.M.w, w", "/stg/loop_pipeline.yaml, @top.f, f"})
  void testProcessIsVerified(String resource, String scopeName, String mainName) {
    Scope scope = build(resource, scopeName);
    Assertions.assertEquals(mainName, scope.getMainStg().orElseThrow().getName());
    scope.getStgs().forEach(STGBuilder::verify);
  }

  @Test
  void testClassScopesAreSkipped() {
    ScopeRegistry registry = load("/stg/worker_pipeline.yaml");
    Scope module = registry.find("@top.M").orElseThrow();
    new STGBuilder().process(module);
    Assertions.assertTrue(module.getStgs().isEmpty());
  }

  private static STG singleStateStg(List<AHDLStm> codes) {
    var registry = new ScopeRegistry();
    Scope scope = registry.createScope(null, "g", EnumSet.of(ScopeTag.Function), 1);
    Block block = scope.newBlock("b");
    scope.setEntryBlock(block);
    var region = SchedulingRegion.createTop(scope, List.of(block), SchedulingMode.STATE_MACHINE);
    var stg = new STG("g", scope, region);
    State state = stg.newState("g_b0_S0", 0, codes);
    stg.addState(state);
    stg.setInitState(state);
    stg.setFinishState(state);
    return stg;
  }

  @Test
  void testVerifyRejectsUnresolvedTransition() {
    STG stg = singleStateStg(List.of(new AHDLTransition()));
    var e = Assertions.assertThrows(CompileException.class, () -> STGBuilder.verify(stg));
    Assertions.assertEquals(Errors.UNRESOLVED_IN_STG, e.getError());
  }

  @Test
  void testVerifyRejectsMissingTerminal() {
    STG stg = singleStateStg(List.of(new AHDLNop("idle")));
    var e = Assertions.assertThrows(CompileException.class, () -> STGBuilder.verify(stg));
    Assertions.assertEquals(Errors.MISSING_TERMINAL, e.getError());
  }

  @Test
  void testScopeWithoutRegion() {
    var registry = new ScopeRegistry();
    Scope scope = registry.createScope(null, "g", EnumSet.of(ScopeTag.Function), 1);
    var e = Assertions.assertThrows(CompileException.class, () -> new STGBuilder().process(scope));
    Assertions.assertEquals(Errors.MISSING_SCHEDULE, e.getError());
  }

  @ParameterizedTest
  @CsvSource({"/stg/error_branch_in_pipeline.yaml, UNSUPPORTED_IN_PIPELINE",
              "/stg/error_phi_without_predicates.yaml, PHI_WITHOUT_PREDICATES",
              "/stg/error_unknown_syscall.yaml, UNSUPPORTED_SYSCALL",
              "/stg/error_wait_edge_args.yaml, UNSUPPORTED_SYSCALL",
              "/stg/error_clksleep_args.yaml, UNSUPPORTED_SYSCALL",
              "/stg/error_array_repeat.yaml, SEQ_MULTIPLIER_MUST_BE_CONST",
              "/stg/error_jump_out_of_region.yaml, UNRESOLVED_TRANSITION"})
  void testCompileErrors(String resource, Errors expected) {
    ScopeRegistry registry = load(resource);
    Scope scope = registry.find("@top.g").orElseThrow();
    var e = Assertions.assertThrows(CompileException.class, () -> new STGBuilder().process(scope));
    Assertions.assertEquals(expected, e.getError());
    Assertions.assertEquals("@top.g", e.getScopeName().orElseThrow());
  }
}

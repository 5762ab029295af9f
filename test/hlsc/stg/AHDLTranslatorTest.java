package hlsc.stg;

import hlsc.ahdl.AHDLConst;
import hlsc.ahdl.AHDLIf;
import hlsc.ahdl.AHDLIfExp;
import hlsc.ahdl.AHDLLoad;
import hlsc.ahdl.AHDLMove;
import hlsc.ahdl.AHDLNop;
import hlsc.ahdl.AHDLSeq;
import hlsc.ahdl.AHDLStm;
import hlsc.ahdl.AHDLStore;
import hlsc.ahdl.AHDLVar;
import hlsc.ir.Scope;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AHDLTranslatorTest {

  static STG build(STGBuilder builder) {
    Scope scope = STGBuilderTest.load("/stg/translate.yaml").find("@top.f").orElseThrow();
    builder.process(scope);
    return scope.getMainStg().orElseThrow();
  }

  /** "state:step/stepN" of every sequence step whose factor is a {@code factorClass}. */
  static List<String> seqSteps(STG stg, Class<? extends AHDLStm> factorClass) {
    var steps = new ArrayList<String>();
    for (State state : stg.getStates()) {
      for (AHDLStm code : state.getCodes()) {
        if (code instanceof AHDLSeq && factorClass.isInstance(((AHDLSeq)code).getFactor()))
          steps.add(String.format("%s:%d/%d", state.getName(), ((AHDLSeq)code).getStep(), ((AHDLSeq)code).getStepN()));
      }
    }
    return steps;
  }

  static String sigName(Object exp) { return ((AHDLVar)exp).getSig().getName(); }

  @Test
  void testDefaultMemoryLatencies() {
    STG stg = build(new STGBuilder());
    Assertions.assertEquals(List.of("f_b0_S0:0/3", "f_b0_S1:1/3", "f_b0_S2:2/3"), seqSteps(stg, AHDLLoad.class));
    Assertions.assertEquals(List.of("f_b0_S3:0/2", "f_b0_S4:1/2"), seqSteps(stg, AHDLStore.class));

    var load = (AHDLLoad)((AHDLSeq)STGBuilderTest.state(stg, "f_b0_S0").getCodes().get(0)).getFactor();
    Assertions.assertEquals("y", sigName(load.getDst()));
    Assertions.assertEquals(0, ((AHDLConst)load.getOffset()).getValue());
  }

  @ParameterizedTest
  @CsvSource({"1,4", "2,1", "5,3"})
  void testConfiguredMemoryLatencies(int loadLatency, int storeLatency) {
    STG stg = build(new STGBuilder(loadLatency, storeLatency, true));
    List<String> loads = seqSteps(stg, AHDLLoad.class);
    List<String> stores = seqSteps(stg, AHDLStore.class);
    Assertions.assertEquals(loadLatency, loads.size());
    Assertions.assertEquals(storeLatency, stores.size());
    Assertions.assertEquals(String.format("f_b0_S3:0/%d", storeLatency), stores.get(0));
    Assertions.assertEquals(String.format("f_b0_S%d:%d/%d", loadLatency - 1, loadLatency - 1, loadLatency),
                            loads.get(loadLatency - 1));
  }

  @Test
  void testClockSleepWaitsWithNops() {
    STG stg = build(new STGBuilder());
    for (String name : List.of("f_b0_S5", "f_b0_S6")) {
      List<AHDLStm> codes = STGBuilderTest.state(stg, name).getCodes();
      Assertions.assertEquals(2, codes.size(), name);
      Assertions.assertTrue(codes.get(0) instanceof AHDLNop, name);
    }
  }

  @Test
  void testConditionalMoveAndLength() {
    STG stg = build(new STGBuilder());
    List<AHDLStm> codes = STGBuilderTest.state(stg, "f_b0_S7").getCodes();
    Assertions.assertEquals(3, codes.size());

    var cond = (AHDLIf)codes.get(0);
    Assertions.assertEquals("f_a", sigName(cond.getConds().get(0)));
    var move = (AHDLMove)cond.getCodesList().get(0).get(0);
    Assertions.assertEquals("y", sigName(move.getDst()));
    Assertions.assertEquals(5, ((AHDLConst)move.getSrc()).getValue());

    // the length of a fixed-size list is a constant
    var len = (AHDLMove)codes.get(1);
    Assertions.assertEquals("n", sigName(len.getDst()));
    Assertions.assertEquals(4, ((AHDLConst)len.getSrc()).getValue());
  }

  @Test
  void testConstantBranchIsUnconditional() {
    STG stg = build(new STGBuilder());
    List<AHDLStm> codes = STGBuilderTest.state(stg, "f_b0_S8").getCodes();
    Assertions.assertEquals(1, codes.size());
    Assertions.assertSame(STGBuilderTest.state(stg, "f_b1_S0"), STGBuilderTest.target(codes.get(0)));
  }

  @Test
  void testPredicatedPhiIsMux() {
    STG stg = build(new STGBuilder());
    Assertions.assertEquals("f_b2_FINISH", stg.getFinishState().getName());
    var move = (AHDLMove)stg.getFinishState().getCodes().get(0);
    Assertions.assertEquals("f_out_0", sigName(move.getDst()));
    // the last predicate is always true so it needs no high-impedance fallback
    var mux = (AHDLIfExp)move.getSrc();
    Assertions.assertEquals("f_a", sigName(mux.getCond()));
    Assertions.assertEquals("y", sigName(mux.getLexp()));
    Assertions.assertEquals("n", sigName(mux.getRexp()));
  }
}

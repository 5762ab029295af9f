package hlsc;

import hlsc.ir.Scope;
import hlsc.ir.ScopeRegistry;
import hlsc.ssa.SSAFormTransformer;
import hlsc.ui.HLSCConfig;
import hlsc.ui.ProgramReader;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HLSCTest {

  static ScopeRegistry load(String resource) { return ProgramReader.read(HLSCTest.class.getResourceAsStream(resource)); }

  @ParameterizedTest
  @ValueSource(strings = {"/stg/branch.yaml", "/stg/loop_pipeline.yaml", "/stg/testbench.yaml", "/stg/worker_pipeline.yaml"})
  void testScheduledPrograms(String resource) {
    ScopeRegistry registry = load(resource);
    Assertions.assertTrue(new HLSC().generate(registry));
    for (Scope scope : registry.getScopes(false, false, false, false)) {
      if (!scope.isClass())
        Assertions.assertTrue(scope.getMainStg().isPresent(), scope.getName());
    }
  }

  @Test
  void testUnscheduledScopeOnlyGetsSSA() {
    ScopeRegistry registry = load("/ssa/diamond.yaml");
    Assertions.assertTrue(new HLSC().generate(registry));
    Scope f = registry.find("@top.f").orElseThrow();
    Assertions.assertEquals(1, SSAFormTransformer.collectPhis(f).size());
    Assertions.assertTrue(f.getStgs().isEmpty());
  }

  @Test
  void testUnscheduledScopeWithoutSSA() {
    var cfg = new HLSCConfig();
    cfg.build_ssa = false;
    Assertions.assertFalse(new HLSC(cfg).generate(load("/ssa/diamond.yaml")));
  }

  @ParameterizedTest
  @ValueSource(strings = {"/stg/error_branch_in_pipeline.yaml", "/stg/error_unknown_syscall.yaml"})
  void testCompileErrorFails(String resource) {
    Assertions.assertFalse(new HLSC().generate(load(resource)));
  }

  @Test
  void testDumpAndNoVerify() {
    var cfg = new HLSCConfig();
    cfg.dump_stg = true;
    cfg.verify_stg = false;
    cfg.mem_load_latency = 1;
    ScopeRegistry registry = load("/stg/branch.yaml");
    Assertions.assertTrue(new HLSC(cfg).generate(registry));
    Assertions.assertSame(cfg, new HLSC(cfg).getConfig());
  }
}

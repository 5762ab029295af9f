package hlsc;

import hlsc.errors.CompileException;
import hlsc.ir.Scope;
import hlsc.ir.ScopeRegistry;
import hlsc.ssa.SSAFormTransformer;
import hlsc.stg.STG;
import hlsc.stg.STGBuilder;
import hlsc.ui.HLSCConfig;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the control-structure back end over every scope of a registry. Scheduled scopes get their STGs and pipeline
 * control; the schedule refers to their statements as given, so they are expected in SSA form already. Scopes
 * without a schedule are only brought into SSA form.
 */
public class HLSC {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final HLSCConfig cfg;

  public HLSC(HLSCConfig cfg) { this.cfg = cfg; }
  public HLSC() { this(new HLSCConfig()); }

  public HLSCConfig getConfig() { return cfg; }

  /**
   * Processes the scopes of {@code registry}, callees before callers.
   * @return false if a scope failed to compile; the error is logged
   */
  public boolean generate(ScopeRegistry registry) {
    List<Scope> scopes = registry.getScopes(true, false, false, false);
    logger.debug("processing {} scopes", scopes.size());
    var stgBuilder = new STGBuilder(cfg.mem_load_latency, cfg.mem_store_latency, cfg.verify_stg);
    for (Scope scope : scopes) {
      try {
        if (scope.getRegions().isEmpty() && cfg.build_ssa) {
          if (!scope.getBlocks().isEmpty() && !scope.isClass()) {
            SSAFormTransformer.process(scope);
            logger.debug("{}", scope);
          }
          continue;
        }
        stgBuilder.process(scope);
      } catch (CompileException e) {
        logger.fatal("{}", e.toString());
        return false;
      }
      if (cfg.dump_stg) {
        for (STG stg : scope.getStgs())
          logger.info("{}", stg);
      }
    }
    return true;
  }
}

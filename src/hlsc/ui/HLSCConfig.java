package hlsc.ui;

/**
 * Data-Class to hold tool options.
 */
public class HLSCConfig {

  public int mem_load_latency = 3;
  public int mem_store_latency = 2;

  public boolean build_ssa = true;
  public boolean verify_stg = true;
  public boolean dump_stg = false;
}

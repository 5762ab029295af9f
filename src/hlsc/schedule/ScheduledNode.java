package hlsc.schedule;

import hlsc.ir.IRStm;

/**
 * One IR statement together with the cycle it starts in and the number of cycles it occupies,
 * as decided by the scheduler.
 */
public class ScheduledNode {
  /** Begin cycle of a node that was removed from the schedule. */
  public static final int UNSCHEDULED = -1;

  private final IRStm stm;
  private final int begin;
  private final int latency;
  private final int instanceNum;

  public ScheduledNode(IRStm stm, int begin, int latency, int instanceNum) {
    if (begin < UNSCHEDULED)
      throw new IllegalArgumentException("begin must be a cycle or UNSCHEDULED");
    if (latency < 0)
      throw new IllegalArgumentException("latency must not be negative");
    this.stm = stm;
    this.begin = begin;
    this.latency = latency;
    this.instanceNum = instanceNum;
  }
  public ScheduledNode(IRStm stm, int begin, int latency) { this(stm, begin, latency, 0); }

  public IRStm getStm() { return stm; }
  public int getBegin() { return begin; }
  public int getLatency() { return latency; }
  public int getEnd() { return begin + latency; }
  /** Distinguishes several hardware instances of the same callee. */
  public int getInstanceNum() { return instanceNum; }
  public boolean isScheduled() { return begin != UNSCHEDULED; }

  @Override
  public String toString() {
    return String.format("<%d:%d> %s", begin, latency, stm);
  }
}

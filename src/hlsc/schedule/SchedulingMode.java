package hlsc.schedule;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * How a scheduling region is turned into control logic.
 */
public enum SchedulingMode {
  /** One state per cycle, linked by transitions. */
  STATE_MACHINE("sequential"),
  /** Loop with a runtime trip count, pipelined with a drain/exit protocol. */
  PIPELINED_LOOP("pipeline"),
  /** Continuously running worker body, pipelined without exit. */
  PIPELINED_WORKER("worker_pipeline");

  public final String serialName;

  private SchedulingMode(String serialName) { this.serialName = serialName; }

  public boolean isPipelined() { return this != STATE_MACHINE; }

  public static Optional<SchedulingMode> fromSerialName(String serialName) {
    return Stream.of(SchedulingMode.values()).filter(mode -> mode.serialName.equals(serialName)).findAny();
  }
}

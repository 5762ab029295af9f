package hlsc.stg;

import hlsc.ahdl.AHDLStm;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Operations keyed by the cycle they execute in. Draining yields the cycles in increasing order; operations of
 * one cycle keep their insertion order.
 */
public class ScheduledItemQueue {
  private final TreeMap<Integer, List<AHDLStm>> queue = new TreeMap<>();

  /** @param schedTime cycle, or -1 to append after every other cycle */
  public void push(int schedTime, AHDLStm item) {
    int key = (schedTime == -1) ? Integer.MAX_VALUE : schedTime;
    queue.computeIfAbsent(key, k -> new ArrayList<>()).add(item);
  }

  public boolean isEmpty() { return queue.isEmpty(); }

  /** Removes and returns all entries, ordered by cycle. */
  public List<Map.Entry<Integer, List<AHDLStm>>> drain() {
    var result = new ArrayList<Map.Entry<Integer, List<AHDLStm>>>();
    queue.forEach((step, items) -> result.add(Map.entry(step, items)));
    queue.clear();
    return result;
  }
}

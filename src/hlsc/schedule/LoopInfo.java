package hlsc.schedule;

import hlsc.ir.Block;
import hlsc.ir.IRExp;
import hlsc.ir.Symbol;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structure of a counted loop that is pipelined as a whole.
 */
public class LoopInfo {
  private final Block head;
  private final List<Block> bodies;
  private final Symbol cond;
  private final Symbol counter;
  private final IRExp init;
  private final Block exit;

  /**
   * @param cond symbol holding the loop continuation condition
   * @param counter induction variable
   * @param init value of the counter on loop entry
   * @param exit block control continues in after the loop
   */
  public LoopInfo(Block head, List<Block> bodies, Symbol cond, Symbol counter, IRExp init, Block exit) {
    this.head = head;
    this.bodies = new ArrayList<>(bodies);
    this.cond = cond;
    this.counter = counter;
    this.init = init;
    this.exit = exit;
  }

  public Block getHead() { return head; }
  public List<Block> getBodies() { return Collections.unmodifiableList(bodies); }
  public Symbol getCond() { return cond; }
  public Symbol getCounter() { return counter; }
  public IRExp getInit() { return init; }
  public Block getExit() { return exit; }
}

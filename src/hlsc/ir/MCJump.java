package hlsc.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Multi-way conditional jump. The first true condition selects the target; the last condition is usually the
 * constant 1.
 */
public class MCJump extends IRStm {
  private final List<IRExp> conds;
  private final List<Block> targets;

  public MCJump(List<IRExp> conds, List<Block> targets) {
    if (conds.size() != targets.size())
      throw new IllegalArgumentException("conds and targets must have the same size");
    this.conds = new ArrayList<>(conds);
    this.targets = new ArrayList<>(targets);
  }

  public List<IRExp> getConds() { return conds; }
  public List<Block> getTargets() { return targets; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitMCJump(this);
  }
  @Override
  public IRStm copy() {
    return withLine(new MCJump(conds.stream().map(IRExp::copy).collect(Collectors.toList()), targets));
  }
  @Override
  public String toString() {
    var sb = new StringBuilder("mcjump");
    for (int i = 0; i < conds.size(); ++i)
      sb.append(String.format(" %s ? %s", conds.get(i), targets.get(i).getName()));
    return sb.toString();
  }
}

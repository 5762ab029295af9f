package hlsc.ahdl;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditional execution: the first branch whose condition holds runs. A trailing constant-1 condition acts as
 * the else branch.
 */
public class AHDLIf extends AHDLStm {
  private final List<AHDLExp> conds;
  private final List<List<AHDLStm>> codesList;

  public AHDLIf(List<AHDLExp> conds, List<List<AHDLStm>> codesList) {
    if (conds.size() != codesList.size())
      throw new IllegalArgumentException("conds and codesList must have the same size");
    this.conds = new ArrayList<>(conds);
    this.codesList = new ArrayList<>();
    codesList.forEach(codes -> this.codesList.add(new ArrayList<>(codes)));
  }

  public List<AHDLExp> getConds() { return conds; }
  /** Mutable branch bodies. */
  public List<List<AHDLStm>> getCodesList() { return codesList; }

  @Override
  public <R> R accept(AHDLVisitor<R> visitor) {
    return visitor.visitIf(this);
  }

  protected String keyword() { return "if"; }

  @Override
  public String toString() {
    var sb = new StringBuilder();
    for (int i = 0; i < conds.size(); ++i) {
      sb.append(i == 0 ? keyword() : " else if").append(" (").append(conds.get(i)).append(") {");
      for (AHDLStm code : codesList.get(i))
        sb.append(" ").append(code).append(";");
      sb.append(" }");
    }
    return sb.toString();
  }
}

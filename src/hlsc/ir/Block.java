package hlsc.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Basic block of a scope's control-flow graph.
 * {@link #getPreds()}/{@link #getSuccs()} hold all edges; loop-back edges are additionally listed in
 * {@link #getPredsLoop()}/{@link #getSuccsLoop()}.
 */
public class Block {
  private final Scope scope;
  private final int num;
  private String nametag;
  private final List<IRStm> stms = new ArrayList<>();
  private final List<Block> preds = new ArrayList<>();
  private final List<Block> succs = new ArrayList<>();
  private final List<Block> predsLoop = new ArrayList<>();
  private final List<Block> succsLoop = new ArrayList<>();

  Block(Scope scope, int num, String nametag) {
    this.scope = scope;
    this.num = num;
    this.nametag = nametag;
  }

  public Scope getScope() { return scope; }
  /** Index of this block in the owning scope's block arena. */
  public int getNum() { return num; }
  public String getNametag() { return nametag; }
  public void setNametag(String nametag) { this.nametag = nametag; }
  public String getName() { return nametag + num; }

  public List<IRStm> getStms() { return Collections.unmodifiableList(stms); }
  public Optional<IRStm> getLastStm() { return stms.isEmpty() ? Optional.empty() : Optional.of(stms.get(stms.size() - 1)); }

  public void appendStm(IRStm stm) {
    stm.setBlock(this);
    stms.add(stm);
  }
  public void insertStm(int idx, IRStm stm) {
    stm.setBlock(this);
    stms.add(idx, stm);
  }
  public boolean removeStm(IRStm stm) {
    boolean removed = stms.remove(stm);
    if (removed && stm.getBlock() == this)
      stm.setBlock(null);
    return removed;
  }
  public boolean containsStm(IRStm stm) { return stms.contains(stm); }

  public List<Phi> collectPhis() {
    return stms.stream().filter(stm -> stm instanceof Phi).map(stm -> (Phi)stm).collect(Collectors.toList());
  }

  public List<Block> getPreds() { return Collections.unmodifiableList(preds); }
  public List<Block> getSuccs() { return Collections.unmodifiableList(succs); }
  public List<Block> getPredsLoop() { return Collections.unmodifiableList(predsLoop); }
  public List<Block> getSuccsLoop() { return Collections.unmodifiableList(succsLoop); }

  /** Predecessors over forward (non loop-back) edges. */
  public List<Block> getNormalPreds() {
    return preds.stream().filter(pred -> !predsLoop.contains(pred)).collect(Collectors.toList());
  }
  /** Successors over forward (non loop-back) edges. */
  public List<Block> getNormalSuccs() {
    return succs.stream().filter(succ -> !succsLoop.contains(succ)).collect(Collectors.toList());
  }

  public void connect(Block next) {
    succs.add(next);
    next.preds.add(this);
  }
  public void connectLoop(Block next) {
    connect(next);
    succsLoop.add(next);
    next.predsLoop.add(this);
  }
  public void disconnect(Block next) {
    succs.remove(next);
    succsLoop.remove(next);
    next.preds.remove(this);
    next.predsLoop.remove(this);
  }

  public void replaceSucc(Block oldSucc, Block newSucc) {
    Collections.replaceAll(succs, oldSucc, newSucc);
    Collections.replaceAll(succsLoop, oldSucc, newSucc);
  }
  public void replacePred(Block oldPred, Block newPred) {
    Collections.replaceAll(preds, oldPred, newPred);
    Collections.replaceAll(predsLoop, oldPred, newPred);
  }

  /** Copies the edges of {@code orig} into this block, mapping every neighbour through {@code blockMap}. */
  void copyEdges(Block orig, Map<Block, Block> blockMap) {
    orig.preds.forEach(b -> preds.add(blockMap.getOrDefault(b, b)));
    orig.succs.forEach(b -> succs.add(blockMap.getOrDefault(b, b)));
    orig.predsLoop.forEach(b -> predsLoop.add(blockMap.getOrDefault(b, b)));
    orig.succsLoop.forEach(b -> succsLoop.add(blockMap.getOrDefault(b, b)));
  }

  @Override
  public String toString() {
    var sb = new StringBuilder();
    sb.append(String.format("Block %s: preds {%s} succs {%s}\n", getName(),
                            preds.stream().map(Block::getName).collect(Collectors.joining(", ")),
                            succs.stream().map(Block::getName).collect(Collectors.joining(", "))));
    for (IRStm stm : stms)
      sb.append("  ").append(stm).append("\n");
    return sb.toString();
  }
}

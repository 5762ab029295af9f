package hlsc.stg;

import hlsc.ahdl.AHDLMove;
import hlsc.ahdl.AHDLStm;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One cycle slice of a pipelined region.
 */
public class PipelineStage {
  public enum StageTag {
    /** The stage blocks on an external interface (or the loop condition for stage 0 of a finite loop). */
    HasEnable("HasEnable"),
    /** The stage latches its value while downstream is stalled. */
    HasHold("HasHold"),
    /** The stage writes to an external interface. */
    Source("Source");

    public final String serialName;

    private StageTag(String serialName) { this.serialName = serialName; }
    public static Optional<StageTag> fromSerialName(String serialName) {
      return Stream.of(StageTag.values()).filter(tagVal -> tagVal.serialName.equals(serialName)).findAny();
    }
  }

  private final String name;
  private final int step;
  private final List<AHDLStm> codes;
  private final PipelineState parentState;
  private final EnumSet<StageTag> tags = EnumSet.noneOf(StageTag.class);
  private AHDLMove enable = null;

  PipelineStage(String name, int step, List<AHDLStm> codes, PipelineState parentState) {
    this.name = name;
    this.step = step;
    this.codes = new ArrayList<>(codes);
    this.parentState = parentState;
  }

  public String getName() { return name; }
  public int getStep() { return step; }
  /** Mutable list of operations. */
  public List<AHDLStm> getCodes() { return codes; }
  public PipelineState getParentState() { return parentState; }

  public boolean hasTag(StageTag tag) { return tags.contains(tag); }
  public void addTag(StageTag tag) { tags.add(tag); }
  public EnumSet<StageTag> getTags() { return tags.clone(); }
  public boolean hasEnable() { return tags.contains(StageTag.HasEnable); }
  public boolean hasHold() { return tags.contains(StageTag.HasHold); }
  public boolean isSource() { return tags.contains(StageTag.Source); }

  /** Assignment driving this stage's enable signal, if the builder supplies one. */
  public Optional<AHDLMove> getEnable() { return Optional.ofNullable(enable); }
  public void setEnable(AHDLMove enable) { this.enable = enable; }

  @Override
  public String toString() {
    var sb = new StringBuilder(String.format("  stage %s:%d %s\n", name, step, tags));
    if (enable != null)
      sb.append("    ").append(enable).append("\n");
    for (AHDLStm code : codes)
      sb.append("    ").append(code).append("\n");
    return sb.toString();
  }
}

package hlsc.ahdl;

import hlsc.ir.Symbol;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A hardware wire or register. Signals are owned by a scope (see {@link hlsc.ir.Scope#genSig}) and referenced by
 * every operation reading or writing them.
 */
public class Signal {
  public enum SignalTag {
    Reg("reg"),
    Net("net"),
    Input("input"),
    Output("output"),
    Int("int"),
    Condition("condition"),
    Induction("induction"),
    PipelineCtrl("pipeline_ctrl"),
    Field("field"),
    Memif("memif"),
    SinglePort("single_port"),
    SeqPort("seq_port"),
    Extport("extport"),
    Initializable("initializable"),
    RegArray("regarray"),
    NetArray("netarray"),
    Rom("rom"),
    ValidProtocol("valid_protocol"),
    ReadyValidProtocol("ready_valid_protocol");

    public final String serialName;

    private SignalTag(String serialName) { this.serialName = serialName; }
    public static Optional<SignalTag> fromSerialName(String serialName) {
      return Stream.of(SignalTag.values()).filter(tag -> tag.serialName.equals(serialName)).findAny();
    }
  }

  private String name;
  private int width;
  private final EnumSet<SignalTag> tags = EnumSet.noneOf(SignalTag.class);
  private Symbol sym;
  private Long initValue = null;
  private int maxsize = 0;

  public Signal(String name, int width, Set<SignalTag> tags, Optional<Symbol> sym) {
    this.name = name;
    this.width = width;
    this.tags.addAll(tags);
    this.sym = sym.orElse(null);
  }

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }
  public int getWidth() { return width; }
  public void setWidth(int width) { this.width = width; }

  public Optional<Symbol> getSym() { return Optional.ofNullable(sym); }
  public void setSym(Symbol sym) { this.sym = sym; }

  public Optional<Long> getInitValue() { return Optional.ofNullable(initValue); }
  public void setInitValue(long initValue) { this.initValue = initValue; }
  public int getMaxsize() { return maxsize; }
  public void setMaxsize(int maxsize) { this.maxsize = maxsize; }

  public Set<SignalTag> getTags() { return Collections.unmodifiableSet(tags); }
  public EnumSet<SignalTag> copyTags() { return tags.clone(); }
  public boolean hasTag(SignalTag tag) { return tags.contains(tag); }
  public void addTag(SignalTag tag) { tags.add(tag); }
  public void addTags(Set<SignalTag> newTags) { tags.addAll(newTags); }
  public void removeTag(SignalTag tag) { tags.remove(tag); }

  public boolean isReg() { return tags.contains(SignalTag.Reg); }
  public boolean isNet() { return tags.contains(SignalTag.Net); }
  public boolean isInput() { return tags.contains(SignalTag.Input); }
  public boolean isOutput() { return tags.contains(SignalTag.Output); }
  public boolean isCondition() { return tags.contains(SignalTag.Condition); }
  public boolean isInduction() { return tags.contains(SignalTag.Induction); }
  public boolean isPipelineCtrl() { return tags.contains(SignalTag.PipelineCtrl); }
  public boolean isRegArray() { return tags.contains(SignalTag.RegArray); }

  @Override
  public String toString() {
    return String.format("%s<%d>{%s}", name, width, tags.stream().map(t -> t.serialName).collect(Collectors.joining(",")));
  }
}

package hlsc.stg;

import hlsc.ahdl.AHDLExp;
import hlsc.ahdl.AHDLIfExp;
import hlsc.ahdl.AHDLOp;
import hlsc.ahdl.AHDLStm;
import hlsc.ahdl.AHDLVar;
import hlsc.ahdl.Signal;
import hlsc.ahdl.Signal.SignalTag;
import hlsc.ir.Op;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A state standing for a whole pipelined region. Owns the stages and the per-stage control signals, which are
 * created on first request and memoized by stage index.
 */
public class PipelineState extends State {
  public enum ControlKind {
    VALID("valid", true),
    READY("ready", false),
    HOLD("hold", true),
    ENABLE("enable", false),
    LAST("last", true),
    EXIT("exit", true);

    public final String serialName;
    /** Registered signals keep their value across cycles; the others are combinational. */
    public final boolean registered;

    private ControlKind(String serialName, boolean registered) {
      this.serialName = serialName;
      this.registered = registered;
    }
  }

  private record SignalKey(ControlKind kind, int idx) {}

  private final List<PipelineStage> stages = new ArrayList<>();
  private final Map<SignalKey, Signal> signals = new HashMap<>();

  public PipelineState(String name, STG stg) { super(name, 0, List.of(), stg); }

  public List<PipelineStage> getStages() { return Collections.unmodifiableList(stages); }

  /** Appends the stage for {@code step}, which must be the next free index. */
  public PipelineStage newStage(int step, List<AHDLStm> codes) {
    assert (stages.size() == step);
    var stage = new PipelineStage(String.format("%s_%d", getName(), step), step, codes, this);
    stages.add(stage);
    return stage;
  }

  public Signal controlSignal(ControlKind kind, int idx) {
    return signals.computeIfAbsent(new SignalKey(kind, idx), key -> {
      EnumSet<SignalTag> tags = EnumSet.of(kind.registered ? SignalTag.Reg : SignalTag.Net, SignalTag.PipelineCtrl);
      return getStg().getScope().genSig(String.format("%s_%d_%s", getName(), idx, kind.serialName), 1, tags);
    });
  }

  public Signal validSignal(int idx) { return controlSignal(ControlKind.VALID, idx); }
  public Signal readySignal(int idx) { return controlSignal(ControlKind.READY, idx); }
  public Signal holdSignal(int idx) { return controlSignal(ControlKind.HOLD, idx); }
  public Signal enableSignal(int idx) { return controlSignal(ControlKind.ENABLE, idx); }
  public Signal lastSignal(int idx) { return controlSignal(ControlKind.LAST, idx); }
  public Signal exitSignal(int idx) { return controlSignal(ControlKind.EXIT, idx); }

  /**
   * Whether stage {@code idx} executes in the current cycle: stage 0 whenever it is ready, a held stage as soon as it
   * is ready again, any other stage when it is ready and its predecessor produced a value.
   */
  public AHDLExp validExp(int idx) {
    AHDLVar ready = AHDLVar.load(readySignal(idx));
    if (idx == 0)
      return ready;
    return new AHDLIfExp(AHDLVar.load(holdSignal(idx)), ready,
                         new AHDLOp(Op.BitAnd, ready.copy(), AHDLVar.load(validSignal(idx - 1))));
  }

  @Override
  protected List<AHDLStm> terminalCodes() {
    if (stages.isEmpty())
      return getCodes();
    return stages.get(stages.size() - 1).getCodes();
  }

  @Override
  public String toString() {
    var sb = new StringBuilder("---------------------------------\n");
    sb.append(getName()).append(" (pipeline)\n");
    for (PipelineStage stage : stages)
      sb.append(stage);
    return sb.toString();
  }
}

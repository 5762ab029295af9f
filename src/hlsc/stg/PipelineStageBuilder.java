package hlsc.stg;

import hlsc.ahdl.AHDLConst;
import hlsc.ahdl.AHDLExp;
import hlsc.ahdl.AHDLIORead;
import hlsc.ahdl.AHDLIOWrite;
import hlsc.ahdl.AHDLIf;
import hlsc.ahdl.AHDLIfExp;
import hlsc.ahdl.AHDLMove;
import hlsc.ahdl.AHDLOp;
import hlsc.ahdl.AHDLPipelineGuard;
import hlsc.ahdl.AHDLProcCall;
import hlsc.ahdl.AHDLSeq;
import hlsc.ahdl.AHDLStm;
import hlsc.ahdl.AHDLStore;
import hlsc.ahdl.AHDLSubscript;
import hlsc.ahdl.AHDLTransition;
import hlsc.ahdl.AHDLTransitionIf;
import hlsc.ahdl.AHDLUseDefDetector;
import hlsc.ahdl.AHDLUseDefTable;
import hlsc.ahdl.AHDLVar;
import hlsc.ahdl.AHDLVarReplacer;
import hlsc.ahdl.Signal;
import hlsc.ahdl.Signal.SignalTag;
import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Block;
import hlsc.ir.CJump;
import hlsc.ir.Const;
import hlsc.ir.IRStm;
import hlsc.ir.MCJump;
import hlsc.ir.Op;
import hlsc.ir.Scope;
import hlsc.schedule.ScheduledNode;
import hlsc.stg.PipelineStage.StageTag;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns the scheduled nodes of a pipelined region into the stages of one {@link PipelineState} and synthesizes the
 * ready/valid/hold control chain between them. Subclasses decide which nodes belong to the pipeline and how it
 * terminates.
 */
public abstract class PipelineStageBuilder extends STGItemBuilder {

  protected PipelineStageBuilder(Scope scope, STG stg, Map<Block, List<State>> blk2states, int memLoadLatency,
                                 int memStoreLatency) {
    super(scope, stg, blk2states, memLoadLatency, memStoreLatency);
  }

  /**
   * Drops branch nodes from a pipeline body. Constant branches and the branches in {@code droppable} are left out,
   * any other conditional branch cannot be pipelined.
   */
  protected List<ScheduledNode> withoutBranches(List<ScheduledNode> nodes, List<IRStm> droppable) {
    var result = new ArrayList<ScheduledNode>();
    for (ScheduledNode node : nodes) {
      IRStm stm = node.getStm();
      if (stm instanceof CJump || stm instanceof MCJump) {
        if (droppable.contains(stm))
          continue;
        if (stm instanceof CJump && ((CJump)stm).getCond() instanceof Const && ((Const)((CJump)stm).getCond()).getValue() == 1)
          continue;
        throw CompileException.at(Errors.UNSUPPORTED_IN_PIPELINE, scope.getName(), stm.getLineno(), stm);
      }
      result.add(node);
    }
    return result;
  }

  /** Builds the stages of {@code pstate} from the queued items, then the control chain and the register slices. */
  protected void buildPipelineStages(PipelineState pstate) {
    int step = 0;
    for (var entry : scheduledItems.drain()) {
      // cycles without operations still get a stage
      while (step < entry.getKey()) {
        makeStage(pstate.newStage(step, List.of()));
        ++step;
      }
      makeStage(pstate.newStage(step, entry.getValue()));
      ++step;
    }
    if (pstate.getStages().isEmpty())
      makeStage(pstate.newStage(0, List.of()));

    for (PipelineStage stage : pstate.getStages())
      addControlChain(pstate, stage);
    insertRegisterSlices(pstate);
  }

  /** Hook for tags a builder puts on a stage before its guard is built. */
  protected void tagStage(PipelineStage stage) {}

  private void makeStage(PipelineStage stage) {
    PipelineState pstate = stage.getParentState();
    var guarded = new ArrayList<AHDLStm>();
    for (AHDLStm code : new ArrayList<>(stage.getCodes())) {
      if (code instanceof AHDLSeq && ((AHDLSeq)code).getStep() == 0) {
        AHDLStm factor = ((AHDLSeq)code).getFactor();
        if (factor instanceof AHDLIORead) {
          stage.addTag(StageTag.HasEnable);
          setIOEnable(pstate, stage, ((AHDLIORead)factor).getIo().getSig(), SignalTag.ValidProtocol, "valid");
        } else if (factor instanceof AHDLIOWrite) {
          stage.addTag(StageTag.HasEnable);
          stage.addTag(StageTag.Source);
          setIOEnable(pstate, stage, ((AHDLIOWrite)factor).getIo().getSig(), SignalTag.ReadyValidProtocol, "ready");
        }
      }
      if (needsGuard(code)) {
        guarded.add(code);
        stage.getCodes().remove(code);
      }
    }
    if (stage.getStep() > 0)
      stage.addTag(StageTag.HasHold);
    tagStage(stage);
    stage.getCodes().add(0, new AHDLPipelineGuard(guardCondition(pstate, stage), guarded));
  }

  /**
   * A stage doing port I/O runs only while the port handshake allows it: reads wait for {@code <port>_valid} on
   * ports with a valid protocol, writes for {@code <port>_ready} on ports with a ready/valid protocol.
   */
  private void setIOEnable(PipelineState pstate, PipelineStage stage, Signal port, SignalTag handshake, String postfix) {
    AHDLExp src = new AHDLConst(1);
    if (port.hasTag(handshake) || (postfix.equals("valid") && port.hasTag(SignalTag.ReadyValidProtocol)))
      src = AHDLVar.load(scope.genSig(String.format("%s_%s", port.getName(), postfix), 1, EnumSet.of(SignalTag.Net)));
    stage.setEnable(new AHDLMove(AHDLVar.store(pstate.enableSignal(stage.getStep())), src));
  }

  /** Operations with a side effect that must not be repeated while the stage stalls. */
  static boolean needsGuard(AHDLStm code) {
    if (code instanceof AHDLProcCall)
      return true;
    if (code instanceof AHDLIf && !(code instanceof AHDLTransitionIf) && !(code instanceof AHDLPipelineGuard))
      return true;
    if (code instanceof AHDLSeq && ((AHDLSeq)code).getFactor() instanceof AHDLStore)
      return true;
    if (code instanceof AHDLMove) {
      AHDLExp dst = ((AHDLMove)code).getDst();
      return (dst instanceof AHDLVar && ((AHDLVar)dst).getSig().isReg()) || dst instanceof AHDLSubscript;
    }
    return false;
  }

  /** A stage executes whenever it passes a value on, see {@link PipelineState#validExp}. */
  static AHDLExp guardCondition(PipelineState pstate, PipelineStage stage) { return pstate.validExp(stage.getStep()); }

  /**
   * Appends the ready, hold and valid assignments of {@code stage}. Readiness runs back to front, validity front to
   * back; a held stage keeps its value until it is ready again.
   */
  protected void addControlChain(PipelineState pstate, PipelineStage stage) {
    int step = stage.getStep();
    boolean isLast = step == pstate.getStages().size() - 1;
    Signal ready = pstate.readySignal(step);

    AHDLExp readyRhs;
    Optional<AHDLExp> enable = stage.hasEnable() ? Optional.of(AHDLVar.load(pstate.enableSignal(step))) : Optional.empty();
    if (stage.isSource()) {
      if (isLast)
        readyRhs = enable.get();
      else
        readyRhs = new AHDLOp(Op.BitAnd, new AHDLOp(Op.Invert, AHDLVar.load(pstate.holdSignal(step + 1))), enable.get());
    } else {
      AHDLExp readyNext = isLast ? new AHDLConst(1) : AHDLVar.load(pstate.readySignal(step + 1));
      readyRhs = enable.isPresent() ? new AHDLOp(Op.BitAnd, readyNext, enable.get()) : readyNext;
    }
    stage.getCodes().add(new AHDLMove(AHDLVar.store(ready), readyRhs));

    if (step == 0) {
      stage.getCodes().add(new AHDLMove(AHDLVar.store(pstate.validSignal(0)), pstate.validExp(0)));
      return;
    }
    Signal hold = pstate.holdSignal(step);
    AHDLExp validPrev = AHDLVar.load(pstate.validSignal(step - 1));
    if (stage.hasHold()) {
      AHDLExp notReady = new AHDLOp(Op.Invert, AHDLVar.load(ready));
      var holdRhs = new AHDLIfExp(AHDLVar.load(hold), notReady, new AHDLOp(Op.BitAnd, notReady.copy(), validPrev));
      stage.getCodes().add(new AHDLMove(AHDLVar.store(hold), holdRhs));
    }
    stage.getCodes().add(new AHDLMove(AHDLVar.store(pstate.validSignal(step)), pstate.validExp(step)));
  }

  /** Stage index of every operation, including the ones nested in conditionals and guards. */
  static Map<AHDLStm, Integer> makeStm2StageNum(PipelineState pstate) {
    var stm2stage = new HashMap<AHDLStm, Integer>();
    for (PipelineStage stage : pstate.getStages())
      mapStms(stage.getCodes(), stage.getStep(), stm2stage);
    return stm2stage;
  }

  private static void mapStms(List<AHDLStm> codes, int step, Map<AHDLStm, Integer> stm2stage) {
    for (AHDLStm code : codes) {
      stm2stage.put(code, step);
      if (code instanceof AHDLIf)
        ((AHDLIf)code).getCodesList().forEach(branch -> mapStms(branch, step, stm2stage));
    }
  }

  /**
   * Keeps values alive across stages: a value read more than one stage after its definition (any later stage for
   * nets and induction variables) is relayed by one slice register per intermediate stage.
   */
  private void insertRegisterSlices(PipelineState pstate) {
    Map<AHDLStm, Integer> stm2stage = makeStm2StageNum(pstate);
    List<List<AHDLStm>> codeLists = pstate.getStages().stream().map(PipelineStage::getCodes).collect(Collectors.toList());
    AHDLUseDefTable usedef = AHDLUseDefDetector.process(codeLists);

    for (Signal sig : new ArrayList<>(usedef.getDefinedSignals())) {
      if (sig.isPipelineCtrl())
        continue;
      var defs = usedef.getDefStms(sig);
      int defStage = defs.stream().mapToInt(stm2stage::get).min().orElse(0);
      int maxDistance = 0;
      for (AHDLStm use : usedef.getUseStms(sig)) {
        int distance = stm2stage.get(use) - defStage;
        if (distance < 0)
          logger.trace("{} is read before its definition in stage {}, using the previous iteration", sig, defStage);
        maxDistance = Math.max(maxDistance, distance);
      }
      boolean isNormalReg = sig.isReg() && !sig.isInduction();
      boolean needsSlices = isNormalReg ? maxDistance > 1 : ((sig.isNet() || sig.isInduction()) && maxDistance > 0);
      if (!needsSlices)
        continue;
      if (defs.size() > 1)
        throw CompileException.of(Errors.MULTIPLE_DEFINITIONS, scope.getName(), sig.getName());
      insertRegisterSlices(sig, pstate, defStage, defStage + maxDistance, isNormalReg, usedef, stm2stage);
    }
  }

  private void insertRegisterSlices(Signal sig, PipelineState pstate, int defStage, int endStage, boolean isNormalReg,
                                    AHDLUseDefTable usedef, Map<AHDLStm, Integer> stm2stage) {
    // a register written in stage d is directly readable in stage d+1
    int startStage = isNormalReg ? defStage + 1 : defStage;
    var slices = new HashMap<Integer, Signal>();
    for (int num = startStage + 1; num <= endStage; ++num) {
      EnumSet<SignalTag> tags = sig.copyTags();
      if (tags.remove(SignalTag.Net))
        tags.add(SignalTag.Reg);
      slices.put(num, scope.genSig(String.format("%s_%d", sig.getName(), num), sig.getWidth(), tags));
    }
    logger.debug("inserting {} register slices for {} between stages {} and {}", slices.size(), sig, defStage, endStage);

    for (AHDLStm use : new ArrayList<>(usedef.getUseStms(sig))) {
      Signal slice = slices.get(stm2stage.get(use));
      if (slice != null)
        AHDLVarReplacer.replaceUses(usedef, use, sig, slice);
    }
    for (int num = startStage; num < endStage; ++num) {
      Signal prev = (num == startStage) ? sig : slices.get(num);
      var sliceMove = new AHDLMove(AHDLVar.store(slices.get(num + 1)), AHDLVar.load(prev));
      var guard = (AHDLPipelineGuard)pstate.getStages().get(num).getCodes().get(0);
      guard.getCodes().add(sliceMove);
    }
  }

  /** Appends {@code terminal} as the last operation of the last stage. */
  protected static void setTerminal(PipelineState pstate, AHDLStm terminal) {
    assert (terminal instanceof AHDLTransition || terminal instanceof AHDLTransitionIf);
    var stages = pstate.getStages();
    stages.get(stages.size() - 1).getCodes().add(terminal);
  }
}

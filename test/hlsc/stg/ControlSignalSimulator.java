package hlsc.stg;

import hlsc.ahdl.AHDLConst;
import hlsc.ahdl.AHDLExp;
import hlsc.ahdl.AHDLIf;
import hlsc.ahdl.AHDLIfExp;
import hlsc.ahdl.AHDLMove;
import hlsc.ahdl.AHDLOp;
import hlsc.ahdl.AHDLPipelineGuard;
import hlsc.ahdl.AHDLStm;
import hlsc.ahdl.AHDLTransition;
import hlsc.ahdl.AHDLVar;
import hlsc.ahdl.Signal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cycle-by-cycle evaluation of the control signals of one pipeline state. Nets (enable, ready) are evaluated first,
 * back to front, then all registered control signals are updated at once. Data operations are not simulated; any
 * signal that is not a control signal reads as an input set with {@link #set}.
 */
class ControlSignalSimulator {
  private final PipelineState pstate;
  private final Map<Signal, Long> values = new HashMap<>();
  private final int[] executions;
  private boolean transitioned = false;

  ControlSignalSimulator(PipelineState pstate) {
    this.pstate = pstate;
    this.executions = new int[pstate.getStages().size()];
  }

  void set(Signal sig, long value) { values.put(sig, value); }
  long get(Signal sig) { return values.getOrDefault(sig, 0L); }

  long valid(int idx) { return get(pstate.validSignal(idx)); }
  long hold(int idx) { return get(pstate.holdSignal(idx)); }
  long ready(int idx) { return get(pstate.readySignal(idx)); }

  /** Number of cycles in which the guard of stage {@code idx} was open. */
  int executions(int idx) { return executions[idx]; }
  /** True once the terminal transition out of the pipeline fired. */
  boolean hasTransitioned() { return transitioned; }

  void step() {
    List<PipelineStage> stages = pstate.getStages();
    for (PipelineStage stage : stages)
      stage.getEnable().ifPresent(enable -> values.put(((AHDLVar)enable.getDst()).getSig(), eval(enable.getSrc())));
    for (int i = stages.size() - 1; i >= 0; --i) {
      Signal ready = pstate.readySignal(i);
      for (AHDLStm code : stages.get(i).getCodes()) {
        if (code instanceof AHDLMove && ((AHDLVar)((AHDLMove)code).getDst()).getSig() == ready)
          values.put(ready, eval(((AHDLMove)code).getSrc()));
      }
    }

    var next = new HashMap<Signal, Long>();
    for (PipelineStage stage : stages) {
      for (AHDLStm code : stage.getCodes()) {
        if (code instanceof AHDLPipelineGuard) {
          if (eval(((AHDLPipelineGuard)code).getCond()) != 0)
            ++executions[stage.getStep()];
        } else if (code instanceof AHDLIf) {
          AHDLIf ahdlIf = (AHDLIf)code;
          for (int b = 0; b < ahdlIf.getConds().size(); ++b) {
            if (eval(ahdlIf.getConds().get(b)) != 0) {
              ahdlIf.getCodesList().get(b).forEach(branchCode -> update(branchCode, next));
              break;
            }
          }
        } else {
          update(code, next);
        }
      }
    }
    values.putAll(next);
  }

  private void update(AHDLStm code, Map<Signal, Long> next) {
    if (code instanceof AHDLTransition) {
      transitioned = true;
      return;
    }
    if (!(code instanceof AHDLMove) || !(((AHDLMove)code).getDst() instanceof AHDLVar))
      return;
    Signal dst = ((AHDLVar)((AHDLMove)code).getDst()).getSig();
    if (dst.isPipelineCtrl() && dst.isReg())
      next.put(dst, eval(((AHDLMove)code).getSrc()));
  }

  long eval(AHDLExp exp) {
    if (exp instanceof AHDLConst)
      return ((AHDLConst)exp).getValue();
    if (exp instanceof AHDLVar)
      return get(((AHDLVar)exp).getSig());
    if (exp instanceof AHDLIfExp) {
      AHDLIfExp ifExp = (AHDLIfExp)exp;
      return eval(ifExp.getCond()) != 0 ? eval(ifExp.getLexp()) : eval(ifExp.getRexp());
    }
    AHDLOp op = (AHDLOp)exp;
    long a = eval(op.getArgs().get(0));
    if (op.isUnary()) {
      switch (op.getOp()) {
      case Invert:
        return (~a) & 1;
      case Not:
        return a == 0 ? 1 : 0;
      case USub:
        return -a;
      default:
        return a;
      }
    }
    long b = eval(op.getArgs().get(1));
    switch (op.getOp()) {
    case BitAnd:
      return a & b;
    case BitOr:
      return a | b;
    case And:
      return (a != 0 && b != 0) ? 1 : 0;
    case Or:
      return (a != 0 || b != 0) ? 1 : 0;
    case Add:
      return a + b;
    case Sub:
      return a - b;
    case Eq:
      return a == b ? 1 : 0;
    case NotEq:
      return a != b ? 1 : 0;
    case Lt:
      return a < b ? 1 : 0;
    case LtE:
      return a <= b ? 1 : 0;
    case Gt:
      return a > b ? 1 : 0;
    case GtE:
      return a >= b ? 1 : 0;
    default:
      throw new IllegalArgumentException("cannot simulate " + op);
    }
  }
}

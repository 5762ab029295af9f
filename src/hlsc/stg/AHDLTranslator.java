package hlsc.stg;

import hlsc.ahdl.AHDL;
import hlsc.ahdl.AHDLConst;
import hlsc.ahdl.AHDLExp;
import hlsc.ahdl.AHDLFunCall;
import hlsc.ahdl.AHDLIORead;
import hlsc.ahdl.AHDLIOWrite;
import hlsc.ahdl.AHDLIf;
import hlsc.ahdl.AHDLIfExp;
import hlsc.ahdl.AHDLLoad;
import hlsc.ahdl.AHDLMemVar;
import hlsc.ahdl.AHDLMetaWait;
import hlsc.ahdl.AHDLMetaWait.WaitKind;
import hlsc.ahdl.AHDLModuleCall;
import hlsc.ahdl.AHDLMove;
import hlsc.ahdl.AHDLNop;
import hlsc.ahdl.AHDLOp;
import hlsc.ahdl.AHDLProcCall;
import hlsc.ahdl.AHDLSeq;
import hlsc.ahdl.AHDLStm;
import hlsc.ahdl.AHDLStore;
import hlsc.ahdl.AHDLSubscript;
import hlsc.ahdl.AHDLSymbol;
import hlsc.ahdl.AHDLTransition;
import hlsc.ahdl.AHDLTransitionIf;
import hlsc.ahdl.AHDLVar;
import hlsc.ahdl.Signal;
import hlsc.ahdl.Signal.SignalTag;
import hlsc.errors.CompileException;
import hlsc.errors.Errors;
import hlsc.ir.Array;
import hlsc.ir.BinOp;
import hlsc.ir.Block;
import hlsc.ir.CExpr;
import hlsc.ir.CJump;
import hlsc.ir.CMove;
import hlsc.ir.Call;
import hlsc.ir.CondOp;
import hlsc.ir.Const;
import hlsc.ir.Expr;
import hlsc.ir.IRExp;
import hlsc.ir.IRStm;
import hlsc.ir.IRVisitor;
import hlsc.ir.Jump;
import hlsc.ir.MCJump;
import hlsc.ir.MRef;
import hlsc.ir.MStore;
import hlsc.ir.Move;
import hlsc.ir.Phi;
import hlsc.ir.PortRead;
import hlsc.ir.PortWrite;
import hlsc.ir.Ret;
import hlsc.ir.Scope;
import hlsc.ir.Symbol;
import hlsc.ir.SysCall;
import hlsc.ir.Temp;
import hlsc.ir.Temp.Ctx;
import hlsc.ir.Type;
import hlsc.ir.Type.MemKind;
import hlsc.ir.Type.PortDirection;
import hlsc.ir.UnOp;
import hlsc.schedule.ScheduledNode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Translates scheduled IR statements into AHDL operations. Statements emit their operations at the cycle of the
 * node being translated (multi-cycle operations at consecutive cycles); expressions are returned.
 */
public class AHDLTranslator implements IRVisitor<AHDL> {
  protected static final Logger logger = LogManager.getLogger();

  private final Scope scope;
  private final STGItemBuilder host;
  private final int memLoadLatency;
  private final int memStoreLatency;

  private ScheduledNode node = null;
  private int schedTime = 0;
  /** Collects emitted operations while translating the body of a conditional statement. */
  private List<Map.Entry<Integer, AHDLStm>> hooked = null;

  AHDLTranslator(Scope scope, STGItemBuilder host, int memLoadLatency, int memStoreLatency) {
    this.scope = scope;
    this.host = host;
    this.memLoadLatency = memLoadLatency;
    this.memStoreLatency = memStoreLatency;
  }

  /** Translates the statement of {@code node}, emitting from cycle {@code schedTime} on. */
  public void translate(ScheduledNode node, int schedTime) {
    this.node = node;
    this.schedTime = schedTime;
    node.getStm().accept(this);
  }

  /** Translates an expression outside of any scheduled statement. */
  public AHDLExp translateExp(IRExp exp) { return (AHDLExp)exp.accept(this); }

  private AHDLExp exp(IRExp ir) { return (AHDLExp)ir.accept(this); }

  private void emit(AHDLStm item, int time) {
    if (hooked != null)
      hooked.add(Map.entry(time, item));
    else
      host.emit(item, time);
  }

  private void emitSequence(AHDLStm factor, int stepN, int time) {
    for (int i = 0; i < stepN; ++i)
      emit(new AHDLSeq(factor, i, stepN), time + i);
  }

  private CompileException unsupported(Errors error, IRStm stm, Object... args) {
    return CompileException.at(error, scope.getName(), stm == null ? -1 : stm.getLineno(), args);
  }

  //////////   expressions   //////////

  @Override
  public AHDL visitConst(Const ir) {
    return new AHDLConst(ir.getValue());
  }

  @Override
  public AHDL visitTemp(Temp ir) {
    Signal sig = symToSig(ir.getSym(), ir.getCtx());
    if (ir.getSym().getType().isList())
      return new AHDLMemVar(sig, ir.getCtx());
    return new AHDLVar(sig, ir.getCtx());
  }

  @Override
  public AHDL visitUnOp(UnOp ir) {
    return new AHDLOp(ir.getOp(), exp(ir.getExp()));
  }

  @Override
  public AHDL visitBinOp(BinOp ir) {
    return new AHDLOp(ir.getOp(), exp(ir.getLeft()), exp(ir.getRight()));
  }

  @Override
  public AHDL visitCondOp(CondOp ir) {
    return new AHDLIfExp(exp(ir.getCond()), exp(ir.getLeft()), exp(ir.getRight()));
  }

  @Override
  public AHDL visitCall(Call ir) {
    Scope callee = ir.getCallee();
    String instanceName = String.format("%s_%d", callee.getOrigName(), node == null ? 0 : node.getInstanceNum());
    List<AHDLExp> args = ir.getArgs().stream().map(this::exp).collect(Collectors.toList());
    scope.appendCalleeInstance(callee, instanceName);
    return new AHDLModuleCall(callee, args, instanceName, instanceName, List.of());
  }

  @Override
  public AHDL visitSysCall(SysCall ir) {
    IRStm stm = node == null ? null : node.getStm();
    switch (ir.getName()) {
    case "print":
      return new AHDLProcCall("!hdl_print", visitArgs(ir.getArgs()));
    case "assert":
      return new AHDLProcCall("!hdl_assert", visitArgs(ir.getArgs()));
    case "display":
      return new AHDLProcCall("!hdl_verilog_display", visitArgs(ir.getArgs()));
    case "write":
      return new AHDLProcCall("!hdl_verilog_write", visitArgs(ir.getArgs()));
    case "len":
      return translateLen(ir, stm);
    case "clksleep": {
      requireArgs(ir, 1, stm);
      IRExp cycles = ir.getArgs().get(0);
      if (!(cycles instanceof Const))
        throw unsupported(Errors.UNSUPPORTED_SYSCALL, stm, "clksleep with a non-constant cycle count");
      for (int i = 0; i < ((Const)cycles).getValue(); ++i)
        emit(new AHDLNop("wait a cycle"), schedTime + i);
      return null;
    }
    case "wait_rising":
      emit(waitEdge(new AHDLConst(0), new AHDLConst(1), ir.getArgs()), schedTime);
      return null;
    case "wait_falling":
      emit(waitEdge(new AHDLConst(1), new AHDLConst(0), ir.getArgs()), schedTime);
      return null;
    case "wait_edge":
      requireArgs(ir, 2, stm);
      emit(waitEdge(exp(ir.getArgs().get(0)), exp(ir.getArgs().get(1)), ir.getArgs().subList(2, ir.getArgs().size())),
           schedTime);
      return null;
    case "wait_value": {
      requireArgs(ir, 1, stm);
      AHDLExp value = exp(ir.getArgs().get(0));
      var args = new ArrayList<AHDLExp>();
      for (IRExp port : ir.getArgs().subList(1, ir.getArgs().size())) {
        args.add(value);
        args.add(AHDLVar.load(portSig(portSym(port, stm))));
      }
      emit(new AHDLMetaWait(WaitKind.WAIT_VALUE, args), schedTime);
      return null;
    }
    case "wait_until":
      emit(new AHDLMetaWait(WaitKind.WAIT_COND, visitArgs(ir.getArgs())), schedTime);
      return null;
    default:
      throw unsupported(Errors.UNSUPPORTED_SYSCALL, stm, ir.getName());
    }
  }

  private void requireArgs(SysCall ir, int count, IRStm stm) {
    if (ir.getArgs().size() < count)
      throw unsupported(Errors.UNSUPPORTED_SYSCALL, stm,
                        String.format("%s needs at least %d argument(s), got %d", ir.getName(), count, ir.getArgs().size()));
  }

  private List<AHDLExp> visitArgs(List<IRExp> args) { return args.stream().map(this::exp).collect(Collectors.toList()); }

  private AHDLMetaWait waitEdge(AHDLExp oldValue, AHDLExp newValue, List<IRExp> ports) {
    var args = new ArrayList<AHDLExp>(List.of(oldValue, newValue));
    IRStm stm = node == null ? null : node.getStm();
    for (IRExp port : ports)
      args.add(AHDLVar.load(portSig(portSym(port, stm))));
    return new AHDLMetaWait(WaitKind.WAIT_EDGE, args);
  }

  private AHDLExp translateLen(SysCall ir, IRStm stm) {
    IRExp arg = ir.getArgs().get(0);
    if (!(arg instanceof Temp) || !((Temp)arg).getSym().getType().isList())
      throw unsupported(Errors.UNSUPPORTED_SYSCALL, stm, "len of a non-list value");
    Symbol mem = ((Temp)arg).getSym();
    int length = mem.getType().getLength();
    if (length != Type.UNKNOWN_LENGTH)
      return new AHDLConst(length);
    Signal lenSig = scope.genSig(String.format("%s_len", mem.hdlName()), Type.DEFAULT_INT_WIDTH, EnumSet.of(SignalTag.Memif));
    return AHDLVar.load(lenSig);
  }

  @Override
  public AHDL visitMRef(MRef ir) {
    AHDLMemVar memvar = (AHDLMemVar)exp(ir.getMem());
    AHDLExp offset = exp(ir.getOffset());
    MemKind memKind = ir.getMem().getSym().getType().getMemKind().orElse(MemKind.RAM);
    switch (memKind) {
    case ROM:
      return new AHDLFunCall(memvar.getSig().getName(), List.of(offset));
    case REGISTER_ARRAY:
      return new AHDLSubscript(memvar, offset);
    default:
      // RAM reads are a load sequence into the destination of the enclosing move
      Move move = (Move)node.getStm();
      return new AHDLLoad(memvar, (AHDLVar)exp(move.getDst()), offset);
    }
  }

  @Override
  public AHDL visitMStore(MStore ir) {
    AHDLMemVar memvar = new AHDLMemVar(symToSig(ir.getMem().getSym(), Ctx.STORE), Ctx.STORE);
    AHDLExp offset = exp(ir.getOffset());
    AHDLExp value = exp(ir.getExp());
    MemKind memKind = ir.getMem().getSym().getType().getMemKind().orElse(MemKind.RAM);
    if (memKind == MemKind.REGISTER_ARRAY) {
      emit(new AHDLMove(new AHDLSubscript(memvar, offset), value), schedTime);
      return null;
    }
    return new AHDLStore(memvar, value, offset);
  }

  @Override
  public AHDL visitArray(Array ir) {
    IRStm stm = node.getStm();
    if (!(ir.getRepeat() instanceof Const))
      throw unsupported(Errors.SEQ_MULTIPLIER_MUST_BE_CONST, stm);
    long repeat = ((Const)ir.getRepeat()).getValue();
    var items = new ArrayList<IRExp>();
    for (long r = 0; r < repeat; ++r)
      ir.getItems().forEach(item -> items.add(item.copy()));

    Temp dst = ((Move)stm).getDst();
    Type dstType = dst.getSym().getType();
    if (dstType.getLength() != Type.UNKNOWN_LENGTH && dstType.getLength() != items.size())
      throw unsupported(Errors.MEM_LENGTH_MISMATCH, stm, dst.getSym().getName(), dstType.getLength(), "array", items.size());
    MemKind memKind = dstType.getMemKind().orElse(MemKind.RAM);
    if (memKind == MemKind.ROM)
      return null;
    AHDLMemVar memvar = new AHDLMemVar(symToSig(dst.getSym(), Ctx.STORE), Ctx.STORE);
    for (int i = 0; i < items.size(); ++i) {
      AHDLExp item = exp(items.get(i));
      if (memKind == MemKind.REGISTER_ARRAY)
        emit(new AHDLMove(new AHDLSubscript(memvar, new AHDLConst(i)), item), schedTime);
      else
        emitSequence(new AHDLStore(memvar, item, new AHDLConst(i)), memStoreLatency, schedTime + i);
    }
    return null;
  }

  @Override
  public AHDL visitPortRead(PortRead ir) {
    return AHDLVar.load(portSig(ir.getPort().getSym()));
  }

  @Override
  public AHDL visitPortWrite(PortWrite ir) {
    Signal port = portSig(ir.getPort().getSym());
    var write = new AHDLIOWrite(AHDLVar.store(port), exp(ir.getValue()));
    emitSequence(write, Math.max(node.getLatency(), 1), schedTime);
    return null;
  }

  //////////   statements   //////////

  @Override
  public AHDL visitMove(Move ir) {
    IRExp src = ir.getSrc();
    if (src instanceof Call) {
      Call call = (Call)src;
      if (call.getCallee().isModule())
        return null;
      emitCallSequence((AHDLModuleCall)call.accept(this), Optional.of(exp(ir.getDst())));
      return null;
    }
    if (src instanceof PortRead) {
      var read = new AHDLIORead(AHDLVar.load(portSig(((PortRead)src).getPort().getSym())),
                                Optional.of((AHDLVar)exp(ir.getDst())));
      emitSequence(read, Math.max(node.getLatency(), 1), schedTime);
      return null;
    }
    if (src instanceof Temp) {
      Symbol srcSym = ((Temp)src).getSym();
      if (srcSym.isParam() && (srcSym.getType().isPort() || srcSym.getType().isObject()))
        return null;
      if (srcSym.getType().isList() && ir.getDst().getSym().getType().isList()) {
        copyMemory(ir, srcSym, ir.getDst().getSym());
        return null;
      }
    }
    AHDL ahdlSrc = src.accept(this);
    if (ahdlSrc == null)
      return null;
    if (ahdlSrc instanceof AHDLStore) {
      emitSequence((AHDLStore)ahdlSrc, memStoreLatency, schedTime);
      return null;
    }
    if (ahdlSrc instanceof AHDLLoad) {
      emitSequence((AHDLLoad)ahdlSrc, memLoadLatency, schedTime);
      return null;
    }
    AHDLExp dst = exp(ir.getDst());
    if (ahdlSrc instanceof AHDLVar && ((AHDLVar)ahdlSrc).getSig() == ((AHDLVar)dst).getSig())
      return null;
    emit(new AHDLMove(dst, (AHDLExp)ahdlSrc), schedTime);
    return null;
  }

  private void copyMemory(Move ir, Symbol src, Symbol dst) {
    Type srcType = src.getType();
    Type dstType = dst.getType();
    boolean regArrays = dstType.getMemKind().orElse(MemKind.RAM) == MemKind.REGISTER_ARRAY &&
                        srcType.getMemKind().orElse(MemKind.RAM) == MemKind.REGISTER_ARRAY;
    if (!regArrays) {
      emit(new AHDLMove(new AHDLMemVar(symToSig(dst, Ctx.STORE), Ctx.STORE), new AHDLMemVar(symToSig(src, Ctx.LOAD), Ctx.LOAD)),
           schedTime);
      return;
    }
    if (srcType.getLength() != dstType.getLength())
      throw unsupported(Errors.MEM_LENGTH_MISMATCH, ir, src.getName(), srcType.getLength(), dst.getName(), dstType.getLength());
    var dstVar = new AHDLMemVar(symToSig(dst, Ctx.STORE), Ctx.STORE);
    var srcVar = new AHDLMemVar(symToSig(src, Ctx.LOAD), Ctx.LOAD);
    for (int i = 0; i < dstType.getLength(); ++i)
      emit(new AHDLMove(new AHDLSubscript(dstVar, new AHDLConst(i)), new AHDLSubscript(srcVar, new AHDLConst(i))), schedTime);
  }

  private void emitCallSequence(AHDLModuleCall call, Optional<AHDLExp> dst) {
    var returns = new ArrayList<AHDLExp>();
    for (AHDLExp arg : call.getArgs()) {
      if (arg instanceof AHDLMemVar && ((AHDLMemVar)arg).getSig().isRegArray())
        returns.add(arg);
    }
    dst.ifPresent(returns::add);
    var withReturns = new AHDLModuleCall(call.getCallee(), call.getArgs(), call.getInstanceName(), call.getPrefix(), returns);
    emitSequence(withReturns, Math.max(node.getLatency(), 1), schedTime);
  }

  @Override
  public AHDL visitExpr(Expr ir) {
    IRExp e = ir.getExp();
    if (e instanceof Call) {
      if (!((Call)e).getCallee().isModule())
        emitCallSequence((AHDLModuleCall)e.accept(this), Optional.empty());
      return null;
    }
    if (e instanceof PortRead) {
      var read = new AHDLIORead(AHDLVar.load(portSig(((PortRead)e).getPort().getSym())), Optional.empty());
      emitSequence(read, Math.max(node.getLatency(), 1) - 1, schedTime);
      return null;
    }
    if (e instanceof MStore) {
      AHDL store = e.accept(this);
      if (store instanceof AHDLStore)
        emitSequence((AHDLStore)store, memStoreLatency, schedTime);
      return null;
    }
    if (e instanceof SysCall || e instanceof PortWrite) {
      AHDL result = e.accept(this);
      if (result instanceof AHDLStm)
        emit((AHDLStm)result, schedTime);
    }
    return null;
  }

  @Override
  public AHDL visitCJump(CJump ir) {
    AHDLExp cond = exp(ir.getCond());
    if (cond instanceof AHDLConst && ((AHDLConst)cond).getValue() == 1) {
      emit(new AHDLTransition(ir.getTrue()), schedTime);
      return null;
    }
    emit(new AHDLTransitionIf(List.of(cond, new AHDLConst(1)),
                              List.of(List.of(new AHDLTransition(ir.getTrue())), List.of(new AHDLTransition(ir.getFalse())))),
         schedTime);
    return null;
  }

  @Override
  public AHDL visitMCJump(MCJump ir) {
    List<IRExp> conds = ir.getConds();
    List<Block> targets = ir.getTargets();
    for (int i = 0; i < conds.size() - 1; ++i) {
      if (conds.get(i) instanceof Const && ((Const)conds.get(i)).getValue() == 1) {
        emit(new AHDLTransition(targets.get(i)), schedTime);
        return null;
      }
    }
    var condList = new ArrayList<AHDLExp>();
    var codesList = new ArrayList<List<AHDLStm>>();
    for (int i = 0; i < conds.size(); ++i) {
      condList.add(exp(conds.get(i)));
      codesList.add(List.of(new AHDLTransition(targets.get(i))));
    }
    emit(new AHDLTransitionIf(condList, codesList), schedTime);
    return null;
  }

  @Override
  public AHDL visitJump(Jump ir) {
    return null;
  }

  @Override
  public AHDL visitRet(Ret ir) {
    return null;
  }

  @Override
  public AHDL visitPhi(Phi ir) {
    var args = ir.getArgs();
    var ps = ir.getPs();
    if (ps.isEmpty() || ps.size() != args.size())
      throw unsupported(Errors.PHI_WITHOUT_PREDICATES, ir, ir.getVar().getSym().getName());
    AHDLExp dst = exp(ir.getVar());
    int last = args.size() - 1;
    AHDLExp lastCond = exp(ps.get(last));
    AHDLExp rexp = exp(args.get(last).var());
    if (!(lastCond instanceof AHDLConst && ((AHDLConst)lastCond).getValue() != 0))
      rexp = new AHDLIfExp(lastCond, rexp, new AHDLSymbol("'bz"));
    for (int i = last - 1; i >= 0; --i)
      rexp = new AHDLIfExp(exp(ps.get(i)), exp(args.get(i).var()), rexp);
    emit(new AHDLMove(dst, rexp), schedTime);
    return null;
  }

  @Override
  public AHDL visitCMove(CMove ir) {
    AHDLExp cond = exp(ir.getCond());
    emitConditionally(cond, () -> visitMove(ir));
    return null;
  }

  @Override
  public AHDL visitCExpr(CExpr ir) {
    AHDLExp cond = exp(ir.getCond());
    emitConditionally(cond, () -> visitExpr(ir));
    return null;
  }

  private void emitConditionally(AHDLExp cond, Runnable body) {
    var outer = hooked;
    hooked = new ArrayList<>();
    List<Map.Entry<Integer, AHDLStm>> items;
    try {
      body.run();
    } finally {
      items = hooked;
      hooked = outer;
    }
    for (var item : items)
      emit(new AHDLIf(List.of(cond), List.of(List.of(item.getValue()))), item.getKey());
  }

  //////////   signals   //////////

  private static int signalWidth(Symbol sym) {
    Type type = sym.getType();
    if (sym.isCondition())
      return 1;
    if (type.isList())
      return type.getElement().map(Type::getWidth).orElse(Type.DEFAULT_INT_WIDTH);
    if (type.isScalar() || type.isPort())
      return type.getWidth();
    return -1;
  }

  /**
   * Signal standing for {@code sym} in this scope. Stored scalars become registers, parameters inputs and the
   * return value the output of the scope's module interface.
   */
  public Signal symToSig(Symbol sym, Ctx ctx) {
    if (sym.getType().isPort())
      return portSig(sym);
    EnumSet<SignalTag> tags = EnumSet.noneOf(SignalTag.class);
    Type type = sym.getType();
    if (type.isList()) {
      tags.add(SignalTag.Memif);
      type.getMemKind().ifPresent(memKind -> {
        if (memKind == MemKind.REGISTER_ARRAY)
          tags.add(SignalTag.RegArray);
        else if (memKind == MemKind.ROM)
          tags.add(SignalTag.Rom);
      });
    } else if (type.isScalar()) {
      if (type.isSigned())
        tags.add(SignalTag.Int);
      if (ctx == Ctx.STORE)
        tags.add(SignalTag.Reg);
    }
    if (sym.isParam())
      tags.add(SignalTag.Input);
    else if (sym.isReturn())
      tags.add(SignalTag.Output);
    else if (sym.isCondition())
      tags.add(SignalTag.Condition);
    if (sym.isAlias()) {
      tags.remove(SignalTag.Reg);
      tags.add(SignalTag.Net);
    }
    if (sym.isInduction())
      tags.add(SignalTag.Induction);

    String sigName;
    if (scope.isWorker() || scope.isMethod() || tags.contains(SignalTag.Input))
      sigName = String.format("%s_%s", scope.getOrigName(), sym.hdlName());
    else if (tags.contains(SignalTag.Output))
      sigName = String.format("%s_out_0", scope.getOrigName());
    else
      sigName = sym.hdlName();
    return scope.genSig(sigName, signalWidth(sym), tags, Optional.of(sym));
  }

  private Symbol portSym(IRExp exp, IRStm stm) {
    if (!(exp instanceof Temp) || !((Temp)exp).getSym().getType().isPort())
      throw unsupported(Errors.UNSUPPORTED_SYSCALL, stm, "wait on a non-port value " + exp);
    return ((Temp)exp).getSym();
  }

  /**
   * Signal of a port. Ports of a module are owned by the module scope so that every worker and method of the module
   * shares one signal; ports of a free-standing scope become external ports of that scope.
   */
  public Signal portSig(Symbol portSym) {
    Symbol root = portSym.rootSym();
    String portName = root.hdlName();
    Type type = portSym.getType();
    Optional<Scope> moduleScope = scope.getModuleScope();
    Scope owner = moduleScope.orElse(scope);
    Optional<Signal> existing = owner.signal(portName);
    if (existing.isPresent())
      return existing.get();

    EnumSet<SignalTag> tags = EnumSet.noneOf(SignalTag.class);
    if (type.getMaxsize() > 0) {
      tags.add(SignalTag.SeqPort);
    } else {
      tags.add(SignalTag.SinglePort);
      if (type.isSigned())
        tags.add(SignalTag.Int);
    }
    PortDirection direction = type.getDirection().orElse(PortDirection.INOUT);
    if (type.isInternal()) {
      if (!tags.contains(SignalTag.SeqPort))
        tags.add(SignalTag.Reg);
    } else if (moduleScope.isPresent()) {
      if (direction == PortDirection.IN)
        tags.add(SignalTag.Input);
      else if (direction == PortDirection.OUT)
        tags.add(SignalTag.Output);
    } else {
      tags.add(SignalTag.Extport);
      tags.add(direction == PortDirection.IN ? SignalTag.Reg : SignalTag.Net);
    }
    if ("valid".equals(type.getProtocol()))
      tags.add(SignalTag.ValidProtocol);
    else if ("ready_valid".equals(type.getProtocol()))
      tags.add(SignalTag.ReadyValidProtocol);
    if (type.getInit() != 0)
      tags.add(SignalTag.Initializable);

    Signal sig = owner.genSig(portName, type.getWidth(), tags, Optional.of(root));
    if (type.getInit() != 0)
      sig.setInitValue(type.getInit());
    if (type.getMaxsize() > 0)
      sig.setMaxsize(type.getMaxsize());
    logger.debug("port signal {} owned by {}", sig, owner.getName());
    return sig;
  }
}

package hlsc.ahdl;

import java.util.List;

/**
 * Recursive walk over operations. {@link #currentStm} is the innermost statement being walked; the conditions of
 * an {@link AHDLIf} belong to the if itself, its branch bodies are walked as statements of their own.
 */
public abstract class AHDLWalker implements AHDLVisitor<Void> {
  protected AHDLStm currentStm = null;

  public void walkCodes(List<AHDLStm> codes) {
    for (AHDLStm code : codes)
      walkStm(code);
  }

  public void walkStm(AHDLStm stm) {
    AHDLStm prevStm = currentStm;
    currentStm = stm;
    stm.accept(this);
    currentStm = prevStm;
  }

  protected void walk(AHDLExp exp) { exp.accept(this); }

  @Override
  public Void visitConst(AHDLConst ahdl) {
    return null;
  }
  @Override
  public Void visitVar(AHDLVar ahdl) {
    return null;
  }
  @Override
  public Void visitMemVar(AHDLMemVar ahdl) {
    return visitVar(ahdl);
  }
  @Override
  public Void visitSymbol(AHDLSymbol ahdl) {
    return null;
  }
  @Override
  public Void visitOp(AHDLOp ahdl) {
    ahdl.getArgs().forEach(this::walk);
    return null;
  }
  @Override
  public Void visitIfExp(AHDLIfExp ahdl) {
    walk(ahdl.getCond());
    walk(ahdl.getLexp());
    walk(ahdl.getRexp());
    return null;
  }
  @Override
  public Void visitSubscript(AHDLSubscript ahdl) {
    walk(ahdl.getMemvar());
    walk(ahdl.getOffset());
    return null;
  }
  @Override
  public Void visitFunCall(AHDLFunCall ahdl) {
    ahdl.getArgs().forEach(this::walk);
    return null;
  }

  @Override
  public Void visitMove(AHDLMove ahdl) {
    walk(ahdl.getSrc());
    walk(ahdl.getDst());
    return null;
  }
  @Override
  public Void visitTransition(AHDLTransition ahdl) {
    return null;
  }
  @Override
  public Void visitTransitionIf(AHDLTransitionIf ahdl) {
    return visitIf(ahdl);
  }
  @Override
  public Void visitIf(AHDLIf ahdl) {
    ahdl.getConds().forEach(this::walk);
    ahdl.getCodesList().forEach(this::walkCodes);
    return null;
  }
  @Override
  public Void visitPipelineGuard(AHDLPipelineGuard ahdl) {
    return visitIf(ahdl);
  }
  @Override
  public Void visitMetaWait(AHDLMetaWait ahdl) {
    ahdl.getArgs().forEach(this::walk);
    return null;
  }
  @Override
  public Void visitSeq(AHDLSeq ahdl) {
    ahdl.getFactor().accept(this);
    return null;
  }
  @Override
  public Void visitModuleCall(AHDLModuleCall ahdl) {
    ahdl.getArgs().forEach(this::walk);
    ahdl.getReturns().forEach(this::walk);
    return null;
  }
  @Override
  public Void visitProcCall(AHDLProcCall ahdl) {
    ahdl.getArgs().forEach(this::walk);
    return null;
  }
  @Override
  public Void visitIORead(AHDLIORead ahdl) {
    walk(ahdl.getIo());
    ahdl.getDst().ifPresent(this::walk);
    return null;
  }
  @Override
  public Void visitIOWrite(AHDLIOWrite ahdl) {
    walk(ahdl.getIo());
    walk(ahdl.getSrc());
    return null;
  }
  @Override
  public Void visitLoad(AHDLLoad ahdl) {
    walk(ahdl.getMem());
    walk(ahdl.getOffset());
    walk(ahdl.getDst());
    return null;
  }
  @Override
  public Void visitStore(AHDLStore ahdl) {
    walk(ahdl.getMem());
    walk(ahdl.getOffset());
    walk(ahdl.getSrc());
    return null;
  }
  @Override
  public Void visitNop(AHDLNop ahdl) {
    return null;
  }
  @Override
  public Void visitInline(AHDLInline ahdl) {
    return null;
  }
  @Override
  public Void visitCalleeProlog(AHDLCalleeProlog ahdl) {
    return null;
  }
  @Override
  public Void visitCalleeEpilog(AHDLCalleeEpilog ahdl) {
    return null;
  }
}

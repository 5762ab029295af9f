package hlsc.ahdl;

/**
 * Visitor over the closed set of low-level operation kinds.
 */
public interface AHDLVisitor<R> {
  R visitConst(AHDLConst ahdl);
  R visitVar(AHDLVar ahdl);
  R visitMemVar(AHDLMemVar ahdl);
  R visitSymbol(AHDLSymbol ahdl);
  R visitOp(AHDLOp ahdl);
  R visitIfExp(AHDLIfExp ahdl);
  R visitSubscript(AHDLSubscript ahdl);
  R visitFunCall(AHDLFunCall ahdl);

  R visitMove(AHDLMove ahdl);
  R visitTransition(AHDLTransition ahdl);
  R visitTransitionIf(AHDLTransitionIf ahdl);
  R visitIf(AHDLIf ahdl);
  R visitPipelineGuard(AHDLPipelineGuard ahdl);
  R visitMetaWait(AHDLMetaWait ahdl);
  R visitSeq(AHDLSeq ahdl);
  R visitModuleCall(AHDLModuleCall ahdl);
  R visitProcCall(AHDLProcCall ahdl);
  R visitIORead(AHDLIORead ahdl);
  R visitIOWrite(AHDLIOWrite ahdl);
  R visitLoad(AHDLLoad ahdl);
  R visitStore(AHDLStore ahdl);
  R visitNop(AHDLNop ahdl);
  R visitInline(AHDLInline ahdl);
  R visitCalleeProlog(AHDLCalleeProlog ahdl);
  R visitCalleeEpilog(AHDLCalleeEpilog ahdl);
}

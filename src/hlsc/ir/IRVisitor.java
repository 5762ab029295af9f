package hlsc.ir;

/**
 * Visitor over the closed set of IR node kinds.
 */
public interface IRVisitor<R> {
  R visitConst(Const ir);
  R visitTemp(Temp ir);
  R visitUnOp(UnOp ir);
  R visitBinOp(BinOp ir);
  R visitCondOp(CondOp ir);
  R visitCall(Call ir);
  R visitSysCall(SysCall ir);
  R visitMRef(MRef ir);
  R visitMStore(MStore ir);
  R visitArray(Array ir);
  R visitPortRead(PortRead ir);
  R visitPortWrite(PortWrite ir);

  R visitMove(Move ir);
  R visitExpr(Expr ir);
  R visitCJump(CJump ir);
  R visitMCJump(MCJump ir);
  R visitJump(Jump ir);
  R visitRet(Ret ir);
  R visitPhi(Phi ir);
  R visitCMove(CMove ir);
  R visitCExpr(CExpr ir);
}

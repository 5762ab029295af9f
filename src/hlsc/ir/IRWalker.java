package hlsc.ir;

/**
 * Recursive walk over an IR tree. Subclasses override the node kinds they are interested in and call the
 * super method to keep descending.
 */
public abstract class IRWalker implements IRVisitor<Void> {
  /** The statement currently being walked. */
  protected IRStm currentStm = null;

  public void walkBlock(Block block) {
    for (IRStm stm : block.getStms())
      walkStm(stm);
  }

  public void walkStm(IRStm stm) {
    IRStm prevStm = currentStm;
    currentStm = stm;
    stm.accept(this);
    currentStm = prevStm;
  }

  protected void walk(IRExp exp) { exp.accept(this); }

  @Override
  public Void visitConst(Const ir) {
    return null;
  }
  @Override
  public Void visitTemp(Temp ir) {
    return null;
  }
  @Override
  public Void visitUnOp(UnOp ir) {
    walk(ir.getExp());
    return null;
  }
  @Override
  public Void visitBinOp(BinOp ir) {
    walk(ir.getLeft());
    walk(ir.getRight());
    return null;
  }
  @Override
  public Void visitCondOp(CondOp ir) {
    walk(ir.getCond());
    walk(ir.getLeft());
    walk(ir.getRight());
    return null;
  }
  @Override
  public Void visitCall(Call ir) {
    ir.getArgs().forEach(this::walk);
    return null;
  }
  @Override
  public Void visitSysCall(SysCall ir) {
    ir.getArgs().forEach(this::walk);
    return null;
  }
  @Override
  public Void visitMRef(MRef ir) {
    walk(ir.getMem());
    walk(ir.getOffset());
    return null;
  }
  @Override
  public Void visitMStore(MStore ir) {
    walk(ir.getMem());
    walk(ir.getOffset());
    walk(ir.getExp());
    return null;
  }
  @Override
  public Void visitArray(Array ir) {
    ir.getItems().forEach(this::walk);
    walk(ir.getRepeat());
    return null;
  }
  @Override
  public Void visitPortRead(PortRead ir) {
    walk(ir.getPort());
    return null;
  }
  @Override
  public Void visitPortWrite(PortWrite ir) {
    walk(ir.getPort());
    walk(ir.getValue());
    return null;
  }

  @Override
  public Void visitMove(Move ir) {
    walk(ir.getSrc());
    walk(ir.getDst());
    return null;
  }
  @Override
  public Void visitExpr(Expr ir) {
    walk(ir.getExp());
    return null;
  }
  @Override
  public Void visitCJump(CJump ir) {
    walk(ir.getCond());
    return null;
  }
  @Override
  public Void visitMCJump(MCJump ir) {
    ir.getConds().forEach(this::walk);
    return null;
  }
  @Override
  public Void visitJump(Jump ir) {
    return null;
  }
  @Override
  public Void visitRet(Ret ir) {
    walk(ir.getExp());
    return null;
  }
  @Override
  public Void visitPhi(Phi ir) {
    ir.getArgs().forEach(arg -> walk(arg.var()));
    ir.getPs().forEach(this::walk);
    walk(ir.getVar());
    return null;
  }
  @Override
  public Void visitCMove(CMove ir) {
    walk(ir.getCond());
    return visitMove(ir);
  }
  @Override
  public Void visitCExpr(CExpr ir) {
    walk(ir.getCond());
    return visitExpr(ir);
  }
}

package hlsc.ir;

/**
 * Builds a {@link UseDefTable} for a scope.
 */
public class UseDefDetector extends IRWalker {
  private final UseDefTable table = new UseDefTable();

  public static UseDefTable process(Scope scope) {
    var detector = new UseDefDetector();
    for (Block block : scope.getBlocks())
      detector.walkBlock(block);
    return detector.table;
  }

  @Override
  public Void visitTemp(Temp ir) {
    if (currentStm == null)
      return null;
    if (ir.isStore())
      table.addVarDef(ir, currentStm);
    else
      table.addVarUse(ir, currentStm);
    return null;
  }
}

package hlsc.errors;

/**
 * Numbered error templates. Templates are filled with {@link String#format(String, Object...)}.
 */
public enum Errors {
  UNSUPPORTED_OPERATOR(804, ErrorKind.UNSUPPORTED, "unsupported operator '%s'"),
  SEQ_ITEM_MUST_BE_INT(802, ErrorKind.UNSUPPORTED, "sequence item must be an integer, got %s"),
  SEQ_MULTIPLIER_MUST_BE_CONST(803, ErrorKind.UNSUPPORTED, "multiplier for the sequence must be a constant"),
  MEM_LENGTH_MISMATCH(805, ErrorKind.UNSUPPORTED, "length of '%s' (%d) does not match length of '%s' (%d)"),
  PHI_WITHOUT_PREDICATES(806, ErrorKind.UNSUPPORTED, "merge of '%s' has no selection predicates and cannot be lowered"),
  UNSUPPORTED_SYSCALL(807, ErrorKind.UNSUPPORTED, "unsupported builtin call '%s'"),
  UNSUPPORTED_IN_PIPELINE(808, ErrorKind.UNSUPPORTED, "conditional branch '%s' is not allowed inside a pipelined region"),

  ENTRY_HAS_PREDECESSORS(1000, ErrorKind.STRUCTURAL, "entry block %s must not have predecessors"),
  UNREACHABLE_BLOCK(1001, ErrorKind.STRUCTURAL, "block %s is not reachable from the entry block"),
  DUPLICATE_SYMBOL(1002, ErrorKind.STRUCTURAL, "symbol '%s' is already defined in scope %s"),
  UNRESOLVED_TRANSITION(1003, ErrorKind.STRUCTURAL, "transition in state %s targets block %s which has no state"),
  MISSING_TERMINAL(1004, ErrorKind.STRUCTURAL, "state %s does not end with a transition"),
  UNRESOLVED_IN_STG(1005, ErrorKind.STRUCTURAL, "state %s still holds an unresolved transition"),
  MULTIPLE_DEFINITIONS(1006, ErrorKind.STRUCTURAL, "signal %s is defined in more than one pipeline stage"),
  MISSING_LOOP_INFO(1007, ErrorKind.STRUCTURAL, "pipelined loop region %s carries no loop information"),
  MISSING_CONDITION_DEF(1008, ErrorKind.STRUCTURAL, "loop condition %s has no definition"),
  BAD_REGION_ENTRY(1009, ErrorKind.STRUCTURAL, "first state %s of region %s must end with a transition"),
  UNSCHEDULED_REGION(1010, ErrorKind.STRUCTURAL, "region %s has no blocks"),
  MISSING_SCHEDULE(1011, ErrorKind.STRUCTURAL, "scope %s has no scheduling region"),
  MALFORMED_INPUT(1012, ErrorKind.STRUCTURAL, "malformed program description: %s");

  public final int code;
  public final ErrorKind kind;
  public final String template;

  private Errors(int code, ErrorKind kind, String template) {
    this.code = code;
    this.kind = kind;
    this.template = template;
  }

  public String format(Object... args) { return String.format(template, args); }
}

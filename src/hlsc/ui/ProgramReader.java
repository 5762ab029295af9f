package hlsc.ui;

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
import hlsc.ir.Jump;
import hlsc.ir.MCJump;
import hlsc.ir.MRef;
import hlsc.ir.MStore;
import hlsc.ir.Move;
import hlsc.ir.Op;
import hlsc.ir.Phi;
import hlsc.ir.PortRead;
import hlsc.ir.PortWrite;
import hlsc.ir.Ret;
import hlsc.ir.Scope;
import hlsc.ir.Scope.ScopeTag;
import hlsc.ir.ScopeRegistry;
import hlsc.ir.Symbol;
import hlsc.ir.Symbol.SymbolTag;
import hlsc.ir.SysCall;
import hlsc.ir.Temp;
import hlsc.ir.Type;
import hlsc.ir.UnOp;
import hlsc.schedule.LoopInfo;
import hlsc.schedule.ScheduledNode;
import hlsc.schedule.SchedulingMode;
import hlsc.schedule.SchedulingRegion;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a YAML program description into a {@link ScopeRegistry}: scopes with their symbols, control-flow graph,
 * scheduling regions and the begin cycle and latency of every scheduled statement.
 *
 * <pre>
 * scopes:
 *   - name: f
 *     tags: [function, returnable]
 *     symbols:
 *       - {name: x, type: {kind: int, width: 32, signed: true}}
 *     params: [x]
 *     blocks:
 *       - id: b0
 *         stms:
 *           - {move: [y, {binop: [Add, x, 1]}], begin: 0, latency: 1}
 *           - {ret: y, begin: 1}
 *     region: {mode: sequential, blocks: [b0]}
 * </pre>
 *
 * Scopes are referenced by their {@code name}, which has to be unique within the document; a parent must be
 * listed before its children. Blocks are referenced by their {@code id} within the scope.
 */
public class ProgramReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Set<String> STM_META_KEYS = Set.of("begin", "latency", "line", "instance");

  private final ScopeRegistry registry = new ScopeRegistry();
  private final Map<String, Scope> scopesByName = new HashMap<>();

  // per-scope state while reading bodies
  private Scope scope;
  private Map<String, Block> blocksById;
  private final Map<IRStm, ScheduledNode> schedule = new LinkedHashMap<>();

  private ProgramReader() {}

  public static ScopeRegistry read(File file) throws IOException {
    try (InputStream in = new FileInputStream(file)) {
      return read(in);
    }
  }

  /**
   * @throws CompileException with {@link Errors#MALFORMED_INPUT} if the document does not describe a program
   */
  public static ScopeRegistry read(InputStream in) {
    Yaml yaml = new Yaml();
    Object doc;
    try {
      doc = yaml.load(in);
    } catch (YAMLException e) {
      throw CompileException.of(Errors.MALFORMED_INPUT, null, e.getMessage());
    }
    var reader = new ProgramReader();
    reader.readProgram(asMap(doc, "document"));
    return reader.registry;
  }

  private void readProgram(Map<String, Object> doc) {
    List<Map<String, Object>> scopeDescs = asMapList(doc.get("scopes"), "scopes");
    // first pass: scopes and symbols, so calls and outer symbols can be referenced in any order
    for (Map<String, Object> desc : scopeDescs)
      declareScope(desc);
    for (Map<String, Object> desc : scopeDescs)
      readBody(desc);
    logger.debug("read {} scopes", scopesByName.size());
  }

  private void declareScope(Map<String, Object> desc) {
    String name = asString(desc.get("name"), "scope name");
    if (scopesByName.containsKey(name))
      throw malformed(null, "duplicate scope " + name);
    Scope parent = null;
    if (desc.containsKey("parent")) {
      String parentName = asString(desc.get("parent"), "scope parent");
      parent = scopesByName.get(parentName);
      if (parent == null)
        throw malformed(null, String.format("parent %s of scope %s is not declared before it", parentName, name));
    }
    EnumSet<ScopeTag> tags = EnumSet.noneOf(ScopeTag.class);
    for (String tagName : asStringList(desc.getOrDefault("tags", List.of()), "scope tags")) {
      var tag_opt = ScopeTag.fromSerialName(tagName);
      tag_opt.ifPresent(tag -> tags.add(tag));
      if (tag_opt.isEmpty())
        logger.warn("Ignoring unknown scope tag {}", tagName);
    }
    int lineno = asInt(desc.getOrDefault("line", -1), "scope line");
    Scope newScope = registry.createScope(parent, name, tags, lineno);
    scopesByName.put(name, newScope);

    for (Map<String, Object> symDesc : asMapList(desc.getOrDefault("symbols", List.of()), "symbols")) {
      String symName = asString(symDesc.get("name"), "symbol name");
      EnumSet<SymbolTag> symTags = EnumSet.noneOf(SymbolTag.class);
      for (String tagName : asStringList(symDesc.getOrDefault("tags", List.of()), "symbol tags")) {
        var tag_opt = SymbolTag.fromSerialName(tagName);
        tag_opt.ifPresent(tag -> symTags.add(tag));
        if (tag_opt.isEmpty())
          logger.warn("Ignoring unknown tag {} of symbol {}", tagName, symName);
      }
      Type type = symDesc.containsKey("type") ? readType(newScope, symDesc.get("type")) : Type.intType();
      newScope.addSym(symName, symTags, type);
    }
    for (String paramName : asStringList(desc.getOrDefault("params", List.of()), "params"))
      newScope.addParam(findSym(newScope, paramName));
    if (desc.containsKey("return"))
      newScope.setReturnSym(findSym(newScope, asString(desc.get("return"), "return")));
  }

  private Type readType(Scope owner, Object node) {
    if (node instanceof String) {
      // shorthand: int, bool, object, function, none
      return readType(owner, Map.of("kind", node));
    }
    Map<String, Object> desc = asMap(node, "type");
    String kindName = asString(desc.get("kind"), "type kind");
    Type.Kind kind = Type.Kind.fromSerialName(kindName).orElseThrow(() -> malformed(owner, "unknown type kind " + kindName));
    switch (kind) {
    case INT:
      return Type.intType(asInt(desc.getOrDefault("width", Type.DEFAULT_INT_WIDTH), "int width"),
                          asBool(desc.getOrDefault("signed", true), "int signedness"));
    case BOOL:
      return Type.boolType();
    case LIST: {
      Type element = readType(owner, desc.getOrDefault("element", "int"));
      int length = asInt(desc.getOrDefault("length", Type.UNKNOWN_LENGTH), "list length");
      String memName = asString(desc.getOrDefault("mem", "ram"), "list memory kind");
      Type.MemKind memKind =
          Type.MemKind.fromSerialName(memName).orElseThrow(() -> malformed(owner, "unknown memory kind " + memName));
      return Type.listType(element, length, memKind);
    }
    case PORT: {
      Type dtype = readType(owner, desc.getOrDefault("dtype", "int"));
      String dirName = asString(desc.getOrDefault("direction", "in"), "port direction");
      Type.PortDirection direction =
          Type.PortDirection.fromSerialName(dirName).orElseThrow(() -> malformed(owner, "unknown port direction " + dirName));
      return Type.portType(dtype, direction, asString(desc.getOrDefault("protocol", "none"), "port protocol"),
                           asBool(desc.getOrDefault("internal", false), "port internal"), asInt(desc.getOrDefault("init", 0), "port init"),
                           asInt(desc.getOrDefault("maxsize", 0), "port maxsize"));
    }
    case OBJECT:
      return Type.objectType();
    case FUNCTION:
      return Type.functionType();
    default:
      return Type.noneType();
    }
  }

  //////////   bodies   //////////

  private void readBody(Map<String, Object> desc) {
    scope = scopesByName.get(asString(desc.get("name"), "scope name"));
    blocksById = new LinkedHashMap<>();
    schedule.clear();

    for (String workerName : asStringList(desc.getOrDefault("workers", List.of()), "workers"))
      scope.appendWorker(findScope(workerName));

    List<Map<String, Object>> blockDescs = asMapList(desc.getOrDefault("blocks", List.of()), "blocks");
    for (Map<String, Object> blockDesc : blockDescs) {
      String id = asString(blockDesc.get("id"), "block id");
      if (blocksById.containsKey(id))
        throw malformed(scope, "duplicate block " + id);
      blocksById.put(id, scope.newBlock(asString(blockDesc.getOrDefault("nametag", "b"), "block nametag")));
    }
    for (Map<String, Object> blockDesc : blockDescs) {
      Block block = blocksById.get(asString(blockDesc.get("id"), "block id"));
      for (Map<String, Object> stmDesc : asMapList(blockDesc.getOrDefault("stms", List.of()), "statements"))
        block.appendStm(readStm(stmDesc));
      for (String succ : asStringList(blockDesc.getOrDefault("succs", List.of()), "succs"))
        block.connect(findBlock(succ));
      for (String succ : asStringList(blockDesc.getOrDefault("loop_succs", List.of()), "loop_succs"))
        block.connectLoop(findBlock(succ));
    }
    if (!blocksById.isEmpty()) {
      var blocks = new ArrayList<>(blocksById.values());
      scope.setEntryBlock(desc.containsKey("entry") ? findBlock(asString(desc.get("entry"), "entry")) : blocks.get(0));
      scope.setExitBlock(desc.containsKey("exit") ? findBlock(asString(desc.get("exit"), "exit")) : blocks.get(blocks.size() - 1));
    }

    if (desc.containsKey("region")) {
      Map<String, Object> regionDesc = asMap(desc.get("region"), "region");
      var top = SchedulingRegion.createTop(scope, findBlocks(regionDesc.get("blocks")), readMode(regionDesc));
      readChildRegions(top, regionDesc);
      assignNodes(top);
    } else if (!schedule.isEmpty()) {
      logger.warn("Scope {} has scheduled statements but no region; the schedule is ignored", scope.getName());
    }
  }

  private void readChildRegions(SchedulingRegion parent, Map<String, Object> regionDesc) {
    for (Map<String, Object> childDesc : asMapList(regionDesc.getOrDefault("children", List.of()), "region children")) {
      String name = asString(childDesc.getOrDefault("name", String.format("%s_%d", parent.getName(), parent.getChildren().size())),
                             "region name");
      Optional<LoopInfo> loop = Optional.empty();
      if (childDesc.containsKey("loop"))
        loop = Optional.of(readLoopInfo(asMap(childDesc.get("loop"), "loop")));
      var child = parent.createChild(name, findBlocks(childDesc.get("blocks")), readMode(childDesc), loop);
      readChildRegions(child, childDesc);
    }
  }

  private SchedulingMode readMode(Map<String, Object> regionDesc) {
    String modeName = asString(regionDesc.getOrDefault("mode", SchedulingMode.STATE_MACHINE.serialName), "region mode");
    return SchedulingMode.fromSerialName(modeName).orElseThrow(() -> malformed(scope, "unknown scheduling mode " + modeName));
  }

  private LoopInfo readLoopInfo(Map<String, Object> desc) {
    Block head = findBlock(asString(desc.get("head"), "loop head"));
    List<Block> bodies = findBlocks(desc.getOrDefault("bodies", List.of()));
    Symbol cond = findSym(scope, asString(desc.get("cond"), "loop condition"));
    Symbol counter = findSym(scope, asString(desc.get("counter"), "loop counter"));
    IRExp init = readExp(desc.getOrDefault("init", 0));
    Block exit = findBlock(asString(desc.get("exit"), "loop exit"));
    return new LoopInfo(head, bodies, cond, counter, init, exit);
  }

  /** Hands each scheduled statement to the innermost region owning its block. */
  private void assignNodes(SchedulingRegion top) {
    var owner = new HashMap<Block, SchedulingRegion>();
    var pending = new ArrayList<SchedulingRegion>(List.of(top));
    while (!pending.isEmpty()) {
      SchedulingRegion region = pending.remove(pending.size() - 1);
      region.getBlocks().forEach(block -> owner.put(block, region));
      pending.addAll(region.getChildren());
    }
    for (var entry : schedule.entrySet()) {
      SchedulingRegion region = owner.get(entry.getKey().getBlock());
      if (region == null) {
        logger.warn("Statement '{}' of {} is outside every region; ignoring its schedule", entry.getKey(), scope.getName());
        continue;
      }
      region.addNode(entry.getValue());
    }
  }

  //////////   statements   //////////

  private IRStm readStm(Map<String, Object> desc) {
    List<String> kinds = desc.keySet().stream().filter(key -> !STM_META_KEYS.contains(key)).collect(Collectors.toList());
    if (kinds.size() != 1)
      throw malformed(scope, "statement needs exactly one kind, got " + kinds);
    String kind = kinds.get(0);
    Object arg = desc.get(kind);
    IRStm stm;
    switch (kind) {
    case "move": {
      List<Object> args = asList(arg, 2, kind);
      stm = new Move(store(args.get(0)), readExp(args.get(1)));
      break;
    }
    case "cmove": {
      List<Object> args = asList(arg, 3, kind);
      stm = new CMove(readExp(args.get(0)), store(args.get(1)), readExp(args.get(2)));
      break;
    }
    case "expr":
      stm = new Expr(readExp(arg));
      break;
    case "cexpr": {
      List<Object> args = asList(arg, 2, kind);
      stm = new CExpr(readExp(args.get(0)), readExp(args.get(1)));
      break;
    }
    case "cjump": {
      List<Object> args = asList(arg, 3, kind);
      stm = new CJump(readExp(args.get(0)), findBlock(asString(args.get(1), kind)), findBlock(asString(args.get(2), kind)));
      break;
    }
    case "mcjump": {
      Map<String, Object> map = asMap(arg, kind);
      List<IRExp> conds = asList(map.get("conds"), -1, kind).stream().map(this::readExp).collect(Collectors.toList());
      List<Block> targets = findBlocks(map.get("targets"));
      if (conds.size() != targets.size())
        throw malformed(scope, "mcjump needs one target per condition");
      stm = new MCJump(conds, targets);
      break;
    }
    case "jump":
      if (arg instanceof Map) {
        Map<String, Object> map = asMap(arg, kind);
        stm = new Jump(findBlock(asString(map.get("target"), kind)), asBool(map.getOrDefault("loop", false), kind));
      } else {
        stm = new Jump(findBlock(asString(arg, kind)));
      }
      break;
    case "ret":
      stm = new Ret(readExp(arg));
      break;
    case "phi": {
      Map<String, Object> map = asMap(arg, kind);
      Phi phi = new Phi(store(map.get("var")));
      for (Object phiArg : asList(map.getOrDefault("args", List.of()), -1, kind)) {
        List<Object> pair = asList(phiArg, 2, "phi argument");
        phi.addArg(Temp.load(findSym(scope, asString(pair.get(0), kind))), findBlock(asString(pair.get(1), kind)));
      }
      for (Object p : asList(map.getOrDefault("ps", List.of()), -1, kind))
        phi.getPs().add(readExp(p));
      stm = phi;
      break;
    }
    default:
      throw malformed(scope, "unknown statement kind " + kind);
    }
    stm.setLineno(asInt(desc.getOrDefault("line", -1), "line"));
    if (desc.containsKey("begin")) {
      var node = new ScheduledNode(stm, asInt(desc.get("begin"), "begin"), asInt(desc.getOrDefault("latency", 1), "latency"),
                                   asInt(desc.getOrDefault("instance", 0), "instance"));
      schedule.put(stm, node);
    }
    return stm;
  }

  //////////   expressions   //////////

  private IRExp readExp(Object node) {
    if (node instanceof Number)
      return new Const(((Number)node).longValue());
    if (node instanceof Boolean)
      return new Const((Boolean)node ? 1 : 0);
    if (node instanceof String)
      return Temp.load(findSym(scope, (String)node));
    Map<String, Object> map = asMap(node, "expression");
    if (map.size() != 1)
      throw malformed(scope, "expression needs exactly one kind, got " + map.keySet());
    var entry = map.entrySet().iterator().next();
    String kind = entry.getKey();
    Object arg = entry.getValue();
    switch (kind) {
    case "const":
      return new Const(asLong(arg, kind));
    case "temp":
      return Temp.load(findSym(scope, asString(arg, kind)));
    case "unop": {
      List<Object> args = asList(arg, 2, kind);
      return new UnOp(readOp(args.get(0)), readExp(args.get(1)));
    }
    case "binop": {
      List<Object> args = asList(arg, 3, kind);
      return new BinOp(readOp(args.get(0)), readExp(args.get(1)), readExp(args.get(2)));
    }
    case "condop": {
      List<Object> args = asList(arg, 3, kind);
      return new CondOp(readExp(args.get(0)), readExp(args.get(1)), readExp(args.get(2)));
    }
    case "call": {
      Map<String, Object> call = asMap(arg, kind);
      Scope callee = findScope(asString(call.get("callee"), "callee"));
      scope.addCallee(callee);
      return new Call(callee, readExps(call.getOrDefault("args", List.of())));
    }
    case "syscall": {
      Map<String, Object> call = asMap(arg, kind);
      return new SysCall(asString(call.get("name"), "syscall name"), readExps(call.getOrDefault("args", List.of())));
    }
    case "mref": {
      List<Object> args = asList(arg, 2, kind);
      return new MRef(Temp.load(findSym(scope, asString(args.get(0), kind))), readExp(args.get(1)));
    }
    case "mstore": {
      List<Object> args = asList(arg, 3, kind);
      return new MStore(Temp.load(findSym(scope, asString(args.get(0), kind))), readExp(args.get(1)), readExp(args.get(2)));
    }
    case "array": {
      Map<String, Object> array = asMap(arg, kind);
      return new Array(readExps(array.getOrDefault("items", List.of())), readExp(array.getOrDefault("repeat", 1)));
    }
    case "port_read":
      return new PortRead(Temp.load(findSym(scope, asString(arg, kind))));
    case "port_write": {
      List<Object> args = asList(arg, 2, kind);
      return new PortWrite(Temp.load(findSym(scope, asString(args.get(0), kind))), readExp(args.get(1)));
    }
    default:
      throw malformed(scope, "unknown expression kind " + kind);
    }
  }

  private List<IRExp> readExps(Object node) {
    return asList(node, -1, "arguments").stream().map(this::readExp).collect(Collectors.toList());
  }

  private Op readOp(Object node) {
    String name = asString(node, "operator");
    return Op.fromSerialName(name).orElseThrow(() -> CompileException.of(Errors.UNSUPPORTED_OPERATOR, scope.getName(), name));
  }

  private Temp store(Object node) { return Temp.store(findSym(scope, asString(node, "destination"))); }

  //////////   lookups   //////////

  private Symbol findSym(Scope owner, String name) {
    return owner.findSym(name).orElseThrow(() -> malformed(owner, String.format("unknown symbol %s", name)));
  }

  private Scope findScope(String name) {
    Scope found = scopesByName.get(name);
    if (found == null)
      throw malformed(scope, "unknown scope " + name);
    return found;
  }

  private Block findBlock(String id) {
    Block block = blocksById.get(id);
    if (block == null)
      throw malformed(scope, "unknown block " + id);
    return block;
  }

  private List<Block> findBlocks(Object node) {
    return asStringList(node == null ? List.of() : node, "block list").stream().map(this::findBlock).collect(Collectors.toList());
  }

  //////////   YAML node access   //////////

  private static CompileException malformed(Scope where, String detail) {
    return CompileException.of(Errors.MALFORMED_INPUT, where == null ? null : where.getName(), detail);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object node, String what) {
    if (!(node instanceof Map))
      throw malformed(null, String.format("%s must be a map, got %s", what, node));
    return (Map<String, Object>)node;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> asList(Object node, int size, String what) {
    if (!(node instanceof List))
      throw malformed(null, String.format("%s must be a list, got %s", what, node));
    List<Object> list = (List<Object>)node;
    if (size >= 0 && list.size() != size)
      throw malformed(null, String.format("%s needs %d entries, got %d", what, size, list.size()));
    return list;
  }

  private static List<Map<String, Object>> asMapList(Object node, String what) {
    return asList(node, -1, what).stream().map(item -> asMap(item, what)).collect(Collectors.toList());
  }

  private static List<String> asStringList(Object node, String what) {
    return asList(node, -1, what).stream().map(item -> asString(item, what)).collect(Collectors.toList());
  }

  private static String asString(Object node, String what) {
    if (node == null)
      throw malformed(null, what + " is missing");
    return node.toString();
  }

  private static long asLong(Object node, String what) {
    if (!(node instanceof Number))
      throw malformed(null, String.format("%s must be a number, got %s", what, node));
    return ((Number)node).longValue();
  }

  private static int asInt(Object node, String what) { return (int)asLong(node, what); }

  private static boolean asBool(Object node, String what) {
    if (!(node instanceof Boolean))
      throw malformed(null, String.format("%s must be true or false, got %s", what, node));
    return (Boolean)node;
  }
}

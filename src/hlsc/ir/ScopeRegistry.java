package hlsc.ir;

import hlsc.ir.Scope.ScopeTag;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns every scope of one compilation, rooted at the global scope {@value #GLOBAL_NAME}.
 */
public class ScopeRegistry {
  public static final String GLOBAL_NAME = "@top";

  private final LinkedHashMap<String, Scope> scopes = new LinkedHashMap<>();
  private final Scope global;

  public ScopeRegistry() {
    global = new Scope(this, null, GLOBAL_NAME, EnumSet.of(ScopeTag.Global, ScopeTag.Namespace), -1);
    scopes.put(global.getName(), global);
  }

  public Scope getGlobal() { return global; }

  /**
   * Creates a new scope below {@code parent} (the global scope if null).
   */
  public Scope createScope(Scope parent, String name, EnumSet<ScopeTag> tags, int lineno) {
    Scope scope = new Scope(this, parent == null ? global : parent, name, tags, lineno);
    if (scopes.containsKey(scope.getName()))
      throw new IllegalArgumentException("duplicate scope " + scope.getName());
    scopes.put(scope.getName(), scope);
    return scope;
  }

  public Optional<Scope> find(String qualifiedName) { return Optional.ofNullable(scopes.get(qualifiedName)); }

  public void remove(Scope scope) { scopes.remove(scope.getName()); }

  public List<Scope> getAll() { return Collections.unmodifiableList(new ArrayList<>(scopes.values())); }

  /**
   * Returns the scopes ordered by nesting and the call graph: a scope comes after every scope that contains or
   * calls it. {@code bottomUp} reverses this so callees are processed before callers.
   */
  public List<Scope> getScopes(boolean bottomUp, boolean withGlobal, boolean withClass, boolean withLib) {
    Map<Scope, Integer> order = computeOrder();
    var creationIdx = new HashMap<Scope, Integer>();
    int idx = 0;
    for (Scope s : scopes.values())
      creationIdx.put(s, idx++);
    Comparator<Scope> cmp = Comparator.comparing((Scope s) -> order.get(s)).thenComparing(s -> creationIdx.get(s));
    if (bottomUp)
      cmp = cmp.reversed();
    return scopes.values()
        .stream()
        .filter(s -> withGlobal || !s.isGlobal())
        .filter(s -> withClass || !s.isClass() || s.isModule())
        .filter(s -> withLib || !s.isLib())
        .sorted(cmp)
        .collect(Collectors.toList());
  }

  private Map<Scope, Integer> computeOrder() {
    var order = new HashMap<Scope, Integer>();
    scopes.values().forEach(s -> order.put(s, 0));
    for (Scope s : scopes.values()) {
      if (s.getParent().isEmpty() || s.getCallers().isEmpty())
        propagateOrder(s, order, new HashSet<>());
    }
    return order;
  }

  private void propagateOrder(Scope scope, Map<Scope, Integer> order, Set<Scope> onPath) {
    if (!onPath.add(scope))
      return; // recursion in the call graph
    int next = order.get(scope) + 1;
    var successors = new ArrayList<Scope>(scope.getChildren());
    successors.addAll(scope.getCallees());
    for (Scope succ : successors) {
      if (!order.containsKey(succ))
        continue;
      if (order.get(succ) < next) {
        order.put(succ, next);
        propagateOrder(succ, order, onPath);
      }
    }
    onPath.remove(scope);
  }
}

package hlsc.ir;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A named storage location owned by a {@link Scope}.
 * Symbols are created through the owning scope only.
 */
public class Symbol {
  public enum SymbolTag {
    Temp("temp"),
    Param("param"),
    Return("return"),
    Condition("condition"),
    Induction("induction"),
    Alias("alias"),
    Function("function"),
    Field("field"),
    Static("static");

    public final String serialName;

    private SymbolTag(String serialName) { this.serialName = serialName; }
    public static Optional<SymbolTag> fromSerialName(String serialName) {
      return Stream.of(SymbolTag.values()).filter(tag -> tag.serialName.equals(serialName)).findAny();
    }
  }

  /** Tags of symbols that are single-assignment by construction and never versioned. */
  public static final Set<SymbolTag> SINGLE_ASSIGNMENT_TAGS =
      Collections.unmodifiableSet(EnumSet.of(SymbolTag.Temp, SymbolTag.Param, SymbolTag.Condition, SymbolTag.Function));

  private final Scope scope;
  private String name;
  private Type type;
  private final EnumSet<SymbolTag> tags;
  private Symbol ancestor = null;

  Symbol(Scope scope, String name, EnumSet<SymbolTag> tags, Type type) {
    this.scope = scope;
    this.name = name;
    this.tags = tags.clone();
    this.type = type;
  }

  public Scope getScope() { return scope; }
  public String getName() { return name; }
  void setName(String name) { this.name = name; }

  /** The name with characters that are illegal in HDL identifiers replaced. */
  public String hdlName() { return name.replace('#', '_').replace('.', '_').replace('@', '_'); }

  public Type getType() { return type; }
  public void setType(Type type) { this.type = type; }

  public Set<SymbolTag> getTags() { return Collections.unmodifiableSet(tags); }
  public EnumSet<SymbolTag> copyTags() { return tags.clone(); }
  public boolean hasTag(SymbolTag tag) { return tags.contains(tag); }
  public void addTag(SymbolTag tag) { tags.add(tag); }
  public void removeTag(SymbolTag tag) { tags.remove(tag); }

  public boolean isTemp() { return tags.contains(SymbolTag.Temp); }
  public boolean isParam() { return tags.contains(SymbolTag.Param); }
  public boolean isReturn() { return tags.contains(SymbolTag.Return); }
  public boolean isCondition() { return tags.contains(SymbolTag.Condition); }
  public boolean isInduction() { return tags.contains(SymbolTag.Induction); }
  public boolean isAlias() { return tags.contains(SymbolTag.Alias); }
  public boolean isField() { return tags.contains(SymbolTag.Field); }

  /** True if the symbol is exempt from SSA renaming. */
  public boolean isSingleAssignment() {
    return tags.stream().anyMatch(SINGLE_ASSIGNMENT_TAGS::contains) || type.isFunction();
  }

  /** The pre-SSA symbol this one was versioned from, if any. */
  public Optional<Symbol> getAncestor() { return Optional.ofNullable(ancestor); }
  void setAncestor(Symbol ancestor) { this.ancestor = ancestor; }

  /** Follows the ancestor chain to the original symbol. */
  public Symbol rootSym() {
    Symbol sym = this;
    while (sym.ancestor != null)
      sym = sym.ancestor;
    return sym;
  }

  @Override
  public String toString() {
    return name;
  }
}

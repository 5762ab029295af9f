package hlsc.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Sequence literal {@code [items] * repeat}. */
public class Array extends IRExp {
  private final List<IRExp> items;
  private IRExp repeat;

  public Array(List<IRExp> items, IRExp repeat) {
    this.items = new ArrayList<>(items);
    this.repeat = repeat;
  }

  public List<IRExp> getItems() { return items; }
  public IRExp getRepeat() { return repeat; }
  public void setRepeat(IRExp repeat) { this.repeat = repeat; }

  @Override
  public <R> R accept(IRVisitor<R> visitor) {
    return visitor.visitArray(this);
  }
  @Override
  public IRExp copy() {
    return withLine(new Array(items.stream().map(IRExp::copy).collect(Collectors.toList()), repeat.copy()));
  }
  @Override
  public String toString() {
    return String.format("[%s] * %s", items.stream().map(Object::toString).collect(Collectors.joining(", ")), repeat);
  }
}

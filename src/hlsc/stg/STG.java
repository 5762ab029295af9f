package hlsc.stg;

import hlsc.ahdl.AHDLStm;
import hlsc.ir.Scope;
import hlsc.schedule.SchedulingMode;
import hlsc.schedule.SchedulingRegion;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * State-transition graph of one scheduling region.
 */
public class STG {
  private final String name;
  private STG parent;
  private final Scope scope;
  private final SchedulingRegion region;
  private final List<State> states = new ArrayList<>();
  private State initState = null;
  private State finishState = null;

  public STG(String name, Scope scope, SchedulingRegion region) {
    this.name = name;
    this.scope = scope;
    this.region = region;
  }

  public String getName() { return name; }
  public Scope getScope() { return scope; }
  public SchedulingRegion getRegion() { return region; }
  public SchedulingMode getMode() { return region.getMode(); }

  public Optional<STG> getParent() { return Optional.ofNullable(parent); }
  void setParent(STG parent) { this.parent = parent; }
  /** True for the STG of the scope's top-level region. */
  public boolean isMain() { return region.isTop(); }

  public State newState(String stateName, int step, List<AHDLStm> codes) { return new State(stateName, step, codes, this); }

  public List<State> getStates() { return Collections.unmodifiableList(states); }
  public void addState(State state) { states.add(state); }

  public State getInitState() { return initState; }
  public void setInitState(State initState) { this.initState = initState; }
  public State getFinishState() { return finishState; }
  public void setFinishState(State finishState) { this.finishState = finishState; }

  @Override
  public String toString() {
    var sb = new StringBuilder();
    sb.append(String.format("STG %s (%s)%s\n", name, region.getMode().serialName,
                            parent == null ? "" : " parent " + parent.name));
    if (initState != null)
      sb.append("init ").append(initState.getName()).append(", finish ").append(finishState.getName()).append("\n");
    for (State state : states)
      sb.append(state);
    return sb.toString();
  }
}

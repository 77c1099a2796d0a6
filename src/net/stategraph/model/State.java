package net.stategraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.stategraph.util.NamedValue;

/**
 * A single state of a state diagram.
 * A state may own a nested diagram of substates, in which case it is a
 * superstate. The enclosing superstate is not referenced directly; it is
 * identified by the scope path, i.e. the names of all enclosing
 * superstates starting from the root diagram.
 */
public class State implements NamedValue {

    private final String name;
    private final List<String> attributes;
    private final List<State> sources;
    private final List<State> destinations;
    private List<String> scopePath;
    private Diagram substates;
    private boolean declared;
    private boolean active;

    protected State(String name, List<String> scopePath) {
        if (name == null)
            throw new NullPointerException("State name may not be null");
        if (scopePath == null)
            throw new NullPointerException(
                "State scope path may not be null");
        this.name = name;
        this.attributes = new ArrayList<String>();
        this.sources = new ArrayList<State>();
        this.destinations = new ArrayList<State>();
        this.declared = false;
        this.active = false;
        setScopePath(scopePath);
    }

    private void setScopePath(List<String> path) {
        scopePath = Collections.unmodifiableList(
            new ArrayList<String>(path));
        List<String> childPath = new ArrayList<String>(path);
        childPath.add(name);
        substates = new Diagram(childPath);
    }

    /* Re-home a state that only transitions have mentioned so far. */
    protected void moveTo(List<String> path) {
        if (declared || hasSubstates())
            throw new IllegalStateException("Cannot move state " + this);
        setScopePath(path);
    }

    public String toString() {
        if (scopePath.isEmpty()) return name;
        StringBuilder sb = new StringBuilder();
        for (String n : scopePath) sb.append(n).append('.');
        return sb.append(name).toString();
    }

    /**
     * The name of this state; unique within its enclosing diagram.
     */
    public String getName() {
        return name;
    }

    /**
     * The names of the enclosing superstates, outermost first.
     * Empty for states declared at the top level of the root diagram.
     */
    public List<String> getScopePath() {
        return scopePath;
    }

    /**
     * The name of the directly enclosing superstate, or null if there is
     * none.
     */
    public String getParentName() {
        if (scopePath.isEmpty()) return null;
        return scopePath.get(scopePath.size() - 1);
    }

    public List<String> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }
    public void addAttribute(String attribute) {
        if (attribute == null)
            throw new NullPointerException(
                "State attribute may not be null");
        attributes.add(attribute);
    }

    /**
     * The diagram holding the substates of this state.
     * The diagram is empty unless this state is a superstate.
     */
    public Diagram getSubstates() {
        return substates;
    }

    public int getSubstateCount() {
        return substates.getStateCount();
    }

    public boolean hasSubstates() {
        return getSubstateCount() > 0;
    }

    public List<String> getSubstateNames() {
        List<String> ret = new ArrayList<String>();
        for (State st : substates.getTopLevel()) ret.add(st.getName());
        return ret;
    }

    /**
     * States with a transition into this one.
     */
    public List<State> getSources() {
        return Collections.unmodifiableList(sources);
    }
    protected void addSource(State source) {
        if (source == null)
            throw new NullPointerException(
                "Transition source may not be null");
        sources.add(source);
    }

    /**
     * States this one has a transition to.
     */
    public List<State> getDestinations() {
        return Collections.unmodifiableList(destinations);
    }
    protected void addDestination(State destination) {
        if (destination == null)
            throw new NullPointerException(
                "Transition destination may not be null");
        destinations.add(destination);
    }

    /**
     * Whether no transition leads into this state.
     * Only transitions recorded on this state are considered; see
     * {@link Diagram#isStartState(State, boolean)} for the form that
     * takes enclosing superstates into account.
     */
    public boolean isStartState() {
        return sources.isEmpty();
    }

    /**
     * Whether no transition leaves this state.
     */
    public boolean isEndState() {
        return destinations.isEmpty();
    }

    /**
     * Whether this state has been declared explicitly, as opposed to
     * having been created implicitly as a transition endpoint.
     */
    public boolean isDeclared() {
        return declared;
    }
    protected void declare() {
        declared = true;
    }

    public boolean isActive() {
        return active;
    }
    public void activate() {
        active = true;
    }
    public void deactivate() {
        active = false;
    }

}

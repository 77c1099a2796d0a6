package net.stategraph.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * A (possibly nested) state diagram.
 * A diagram owns the states declared directly in it, the transitions
 * declared at its scope and the edges those transitions induce. Nested
 * diagrams are owned by superstates; see {@link State#getSubstates()}.
 */
public class Diagram {

    /**
     * The canonical name of the shared state standing in for the start
     * marker when it is used as a transition source.
     */
    public static final String START = "START";

    /**
     * The canonical name of the shared state standing in for the end
     * marker when it is used as a transition destination.
     */
    public static final String END = "END";

    /**
     * The default notation for the anonymous start/end marker.
     */
    public static final String DEFAULT_MARKER = "[*]";

    private static final Logger LOGGER = Logger.getLogger("Diagram");

    private final List<String> scopePath;
    private final Map<String, State> states;
    private final List<State> topLevel;
    private final List<Transition> transitions;
    private final Map<Edge, List<Transition>> edges;
    private String marker;

    public Diagram() {
        this(Collections.<String>emptyList());
    }
    protected Diagram(List<String> scopePath) {
        this.scopePath = Collections.unmodifiableList(
            new ArrayList<String>(scopePath));
        this.states = new LinkedHashMap<String, State>();
        this.topLevel = new ArrayList<State>();
        this.transitions = new ArrayList<Transition>();
        this.edges = new LinkedHashMap<Edge, List<Transition>>();
        this.marker = DEFAULT_MARKER;
    }

    public String toString() {
        return String.format("%s@%h[scope=%s,states=%s,transitions=%s]",
            getClass().getName(), this, scopePath, states.size(),
            transitions.size());
    }

    /**
     * The names of the superstates enclosing this diagram, outermost
     * first; empty for a root diagram.
     */
    public List<String> getScopePath() {
        return scopePath;
    }

    /**
     * The literal that denotes the start marker as a transition source
     * and the end marker as a transition destination.
     */
    public String getMarker() {
        return marker;
    }
    public void setMarker(String m) {
        if (m == null)
            throw new NullPointerException("Marker may not be null");
        marker = m;
    }

    public boolean hasState(String name) {
        return states.containsKey(name);
    }

    /**
     * Look up a state declared directly in this diagram.
     *
     * @throws NoSuchStateException if there is no such state
     */
    public State getState(String name) throws NoSuchStateException {
        State ret = states.get(name);
        if (ret == null) throw new NoSuchStateException(name);
        return ret;
    }

    /**
     * The states declared directly in this diagram, in declaration order.
     */
    public List<State> getTopLevel() {
        return Collections.unmodifiableList(topLevel);
    }

    public int getStateCount() {
        return states.size();
    }

    /**
     * All states of this diagram and of every nested diagram, each
     * superstate preceding its substates.
     */
    public List<State> getAllStates() {
        List<State> ret = new ArrayList<State>();
        collectStates(ret);
        return ret;
    }
    private void collectStates(List<State> drain) {
        for (State st : topLevel) {
            drain.add(st);
            st.getSubstates().collectStates(drain);
        }
    }

    /**
     * Declare a state.
     * If parent is null, the state is declared in this diagram; otherwise,
     * it becomes a substate of parent (which must be part of this
     * diagram's tree). Re-declaring a state returns the existing instance,
     * with the given attributes appended. A state previously created by a
     * transition inside a nested scope is moved into the declaring scope.
     */
    public State addState(String name, State parent,
                          Collection<String> attrs) {
        if (name == null)
            throw new NullPointerException("State name may not be null");
        Diagram scope = scopeChain(parent).get(0);
        State ret = scope.states.get(name);
        if (ret == null) ret = scope.adopt(name);
        if (ret == null) ret = scope.createState(name);
        ret.declare();
        if (attrs != null) {
            for (String a : attrs) ret.addAttribute(a);
        }
        return ret;
    }
    public State addState(String name, State parent) {
        return addState(name, parent, null);
    }
    public State addState(String name) {
        return addState(name, null, null);
    }

    public void addStateAttribute(String name, String attribute)
            throws NoSuchStateException {
        getState(name).addAttribute(attribute);
    }

    /**
     * Declare a transition.
     * The marker is rewritten to {@link #START} as a source and to
     * {@link #END} as a destination. Other endpoint names are looked up
     * in the transition's scope first and then in the enclosing scopes.
     * Failing that, an implicitly created state of that name in a nested
     * scope is moved into the innermost scope enclosing both references;
     * endpoints not found anywhere (as well as the start/end states) are
     * created in the transition's scope.
     *
     * @param parent The superstate in whose scope the transition is
     *               declared, or null for this diagram's own scope.
     */
    public Transition addTransition(String source, String dest,
                                    State parent, Collection<String> attrs) {
        if (source == null)
            throw new NullPointerException(
                "Transition source may not be null");
        if (dest == null)
            throw new NullPointerException(
                "Transition destination may not be null");
        if (source.equals(marker)) source = START;
        if (dest.equals(marker)) dest = END;
        List<Diagram> chain = scopeChain(parent);
        Diagram scope = chain.get(0);
        State src = resolve(chain, source);
        State dst = resolve(chain, dest);
        Transition ret = new Transition(src, dst,
            (attrs == null) ? null : new ArrayList<String>(attrs));
        scope.transitions.add(ret);
        Edge edge = new Edge(src, dst);
        List<Transition> owners = scope.edges.get(edge);
        if (owners == null) {
            owners = new ArrayList<Transition>();
            scope.edges.put(edge, owners);
        }
        owners.add(ret);
        src.addDestination(dst);
        dst.addSource(src);
        LOGGER.finer("Added transition " + ret);
        return ret;
    }
    public Transition addTransition(String source, String dest,
                                    State parent) {
        return addTransition(source, dest, parent, null);
    }
    public Transition addTransition(String source, String dest) {
        return addTransition(source, dest, null, null);
    }

    private State resolve(List<Diagram> chain, String name) {
        Diagram scope = chain.get(0);
        if (name.equals(START) || name.equals(END))
            return scope.createState(name);
        for (Diagram d : chain) {
            State st = d.states.get(name);
            if (st != null) return st;
        }
        for (Diagram d : chain) {
            State st = d.adopt(name);
            if (st != null) return st;
        }
        return scope.createState(name);
    }

    private State createState(String name) {
        State ret = states.get(name);
        if (ret != null) return ret;
        ret = new State(name, scopePath);
        states.put(name, ret);
        topLevel.add(ret);
        LOGGER.finer("Added state " + ret);
        return ret;
    }

    /* Move an undeclared leaf state called name from anywhere below this
     * diagram into it; return null if there is none. */
    private State adopt(String name) {
        if (name.equals(START) || name.equals(END)) return null;
        Diagram owner = findImplicitOwner(name);
        if (owner == null) return null;
        State ret = owner.states.remove(name);
        owner.topLevel.remove(ret);
        List<String> from = ret.getScopePath();
        ret.moveTo(scopePath);
        states.put(name, ret);
        topLevel.add(ret);
        LOGGER.fine("Moved state " + name + " from scope " + from +
                    " to scope " + scopePath);
        return ret;
    }

    private Diagram findImplicitOwner(String name) {
        for (State st : topLevel) {
            Diagram sub = st.getSubstates();
            State found = sub.states.get(name);
            if (found != null && ! found.isDeclared() &&
                    ! found.hasSubstates())
                return sub;
            Diagram ret = sub.findImplicitOwner(name);
            if (ret != null) return ret;
        }
        return null;
    }

    /* Return the diagrams from the scope of parent (inclusive) outwards
     * up to this diagram (inclusive). */
    private List<Diagram> scopeChain(State parent) {
        List<Diagram> ret = new ArrayList<Diagram>();
        ret.add(this);
        if (parent == null) return ret;
        List<String> path = new ArrayList<String>(
            relativePath(parent.getScopePath()));
        path.add(parent.getName());
        Diagram d = this;
        State st = null;
        for (String n : path) {
            st = d.states.get(n);
            if (st == null) break;
            d = st.getSubstates();
            ret.add(0, d);
        }
        if (st != parent)
            throw new IllegalArgumentException("State " + parent +
                " is not part of this diagram");
        return ret;
    }

    private List<String> relativePath(List<String> path) {
        int base = scopePath.size();
        if (path.size() < base || ! path.subList(0, base).equals(scopePath))
            throw new IllegalArgumentException("Scope " + path +
                " lies outside of diagram scope " + scopePath);
        return path.subList(base, path.size());
    }

    /* Return the enclosing superstate of st, or null if st is declared
     * directly in this diagram. */
    private State findParent(State st) {
        List<String> path = relativePath(st.getScopePath());
        if (path.isEmpty()) return null;
        Diagram d = this;
        State ret = null;
        for (String n : path) {
            ret = d.getState(n);
            d = ret.getSubstates();
        }
        return ret;
    }

    /**
     * Whether st is a start state.
     * In local scope, this is {@link State#isStartState()}. In global
     * scope, st must additionally have no enclosing superstate within
     * this diagram, or the enclosing superstate must itself be a start
     * state in global scope.
     */
    public boolean isStartState(State st, boolean globalScope) {
        boolean local = st.isStartState();
        if (! globalScope || ! local) return local;
        State parent = findParent(st);
        return (parent == null || isStartState(parent, true));
    }

    /**
     * Whether st is an end state; the counterpart of
     * {@link #isStartState(State, boolean)}.
     */
    public boolean isEndState(State st, boolean globalScope) {
        boolean local = st.isEndState();
        if (! globalScope || ! local) return local;
        State parent = findParent(st);
        return (parent == null || isEndState(parent, true));
    }

    public List<State> getStartStates() {
        List<State> ret = new ArrayList<State>();
        for (State st : topLevel) {
            if (st.isStartState()) ret.add(st);
        }
        return ret;
    }

    public List<State> getEndStates() {
        List<State> ret = new ArrayList<State>();
        for (State st : topLevel) {
            if (st.isEndState()) ret.add(st);
        }
        return ret;
    }

    public int getTransitionCount() {
        return transitions.size();
    }

    /**
     * The transitions declared at this diagram's scope.
     */
    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    /**
     * The transitions declared at this scope that have source among their
     * sources and dest among their destinations. Either filter may be
     * null.
     */
    public List<Transition> getTransitions(State source, State dest) {
        List<Transition> ret = new ArrayList<Transition>();
        for (Transition t : transitions) {
            if (source != null && ! t.getSources().contains(source))
                continue;
            if (dest != null && ! t.getDestinations().contains(dest))
                continue;
            ret.add(t);
        }
        return ret;
    }

    /**
     * Name-based variant of {@link #getTransitions(State, State)}.
     *
     * @throws NoSuchStateException if a non-null name does not denote a
     *                              state of this diagram
     */
    public List<Transition> getTransitions(String source, String dest)
            throws NoSuchStateException {
        return getTransitions(
            (source == null) ? null : getState(source),
            (dest == null) ? null : getState(dest));
    }

    /**
     * The transitions of this diagram and of every nested diagram.
     */
    public List<Transition> getAllTransitions() {
        List<Transition> ret = new ArrayList<Transition>(transitions);
        for (State st : topLevel)
            ret.addAll(st.getSubstates().getAllTransitions());
        return ret;
    }

    public Set<Edge> getEdges() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    /**
     * The transitions inducing the given edge at this scope.
     */
    public List<Transition> getEdgeTransitions(Edge edge) {
        List<Transition> ret = edges.get(edge);
        if (ret == null) return Collections.emptyList();
        return Collections.unmodifiableList(ret);
    }

    /**
     * Collapse all superstates into a single flat graph.
     * This diagram is left unchanged.
     */
    public FlatGraph flattenGraph() {
        return new GraphFlattener().flatten(this);
    }

}

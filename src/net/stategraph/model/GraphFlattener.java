package net.stategraph.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Collapses the superstates of a diagram into a single flat graph.
 * Leaf states (those without substates) become nodes. An edge leading
 * into a superstate is replaced by edges into each of the superstate's
 * internal start states, and an edge leaving a superstate by edges out
 * of each of its internal end states, recursively; the superstates
 * themselves do not appear in the result.
 */
public class GraphFlattener {

    private static final Logger LOGGER = Logger.getLogger("GraphFlattener");

    public FlatGraph flatten(Diagram diagram) {
        FlatGraph.Builder drain = new FlatGraph.Builder();
        collect(diagram, drain);
        FlatGraph ret = drain.build();
        LOGGER.fine("Flattened diagram into " + ret.getNodeCount() +
                    " nodes and " + ret.getEdgeCount() + " edges");
        return ret;
    }

    protected void collect(Diagram diagram, FlatGraph.Builder drain) {
        for (State st : diagram.getTopLevel()) {
            if (st.hasSubstates()) {
                LOGGER.finer("Collapsing superstate " + st);
                collect(st.getSubstates(), drain);
            } else {
                drain.addNode(st);
            }
        }
        for (Edge e : diagram.getEdges()) {
            for (State src : exits(e.getSource())) {
                for (State dst : entries(e.getDestination())) {
                    drain.addEdge(src, dst);
                }
            }
        }
    }

    /**
     * The leaf states through which st is entered.
     */
    protected Set<State> entries(State st) {
        if (! st.hasSubstates()) return Collections.singleton(st);
        Set<State> ret = new LinkedHashSet<State>();
        for (State sub : st.getSubstates().getTopLevel()) {
            if (sub.isStartState()) ret.addAll(entries(sub));
        }
        if (ret.isEmpty())
            LOGGER.warning("Superstate " + st + " has no start states; " +
                           "edges into it are dropped");
        return ret;
    }

    /**
     * The leaf states through which st is left.
     */
    protected Set<State> exits(State st) {
        if (! st.hasSubstates()) return Collections.singleton(st);
        Set<State> ret = new LinkedHashSet<State>();
        for (State sub : st.getSubstates().getTopLevel()) {
            if (sub.isEndState()) ret.addAll(exits(sub));
        }
        if (ret.isEmpty())
            LOGGER.warning("Superstate " + st + " has no end states; " +
                           "edges out of it are dropped");
        return ret;
    }

}

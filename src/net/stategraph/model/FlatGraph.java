package net.stategraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A directed graph of states without any nesting.
 * Instances are read-only; they are assembled by a {@link Builder}.
 */
public class FlatGraph {

    public static class Builder {

        private final Set<State> nodes;
        private final Set<Edge> edges;

        public Builder() {
            nodes = new LinkedHashSet<State>();
            edges = new LinkedHashSet<Edge>();
        }

        public boolean addNode(State st) {
            if (st == null)
                throw new NullPointerException("Node may not be null");
            return nodes.add(st);
        }

        /**
         * Add an edge, adding its endpoints as nodes if necessary.
         */
        public boolean addEdge(State source, State destination) {
            Edge e = new Edge(source, destination);
            nodes.add(source);
            nodes.add(destination);
            return edges.add(e);
        }

        public FlatGraph build() {
            return new FlatGraph(new ArrayList<State>(nodes),
                                 new ArrayList<Edge>(edges));
        }

    }

    private final List<State> nodes;
    private final List<Edge> edges;
    private final Map<State, List<State>> successors;
    private final Map<State, List<State>> predecessors;

    protected FlatGraph(List<State> nodes, List<Edge> edges) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
        this.successors = new LinkedHashMap<State, List<State>>();
        this.predecessors = new LinkedHashMap<State, List<State>>();
        for (State st : nodes) {
            successors.put(st, new ArrayList<State>());
            predecessors.put(st, new ArrayList<State>());
        }
        for (Edge e : edges) {
            successors.get(e.getSource()).add(e.getDestination());
            predecessors.get(e.getDestination()).add(e.getSource());
        }
    }

    public String toString() {
        return String.format("%s@%h[nodes=%s,edges=%s]",
            getClass().getName(), this, nodes, edges);
    }

    public List<State> getNodes() {
        return nodes;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    /**
     * The names of all nodes, in node order. Names need not be unique.
     */
    public List<String> getNodeNames() {
        List<String> ret = new ArrayList<String>();
        for (State st : nodes) ret.add(st.getName());
        return ret;
    }

    /**
     * All nodes with the given name.
     */
    public List<State> getNodes(String name) {
        List<State> ret = new ArrayList<State>();
        for (State st : nodes) {
            if (st.getName().equals(name)) ret.add(st);
        }
        return ret;
    }

    public boolean hasNode(State st) {
        return successors.containsKey(st);
    }
    public boolean hasNode(String name) {
        return ! getNodes(name).isEmpty();
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public int getEdgeCount() {
        return edges.size();
    }

    public boolean hasEdge(State source, State destination) {
        List<State> succ = successors.get(source);
        return (succ != null && succ.contains(destination));
    }

    /**
     * Whether there is an edge between any node named source and any node
     * named destination.
     */
    public boolean hasEdge(String source, String destination) {
        for (Edge e : edges) {
            if (e.getSource().getName().equals(source) &&
                    e.getDestination().getName().equals(destination))
                return true;
        }
        return false;
    }

    public List<State> getSuccessors(State st) {
        List<State> ret = successors.get(st);
        if (ret == null)
            throw new IllegalArgumentException("State " + st +
                " is not part of this graph");
        return Collections.unmodifiableList(ret);
    }

    public List<State> getPredecessors(State st) {
        List<State> ret = predecessors.get(st);
        if (ret == null)
            throw new IllegalArgumentException("State " + st +
                " is not part of this graph");
        return Collections.unmodifiableList(ret);
    }

}

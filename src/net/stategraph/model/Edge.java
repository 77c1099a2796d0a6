package net.stategraph.model;

/**
 * A directed edge between two states.
 * Edges compare their endpoints by identity, as same-named states may
 * exist in different scopes.
 */
public final class Edge {

    private final State source;
    private final State destination;

    public Edge(State source, State destination) {
        if (source == null)
            throw new NullPointerException("Edge source may not be null");
        if (destination == null)
            throw new NullPointerException(
                "Edge destination may not be null");
        this.source = source;
        this.destination = destination;
    }

    public String toString() {
        return source + " -> " + destination;
    }

    public boolean equals(Object other) {
        if (! (other instanceof Edge)) return false;
        Edge eo = (Edge) other;
        return (source == eo.getSource() &&
                destination == eo.getDestination());
    }

    public int hashCode() {
        return System.identityHashCode(source) * 31 ^
            System.identityHashCode(destination);
    }

    public State getSource() {
        return source;
    }

    public State getDestination() {
        return destination;
    }

}

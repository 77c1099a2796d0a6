package net.stategraph.model;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * JSON renditions of diagrams and flattened graphs.
 *
 * A diagram becomes an object with a "states" array (each state having a
 * "name", an "attributes" array and, for superstates, a nested
 * "substates" diagram) and a "transitions" array (each transition having
 * "sources", "destinations" and "attributes" arrays of names). A flat
 * graph becomes an object with "nodes" (qualified names) and "edges"
 * (pairs of qualified names).
 */
public final class DiagramExport {

    private DiagramExport() {}

    public static JSONObject toJSON(Diagram diagram) {
        JSONArray states = new JSONArray();
        for (State st : diagram.getTopLevel()) {
            states.put(toJSON(st));
        }
        JSONArray transitions = new JSONArray();
        for (Transition t : diagram.getTransitions()) {
            transitions.put(toJSON(t));
        }
        return new JSONObject()
            .put("states", states)
            .put("transitions", transitions);
    }

    public static JSONObject toJSON(State st) {
        JSONObject ret = new JSONObject()
            .put("name", st.getName())
            .put("attributes", new JSONArray(st.getAttributes()));
        if (st.hasSubstates())
            ret.put("substates", toJSON(st.getSubstates()));
        return ret;
    }

    public static JSONObject toJSON(Transition t) {
        return new JSONObject()
            .put("sources", names(t.getSources()))
            .put("destinations", names(t.getDestinations()))
            .put("attributes", new JSONArray(t.getAttributes()));
    }

    public static JSONObject toJSON(FlatGraph graph) {
        JSONArray nodes = new JSONArray();
        for (State st : graph.getNodes()) {
            nodes.put(st.toString());
        }
        JSONArray edges = new JSONArray();
        for (Edge e : graph.getEdges()) {
            edges.put(new JSONArray()
                .put(e.getSource().toString())
                .put(e.getDestination().toString()));
        }
        return new JSONObject()
            .put("nodes", nodes)
            .put("edges", edges);
    }

    private static JSONArray names(Iterable<State> states) {
        JSONArray ret = new JSONArray();
        for (State st : states) ret.put(st.getName());
        return ret;
    }

}

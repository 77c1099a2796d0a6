package net.stategraph.model;

import org.junit.Test;
import static org.junit.Assert.*;

import java.util.Arrays;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Unit tests for DiagramExport.
 */
public class DiagramExportTest {

    @Test
    public void testDiagram() {
        Diagram d = new Diagram();
        State sup = d.addState("Sup", null, Arrays.asList("composite"));
        d.addTransition("X", "Y", sup, Arrays.asList("tick"));
        d.addTransition("[*]", "Sup");

        JSONObject json = DiagramExport.toJSON(d);

        JSONArray states = json.getJSONArray("states");
        assertEquals(2, states.length());
        JSONObject first = states.getJSONObject(0);
        assertEquals("Sup", first.getString("name"));
        assertEquals("composite",
                     first.getJSONArray("attributes").getString(0));
        JSONObject nested = first.getJSONObject("substates");
        assertEquals(2, nested.getJSONArray("states").length());
        JSONObject inner = nested.getJSONArray("transitions")
            .getJSONObject(0);
        assertEquals("X", inner.getJSONArray("sources").getString(0));
        assertEquals("Y", inner.getJSONArray("destinations").getString(0));
        assertEquals("tick", inner.getJSONArray("attributes").getString(0));
        assertFalse(states.getJSONObject(1).has("substates"));

        JSONArray transitions = json.getJSONArray("transitions");
        assertEquals(1, transitions.length());
        assertEquals(Diagram.START, transitions.getJSONObject(0)
            .getJSONArray("sources").getString(0));
    }

    @Test
    public void testFlatGraph() {
        Diagram d = new Diagram();
        State b = d.addState("B");
        d.addTransition("X", "Y", b);
        d.addTransition("A", "B");

        JSONObject json = DiagramExport.toJSON(d.flattenGraph());

        JSONArray nodes = json.getJSONArray("nodes");
        assertEquals(3, nodes.length());
        assertEquals("B.X", nodes.getString(0));
        JSONArray edges = json.getJSONArray("edges");
        assertEquals(2, edges.length());
        boolean found = false;
        for (int i = 0; i < edges.length(); i++) {
            JSONArray e = edges.getJSONArray(i);
            if (e.getString(0).equals("A") && e.getString(1).equals("B.X"))
                found = true;
        }
        assertTrue(found);
    }

}

package net.stategraph.model;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Unit tests for GraphFlattener and FlatGraph.
 */
public class GraphFlattenerTest {

    private Diagram diagram;

    @Before
    public void setUp() {
        diagram = new Diagram();
    }

    private static Set<String> names(FlatGraph g) {
        return new HashSet<String>(g.getNodeNames());
    }

    @Test
    public void testFlatDiagramUnchanged() {
        diagram.addTransition("A", "B");
        diagram.addTransition("B", "C");

        FlatGraph g = diagram.flattenGraph();

        assertEquals(new HashSet<String>(Arrays.asList("A", "B", "C")),
                     names(g));
        assertEquals(2, g.getEdgeCount());
        assertTrue(g.hasEdge("A", "B"));
        assertTrue(g.hasEdge("B", "C"));
    }

    @Test
    public void testSuperstateCollapsed() {
        State b = diagram.addState("B");
        diagram.addTransition("X", "Y", b);
        diagram.addTransition("A", "B");
        diagram.addTransition("B", "C");

        FlatGraph g = diagram.flattenGraph();

        assertEquals(new HashSet<String>(Arrays.asList("A", "X", "Y", "C")),
                     names(g));
        assertFalse(g.hasNode("B"));
        assertTrue(g.hasEdge("A", "X"));
        assertTrue(g.hasEdge("X", "Y"));
        assertTrue(g.hasEdge("Y", "C"));
        assertEquals(3, g.getEdgeCount());
    }

    @Test
    public void testMultipleEntriesAndExits() {
        State s = diagram.addState("S");
        diagram.addState("P", s);
        diagram.addState("Q", s);
        diagram.addTransition("In1", "S");
        diagram.addTransition("In2", "S");
        diagram.addTransition("S", "Out");

        FlatGraph g = diagram.flattenGraph();

        for (String src : Arrays.asList("In1", "In2")) {
            assertTrue(g.hasEdge(src, "P"));
            assertTrue(g.hasEdge(src, "Q"));
        }
        assertTrue(g.hasEdge("P", "Out"));
        assertTrue(g.hasEdge("Q", "Out"));
        assertEquals(6, g.getEdgeCount());
    }

    @Test
    public void testNestedSuperstates() {
        State outer = diagram.addState("Outer");
        State inner = diagram.addState("Inner", outer);
        diagram.addTransition("L1", "L2", inner);
        diagram.addTransition("Inner", "M", outer);
        diagram.addTransition("Before", "Outer");
        diagram.addTransition("Outer", "After");

        FlatGraph g = diagram.flattenGraph();

        assertEquals(new HashSet<String>(Arrays.asList(
                         "Before", "L1", "L2", "M", "After")),
                     names(g));
        assertTrue(g.hasEdge("Before", "L1"));
        assertTrue(g.hasEdge("L1", "L2"));
        assertTrue(g.hasEdge("L2", "M"));
        assertTrue(g.hasEdge("M", "After"));
        assertEquals(4, g.getEdgeCount());
    }

    @Test
    public void testAdjacentSuperstates() {
        State a = diagram.addState("A");
        State b = diagram.addState("B");
        diagram.addTransition("A1", "A2", a);
        diagram.addTransition("B1", "B2", b);
        diagram.addTransition("A", "B");

        FlatGraph g = diagram.flattenGraph();

        assertTrue(g.hasEdge("A2", "B1"));
        assertFalse(g.hasNode("A"));
        assertFalse(g.hasNode("B"));
        assertEquals(3, g.getEdgeCount());
    }

    @Test
    public void testInternalSentinels() {
        State s = diagram.addState("S");
        diagram.addTransition("[*]", "Work", s);
        diagram.addTransition("Work", "[*]", s);
        diagram.addTransition("[*]", "S");
        diagram.addTransition("S", "[*]");

        FlatGraph g = diagram.flattenGraph();

        State outerStart = diagram.getState(Diagram.START);
        State innerStart = s.getSubstates().getState(Diagram.START);
        State innerEnd = s.getSubstates().getState(Diagram.END);
        State outerEnd = diagram.getState(Diagram.END);
        assertTrue(g.hasEdge(outerStart, innerStart));
        assertTrue(g.hasEdge(innerEnd, outerEnd));
        assertEquals(2, g.getNodes(Diagram.START).size());
        assertEquals(Arrays.asList(innerStart),
                     g.getSuccessors(outerStart));
        assertEquals(Arrays.asList(innerEnd), g.getPredecessors(outerEnd));
    }

    @Test
    public void testIsolatedStatesKept() {
        State s = diagram.addState("S");
        diagram.addState("Inside", s);
        diagram.addState("Alone");

        FlatGraph g = diagram.flattenGraph();

        assertEquals(new HashSet<String>(Arrays.asList("Inside", "Alone")),
                     names(g));
        assertEquals(0, g.getEdgeCount());
    }

    @Test
    public void testSourceDiagramUntouched() {
        State b = diagram.addState("B");
        diagram.addTransition("X", "Y", b);
        diagram.addTransition("A", "B");

        diagram.flattenGraph();

        assertEquals(2, diagram.getStateCount());
        assertTrue(diagram.hasState("B"));
        assertEquals(1, diagram.getTransitionCount());
        assertEquals(2, b.getSubstateCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSuccessorsOfForeignState() {
        FlatGraph g = diagram.flattenGraph();
        g.getSuccessors(new Diagram().addState("X"));
    }

}

package net.stategraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A transition between states.
 * Transitions reference their endpoints without owning them; they are
 * only valid as long as the diagram holding them.
 */
public class Transition {

    private final List<State> sources;
    private final List<State> destinations;
    private final List<String> attributes;

    public Transition(State source, State destination,
                      List<String> attributes) {
        this.sources = new ArrayList<State>();
        this.destinations = new ArrayList<State>();
        this.attributes = new ArrayList<String>();
        addSource(source);
        addDestination(destination);
        if (attributes != null) {
            for (String a : attributes) addAttribute(a);
        }
    }
    public Transition(State source, State destination) {
        this(source, destination, null);
    }

    public String toString() {
        return String.format("%s -> %s%s", sources, destinations,
            (attributes.isEmpty()) ? "" : " : " + attributes);
    }

    public List<State> getSources() {
        return Collections.unmodifiableList(sources);
    }
    public void addSource(State source) {
        if (source == null)
            throw new NullPointerException(
                "Transition source may not be null");
        sources.add(source);
    }

    public List<State> getDestinations() {
        return Collections.unmodifiableList(destinations);
    }
    public void addDestination(State destination) {
        if (destination == null)
            throw new NullPointerException(
                "Transition destination may not be null");
        destinations.add(destination);
    }

    public List<String> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }
    public void addAttribute(String attribute) {
        if (attribute == null)
            throw new NullPointerException(
                "Transition attribute may not be null");
        attributes.add(attribute);
    }

}

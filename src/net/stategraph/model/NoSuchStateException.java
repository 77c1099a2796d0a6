package net.stategraph.model;

public class NoSuchStateException extends RuntimeException {

    private final String stateName;

    public NoSuchStateException(String stateName) {
        super("No state named " + stateName + " exists in diagram");
        this.stateName = stateName;
    }

    public String getStateName() {
        return stateName;
    }

}

package net.stategraph.builder;

public class FixedLocation implements TextLocation {

    private final long line;
    private final long column;

    public FixedLocation(long line, long column) {
        this.line = line;
        this.column = column;
    }

    public String toString() {
        return String.format("line %d column %d", getLine(), getColumn());
    }

    public boolean equals(Object other) {
        if (! (other instanceof TextLocation)) return false;
        TextLocation co = (TextLocation) other;
        return (line == co.getLine() && column == co.getColumn());
    }

    public int hashCode() {
        return (int) (line ^ line >>> 31 ^ column ^ column >>> 31);
    }

    public long getLine() {
        return line;
    }

    public long getColumn() {
        return column;
    }

}

package net.stategraph.builder;

/**
 * A location inside a multi-line text stream.
 */
public interface TextLocation {

    /**
     * The 1-based line index.
     */
    long getLine();

    /**
     * The 1-based column index.
     */
    long getColumn();

}

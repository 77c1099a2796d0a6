package net.stategraph.builder;

/**
 * Token kinds of the state diagram grammar.
 */
public enum StateToken {

    /** Whitespace and other text noise; always ignored. */
    TEXT,
    /** Input the lexer could not classify; always ignored. */
    ERROR,
    /** The name of a declared state. */
    STATE,
    /** An alias for a state name. */
    STATE_ALIAS,
    /** An attribute (description) of the preceding state. */
    STATE_ATTRIBUTE,
    /** The delimiter opening the body of a superstate. */
    SCOPE_OPEN,
    /** The delimiter closing the body of a superstate. */
    SCOPE_CLOSE,
    /** The source state of a transition. */
    TRANSITION_SOURCE,
    /** The destination state of a transition. */
    TRANSITION_DESTINATION,
    /** An attribute (label) of the preceding transition. */
    TRANSITION_ATTRIBUTE

}

package net.stategraph.builder;

/**
 * Base class of failures while turning tokens into a model.
 * The position is that of the offending token, or null if unknown.
 */
public class ParserException extends Exception {

    private final TextLocation position;

    public ParserException(TextLocation pos, String message) {
        super(message);
        position = pos;
    }
    public ParserException(TextLocation pos, String message,
                           Throwable cause) {
        super(message, cause);
        position = pos;
    }

    public TextLocation getPosition() {
        return position;
    }

}

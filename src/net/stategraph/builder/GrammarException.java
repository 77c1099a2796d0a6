package net.stategraph.builder;

/**
 * Signals that the token stream does not form a valid diagram.
 */
public class GrammarException extends ParserException {

    public enum Kind {
        /** A transition source is not followed by a destination. */
        MISSING_DESTINATION,
        /** A token refers to a state that does not exist. */
        UNKNOWN_STATE,
        /** A scope is closed while none is open. */
        STACK_UNDERFLOW,
        /** State aliases are not supported. */
        ALIAS_UNSUPPORTED
    }

    private final Kind kind;
    private final Token<?> token;

    public GrammarException(Kind kind, Token<?> token, String message) {
        super((token == null) ? null : token.getPosition(), message);
        this.kind = kind;
        this.token = token;
    }
    public GrammarException(Kind kind, Token<?> token, String message,
                            Throwable cause) {
        super((token == null) ? null : token.getPosition(), message, cause);
        this.kind = kind;
        this.token = token;
    }

    public Kind getKind() {
        return kind;
    }

    public Token<?> getToken() {
        return token;
    }

}

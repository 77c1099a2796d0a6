package net.stategraph.builder;

/**
 * A non-fatal problem encountered while building a model.
 */
public class Diagnostic {

    private final String message;
    private final Token<?> token;

    public Diagnostic(String message, Token<?> token) {
        if (message == null)
            throw new NullPointerException(
                "Diagnostic message may not be null");
        this.message = message;
        this.token = token;
    }

    public String toString() {
        return (token == null) ? message : message + ": " + token;
    }

    public String getMessage() {
        return message;
    }

    public Token<?> getToken() {
        return token;
    }

}

package net.stategraph.builder;

import net.stategraph.util.Util;

/**
 * A lexical token as delivered by a lexer.
 * The position is optional; lexers that do not track positions pass null.
 */
public class Token<K> {

    private final K kind;
    private final String content;
    private final TextLocation position;

    public Token(K kind, String content, TextLocation position) {
        if (kind == null)
            throw new NullPointerException("Token kind may not be null");
        if (content == null)
            throw new NullPointerException(
                "Token content may not be null");
        this.kind = kind;
        this.content = content;
        this.position = position;
    }
    public Token(K kind, String content) {
        this(kind, content, null);
    }

    public String toString() {
        return String.format("%s (%s)%s", Util.formatString(getContent()),
            getKind(),
            ((position == null) ? "" : " at " + position));
    }

    public boolean equals(Object other) {
        if (! (other instanceof Token)) return false;
        Token<?> to = (Token<?>) other;
        return (getKind().equals(to.getKind()) &&
                getContent().equals(to.getContent()) &&
                equalOrNull(getPosition(), to.getPosition()));
    }

    public int hashCode() {
        return getKind().hashCode() ^ getContent().hashCode() ^
            hashCodeOrNull(getPosition());
    }

    public K getKind() {
        return kind;
    }

    public String getContent() {
        return content;
    }

    public TextLocation getPosition() {
        return position;
    }

    public boolean is(K k) {
        return kind.equals(k);
    }

    private static boolean equalOrNull(Object a, Object b) {
        return (a == null) ? (b == null) : a.equals(b);
    }
    private static int hashCodeOrNull(Object o) {
        return (o == null) ? 0 : o.hashCode();
    }

}

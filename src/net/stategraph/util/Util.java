package net.stategraph.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Util {

    /* Characters not reproduced literally by formatString(). */
    private static final Pattern ESCAPE = Pattern.compile(
        "[^ !#-\\[\\]-~]");

    private Util() {}

    public static boolean isTrue(String s) {
        if (s == null) return false;
        return (Boolean.parseBoolean(s) || s.equalsIgnoreCase("1") ||
            s.equalsIgnoreCase("y") || s.equalsIgnoreCase("yes") ||
            s.equalsIgnoreCase("on"));
    }

    /* Render data as a double-quoted string literal for messages. */
    public static String formatString(String data) {
        if (data == null) return "null";
        Matcher m = ESCAPE.matcher(data);
        StringBuffer sb = new StringBuffer("\"");
        while (m.find()) {
            // Supplementary characters match as surrogate pairs.
            StringBuilder rep = new StringBuilder();
            for (char ch : m.group().toCharArray()) rep.append(escape(ch));
            m.appendReplacement(sb, Matcher.quoteReplacement(rep.toString()));
        }
        m.appendTail(sb);
        return sb.append('"').toString();
    }

    private static String escape(char ch) {
        switch (ch) {
            case '"':  return "\\\"";
            case '\\': return "\\\\";
            case '\n': return "\\n";
            case '\t': return "\\t";
            default:
                return String.format((ch < 256) ? "\\x%02x" : "\\u%04x",
                                     (int) ch);
        }
    }

}

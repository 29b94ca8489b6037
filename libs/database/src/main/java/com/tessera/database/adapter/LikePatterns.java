package com.tessera.database.adapter;

import java.util.regex.Pattern;

/** Converts SQL LIKE patterns for backends without a native LIKE. */
public final class LikePatterns {

    private LikePatterns() {}

    /**
     * Anchored regular expression equivalent of a LIKE pattern. {@code %} matches any run of
     * characters, {@code _} exactly one. Everything else is literal.
     */
    public static String toRegex(String pattern) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '%' || c == '_') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.append('$').toString();
    }

    public static Pattern compile(String pattern, boolean caseInsensitive) {
        return Pattern.compile(
                toRegex(pattern), caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.DOTALL : Pattern.DOTALL);
    }
}

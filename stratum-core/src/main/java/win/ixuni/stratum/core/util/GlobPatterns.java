package win.ixuni.stratum.core.util;

import java.util.regex.Pattern;

/**
 * Filename pattern matching
 * <p>
 * Supports wildcards:
 * - * matches any characters
 * - ? matches a single character
 * <p>
 * A pattern without wildcards matches when the value contains it.
 */
public final class GlobPatterns {

    private GlobPatterns() {
    }

    public static boolean matches(String pattern, String value) {
        if (pattern == null || value == null) {
            return false;
        }
        if (!hasWildcard(pattern)) {
            return value.contains(pattern);
        }
        return value.matches(toRegex(pattern));
    }

    public static boolean hasWildcard(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
    }

    static String toRegex(String pattern) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.toString();
    }
}

package com.conveyor.engine.trigger;

import java.util.regex.Pattern;

/**
 * Glob to regex translation for ref and branch patterns.
 *
 * <pre>
 *   ?      one character other than '/'
 *   *      any run of characters without '/'
 *   **     any run of characters, '/' included
 *   [abc]  character class; [!abc] or [^abc] negates
 *   \x     literal x
 * </pre>
 * A '*' that ends the pattern matches the rest of the input including '/',
 * so {@code refs/tags/*} also accepts {@code refs/tags/release/v1}.
 */
final class GlobPattern {

    private GlobPattern() {}

    static Pattern compile(String glob) {
        if (glob == null || glob.isEmpty()) {
            throw new EvaluationException("Empty ref pattern");
        }
        StringBuilder regex = new StringBuilder(glob.length() + 16);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> {
                    boolean doubleStar = i + 1 < glob.length() && glob.charAt(i + 1) == '*';
                    int end = doubleStar ? i + 2 : i + 1;
                    regex.append(doubleStar || end == glob.length() ? ".*" : "[^/]*");
                    i = end;
                }
                case '?' -> {
                    regex.append("[^/]");
                    i++;
                }
                case '[' -> i = appendClass(glob, i, regex);
                case '\\' -> {
                    if (i + 1 >= glob.length()) {
                        throw new EvaluationException("Pattern ends with an escape: " + glob);
                    }
                    regex.append(Pattern.quote(String.valueOf(glob.charAt(i + 1))));
                    i += 2;
                }
                default -> {
                    regex.append(Pattern.quote(String.valueOf(c)));
                    i++;
                }
            }
        }
        return Pattern.compile(regex.toString());
    }

    /** Appends a character class starting at {@code open}; returns the index after ']'. */
    private static int appendClass(String glob, int open, StringBuilder regex) {
        int i = open + 1;
        regex.append('[');
        if (i < glob.length() && (glob.charAt(i) == '!' || glob.charAt(i) == '^')) {
            regex.append('^');
            i++;
        }
        boolean empty = true;
        while (i < glob.length() && (glob.charAt(i) != ']' || empty)) {
            char c = glob.charAt(i);
            if (c == '-' && !empty && i + 1 < glob.length() && glob.charAt(i + 1) != ']') {
                regex.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                regex.append(c);
            } else {
                regex.append('\\').append(c);
            }
            empty = false;
            i++;
        }
        if (i >= glob.length()) {
            throw new EvaluationException("Unterminated character class in pattern: " + glob);
        }
        regex.append(']');
        return i + 1;
    }
}

package com.conveyor.engine.compile;

import java.util.Map;

import static com.conveyor.engine.compile.PipelineConfigException.Kind.INVALID_DEFINITION;
import static com.conveyor.engine.compile.PipelineConfigException.Kind.UNRESOLVED_PLACEHOLDER;

/**
 * Textual ${...} substitution over a fixed set of named values.
 *
 * Supported forms:
 * <pre>
 *   ${NAME}             value of NAME
 *   ${NAME:-fallback}   value of NAME, or fallback when NAME is unknown
 *   ${NAME/find/repl}   first occurrence of find replaced
 *   ${NAME//find/repl}  every occurrence of find replaced
 *   $$                  a literal '$'
 * </pre>
 * A '$' not followed by '{' or '$' is copied as-is, so shell variables such
 * as $HOME reach the step untouched.
 */
final class PlaceholderResolver {

    private final Map<String, String> values;

    PlaceholderResolver(Map<String, String> values) {
        this.values = values;
    }

    /**
     * @param where human-readable location used in error messages,
     *              e.g. "image of step 'pytest' in pipeline 'test'"
     */
    String resolve(String text, String where) {
        if (text == null || text.indexOf('$') < 0) return text;

        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '$' || i + 1 >= text.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = text.charAt(i + 1);
            if (next == '$') {
                out.append('$');
                i += 2;
            } else if (next == '{') {
                int close = text.indexOf('}', i + 2);
                if (close < 0) {
                    throw new PipelineConfigException(INVALID_DEFINITION,
                            "Unterminated placeholder in " + where + ": " + text);
                }
                out.append(expand(text.substring(i + 2, close), where));
                i = close + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private String expand(String expression, String where) {
        int nameEnd = 0;
        while (nameEnd < expression.length() && isNameChar(expression.charAt(nameEnd), nameEnd)) {
            nameEnd++;
        }
        String name = expression.substring(0, nameEnd);
        String operator = expression.substring(nameEnd);
        if (name.isEmpty()) {
            throw new PipelineConfigException(INVALID_DEFINITION,
                    "Malformed placeholder ${" + expression + "} in " + where);
        }

        String value = values.get(name);
        if (operator.startsWith(":-")) {
            return value != null ? value : operator.substring(2);
        }
        if (value == null) {
            throw new PipelineConfigException(UNRESOLVED_PLACEHOLDER,
                    "${" + name + "} in " + where + " is neither a matrix axis nor a compile variable");
        }
        if (operator.isEmpty()) {
            return value;
        }
        if (operator.startsWith("//")) {
            String[] parts = splitReplacement(operator.substring(2), expression, where);
            return parts[0].isEmpty() ? value : value.replace(parts[0], parts[1]);
        }
        if (operator.startsWith("/")) {
            String[] parts = splitReplacement(operator.substring(1), expression, where);
            int at = parts[0].isEmpty() ? -1 : value.indexOf(parts[0]);
            return at < 0 ? value : value.substring(0, at) + parts[1] + value.substring(at + parts[0].length());
        }
        throw new PipelineConfigException(INVALID_DEFINITION,
                "Unsupported placeholder operator in ${" + expression + "} in " + where);
    }

    private static String[] splitReplacement(String body, String expression, String where) {
        int slash = body.indexOf('/');
        if (slash < 0) {
            // ${NAME//find} deletes every occurrence of find
            return new String[] { body, "" };
        }
        if (body.indexOf('/', slash + 1) >= 0) {
            throw new PipelineConfigException(INVALID_DEFINITION,
                    "Malformed replacement ${" + expression + "} in " + where);
        }
        return new String[] { body.substring(0, slash), body.substring(slash + 1) };
    }

    private static boolean isNameChar(char c, int position) {
        if (c == '_' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')) return true;
        return position > 0 && c >= '0' && c <= '9';
    }
}

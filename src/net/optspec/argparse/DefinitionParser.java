package net.optspec.argparse;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses option definition strings.
 * A definition looks like
 * <pre>
 *     -p,--port:number=3000; Port to listen on
 * </pre>
 * i.e. an optional short flag followed by a comma, the long flag, a colon,
 * the value type ({@code boolean}, {@code number}, {@code number[]},
 * {@code string}, or {@code string[]}), then either a {@code !} marking the
 * option as required or an {@code =} followed by a JSON literal giving the
 * default, and finally an optional {@code ;} followed by a free-form
 * description. Whitespace is insignificant except inside quoted strings and
 * the description (which is trimmed).
 */
public final class DefinitionParser {

    private static final Logger LOGGER = Logger.getLogger("DefinitionParser");

    private static final Pattern HEAD = Pattern.compile(
        "(?:-([a-zA-Z0-9]),)?--([a-zA-Z0-9]+):([a-zA-Z]+(?:\\[\\])?)" +
        "(!)?(?:=(.*))?", Pattern.DOTALL);

    private DefinitionParser() {}

    public static OptionDefinition parse(String spec) {
        if (spec == null)
            throw new NullPointerException("Option definition may not be " +
                "null");
        int descStart = findDescription(spec);
        String head, description;
        if (descStart == -1) {
            head = compact(spec);
            description = "";
        } else {
            head = compact(spec.substring(0, descStart));
            description = spec.substring(descStart + 1).trim();
        }
        Matcher m = HEAD.matcher(head);
        if (! m.matches())
            throw new SettingsException("Syntax error in option " +
                "definition: " + spec, spec);
        String shortGroup = m.group(1);
        String longFlag = m.group(2);
        ValueType type = ValueType.forToken(m.group(3));
        if (type == null)
            throw new SettingsException("Unknown type: " + m.group(3), spec);
        boolean required = (m.group(4) != null);
        String literal = m.group(5);
        Object defaultValue = null;
        if (literal != null) {
            if (required || literal.endsWith("!"))
                throw new SettingsException("Option --" + longFlag +
                    " cannot be both required and have a default value",
                    spec);
            defaultValue = DefaultValueResolver.resolve(type, literal,
                                                        longFlag);
        }
        Character shortFlag = (shortGroup == null) ? null :
            Character.valueOf(shortGroup.charAt(0));
        OptionDefinition ret = new OptionDefinition(shortFlag, longFlag,
            type, required, defaultValue, description);
        if (LOGGER.isLoggable(Level.FINE))
            LOGGER.fine("Parsed " + ret + " from " + spec);
        return ret;
    }

    /* Index of the ';' introducing the description (ignoring any inside
     * quoted strings), or -1 if there is none. */
    static int findDescription(String spec) {
        boolean quoted = false;
        for (int i = 0; i < spec.length(); i++) {
            char c = spec.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ';') {
                return i;
            }
        }
        return -1;
    }

    /* Drops all whitespace outside quoted strings. */
    static String compact(String head) {
        StringBuilder sb = new StringBuilder(head.length());
        boolean quoted = false;
        for (int i = 0; i < head.length(); i++) {
            char c = head.charAt(i);
            if (quoted) {
                sb.append(c);
                if (c == '\\' && i + 1 < head.length()) {
                    sb.append(head.charAt(++i));
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (c == '"') {
                sb.append(c);
                quoted = true;
            } else if (! Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

}

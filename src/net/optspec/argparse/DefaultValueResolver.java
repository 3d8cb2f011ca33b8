package net.optspec.argparse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.json.JSONException;
import org.json.JSONTokener;

/**
 * Decodes the JSON literal of a "=default" clause and checks that it fits
 * the declared value type.
 * Numbers come out as Double, arrays as lists. Strings must be written
 * in double quotes, as JSON demands; the lenient unquoted forms org.json
 * would otherwise accept are rejected.
 */
public final class DefaultValueResolver {

    private static final Pattern JSON_NUMBER = Pattern.compile(
        "-?(?:0|[1-9]\\d*)(?:\\.\\d+)?(?:[eE][-+]?\\d+)?");
    private static final String NUMBER_START = "+-.0123456789";
    private static final String NUMBER_CHARS = NUMBER_START + "eE";

    private DefaultValueResolver() {}

    public static Object resolve(ValueType type, String literal,
                                 String longFlag) {
        JSONTokener tok = new JSONTokener(literal);
        Object ret;
        try {
            if (type.isArray()) {
                ret = readArray(tok, type, literal, longFlag);
            } else {
                ret = check(readScalar(tok), type, literal, longFlag);
            }
            if (tok.nextClean() != 0)
                throw tok.syntaxError("Unexpected garbage after JSON value");
        } catch (JSONException exc) {
            throw new SettingsException("The default value of --" +
                longFlag + " is not a valid JSON literal: " + literal,
                literal, exc);
        }
        return ret;
    }

    private static Object readScalar(JSONTokener tok) throws JSONException {
        char c = tok.nextClean();
        if (c == 0) throw tok.syntaxError("Missing value");
        if (c == '"') return tok.nextString('"');
        if (NUMBER_START.indexOf(c) != -1) return readNumber(tok, c);
        tok.back();
        Object ret = tok.nextValue();
        // Anything nextValue() hands back as a plain string was unquoted
        // (or single-quoted), which is not JSON.
        if (ret instanceof String)
            throw tok.syntaxError("Unquoted string " + ret);
        return ret;
    }

    /* org.json would take "1.", ".5" or "01" as numbers; JSON does not. */
    private static Double readNumber(JSONTokener tok, char first)
            throws JSONException {
        StringBuilder sb = new StringBuilder().append(first);
        for (;;) {
            char c = tok.next();
            if (c == 0) break;
            if (NUMBER_CHARS.indexOf(c) == -1) {
                tok.back();
                break;
            }
            sb.append(c);
        }
        String text = sb.toString();
        if (! JSON_NUMBER.matcher(text).matches())
            throw tok.syntaxError("Malformed number " + text);
        return Double.valueOf(text);
    }

    private static List<Object> readArray(JSONTokener tok, ValueType type,
            String literal, String longFlag) throws JSONException {
        if (tok.nextClean() != '[')
            throw shapeError(type, literal, longFlag);
        List<Object> ret = new ArrayList<Object>();
        if (tok.nextClean() == ']') return ret;
        tok.back();
        ValueType elementType = (type == ValueType.NUMBER_ARRAY) ?
            ValueType.NUMBER : ValueType.STRING;
        for (;;) {
            Object item = check(readScalar(tok), elementType);
            if (item == null) throw shapeError(type, literal, longFlag);
            ret.add(item);
            char c = tok.nextClean();
            if (c == ']') break;
            if (c != ',') throw tok.syntaxError("Expected ',' or ']'");
        }
        return ret;
    }

    private static Object check(Object value, ValueType type,
                                String literal, String longFlag) {
        Object ret = check(value, type);
        if (ret == null) throw shapeError(type, literal, longFlag);
        return ret;
    }

    /* Returns null if value does not fit the scalar type. */
    private static Object check(Object value, ValueType type) {
        switch (type) {
            case BOOLEAN:
                return (value instanceof Boolean) ? value : null;
            case NUMBER:
                if (! (value instanceof Number)) return null;
                double d = ((Number) value).doubleValue();
                // Out of range, like 1e400.
                if (Double.isInfinite(d) || Double.isNaN(d)) return null;
                return Double.valueOf(d);
            case STRING:
                return (value instanceof String) ? value : null;
            default:
                throw new AssertionError("This should not happen!");
        }
    }

    private static SettingsException shapeError(ValueType type,
            String literal, String longFlag) {
        String what;
        switch (type) {
            case BOOLEAN     : what = "a boolean"          ; break;
            case NUMBER      : what = "a number"           ; break;
            case NUMBER_ARRAY: what = "an array of numbers"; break;
            case STRING      : what = "a string"           ; break;
            case STRING_ARRAY: what = "an array of strings"; break;
            default: throw new AssertionError("This should not happen!");
        }
        return new SettingsException("The default value of --" + longFlag +
            " should be " + what + ": " + literal, literal);
    }

}

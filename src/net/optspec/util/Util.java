package net.optspec.util;

import org.json.JSONObject;

public final class Util {

    private Util() {}

    /**
     * Test whether the given string is a "true" value.
     * Accepts "true", "1", "y", "yes", and "on" (ignoring case); everything
     * else (including null) is false.
     */
    public static boolean isTrue(String s) {
        if (s == null) return false;
        return (Boolean.parseBoolean(s) || s.equalsIgnoreCase("1") ||
            s.equalsIgnoreCase("y") || s.equalsIgnoreCase("yes") ||
            s.equalsIgnoreCase("on"));
    }

    /**
     * Render the given value (a string, number, boolean, or list thereof)
     * as JSON.
     */
    public static String formatJSON(Object value) {
        return JSONObject.valueToString(value);
    }

}

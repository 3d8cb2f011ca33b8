package net.optspec.argparse;

import java.util.Collections;

public enum ValueType {

    BOOLEAN("boolean", false, false),
    NUMBER("number", true, false),
    NUMBER_ARRAY("number[]", true, true),
    STRING("string", true, false),
    STRING_ARRAY("string[]", true, true);

    private final String token;
    private final boolean takingValue;
    private final boolean array;

    private ValueType(String token, boolean takingValue, boolean array) {
        this.token = token;
        this.takingValue = takingValue;
        this.array = array;
    }

    /** The grammar token naming this type, like "number[]". */
    public String getToken() {
        return token;
    }

    /** Whether a flag of this type consumes a value on the command line. */
    public boolean isTakingValue() {
        return takingValue;
    }

    public boolean isArray() {
        return array;
    }

    /**
     * The value an option of this type resolves to when it is neither
     * given nor has an explicit default.
     */
    public Object getImplicitDefault() {
        switch (this) {
            case BOOLEAN:
                return Boolean.FALSE;
            case NUMBER:
            case STRING:
                return null;
            case NUMBER_ARRAY:
            case STRING_ARRAY:
                return Collections.emptyList();
            default:
                throw new AssertionError("This should not happen!");
        }
    }

    public static ValueType forToken(String token) {
        for (ValueType t : values()) {
            if (t.getToken().equals(token)) return t;
        }
        return null;
    }

}

package net.optspec.argparse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class OptionDefinition {

    private final Character shortFlag;
    private final String longFlag;
    private final ValueType valueType;
    private final boolean required;
    private final Object defaultValue;
    private final String description;

    public OptionDefinition(Character shortFlag, String longFlag,
                            ValueType valueType, boolean required,
                            Object defaultValue, String description) {
        if (longFlag == null)
            throw new NullPointerException("Long flag may not be null");
        if (valueType == null)
            throw new NullPointerException("Value type may not be null");
        this.shortFlag = shortFlag;
        this.longFlag = longFlag;
        this.valueType = valueType;
        this.required = required;
        this.defaultValue = (defaultValue == null) ?
            valueType.getImplicitDefault() : freeze(defaultValue);
        this.description = (description == null) ? "" : description;
    }

    public Character getShortFlag() {
        return shortFlag;
    }

    public String getLongFlag() {
        return longFlag;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public boolean isRequired() {
        return required;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    public boolean hasExplicitDefault() {
        Object implicit = valueType.getImplicitDefault();
        return (implicit == null) ? defaultValue != null :
            ! implicit.equals(defaultValue);
    }

    public String formatLongFlag() {
        return "--" + longFlag;
    }

    public String formatShortFlag() {
        return (shortFlag == null) ? null : "-" + shortFlag;
    }

    /** All aliases with their prefixes, short one first. */
    public List<String> getAliases() {
        List<String> ret = new ArrayList<String>(2);
        if (shortFlag != null) ret.add(formatShortFlag());
        ret.add(formatLongFlag());
        return ret;
    }

    public String formatAliases() {
        StringBuilder sb = new StringBuilder();
        if (shortFlag != null) sb.append(formatShortFlag()).append(", ");
        return sb.append(formatLongFlag()).toString();
    }

    public String toString() {
        return getClass().getSimpleName() + "[" + formatAliases() + ":" +
            valueType.getToken() + ((required) ? "!" : "") + "]";
    }

    private static Object freeze(Object value) {
        if (! (value instanceof List<?>)) return value;
        return Collections.unmodifiableList(
            new ArrayList<Object>((List<?>) value));
    }

}

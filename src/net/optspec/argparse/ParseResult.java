package net.optspec.argparse;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The outcome of parsing one command line.
 * <p>
 * {@link #getOptions()} holds an entry for every declared option key. Value
 * types map to Java types as follows: {@code boolean} to {@link Boolean},
 * {@code number} to {@link Double}, {@code string} to {@link String}, and
 * the array types to (unmodifiable) lists of these. Scalar numbers and
 * strings that were neither given nor defaulted are null.
 */
public class ParseResult {

    private final List<String> targets;
    private final Map<String, Object> options;
    private final List<String> rest;
    private final DefinitionSet definitions;
    private final String helpText;
    private final ExitHandler exitHandler;
    private final boolean helpRequested;

    public ParseResult(List<String> targets, Map<String, Object> options,
                       List<String> rest, DefinitionSet definitions,
                       String helpText, ExitHandler exitHandler,
                       boolean helpRequested) {
        this.targets = Collections.unmodifiableList(targets);
        this.options = Collections.unmodifiableMap(options);
        this.rest = Collections.unmodifiableList(rest);
        this.definitions = definitions;
        this.helpText = helpText;
        this.exitHandler = exitHandler;
        this.helpRequested = helpRequested;
    }

    /** Positional arguments not belonging to any option. */
    public List<String> getTargets() {
        return targets;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    /** Everything after the first "--", verbatim. */
    public List<String> getRest() {
        return rest;
    }

    public DefinitionSet getDefinitions() {
        return definitions;
    }

    /**
     * Whether a help option was given.
     * Only ever true if the parser was configured to handle the help flag
     * and not to exit.
     */
    public boolean isHelpRequested() {
        return helpRequested;
    }

    public Object get(String key) {
        definitionOf(key, null);
        return options.get(key);
    }

    public boolean getBoolean(String key) {
        definitionOf(key, ValueType.BOOLEAN);
        return (Boolean) options.get(key);
    }

    public Double getNumber(String key) {
        definitionOf(key, ValueType.NUMBER);
        return (Double) options.get(key);
    }

    public List<Double> getNumbers(String key) {
        definitionOf(key, ValueType.NUMBER_ARRAY);
        @SuppressWarnings("unchecked")
        List<Double> ret = (List<Double>) options.get(key);
        return ret;
    }

    public String getString(String key) {
        definitionOf(key, ValueType.STRING);
        return (String) options.get(key);
    }

    public List<String> getStrings(String key) {
        definitionOf(key, ValueType.STRING_ARRAY);
        @SuppressWarnings("unchecked")
        List<String> ret = (List<String>) options.get(key);
        return ret;
    }

    /** The help text for the options this result was parsed against. */
    public String help() {
        return helpText;
    }

    /**
     * Print the help text and terminate with the given status.
     * Whether this actually ends the process depends on the configured
     * {@link ExitHandler}.
     */
    public void help(int status) {
        exitHandler.exit(helpText, status);
    }

    public String toString() {
        return getClass().getSimpleName() + "[targets=" + targets +
            ", options=" + options + ", rest=" + rest + "]";
    }

    private OptionDefinition definitionOf(String key, ValueType expected) {
        OptionDefinition def = definitions.get(key);
        if (def == null)
            throw new IllegalArgumentException("No such option: " + key);
        if (expected != null && def.getValueType() != expected)
            throw new IllegalArgumentException("Option " + key + " is of " +
                "type " + def.getValueType().getToken() + ", not " +
                expected.getToken());
        return def;
    }

}

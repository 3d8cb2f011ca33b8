package net.optspec.argparse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * An ordered collection of option definitions, keyed by caller-chosen names.
 * Guarantees that no short or long flag is claimed by more than one entry.
 */
public class DefinitionSet {

    private static final Logger LOGGER = Logger.getLogger("DefinitionSet");

    private final Map<String, OptionDefinition> definitions;
    private final Map<String, String> names;

    public DefinitionSet(Map<String, OptionDefinition> definitions) {
        Map<String, OptionDefinition> defs =
            new LinkedHashMap<String, OptionDefinition>();
        // Short and long flags share one namespace: "-a" and "--a" clash.
        Map<String, String> names = new LinkedHashMap<String, String>();
        Set<String> duplicates = new LinkedHashSet<String>();
        for (Map.Entry<String, OptionDefinition> e : definitions.entrySet()) {
            String key = e.getKey();
            OptionDefinition def = e.getValue();
            defs.put(key, def);
            claim(names, duplicates, def.getLongFlag(), key);
            if (def.getShortFlag() != null)
                claim(names, duplicates, def.getShortFlag().toString(), key);
        }
        if (! duplicates.isEmpty())
            throw new SettingsException("Duplicate option flag names: " +
                String.join(", ", duplicates));
        this.definitions = Collections.unmodifiableMap(defs);
        this.names = names;
    }

    public Map<String, OptionDefinition> getDefinitions() {
        return definitions;
    }

    public Set<String> getKeys() {
        return definitions.keySet();
    }

    public OptionDefinition get(String key) {
        return definitions.get(key);
    }

    public int size() {
        return definitions.size();
    }

    /** The definition owning the given long flag, or null. */
    public OptionDefinition forLongFlag(String name) {
        OptionDefinition ret = lookup(name);
        return (ret == null || ! name.equals(ret.getLongFlag())) ? null : ret;
    }

    /** The definition owning the given short flag, or null. */
    public OptionDefinition forShortFlag(char name) {
        OptionDefinition ret = lookup(String.valueOf(name));
        return (ret == null || ret.getShortFlag() == null ||
                ret.getShortFlag().charValue() != name) ? null : ret;
    }

    /**
     * Parse every specification string of the given mapping.
     * Iteration order of the mapping is preserved.
     *
     * @throws SettingsException If any specification is malformed, or if
     *                           any flag is declared more than once.
     */
    public static DefinitionSet parse(Map<String, String> specs) {
        Map<String, OptionDefinition> defs =
            new LinkedHashMap<String, OptionDefinition>();
        for (Map.Entry<String, String> e : specs.entrySet()) {
            defs.put(e.getKey(), DefinitionParser.parse(e.getValue()));
        }
        DefinitionSet ret = new DefinitionSet(defs);
        LOGGER.fine("Parsed " + ret.size() + " option definitions");
        return ret;
    }

    private OptionDefinition lookup(String name) {
        String key = names.get(name);
        return (key == null) ? null : definitions.get(key);
    }

    private static void claim(Map<String, String> names,
                              Set<String> duplicates, String name,
                              String key) {
        if (names.containsKey(name)) {
            duplicates.add(name);
        } else {
            names.put(name, key);
        }
    }

}

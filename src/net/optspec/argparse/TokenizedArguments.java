package net.optspec.argparse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a {@link Tokenizer} extracted from a command line: positional
 * targets, raw values per flag, unrecognized flags, and everything after
 * the "--" delimiter.
 */
public class TokenizedArguments {

    private final List<String> targets;
    private final Map<String, List<RawValue>> longValues;
    private final Map<Character, List<RawValue>> shortValues;
    private final List<String> unknownFlags;
    private final List<String> rest;

    public TokenizedArguments() {
        targets = new ArrayList<String>();
        longValues = new LinkedHashMap<String, List<RawValue>>();
        shortValues = new LinkedHashMap<Character, List<RawValue>>();
        unknownFlags = new ArrayList<String>();
        rest = new ArrayList<String>();
    }

    public List<String> getTargets() {
        return Collections.unmodifiableList(targets);
    }
    public void addTarget(String target) {
        targets.add(target);
    }

    public List<RawValue> getLongValues(String name) {
        List<RawValue> ret = longValues.get(name);
        return (ret == null) ? Collections.<RawValue>emptyList() :
            Collections.unmodifiableList(ret);
    }
    public void addLongValue(String name, RawValue value) {
        List<RawValue> l = longValues.get(name);
        if (l == null) {
            l = new ArrayList<RawValue>();
            longValues.put(name, l);
        }
        l.add(value);
    }

    public List<RawValue> getShortValues(char name) {
        List<RawValue> ret = shortValues.get(name);
        return (ret == null) ? Collections.<RawValue>emptyList() :
            Collections.unmodifiableList(ret);
    }
    public void addShortValue(char name, RawValue value) {
        List<RawValue> l = shortValues.get(name);
        if (l == null) {
            l = new ArrayList<RawValue>();
            shortValues.put(name, l);
        }
        l.add(value);
    }

    /** Unrecognized flags, each with its "-" or "--" prefix. */
    public List<String> getUnknownFlags() {
        return Collections.unmodifiableList(unknownFlags);
    }
    public void addUnknownFlag(String flag) {
        unknownFlags.add(flag);
    }

    public List<String> getRest() {
        return Collections.unmodifiableList(rest);
    }
    public void addRest(String token) {
        rest.add(token);
    }

}

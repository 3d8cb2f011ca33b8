package net.optspec.argparse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Turns tokenizer output into typed option values.
 * Options are processed in definition order and the first violation ends
 * validation; unknown flags and the target policy are checked after all
 * options have been resolved.
 */
public final class Validator {

    private static final Logger LOGGER = Logger.getLogger("Validator");

    private Validator() {}

    public static Map<String, Object> validate(DefinitionSet defs,
            TokenizedArguments args, TargetPolicy targets)
            throws ValidationException {
        Map<String, Object> ret = new LinkedHashMap<String, Object>();
        for (Map.Entry<String, OptionDefinition> e :
                defs.getDefinitions().entrySet()) {
            ret.put(e.getKey(), resolve(e.getValue(), args));
        }
        List<String> unknown = args.getUnknownFlags();
        if (! unknown.isEmpty())
            throw new ValidationException("unknown option: " +
                unknown.get(0), Collections.singletonList(unknown.get(0)));
        if (targets.isRequired() && args.getTargets().isEmpty())
            throw new ValidationException(targets.getMessage());
        LOGGER.fine("Validated " + ret.size() + " options");
        return Collections.unmodifiableMap(ret);
    }

    /** Raw values of both aliases, those of the long flag first. */
    public static List<RawValue> collect(OptionDefinition def,
                                         TokenizedArguments args) {
        List<RawValue> ret = new ArrayList<RawValue>(
            args.getLongValues(def.getLongFlag()));
        if (def.getShortFlag() != null)
            ret.addAll(args.getShortValues(def.getShortFlag()));
        return ret;
    }

    static Object resolve(OptionDefinition def, TokenizedArguments args)
            throws ValidationException {
        List<RawValue> raw = collect(def, args);
        if (def.getValueType() == ValueType.BOOLEAN) {
            for (RawValue rv : raw) {
                if (rv.getKind() == RawValue.Kind.TEXT)
                    throw new ValidationException(def.formatAliases() +
                        " is a boolean switch and must be given without " +
                        "a value", def);
            }
        }
        if (raw.isEmpty()) {
            Object ret = def.getDefaultValue();
            if (ret == null && def.isRequired())
                throw new ValueMissingException(def.formatAliases() +
                    " is required", def);
            return ret;
        }
        switch (def.getValueType()) {
            case BOOLEAN:
                checkSingle(def, raw);
                return Boolean.TRUE;
            case NUMBER:
                checkSingle(def, raw);
                return toNumber(def, raw.get(0), false);
            case STRING:
                checkSingle(def, raw);
                return toText(def, raw.get(0));
            case NUMBER_ARRAY: {
                List<Double> ret = new ArrayList<Double>(raw.size());
                for (RawValue rv : raw) ret.add(toNumber(def, rv, true));
                return Collections.unmodifiableList(ret);
            }
            case STRING_ARRAY: {
                List<String> ret = new ArrayList<String>(raw.size());
                for (RawValue rv : raw) ret.add(toText(def, rv));
                return Collections.unmodifiableList(ret);
            }
            default:
                throw new AssertionError("This should not happen!");
        }
    }

    private static void checkSingle(OptionDefinition def, List<RawValue> raw)
            throws ValidationException {
        if (raw.size() > 1)
            throw new ValidationException(def.formatAliases() +
                " should not have multiple values", def);
    }

    private static void checkPresent(OptionDefinition def, RawValue rv)
            throws ValidationException {
        if (rv.getKind() != RawValue.Kind.TEXT)
            throw new ValueMissingException(def.formatAliases() +
                " needs a value", def);
    }

    private static Double toNumber(OptionDefinition def, RawValue rv,
                                   boolean element)
            throws ValidationException {
        checkPresent(def, rv);
        if (! rv.isNumeric())
            throw new ValidationException(((element) ?
                "all values of " + def.formatAliases() + " should be " +
                "numbers" : def.formatAliases() + " should be a number") +
                ": " + rv.getText(), def);
        return rv.getNumber();
    }

    /* Numeric-looking values get their original text back. */
    private static String toText(OptionDefinition def, RawValue rv)
            throws ValidationException {
        checkPresent(def, rv);
        return rv.getText();
    }

}

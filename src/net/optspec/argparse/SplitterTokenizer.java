package net.optspec.argparse;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The default {@link Tokenizer}, built on {@link ArgumentSplitter}.
 * Value-taking flags consume an attached value ("--name=value",
 * "-nvalue") or else the next token, unless that one looks like a flag of
 * its own or is the "--" delimiter; negative numbers do not count as
 * flags; "-n=value" is read as "-nvalue". Boolean short flags may be
 * clustered ("-abc"), except that a numeric or non-word remainder ("-a1",
 * "-a=x") is recorded as a value so the validator can reject it.
 */
public class SplitterTokenizer implements Tokenizer {

    private static final Logger LOGGER = Logger.getLogger("Tokenizer");

    public TokenizedArguments tokenize(List<String> args,
                                       DefinitionSet defs) {
        TokenizedArguments ret = new TokenizedArguments();
        ArgumentSplitter source = new ArgumentSplitter(args);
        for (;;) {
            ArgumentSplitter.ArgValue av = source.next(
                ArgumentSplitter.Mode.OPTIONS);
            if (av == null) break;
            switch (av.getType()) {
                case SHORT_OPTION:
                    handleShort(av, source, defs, ret);
                    break;
                case LONG_OPTION:
                    handleLong(av, source, defs, ret);
                    break;
                case ARGUMENT:
                    ret.addTarget(av.getValue());
                    break;
                case SPECIAL:
                    for (;;) {
                        av = source.next(ArgumentSplitter.Mode.FORCE_ARGUMENTS);
                        if (av == null) break;
                        ret.addRest(av.getValue());
                    }
                    break;
                default:
                    // Attached values are consumed together with their
                    // option.
                    throw new AssertionError("Orphan " + av);
            }
        }
        if (LOGGER.isLoggable(Level.FINER))
            LOGGER.finer("Tokenized " + args.size() + " arguments: " +
                ret.getTargets().size() + " targets, " +
                ret.getUnknownFlags().size() + " unknown flags, " +
                ret.getRest().size() + " after delimiter");
        return ret;
    }

    private void handleLong(ArgumentSplitter.ArgValue av,
                            ArgumentSplitter source, DefinitionSet defs,
                            TokenizedArguments drain) {
        String attached = null;
        if (source.hasAttachedValue())
            attached = source.next(ArgumentSplitter.Mode.ARGUMENTS)
                .getValue();
        OptionDefinition def = defs.forLongFlag(av.getValue());
        if (def == null) {
            drain.addUnknownFlag(av.formatOption());
            return;
        }
        drain.addLongValue(av.getValue(), readValue(def, attached, source));
    }

    private void handleShort(ArgumentSplitter.ArgValue av,
                             ArgumentSplitter source, DefinitionSet defs,
                             TokenizedArguments drain) {
        String name = av.getValue();
        // Non-BMP characters take two chars and never name an option.
        OptionDefinition def = (name.length() == 1) ?
            defs.forShortFlag(name.charAt(0)) : null;
        if (def == null) {
            drain.addUnknownFlag(av.formatOption());
            return;
        }
        boolean takesValue = def.getValueType().isTakingValue();
        String attached = null;
        if (source.isInsideCluster()) {
            ArgumentSplitter.ArgValue remainder = source.peek(
                ArgumentSplitter.Mode.ARGUMENTS);
            if (takesValue || isGluedValue(remainder.getValue())) {
                attached = source.next(ArgumentSplitter.Mode.ARGUMENTS)
                    .getValue();
                // "-n=5" means "-n5"; switches keep the "=" to be rejected.
                if (takesValue && attached.startsWith("="))
                    attached = attached.substring(1);
            }
        }
        drain.addShortValue(name.charAt(0), readValue(def, attached, source));
    }

    private RawValue readValue(OptionDefinition def, String attached,
                               ArgumentSplitter source) {
        if (attached != null) return RawValue.text(attached, true);
        if (! def.getValueType().isTakingValue()) return RawValue.SWITCH;
        ArgumentSplitter.ArgValue next = source.peek(
            ArgumentSplitter.Mode.FORCE_ARGUMENTS);
        if (next == null || ! isSeparateValue(next.getValue()))
            return RawValue.ABSENT;
        source.next(ArgumentSplitter.Mode.FORCE_ARGUMENTS);
        return RawValue.text(next.getValue(), false);
    }

    /* Whether the rest of a short option cluster following a boolean flag
     * is a value rather than more flags. */
    static boolean isGluedValue(String remainder) {
        if (RawValue.looksNumeric(remainder)) return true;
        int c = remainder.codePointAt(0);
        return ! (Character.isLetterOrDigit(c) || c == '_');
    }

    /* Whether a complete token may serve as the value of the flag before
     * it. */
    static boolean isSeparateValue(String token) {
        if (token.equals("--")) return false;
        if (token.equals("-") || ! token.startsWith("-")) return true;
        return RawValue.looksNumeric(token);
    }

}

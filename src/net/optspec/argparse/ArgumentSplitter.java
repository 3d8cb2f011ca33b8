package net.optspec.argparse;

import java.util.Iterator;

/**
 * Cuts command-line tokens into options, option values and arguments.
 * <p>
 * The caller says with every request how continuations are to be read:
 * after a short option that takes a value, the rest of its token is that
 * value, while after a switch it holds further short options. Short
 * options are single code points, so clusters containing characters
 * outside the BMP are split correctly.
 */
public class ArgumentSplitter {

    public enum Mode {
        OPTIONS,        // Continuations of short options are options, too
        ARGUMENTS,      // Continuations of short options are arguments
        FORCE_ARGUMENTS // Everything is an argument
    }

    public enum ArgType {
        SHORT_OPTION(true, false), // Single-character option
        LONG_OPTION(true, false),  // Long option
        VALUE(false, true),        // Value glued to an option
        ARGUMENT(false, true),     // Stand-alone token
        SPECIAL(false, false);     // The "--" delimiter

        private final boolean option;
        private final boolean argument;

        private ArgType(boolean option, boolean argument) {
            this.option = option;
            this.argument = argument;
        }

        public boolean matches(Mode mode) {
            if (this == SPECIAL) return true;
            return (mode == Mode.OPTIONS) ? option : argument;
        }

    }

    public static class ArgValue {

        private final ArgType type;
        private final String value;

        public ArgValue(ArgType type, String value) {
            this.type = type;
            this.value = value;
        }

        public String toString() {
            switch (type) {
                case SHORT_OPTION: return "option -"      +       value ;
                case LONG_OPTION : return "option --"     +       value ;
                case VALUE       : return "option value " + quote(value);
                case ARGUMENT    : return "argument "     + quote(value);
                case SPECIAL     : return "token "        +       value ;
                default: throw new AssertionError("This should not happen!");
            }
        }

        public ArgType getType() {
            return type;
        }

        public String getValue() {
            return value;
        }

        /** The option as it was written, i.e. with its dash prefix. */
        public String formatOption() {
            switch (type) {
                case SHORT_OPTION: return "-" + value;
                case LONG_OPTION : return "--" + value;
                default: return value;
            }
        }

        private static String quote(String value) {
            return (value.contains("\"")) ? "'" + value + "'" :
                '"' + value + '"';
        }

    }

    private final Iterator<String> tokens;
    /* The token being taken apart, or null between tokens. */
    private String token;
    /* Zero: at the start of token.
     * Positive: inside a short option cluster; next code point here.
     * Negative: after "--name="; the value starts at -offset. */
    private int offset;
    private int nextOffset;
    private ArgValue lookahead;

    public ArgumentSplitter(Iterable<String> args) {
        tokens = args.iterator();
    }

    /**
     * Whether the previously returned option is a short option that is
     * followed by more characters within the same command-line token.
     */
    public boolean isInsideCluster() {
        return (token != null && offset > 0);
    }

    /**
     * Whether the previously returned option is a long option carrying an
     * "=" and a (possibly empty) value.
     */
    public boolean hasAttachedValue() {
        return (token != null && offset < 0);
    }

    public ArgValue peek(Mode mode) {
        if (lookahead != null && lookahead.getType().matches(mode))
            return lookahead;
        if (token == null) {
            if (! tokens.hasNext()) return null;
            token = tokens.next();
            if (token == null)
                throw new NullPointerException("Null arguments not allowed");
            offset = 0;
        }
        if (mode != Mode.FORCE_ARGUMENTS && offset == 0) {
            lookahead = splitFresh();
        } else if (mode != Mode.OPTIONS || offset < 0) {
            ArgType tp = (offset != 0) ? ArgType.VALUE : ArgType.ARGUMENT;
            lookahead = new ArgValue(tp, token.substring(Math.abs(offset)));
            nextOffset = 0;
        } else {
            lookahead = new ArgValue(ArgType.SHORT_OPTION,
                                     shortOptionAt(offset));
        }
        return lookahead;
    }

    public ArgValue next(Mode mode) {
        ArgValue ret = peek(mode);
        if (ret == null) return null;
        offset = nextOffset;
        if (offset == 0 || offset == token.length()) token = null;
        lookahead = null;
        return ret;
    }

    /* Classifies a token seen from its beginning. */
    private ArgValue splitFresh() {
        if (token.equals("-")) {
            nextOffset = 0;
            return new ArgValue(ArgType.ARGUMENT, token);
        } else if (token.equals("--")) {
            nextOffset = 0;
            return new ArgValue(ArgType.SPECIAL, token);
        } else if (token.startsWith("--")) {
            int eq = token.indexOf('=');
            if (eq == -1) {
                nextOffset = 0;
                return new ArgValue(ArgType.LONG_OPTION, token.substring(2));
            }
            nextOffset = -(eq + 1);
            return new ArgValue(ArgType.LONG_OPTION, token.substring(2, eq));
        } else if (token.startsWith("-")) {
            return new ArgValue(ArgType.SHORT_OPTION, shortOptionAt(1));
        } else {
            nextOffset = 0;
            return new ArgValue(ArgType.ARGUMENT, token);
        }
    }

    /* The short option starting at index, which may be a surrogate pair. */
    private String shortOptionAt(int index) {
        int end = index + Character.charCount(token.codePointAt(index));
        nextOffset = end;
        return token.substring(index, end);
    }

}

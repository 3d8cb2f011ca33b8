package net.optspec.argparse;

import java.util.regex.Pattern;

/**
 * A single occurrence of a flag on the command line, before validation.
 * Text values record whether the tokenizer considered them numeric; the
 * original text is always retained.
 */
public final class RawValue {

    public enum Kind {
        SWITCH, // Bare flag of a boolean option
        ABSENT, // Value-taking flag with no value following it
        TEXT    // Flag with a value (attached or separate)
    }

    public static final Pattern NUMERIC = Pattern.compile(
        "[-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][-+]?\\d+)?");

    public static final RawValue SWITCH = new RawValue(Kind.SWITCH, null,
                                                       false);
    public static final RawValue ABSENT = new RawValue(Kind.ABSENT, null,
                                                       false);

    private final Kind kind;
    private final String text;
    private final boolean attached;
    private final Double number;

    private RawValue(Kind kind, String text, boolean attached) {
        this.kind = kind;
        this.text = text;
        this.attached = attached;
        this.number = (text != null && looksNumeric(text)) ?
            Double.valueOf(text) : null;
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    /** Whether the value was glued to its flag ("--x=v" or "-xv"). */
    public boolean isAttached() {
        return attached;
    }

    public boolean isNumeric() {
        return (number != null);
    }

    public Double getNumber() {
        return number;
    }

    public String toString() {
        switch (kind) {
            case SWITCH: return "<switch>";
            case ABSENT: return "<absent>";
            case TEXT  : return ((attached) ? "=" : " ") + text;
            default: throw new AssertionError("This should not happen!");
        }
    }

    public static RawValue text(String text, boolean attached) {
        if (text == null)
            throw new NullPointerException("Raw value text may not be null");
        return new RawValue(Kind.TEXT, text, attached);
    }

    public static boolean looksNumeric(String s) {
        return NUMERIC.matcher(s).matches();
    }

}

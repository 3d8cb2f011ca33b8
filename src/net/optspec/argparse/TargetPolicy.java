package net.optspec.argparse;

/**
 * Whether at least one positional target must be present.
 */
public final class TargetPolicy {

    public static final String DEFAULT_MESSAGE =
        "at least one target is required";

    public static final TargetPolicy OFF = new TargetPolicy(false, null);
    public static final TargetPolicy REQUIRED = new TargetPolicy(true,
        DEFAULT_MESSAGE);

    private final boolean required;
    private final String message;

    private TargetPolicy(boolean required, String message) {
        this.required = required;
        this.message = message;
    }

    public boolean isRequired() {
        return required;
    }

    /** The error message used when no target is given, or null if off. */
    public String getMessage() {
        return message;
    }

    public String toString() {
        return (required) ? "TargetPolicy[required: " + message + "]" :
            "TargetPolicy[off]";
    }

    public static TargetPolicy requiring(String message) {
        if (message == null)
            throw new NullPointerException("Message may not be null");
        return new TargetPolicy(true, message);
    }

}

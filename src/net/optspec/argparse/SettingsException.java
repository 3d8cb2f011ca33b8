package net.optspec.argparse;

/**
 * Signals a mistake in the option definitions themselves.
 * Raised while definitions are parsed, before any command-line argument is
 * looked at; never subject to the exit-on-error policy.
 */
public class SettingsException extends RuntimeException {

    private final String definition;

    public SettingsException(String message) {
        this(message, null, null);
    }
    public SettingsException(String message, String definition) {
        this(message, definition, null);
    }
    public SettingsException(String message, String definition,
                             Throwable cause) {
        super(message, cause);
        this.definition = definition;
    }

    /**
     * The offending definition string, or null if the problem spans
     * several definitions.
     */
    public String getDefinition() {
        return definition;
    }

}

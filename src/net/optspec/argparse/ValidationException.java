package net.optspec.argparse;

import java.util.Collections;
import java.util.List;

/**
 * Signals that a command line does not satisfy the option definitions.
 * The message is meant for the user; {@link #getAliases()} names the flags
 * it is about (if any).
 */
public class ValidationException extends Exception {

    private final List<String> aliases;

    public ValidationException(String message) {
        this(message, Collections.<String>emptyList());
    }
    public ValidationException(String message, List<String> aliases) {
        super(message);
        this.aliases = Collections.unmodifiableList(aliases);
    }
    public ValidationException(String message, OptionDefinition option) {
        this(message, option.getAliases());
    }

    public List<String> getAliases() {
        return aliases;
    }

}

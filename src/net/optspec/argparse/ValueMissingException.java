package net.optspec.argparse;

public class ValueMissingException extends ValidationException {

    public ValueMissingException(String message, OptionDefinition option) {
        super(message, option);
    }

}

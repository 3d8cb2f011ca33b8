package net.optspec.argparse;

import net.optspec.util.Util;
import net.optspec.util.config.Configuration;

/**
 * Settings for {@link ArgumentParser}.
 * <p>
 * The exit-on-error and help-flag defaults (both true) can be overridden
 * for a whole process via the {@value #EXIT_ON_ERROR_KEY} and
 * {@value #HANDLE_HELP_KEY} system properties (or the corresponding
 * environment variables {@code OPTSPEC_EXITONERROR} and
 * {@code OPTSPEC_HANDLEHELP}); explicit setter calls win over both.
 */
public class ParserConfig {

    public static final String EXIT_ON_ERROR_KEY = "optspec.exitOnError";
    public static final String HANDLE_HELP_KEY = "optspec.handleHelp";

    private String usage;
    private boolean exitOnProcessError;
    private boolean handleHelpFlag;
    private TargetPolicy requireTarget;
    private ExitHandler exitHandler;
    private Tokenizer tokenizer;

    public ParserConfig(Configuration source) {
        this.usage = null;
        this.exitOnProcessError = getFlag(source, EXIT_ON_ERROR_KEY, true);
        this.handleHelpFlag = getFlag(source, HANDLE_HELP_KEY, true);
        this.requireTarget = TargetPolicy.OFF;
        this.exitHandler = SystemExitHandler.INSTANCE;
        this.tokenizer = new SplitterTokenizer();
    }
    public ParserConfig() {
        this(Configuration.DEFAULT);
    }

    /** The usage synopsis shown atop help text; may be null. */
    public String getUsage() {
        return usage;
    }
    public ParserConfig withUsage(String u) {
        usage = u;
        return this;
    }

    /**
     * Whether validation errors end the process (through the
     * {@link ExitHandler}) rather than only being thrown.
     * This also governs help requests.
     */
    public boolean isExitOnProcessError() {
        return exitOnProcessError;
    }
    public ParserConfig withExitOnProcessError(boolean e) {
        exitOnProcessError = e;
        return this;
    }

    /**
     * Whether a boolean option keyed {@code "help"} that resolves to true
     * is treated as a help request.
     */
    public boolean isHandleHelpFlag() {
        return handleHelpFlag;
    }
    public ParserConfig withHandleHelpFlag(boolean h) {
        handleHelpFlag = h;
        return this;
    }

    public TargetPolicy getRequireTarget() {
        return requireTarget;
    }
    public ParserConfig withRequireTarget(TargetPolicy p) {
        if (p == null)
            throw new NullPointerException("Target policy may not be null");
        requireTarget = p;
        return this;
    }

    public ExitHandler getExitHandler() {
        return exitHandler;
    }
    public ParserConfig withExitHandler(ExitHandler h) {
        if (h == null)
            throw new NullPointerException("Exit handler may not be null");
        exitHandler = h;
        return this;
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }
    public ParserConfig withTokenizer(Tokenizer t) {
        if (t == null)
            throw new NullPointerException("Tokenizer may not be null");
        tokenizer = t;
        return this;
    }

    private static boolean getFlag(Configuration source, String key,
                                   boolean dflt) {
        String value = source.get(key);
        return (value == null) ? dflt : Util.isTrue(value);
    }

}

package net.optspec.argparse;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Parses command lines against textual option definitions.
 * <p>
 * Typical use:
 * <pre>
 *     Map&lt;String, String&gt; defs = new LinkedHashMap&lt;String, String&gt;();
 *     defs.put("port", "-p,--port:number=3000; Port to use");
 *     defs.put("help", "--help:boolean; Show this help");
 *     ParseResult r = ArgumentParser.parse(args, defs,
 *         new ParserConfig().withUsage("serve [&lt;options&gt;]"));
 *     double port = r.getNumber("port");
 * </pre>
 * See {@link DefinitionParser} for the definition syntax.
 * <p>
 * Mistakes in the definitions surface as {@link SettingsException}s before
 * any argument is examined. Mistakes in the command line surface as
 * {@link ValidationException}s; unless exiting is disabled in the
 * {@link ParserConfig}, the error message and the help text are handed to
 * the configured {@link ExitHandler} with status 1 beforehand. A help
 * request likewise hands the help text to the handler with status 0.
 */
public class ArgumentParser {

    public static final String HELP_KEY = "help";
    public static final int ERROR_STATUS = 1;

    private static final Logger LOGGER = Logger.getLogger("ArgumentParser");

    private final ParserConfig config;

    public ArgumentParser(ParserConfig config) {
        this.config = config;
    }
    public ArgumentParser() {
        this(new ParserConfig());
    }

    public ParserConfig getConfig() {
        return config;
    }

    public ParseResult parse(List<String> args, Map<String, String> specs)
            throws ValidationException {
        return parse(args, DefinitionSet.parse(specs));
    }

    public ParseResult parse(List<String> args, DefinitionSet defs)
            throws ValidationException {
        String help = HelpFormatter.format(config.getUsage(), defs);
        TokenizedArguments tokens = config.getTokenizer().tokenize(args,
                                                                   defs);
        Map<String, Object> options;
        try {
            options = Validator.validate(defs, tokens,
                                         config.getRequireTarget());
        } catch (ValidationException exc) {
            LOGGER.fine("Invalid command line: " + exc.getMessage());
            if (config.isExitOnProcessError())
                config.getExitHandler().exit(exc.getMessage() + "\n" + help,
                                             ERROR_STATUS);
            throw exc;
        }
        boolean helpRequested = isHelpRequested(defs, options);
        if (helpRequested && config.isExitOnProcessError()) {
            LOGGER.fine("Help requested");
            config.getExitHandler().exit(help, 0);
        }
        return new ParseResult(tokens.getTargets(), options,
            tokens.getRest(), defs, help, config.getExitHandler(),
            helpRequested);
    }

    private boolean isHelpRequested(DefinitionSet defs,
                                    Map<String, Object> options) {
        if (! config.isHandleHelpFlag()) return false;
        OptionDefinition def = defs.get(HELP_KEY);
        return (def != null && def.getValueType() == ValueType.BOOLEAN &&
                Boolean.TRUE.equals(options.get(HELP_KEY)));
    }

    public static ParseResult parse(List<String> args,
            Map<String, String> specs, ParserConfig config)
            throws ValidationException {
        return new ArgumentParser(config).parse(args, specs);
    }
    public static ParseResult parse(String[] args,
            Map<String, String> specs, ParserConfig config)
            throws ValidationException {
        return parse(Arrays.asList(args), specs, config);
    }

}

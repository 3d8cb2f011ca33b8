package net.optspec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import net.optspec.argparse.ArgumentParser;
import net.optspec.argparse.ParseResult;
import net.optspec.argparse.ParserConfig;
import net.optspec.argparse.ValidationException;
import net.optspec.util.Logging;
import net.optspec.util.Util;
import net.optspec.util.config.Configuration;

/**
 * Demonstration program: parses a small server-style command line and
 * echoes what it got.
 */
public class Main implements Runnable {

    public static final String APPNAME = "optspec-demo";
    public static final String USAGE = APPNAME + " [<options>] <paths>...";
    public static final String DEBUG_KEY = "optspec.debug";

    public static final Map<String, String> DEFINITIONS;

    private static final Logger LOGGER;

    static {
        Logging.initFormat();
        LOGGER = Logger.getLogger("Main");
        Map<String, String> defs = new LinkedHashMap<String, String>();
        defs.put("port",    "-p,--port:number=3000;         Port to use");
        defs.put("address", "-a,--address:string=\"0.0.0.0\"; Address to use");
        defs.put("cors",    "--cors:boolean;                Enable CORS");
        defs.put("help",    "--help:boolean;                Show this help");
        DEFINITIONS = Collections.unmodifiableMap(defs);
    }

    private final String[] args;

    public Main(String[] args) {
        this.args = args;
    }

    public void run() {
        if (Util.isTrue(Configuration.DEFAULT.get(DEBUG_KEY))) {
            Logging.enableTracing(System.err);
        }
        ParseResult r;
        try {
            r = ArgumentParser.parse(args, DEFINITIONS,
                                     new ParserConfig().withUsage(USAGE));
        } catch (ValidationException exc) {
            // Only reached if exiting has been disabled via configuration.
            System.err.println(exc.getMessage());
            System.exit(ArgumentParser.ERROR_STATUS);
            return;
        }
        if (r.isHelpRequested()) {
            r.help(0);
            return;
        }
        LOGGER.info("Parsed command line: " + r);
        System.out.println("port:    " + r.getNumber("port").intValue());
        System.out.println("address: " + r.getString("address"));
        System.out.println("cors:    " + r.getBoolean("cors"));
        System.out.println("paths:   " + r.getTargets());
    }

    public static void main(String[] args) {
        new Main(args).run();
    }

}

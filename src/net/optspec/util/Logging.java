package net.optspec.util;

import java.io.OutputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

public final class Logging {

    public static final String FORMAT_PROPERTY =
        "java.util.logging.SimpleFormatter.format";
    public static final String FORMAT =
        "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL %4$s %3$s] %5$s%6$s%n";

    private Logging() {}

    /** Must run before the first SimpleFormatter is created. */
    public static void initFormat() {
        if (System.getProperty(FORMAT_PROPERTY) == null)
            System.setProperty(FORMAT_PROPERTY, FORMAT);
    }

    public static void redirectToStream(OutputStream os) {
        Logger rootLogger = Logger.getLogger("");
        Handler newhnd = new StreamHandler(os, new SimpleFormatter()) {
            public synchronized void publish(LogRecord record) {
                // Tracing output interleaves with the program's own.
                super.publish(record);
                flush();
            }
        };
        for (Handler hnd : rootLogger.getHandlers()) {
            rootLogger.removeHandler(hnd);
        }
        rootLogger.addHandler(newhnd);
    }

    public static void setLevel(Level level) {
        Logger rootLogger = Logger.getLogger("");
        rootLogger.setLevel(level);
        for (Handler hnd : rootLogger.getHandlers()) {
            hnd.setLevel(level);
        }
    }

    /**
     * Send the parser's FINE-level traces (definition parsing, validation
     * outcomes, exits) to the given stream.
     */
    public static void enableTracing(OutputStream os) {
        redirectToStream(os);
        setLevel(Level.FINE);
    }

}

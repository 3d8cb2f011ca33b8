package net.optspec.argparse;

import java.io.PrintStream;
import java.util.logging.Logger;

public class SystemExitHandler implements ExitHandler {

    private static final Logger LOGGER = Logger.getLogger("ExitHandler");

    public static final SystemExitHandler INSTANCE = new SystemExitHandler();

    public void show(String text, int status) {
        PrintStream out = (status == 0) ? System.out : System.err;
        out.println(text);
        out.flush();
    }

    public void finish(int status) {
        LOGGER.fine("Exiting with status " + status);
        System.exit(status);
    }

    public void exit(String text, int status) {
        show(text, status);
        finish(status);
    }

}

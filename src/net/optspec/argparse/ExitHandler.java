package net.optspec.argparse;

/**
 * Terminal action taken when parsing ends in an error or a help request.
 * The default implementation prints the text and terminates the process;
 * embedders and tests substitute their own to keep the process alive.
 * If {@link #exit} returns normally, the caller carries on as if exiting
 * were disabled.
 */
public interface ExitHandler {

    /**
     * Report text and finish.
     *
     * @param text   Help text, possibly preceded by an error message.
     * @param status Zero for a help request; nonzero for an error.
     */
    void exit(String text, int status);

}

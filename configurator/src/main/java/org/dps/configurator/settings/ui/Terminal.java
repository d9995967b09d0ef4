package org.dps.configurator.settings.ui;

public interface Terminal {

    /**
     * @return the entered line without its terminator, or {@code null} at end of input
     */
    String readLine(String prompt);

    /**
     * Reads a line without echoing it where the terminal supports that.
     *
     * @return the entered line, or {@code null} at end of input
     */
    String readSecret(String prompt);

    void println(String line);

    default void println() {
        println("");
    }
}

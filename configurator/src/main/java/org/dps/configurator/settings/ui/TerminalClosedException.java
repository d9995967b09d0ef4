package org.dps.configurator.settings.ui;

public class TerminalClosedException extends RuntimeException {
    public TerminalClosedException() {
        super("Terminal input closed");
    }
}

package org.dps.configurator.settings.ui;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public class ConsoleTerminal implements Terminal {
    private final BufferedReader reader;
    private final PrintStream out;
    private final Console console;

    public ConsoleTerminal(InputStream in, PrintStream out, Console console) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.console = console;
    }

    public static ConsoleTerminal system() {
        return new ConsoleTerminal(System.in, System.err, System.console());
    }

    @Override
    public String readLine(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from terminal", e);
        }
    }

    @Override
    public String readSecret(String prompt) {
        if (console == null) {
            return readLine(prompt);
        }
        char[] secret = console.readPassword("%s", prompt);
        return secret != null ? new String(secret) : null;
    }

    @Override
    public void println(String line) {
        out.println(line);
    }
}

package org.dps.configurator;

import org.dps.configurator.settings.io.ExportFormat;
import org.dps.configurator.settings.io.ExportMode;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void unknownFormatIsAUsageError() {
        CommandLine commandLine = new CommandLine(new Main());
        StringWriter err = new StringWriter();
        commandLine.setErr(new PrintWriter(err));

        int exitCode = commandLine.execute("--format", "xml");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertTrue(err.toString().contains("--format must be 'shell' or 'json'"));
    }

    @Test
    void helpListsOptions() {
        CommandLine commandLine = new CommandLine(new Main());
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));

        assertEquals(0, commandLine.execute("--help"));
        assertTrue(out.toString().contains("--export-mode"));
        assertTrue(out.toString().contains("--auto-confirm"));
    }

    @Test
    void exportOptionsAreCaseInsensitiveUnderAnyDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            Main main = new Main();
            new CommandLine(main).parseArgs("--format", "JSON", "--export-mode", "ALL");

            assertEquals(ExportFormat.JSON, main.parseFormat());
            assertEquals(ExportMode.ALL, main.parseExportMode());
        } finally {
            Locale.setDefault(saved);
        }
    }
}

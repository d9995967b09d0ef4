package org.dps.configurator;

import org.dps.configurator.config.ConfiguratorOptions;
import org.dps.configurator.config.OptionsLoader;
import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.SettingsManager;
import org.dps.configurator.settings.io.EnvironmentImporter;
import org.dps.configurator.settings.io.ExportFormat;
import org.dps.configurator.settings.io.ExportMode;
import org.dps.configurator.settings.ui.ConsoleTerminal;
import org.dps.configurator.settings.ui.WorkflowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
        name = "dps-configurator",
        mixinStandardHelpOptions = true,
        version = "dps-configurator 1.0",
        description = {
                "Collects, validates and confirms installer settings.%n",
                "Settings are preset from <PREFIX>_<NAME> environment variables. After confirmation the "
                        + "changed settings are printed as sourceable export lines."
        })
public class Main implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_CONFIRMED = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE", description = "Options file (default: ~/.dps/configurator.json)")
    private Path configFile;

    @Option(names = {"-p", "--prefix"}, description = "Environment variable prefix (default from options: DPS)")
    private String prefix;

    @Option(names = {"-y", "--auto-confirm"}, description = "Confirm without asking when the configuration is valid")
    private boolean autoConfirm;

    @Option(names = {"-o", "--export"}, paramLabel = "FILE", description = "Write the export to FILE instead of stdout")
    private Path exportFile;

    @Option(names = "--export-mode", paramLabel = "changed|all", defaultValue = "changed",
            description = "Export only changed settings or all of them (default: ${DEFAULT-VALUE})")
    private String exportMode;

    @Option(names = "--format", paramLabel = "shell|json", defaultValue = "shell",
            description = "Export format (default: ${DEFAULT-VALUE})")
    private String format;

    @Option(names = "--preset", paramLabel = "NAME", description = "Restrict the menu to this preset (repeatable)")
    private List<String> presets = new ArrayList<>();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        logger.info("DPS configurator starting");
        ExportMode mode = parseExportMode();
        ExportFormat exportFormat = parseFormat();

        ConfiguratorOptions options = new OptionsLoader().load(configFile != null ? configFile : OptionsLoader.defaultPath());
        if (prefix != null) {
            options.setEnvPrefix(prefix);
        }
        if (autoConfirm) {
            options.setAutoConfirm(true);
        }

        try {
            SettingsManager manager = new SettingsManager(options);
            EnvironmentImporter.ImportSummary summary = manager.importEnvironment(System.getenv());
            if (summary.invalidCount() > 0) {
                logger.warn("Invalid environment values for {}", summary.invalid());
            }

            WorkflowResult result = manager.workflow(ConsoleTerminal.system(), presets).run();
            if (!result.isConfirmed()) {
                return EXIT_ABORTED;
            }

            if (exportFile != null) {
                manager.exporter().write(exportFile, mode, exportFormat);
            } else {
                System.out.print(manager.exporter().render(mode, exportFormat));
                System.out.flush();
            }
            return EXIT_CONFIRMED;
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage(), e);
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            logger.error("Failed to write export to {}", exportFile, e);
            return EXIT_CONFIG_ERROR;
        }
    }

    ExportMode parseExportMode() {
        return switch (exportMode.toLowerCase(Locale.ROOT)) {
            case "changed" -> ExportMode.NON_DEFAULTS;
            case "all" -> ExportMode.ALL;
            default -> throw new ParameterException(spec.commandLine(),
                    "--export-mode must be 'changed' or 'all', got: " + exportMode);
        };
    }

    ExportFormat parseFormat() {
        return switch (format.toLowerCase(Locale.ROOT)) {
            case "shell" -> ExportFormat.SHELL;
            case "json" -> ExportFormat.JSON;
            default -> throw new ParameterException(spec.commandLine(),
                    "--format must be 'shell' or 'json', got: " + format);
        };
    }
}

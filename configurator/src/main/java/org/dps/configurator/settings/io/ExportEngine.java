package org.dps.configurator.settings.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.dps.configurator.settings.ConfigStore;
import org.dps.configurator.settings.model.Setting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

public class ExportEngine {
    private static final Logger logger = LoggerFactory.getLogger(ExportEngine.class);

    record ExportedSetting(String name, String preset, String value, String origin) {
    }

    private final ConfigStore store;
    private final String prefix;
    private final boolean comments;
    private final Gson gson;

    public ExportEngine(ConfigStore store, String prefix, boolean comments) {
        this.store = store;
        this.prefix = prefix;
        this.comments = comments;
        this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    }

    public String exportAll() {
        return export(ExportMode.ALL);
    }

    public String exportNonDefaults() {
        return export(ExportMode.NON_DEFAULTS);
    }

    public String export(ExportMode mode) {
        StringBuilder out = new StringBuilder();
        if (comments) {
            out.append("# Config export (").append(mode.getLabel()).append(") at ").append(LocalDate.now()).append('\n');
        }
        String currentPreset = null;
        for (Setting setting : store.settingsInPriorityOrder()) {
            if (!mode.includes(setting)) {
                continue;
            }
            if (comments && !setting.getPreset().equals(currentPreset)) {
                out.append('\n').append("# preset: ").append(setting.getPreset()).append('\n');
                currentPreset = setting.getPreset();
            }
            out.append("export ")
                    .append(EnvironmentImporter.variableName(prefix, setting.getName()))
                    .append("=\"")
                    .append(escape(setting.getValue()))
                    .append("\"\n");
        }
        return out.toString();
    }

    public String toJson(ExportMode mode) {
        List<ExportedSetting> exported = store.settingsInPriorityOrder().stream()
                .filter(mode::includes)
                .map(setting -> new ExportedSetting(setting.getName(), setting.getPreset(),
                        setting.getValue(), setting.getOrigin().label()))
                .toList();
        return gson.toJson(exported);
    }

    public String render(ExportMode mode, ExportFormat format) {
        return format == ExportFormat.JSON ? toJson(mode) + "\n" : export(mode);
    }

    public void write(Path target, ExportMode mode, ExportFormat format) throws IOException {
        logger.debug("Writing {} export to {}", format, target);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(mode, format));
        logger.info("Configuration exported to {}", target);
    }

    static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '"' || c == '\\' || c == '$' || c == '`') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}

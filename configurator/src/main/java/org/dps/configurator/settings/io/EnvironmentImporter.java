package org.dps.configurator.settings.io;

import org.dps.configurator.settings.ConfigStore;
import org.dps.configurator.settings.WriteResult;
import org.dps.configurator.settings.model.Origin;
import org.dps.configurator.settings.model.Setting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Overrides defaults from {@code <PREFIX>_<NAME>} environment variables, in preset priority then
 * declaration order. A variable that is set but empty counts as present and clears the value.
 */
public class EnvironmentImporter {
    private static final Logger logger = LoggerFactory.getLogger(EnvironmentImporter.class);

    public record ImportSummary(List<String> imported, List<String> invalid) {
        public ImportSummary {
            imported = List.copyOf(imported);
            invalid = List.copyOf(invalid);
        }

        public int importedCount() {
            return imported.size();
        }

        public int invalidCount() {
            return invalid.size();
        }
    }

    private final ConfigStore store;
    private final String prefix;
    private final Map<String, String> environment;

    public EnvironmentImporter(ConfigStore store, String prefix, Map<String, String> environment) {
        this.store = store;
        this.prefix = prefix;
        this.environment = environment;
    }

    public static String variableName(String prefix, String settingName) {
        if (prefix == null || prefix.isEmpty()) {
            return settingName;
        }
        return prefix.endsWith("_") ? prefix + settingName : prefix + "_" + settingName;
    }

    public ImportSummary importAll() {
        logger.debug("Importing configuration from environment (prefix: {})", prefix);
        List<String> imported = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (Setting setting : store.settingsInPriorityOrder()) {
            String variable = variableName(prefix, setting.getName());
            if (!environment.containsKey(variable)) {
                continue;
            }
            WriteResult result = store.set(setting.getName(), environment.get(variable), Origin.ENV);
            imported.add(setting.getName());
            if (result.status() == WriteResult.Status.STORED_INVALID) {
                invalid.add(setting.getName());
            }
        }
        if (!imported.isEmpty()) {
            logger.info("Environment import: {} setting(s) imported, {} invalid", imported.size(), invalid.size());
        }
        return new ImportSummary(imported, invalid);
    }

    public boolean importSingle(String settingName) {
        String variable = variableName(prefix, settingName);
        if (!environment.containsKey(variable)) {
            return false;
        }
        store.set(settingName, environment.get(variable), Origin.ENV);
        return true;
    }
}

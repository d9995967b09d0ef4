package org.dps.configurator.settings;

import lombok.Getter;
import org.dps.configurator.config.ConfiguratorOptions;
import org.dps.configurator.settings.io.EnvironmentImporter;
import org.dps.configurator.settings.io.ExportEngine;
import org.dps.configurator.settings.model.PresetModel;
import org.dps.configurator.settings.types.SettingTypeCatalog;
import org.dps.configurator.settings.ui.ConfigWorkflow;
import org.dps.configurator.settings.ui.Terminal;
import org.dps.configurator.settings.validation.ValidationEngine;
import org.dps.configurator.settings.visibility.VisibilityEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Getter
public class SettingsManager {
    private static final Logger logger = LoggerFactory.getLogger(SettingsManager.class);

    private final ConfiguratorOptions options;
    private final ConfigStore store;
    private final VisibilityEvaluator visibility;
    private final ValidationEngine validation;
    private final List<PresetModel> presets;

    public SettingsManager(ConfiguratorOptions options) {
        this(options, SettingTypeCatalog.withBuiltins(), defaultPresets());
    }

    public SettingsManager(ConfiguratorOptions options, SettingTypeCatalog catalog, List<Object> presetInstances) {
        logger.info("Initializing SettingsManager");
        this.options = options;
        this.store = new ConfigStore(catalog);
        this.presets = discoverPresets(presetInstances);
        for (PresetModel preset : presets) {
            preset.registerInto(store);
        }
        for (String disabled : options.getDisabledPresets()) {
            if (store.presets().stream().anyMatch(preset -> preset.getName().equals(disabled))) {
                store.setPresetEnabled(disabled, false);
            } else {
                logger.warn("Cannot disable unknown preset '{}'", disabled);
            }
        }
        this.visibility = new VisibilityEvaluator(store);
        this.validation = new ValidationEngine(store, visibility);
        logger.info("Configurator initialized ({} types, {} presets, {} settings)",
                catalog.typeNames().size(), store.presets().size(), store.list().size());
    }

    public static List<Object> defaultPresets() {
        return List.of(
                new QuickSetupSettings(),
                new NetworkSettings(),
                new DiskSettings(),
                new BootSettings(),
                new SecuritySettings(),
                new RegionSettings());
    }

    private List<PresetModel> discoverPresets(List<Object> presetInstances) {
        List<PresetModel> models = new ArrayList<>();
        for (Object instance : presetInstances) {
            models.add(new PresetModel(instance));
        }
        models.sort(Comparator.comparingInt(PresetModel::getPriority));
        return models;
    }

    public EnvironmentImporter.ImportSummary importEnvironment(Map<String, String> environment) {
        return new EnvironmentImporter(store, options.getEnvPrefix(), environment).importAll();
    }

    public ExportEngine exporter() {
        return new ExportEngine(store, options.getEnvPrefix(), options.isExportComments());
    }

    public ConfigWorkflow workflow(Terminal terminal, List<String> presetNames) {
        return new ConfigWorkflow(store, visibility, validation, terminal, presetNames, options.isAutoConfirm());
    }
}

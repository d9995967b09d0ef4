package org.dps.configurator.settings.validation;

import org.dps.configurator.settings.ConfigStore;
import org.dps.configurator.settings.model.Preset;
import org.dps.configurator.settings.model.Setting;
import org.dps.configurator.settings.visibility.VisibilityEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public class ValidationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ValidationEngine.class);

    private final ConfigStore store;
    private final VisibilityEvaluator visibility;

    public ValidationEngine(ConfigStore store, VisibilityEvaluator visibility) {
        this.store = store;
        this.visibility = visibility;
    }

    public Optional<ValidationError> validateSetting(String name) {
        Setting setting = store.getSetting(name);
        if (!visibility.isVisible(setting)) {
            return Optional.empty();
        }
        return store.getCatalog().validate(setting)
                .map(message -> ValidationError.forSetting(setting.getPreset(), name, message));
    }

    public ValidationReport validatePreset(String presetName) {
        Preset preset = store.getPreset(presetName);
        List<ValidationError> errors = new ArrayList<>();
        for (String name : preset.getSettings()) {
            validateSetting(name).ifPresent(errors::add);
        }
        preset.getValidator().ifPresent(validator -> validator.validate(store)
                .forEach(message -> errors.add(ValidationError.crossField(presetName, message))));

        if (!errors.isEmpty()) {
            logger.debug("Preset '{}' has {} error(s): {}", presetName, errors.size(), errors);
        }
        return new ValidationReport(errors);
    }

    public ValidationReport validateAll() {
        return validatePresets(store.enabledPresetsByPriority().stream().map(Preset::getName).toList());
    }

    public ValidationReport validateAll(Collection<String> presetNames) {
        if (presetNames == null || presetNames.isEmpty()) {
            return validateAll();
        }
        return validatePresets(presetNames);
    }

    private ValidationReport validatePresets(Collection<String> presetNames) {
        List<ValidationReport> reports = new ArrayList<>();
        for (String presetName : presetNames) {
            reports.add(validatePreset(presetName));
        }
        ValidationReport report = ValidationReport.merge(reports);
        logger.debug("Validated {} preset(s): {} error(s)", presetNames.size(), report.getErrorCount());
        return report;
    }
}

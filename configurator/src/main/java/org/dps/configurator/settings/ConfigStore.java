package org.dps.configurator.settings;

import org.dps.configurator.settings.apply.ApplyHookDispatcher;
import org.dps.configurator.settings.model.Origin;
import org.dps.configurator.settings.model.Preset;
import org.dps.configurator.settings.model.Setting;
import org.dps.configurator.settings.model.SettingAttributes;
import org.dps.configurator.settings.model.SettingDefinition;
import org.dps.configurator.settings.model.VisibilityRule;
import org.dps.configurator.settings.types.SettingType;
import org.dps.configurator.settings.types.SettingTypeCatalog;
import org.dps.configurator.settings.validation.CrossFieldValidator;
import org.dps.configurator.settings.visibility.ConditionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ConfigStore {
    private static final Logger logger = LoggerFactory.getLogger(ConfigStore.class);

    private final SettingTypeCatalog catalog;
    private final Map<String, Preset> presets = new LinkedHashMap<>();
    private final Map<String, Setting> settings = new LinkedHashMap<>();
    private final ApplyHookDispatcher dispatcher;

    public ConfigStore(SettingTypeCatalog catalog) {
        this.catalog = catalog;
        this.dispatcher = new ApplyHookDispatcher(this);
    }

    public SettingTypeCatalog getCatalog() {
        return catalog;
    }

    // ---------------------------------------------------------------- registration

    public Preset createPreset(String name, String display, int priority, CrossFieldValidator validator) {
        if (presets.containsKey(name)) {
            throw new DuplicatePresetException(name);
        }
        Preset preset = new Preset(name, display, priority, presets.size(), validator);
        presets.put(name, preset);
        logger.debug("Created preset '{}' (priority {})", name, priority);
        return preset;
    }

    public Setting create(String presetName, SettingDefinition definition) {
        String name = definition.getName();
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Setting in preset '" + presetName + "' has no name");
        }
        if (settings.containsKey(name)) {
            throw new DuplicateSettingException(name);
        }
        Preset preset = presets.get(presetName);
        if (preset == null) {
            throw new ConfigurationException("Setting '" + name + "' references unknown preset '" + presetName + "'");
        }
        if (definition.getType() == null || definition.getType().isBlank()) {
            throw new ConfigurationException("Setting '" + name + "' is missing its type");
        }
        SettingType type = catalog.lookup(definition.getType());
        SettingAttributes attributes = definition.getAttributes() != null
                ? definition.getAttributes() : SettingAttributes.none();
        type.checkAttributes(name, attributes);

        VisibilityRule visibility = ConditionParser.parseRule(name, definition.getVisibleAll(),
                definition.getVisibleAny(), settings::containsKey);

        Setting setting = new Setting(definition, type, visibility, presetName, settings.size());
        settings.put(name, setting);
        preset.addSetting(name);

        setting.check(setting.getDefaultValue())
                .filter(message -> !setting.getDefaultValue().isEmpty())
                .ifPresent(message -> logger.warn("Default of {} does not validate: {}", name, message));
        logger.debug("Created setting {} ({}) in preset '{}'", name, type.getName(), presetName);
        return setting;
    }

    // ---------------------------------------------------------------- values

    public String get(String name) {
        return getSetting(name).getValue();
    }

    public Origin getOrigin(String name) {
        return getSetting(name).getOrigin();
    }

    /**
     * Normalizes, validates and stores a value. Rejected values leave the setting untouched, except for
     * {@link Origin#ENV} where the value is kept and the problem surfaces at the next validation.
     * Accepted writes from the environment, a prompt or a manual call run the type's apply hook before
     * returning.
     */
    public WriteResult set(String name, String value, Origin origin) {
        Setting setting = getSetting(name);
        SettingType type = setting.getType();
        String normalized = type.normalize(value == null ? "" : value);
        if (normalized == null) {
            normalized = "";
        }
        String previous = setting.getValue();
        Optional<String> error = setting.check(normalized);

        if (error.isPresent()) {
            if (origin != Origin.ENV) {
                logger.debug("Rejected {} value for {}: {}", origin.label(), name, error.get());
                return WriteResult.rejected(name, previous, normalized, error.get());
            }
            logger.warn("Environment value for {} is invalid and will be re-prompted: {}", name, error.get());
            setting.assign(normalized, origin);
            return WriteResult.storedInvalid(name, previous, normalized, error.get());
        }

        setting.assign(normalized, origin);
        logger.debug("{} = {} ({})", name, type.display(normalized, setting.getAttributes()), origin.label());
        if (origin.triggersApply()) {
            dispatcher.dispatch(setting);
        }
        return WriteResult.accepted(name, previous, normalized);
    }

    public Setting getSetting(String name) {
        Setting setting = settings.get(name);
        if (setting == null) {
            throw new UnknownSettingException(name);
        }
        return setting;
    }

    public boolean contains(String name) {
        return settings.containsKey(name);
    }

    public SettingAttributes getAttributes(String name) {
        return getSetting(name).getAttributes();
    }

    public Optional<Object> getMeta(String name, String key) {
        SettingAttributes attributes = getAttributes(name);
        Object value = switch (key) {
            case "min" -> attributes.getMin();
            case "max" -> attributes.getMax();
            case "minLength" -> attributes.getMinLength();
            case "maxLength" -> attributes.getMaxLength();
            case "pattern" -> attributes.getPattern() != null ? attributes.getPattern().pattern() : null;
            case "options" -> attributes.hasOptions() ? attributes.getOptions() : null;
            default -> null;
        };
        return Optional.ofNullable(value);
    }

    // ---------------------------------------------------------------- listing

    public List<String> list() {
        return List.copyOf(settings.keySet());
    }

    public List<String> list(String presetName) {
        return getPreset(presetName).getSettings();
    }

    public Preset getPreset(String name) {
        Preset preset = presets.get(name);
        if (preset == null) {
            throw new ConfigurationException("Unknown preset '" + name + "'");
        }
        return preset;
    }

    public List<Preset> presets() {
        return List.copyOf(presets.values());
    }

    public List<Preset> presetsByPriority() {
        return presets.values().stream().sorted(Preset.BY_PRIORITY).toList();
    }

    public List<Preset> enabledPresetsByPriority() {
        return presets.values().stream().filter(Preset::isEnabled).sorted(Preset.BY_PRIORITY).toList();
    }

    public void setPresetEnabled(String name, boolean enabled) {
        getPreset(name).setEnabled(enabled);
        logger.debug("Preset '{}' {}", name, enabled ? "enabled" : "disabled");
    }

    public List<Setting> settingsInPriorityOrder() {
        List<Setting> ordered = new ArrayList<>();
        for (Preset preset : presetsByPriority()) {
            preset.getSettings().stream()
                    .map(settings::get)
                    .sorted(Comparator.comparingInt(Setting::getDeclarationIndex))
                    .forEach(ordered::add);
        }
        return ordered;
    }
}

package org.dps.configurator.settings.model;

import lombok.Getter;
import org.dps.configurator.settings.types.SettingType;

import java.util.Optional;

@Getter
public class Setting {
    private final String name;
    private final SettingType type;
    private final String display;
    private final String defaultValue;
    private final boolean exportable;
    private final boolean required;
    private final SettingAttributes attributes;
    private final VisibilityRule visibility;
    private final String preset;
    private final int declarationIndex;
    private String value;
    private Origin origin;

    public Setting(SettingDefinition definition, SettingType type, VisibilityRule visibility,
                   String preset, int declarationIndex) {
        this.name = definition.getName();
        this.type = type;
        this.display = definition.getDisplay() != null ? definition.getDisplay() : definition.getName();
        this.defaultValue = definition.getDefaultValue() != null ? definition.getDefaultValue() : "";
        this.exportable = definition.isExportable();
        this.required = definition.isRequired();
        this.attributes = definition.getAttributes() != null ? definition.getAttributes() : SettingAttributes.none();
        this.visibility = visibility;
        this.preset = preset;
        this.declarationIndex = declarationIndex;
        this.value = this.defaultValue;
        this.origin = Origin.DEFAULT;
    }

    public void assign(String newValue, Origin newOrigin) {
        this.value = newValue != null ? newValue : "";
        this.origin = newOrigin;
    }

    /**
     * Checks a candidate value against this setting's type and attributes.
     * An empty value is valid unless the setting is required.
     *
     * @return the error message, or empty when the value is acceptable
     */
    public Optional<String> check(String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return required ? Optional.of("A value is required") : Optional.empty();
        }
        if (type.validate(candidate, attributes)) {
            return Optional.empty();
        }
        return Optional.of(type.errorMessage(candidate, attributes));
    }

    public String getTypeName() {
        return type.getName();
    }

    public String displayValue() {
        return type.display(value, attributes);
    }

    public String promptHint() {
        return type.promptHint(attributes);
    }
}

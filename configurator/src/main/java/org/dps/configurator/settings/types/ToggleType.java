package org.dps.configurator.settings.types;

import org.dps.configurator.settings.model.SettingAttributes;

import java.util.Locale;

public class ToggleType implements SettingType {

    @Override
    public String getName() {
        return "toggle";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "false", "enabled", "disabled", "1", "0" -> true;
            default -> false;
        };
    }

    @Override
    public String normalize(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "enabled", "1" -> "true";
            case "false", "disabled", "0" -> "false";
            default -> value;
        };
    }

    @Override
    public String display(String value, SettingAttributes attributes) {
        return switch (value) {
            case "true" -> "✓";
            case "false" -> "✗";
            default -> value;
        };
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        return "Enter true, false, enabled, or disabled";
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        return "(true/false, enabled/disabled)";
    }
}

package org.dps.configurator.settings.types;

import org.dps.configurator.settings.model.SettingAttributes;

import java.util.Locale;

public class QuestionType implements SettingType {

    @Override
    public String getName() {
        return "question";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "yes", "no", "y", "n" -> true;
            default -> false;
        };
    }

    @Override
    public String normalize(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "yes", "y" -> "yes";
            case "no", "n" -> "no";
            default -> value;
        };
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        return "Enter yes or no";
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        return "(yes/no)";
    }
}

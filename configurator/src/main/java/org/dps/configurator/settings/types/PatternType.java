package org.dps.configurator.settings.types;

import org.dps.configurator.settings.model.SettingAttributes;

import java.util.regex.Pattern;

abstract class PatternType implements SettingType {
    private final String name;
    private final Pattern pattern;
    private final String hint;
    private final String error;

    PatternType(String name, String regex, String hint, String error) {
        this.name = name;
        this.pattern = Pattern.compile(regex);
        this.hint = hint;
        this.error = error;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        return value != null && pattern.matcher(value).matches();
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        return error;
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        return hint;
    }
}

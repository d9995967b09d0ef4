package org.dps.configurator.settings.types;

import org.dps.configurator.settings.model.SettingAttributes;

public class SecretType implements SettingType {
    private static final int DEFAULT_MIN_LENGTH = 8;

    @Override
    public String getName() {
        return "secret";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        return value.length() >= attributes.minLengthOr(DEFAULT_MIN_LENGTH);
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        return "Must be at least " + attributes.minLengthOr(DEFAULT_MIN_LENGTH) + " characters";
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        return "(hidden, min " + attributes.minLengthOr(DEFAULT_MIN_LENGTH) + " chars)";
    }

    @Override
    public boolean isSecret() {
        return true;
    }

    @Override
    public String display(String value, SettingAttributes attributes) {
        int length = value.length();
        if (length == 0) {
            return "(not set)";
        }
        if (length < 9) {
            return "*".repeat(length - 1) + value.charAt(length - 1);
        }
        int show = Math.max(1, Math.min(4, length / 10));
        return value.substring(0, show) + "*".repeat(length - show * 2) + value.substring(length - show);
    }
}

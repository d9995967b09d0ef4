package org.dps.configurator.settings.types;

import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.model.SettingAttributes;

public class StringType implements SettingType {

    @Override
    public String getName() {
        return "string";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        return matchesPattern(value, attributes) && withinLength(value, attributes);
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        if (!matchesPattern(value, attributes)) {
            return "Must match pattern: " + attributes.getPattern().pattern();
        }
        Integer min = attributes.getMinLength();
        Integer max = attributes.getMaxLength();
        if (min != null && max != null) {
            return "Length must be between " + min + " and " + max + " characters";
        } else if (min != null) {
            return "Must be at least " + min + " characters";
        } else if (max != null) {
            return "Must be at most " + max + " characters";
        }
        return "Invalid string";
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        Integer min = attributes.getMinLength();
        Integer max = attributes.getMaxLength();
        if (min != null && max != null) {
            return "(length: " + min + "-" + max + " chars)";
        } else if (min != null) {
            return "(min: " + min + " chars)";
        } else if (max != null) {
            return "(max: " + max + " chars)";
        }
        return "";
    }

    @Override
    public void checkAttributes(String settingName, SettingAttributes attributes) {
        Integer min = attributes.getMinLength();
        Integer max = attributes.getMaxLength();
        if (min != null && max != null && min > max) {
            throw new ConfigurationException("Setting '" + settingName + "' has minLength greater than maxLength");
        }
    }

    private static boolean matchesPattern(String value, SettingAttributes attributes) {
        return attributes.getPattern() == null || attributes.getPattern().matcher(value).matches();
    }

    private static boolean withinLength(String value, SettingAttributes attributes) {
        int length = value.length();
        if (attributes.getMinLength() != null && length < attributes.getMinLength()) {
            return false;
        }
        return attributes.getMaxLength() == null || length <= attributes.getMaxLength();
    }
}

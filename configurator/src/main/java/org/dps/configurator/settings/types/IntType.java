package org.dps.configurator.settings.types;

import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.model.SettingAttributes;

import java.util.regex.Pattern;

public class IntType implements SettingType {
    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

    @Override
    public String getName() {
        return "int";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        if (!INTEGER.matcher(value).matches()) {
            return false;
        }
        long number;
        try {
            number = Long.parseLong(value);
        } catch (NumberFormatException e) {
            return false;
        }
        if (attributes.getMin() != null && number < attributes.getMin()) {
            return false;
        }
        return attributes.getMax() == null || number <= attributes.getMax();
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        if (!INTEGER.matcher(value).matches()) {
            return "Must be an integer (no letters or special characters)";
        }
        Integer min = attributes.getMin();
        Integer max = attributes.getMax();
        if (min != null && max != null) {
            return "Must be between " + min + " and " + max;
        } else if (min != null) {
            return "Must be >= " + min;
        } else if (max != null) {
            return "Must be <= " + max;
        }
        return "Out of range";
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        Integer min = attributes.getMin();
        Integer max = attributes.getMax();
        if (min != null && max != null) {
            return "(" + min + "-" + max + ")";
        } else if (min != null) {
            return "(min: " + min + ")";
        } else if (max != null) {
            return "(max: " + max + ")";
        }
        return "";
    }

    @Override
    public void checkAttributes(String settingName, SettingAttributes attributes) {
        if (attributes.getMin() != null && attributes.getMax() != null && attributes.getMin() > attributes.getMax()) {
            throw new ConfigurationException("Setting '" + settingName + "' has min greater than max");
        }
    }
}

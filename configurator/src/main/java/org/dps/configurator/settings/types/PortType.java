package org.dps.configurator.settings.types;

import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.model.SettingAttributes;

import java.util.regex.Pattern;

public class PortType implements SettingType {
    private static final Pattern DIGITS = Pattern.compile("[0-9]{1,9}");
    private static final int LOWEST = 1;
    private static final int HIGHEST = 65535;

    @Override
    public String getName() {
        return "port";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        if (!DIGITS.matcher(value).matches()) {
            return false;
        }
        int port = Integer.parseInt(value);
        return port >= attributes.minOr(LOWEST) && port <= attributes.maxOr(HIGHEST);
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        if (!DIGITS.matcher(value).matches()) {
            return "Port must be numeric (no letters or special characters)";
        }
        return "Port must be between " + attributes.minOr(LOWEST) + " and " + attributes.maxOr(HIGHEST);
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        return "(" + attributes.minOr(LOWEST) + "-" + attributes.maxOr(HIGHEST) + ")";
    }

    @Override
    public void checkAttributes(String settingName, SettingAttributes attributes) {
        int min = attributes.minOr(LOWEST);
        int max = attributes.maxOr(HIGHEST);
        if (min < 0 || max > HIGHEST || min > max) {
            throw new ConfigurationException("Setting '" + settingName + "' has an invalid port range " + min + "-" + max);
        }
    }
}

package org.dps.configurator.settings;

public class UnknownSettingException extends ConfigurationException {
    private final String settingName;

    public UnknownSettingException(String settingName) {
        super(String.format("Unknown setting '%s'", settingName));
        this.settingName = settingName;
    }

    public String getSettingName() {
        return settingName;
    }
}

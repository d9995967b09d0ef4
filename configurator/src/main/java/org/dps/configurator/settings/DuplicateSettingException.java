package org.dps.configurator.settings;

public class DuplicateSettingException extends ConfigurationException {
    private final String settingName;

    public DuplicateSettingException(String settingName) {
        super(String.format("Setting '%s' already exists", settingName));
        this.settingName = settingName;
    }

    public String getSettingName() {
        return settingName;
    }
}

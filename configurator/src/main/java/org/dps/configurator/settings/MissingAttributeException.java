package org.dps.configurator.settings;

public class MissingAttributeException extends ConfigurationException {
    private final String settingName;
    private final String attribute;

    public MissingAttributeException(String settingName, String typeName, String attribute) {
        super(String.format("Setting '%s' of type '%s' requires the '%s' attribute", settingName, typeName, attribute));
        this.settingName = settingName;
        this.attribute = attribute;
    }

    public String getSettingName() {
        return settingName;
    }

    public String getAttribute() {
        return attribute;
    }
}

package org.dps.configurator.settings;

public class DuplicatePresetException extends ConfigurationException {
    private final String presetName;

    public DuplicatePresetException(String presetName) {
        super(String.format("Preset '%s' already exists", presetName));
        this.presetName = presetName;
    }

    public String getPresetName() {
        return presetName;
    }
}

package org.dps.configurator.settings.io;

import org.dps.configurator.settings.model.Origin;
import org.dps.configurator.settings.model.Setting;

public enum ExportMode {
    ALL("all settings"),
    NON_DEFAULTS("non-default settings");

    private final String label;

    ExportMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean includes(Setting setting) {
        if (!setting.isExportable()) {
            return false;
        }
        return this == ALL || setting.getOrigin() != Origin.DEFAULT;
    }
}

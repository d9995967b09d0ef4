package org.dps.configurator.settings.io;

public enum ExportFormat {
    SHELL,
    JSON
}

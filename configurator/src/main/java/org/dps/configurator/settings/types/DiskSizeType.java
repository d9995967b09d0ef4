package org.dps.configurator.settings.types;

import java.util.Locale;

public class DiskSizeType extends PatternType {

    public DiskSizeType() {
        super("diskSize",
                "[0-9]+[KMGT]?",
                "(e.g., 8G, 500M, 1T)",
                "Invalid disk size format (examples: 8G, 500M, 1T, 50G)");
    }

    @Override
    public String normalize(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }
}

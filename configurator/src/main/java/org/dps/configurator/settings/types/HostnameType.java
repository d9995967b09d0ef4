package org.dps.configurator.settings.types;

import java.util.Locale;

public class HostnameType extends PatternType {

    public HostnameType() {
        super("hostname",
                "[a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?",
                "(alphanumeric, hyphens allowed, no leading/trailing hyphens)",
                "Invalid hostname. Use 1-63 alphanumeric characters and hyphens (no leading/trailing hyphens)");
    }

    @Override
    public String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}

package org.dps.configurator.settings.model;

import java.util.Locale;

public enum Origin {
    DEFAULT,
    ENV,
    PROMPT,
    AUTO,
    MANUAL;

    /**
     * Writes through these paths run the type's apply hook. Derived ({@link #AUTO}) writes never cascade further.
     */
    public boolean triggersApply() {
        return this == ENV || this == PROMPT || this == MANUAL;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package org.dps.configurator.settings.types;

import java.util.Locale;

public class KeyboardType extends PatternType {

    public KeyboardType() {
        super("keyboard",
                "[a-z]{2,5}",
                "(e.g., us, de, fr, uk, ch)",
                "Invalid keyboard layout. Use 2-5 lowercase letters (e.g., us, de, fr)");
    }

    @Override
    public String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}

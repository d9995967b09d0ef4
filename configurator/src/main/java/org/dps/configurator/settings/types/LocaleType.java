package org.dps.configurator.settings.types;

public class LocaleType extends PatternType {

    public LocaleType() {
        super("locale",
                "[a-z]{2}_[A-Z]{2}\\.(UTF-8|utf8)",
                "(e.g., en_US.UTF-8, de_DE.UTF-8, fr_FR.UTF-8)",
                "Invalid locale format. Use: language_COUNTRY.UTF-8 (e.g., en_US.UTF-8)");
    }

    @Override
    public String normalize(String value) {
        return value.trim().replace(".utf8", ".UTF-8");
    }
}

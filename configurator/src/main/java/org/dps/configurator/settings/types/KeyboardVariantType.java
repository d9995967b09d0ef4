package org.dps.configurator.settings.types;

// variants are case-sensitive in X11, so no normalization
public class KeyboardVariantType extends PatternType {

    public KeyboardVariantType() {
        super("keyboardVariant",
                "[a-zA-Z0-9_-]+",
                "(e.g., nodeadkeys, intl, dvorak, or empty for standard)",
                "Invalid keyboard variant. Use alphanumeric characters, hyphens, underscores, or leave empty");
    }
}

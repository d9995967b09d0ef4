package org.dps.configurator.settings.validation;

public record ValidationError(String preset, String setting, ErrorKind kind, String message) {

    public static ValidationError forSetting(String preset, String setting, String message) {
        return new ValidationError(preset, setting, ErrorKind.VALIDATION, message);
    }

    public static ValidationError crossField(String preset, String message) {
        return new ValidationError(preset, null, ErrorKind.CROSS_FIELD, message);
    }

    @Override
    public String toString() {
        return kind == ErrorKind.CROSS_FIELD
                ? preset + ": " + message
                : setting + ": " + message;
    }
}

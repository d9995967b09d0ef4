package org.dps.configurator.settings.validation;

public enum ErrorKind {
    VALIDATION,
    CROSS_FIELD
}

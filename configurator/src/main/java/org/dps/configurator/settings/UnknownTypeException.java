package org.dps.configurator.settings;

public class UnknownTypeException extends ConfigurationException {
    private final String typeName;

    public UnknownTypeException(String typeName) {
        super(String.format("Unknown setting type '%s'", typeName));
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}

package org.dps.configurator.settings.types;

public class FloatType extends PatternType {

    public FloatType() {
        super("float", "-?[0-9]+(\\.[0-9]+)?", "(decimal number)", "Must be a number (integer or decimal)");
    }
}

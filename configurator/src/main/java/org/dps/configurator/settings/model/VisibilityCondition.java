package org.dps.configurator.settings.model;

public record VisibilityCondition(String setting, Operator operator, String operand) {

    @Override
    public String toString() {
        return setting + operator.getSymbol() + operand;
    }
}

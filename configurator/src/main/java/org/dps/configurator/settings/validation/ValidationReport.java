package org.dps.configurator.settings.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class ValidationReport {
    private final List<ValidationError> errors;

    public ValidationReport(List<ValidationError> errors) {
        this.errors = List.copyOf(errors);
    }

    public static ValidationReport merge(Collection<ValidationReport> reports) {
        List<ValidationError> all = new ArrayList<>();
        reports.forEach(report -> all.addAll(report.errors));
        return new ValidationReport(all);
    }

    public int getErrorCount() {
        return errors.size();
    }

    public boolean isClean() {
        return errors.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public boolean hasCrossFieldError(String preset) {
        return errors.stream()
                .anyMatch(error -> error.preset().equals(preset) && error.kind() == ErrorKind.CROSS_FIELD);
    }

    public boolean contains(String message) {
        return errors.stream().anyMatch(error -> error.message().contains(message));
    }

    @Override
    public String toString() {
        return "ValidationReport{errors=" + errors + "}";
    }
}

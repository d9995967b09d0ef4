package org.dps.configurator.settings.ui;

import org.dps.configurator.settings.validation.ValidationReport;

public record WorkflowResult(WorkflowState finalState, ValidationReport lastReport) {

    public boolean isConfirmed() {
        return finalState == WorkflowState.CONFIRMED;
    }
}

package org.dps.configurator.settings.ui;

public enum WorkflowState {
    VALIDATING,
    PROMPT_ERRORS_ONLY,
    MENU_DISPLAY,
    PRESET_EDIT_LOOP,
    CONFIRMED,
    ABORTED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == ABORTED;
    }
}

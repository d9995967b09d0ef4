package org.dps.configurator.settings.ui;

import org.dps.configurator.settings.ConfigStore;
import org.dps.configurator.settings.model.Preset;
import org.dps.configurator.settings.validation.ErrorKind;
import org.dps.configurator.settings.validation.ValidationEngine;
import org.dps.configurator.settings.validation.ValidationError;
import org.dps.configurator.settings.validation.ValidationReport;
import org.dps.configurator.settings.visibility.VisibilityEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class ConfigWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(ConfigWorkflow.class);

    static final String ERRORS_WARNING = "Configuration has errors. Fix before proceeding.";

    private final ConfigStore store;
    private final VisibilityEvaluator visibility;
    private final ValidationEngine validation;
    private final Terminal terminal;
    private final SettingPrompter prompter;
    private final PresetRenderer renderer;
    private final List<String> presetNames;
    private final boolean autoConfirm;

    private WorkflowState state = WorkflowState.VALIDATING;
    private ValidationReport lastReport;
    private String status;
    private Preset selected;

    public ConfigWorkflow(ConfigStore store, VisibilityEvaluator visibility, ValidationEngine validation,
                          Terminal terminal, List<String> presetNames, boolean autoConfirm) {
        this.store = store;
        this.visibility = visibility;
        this.validation = validation;
        this.terminal = terminal;
        this.prompter = new SettingPrompter(store, terminal);
        this.renderer = new PresetRenderer(visibility);
        this.presetNames = presetNames == null || presetNames.isEmpty()
                ? store.enabledPresetsByPriority().stream().map(Preset::getName).toList()
                : List.copyOf(presetNames);
        this.presetNames.forEach(store::getPreset);
        this.autoConfirm = autoConfirm;
    }

    public WorkflowResult run() {
        logger.debug("Starting configuration workflow for presets {}", presetNames);
        try {
            while (!state.isTerminal()) {
                WorkflowState next = switch (state) {
                    case VALIDATING -> validating();
                    case PROMPT_ERRORS_ONLY -> promptErrors();
                    case MENU_DISPLAY -> menu();
                    case PRESET_EDIT_LOOP -> editPreset();
                    case CONFIRMED, ABORTED -> state;
                };
                logger.debug("Workflow {} -> {}", state, next);
                state = next;
            }
        } catch (TerminalClosedException e) {
            logger.warn("Terminal input ended, aborting configuration");
            state = WorkflowState.ABORTED;
        }
        logger.info("Configuration workflow finished: {}", state);
        return new WorkflowResult(state, lastReport);
    }

    private WorkflowState validating() {
        lastReport = validation.validateAll(presetNames);
        return lastReport.isClean() ? WorkflowState.MENU_DISPLAY : WorkflowState.PROMPT_ERRORS_ONLY;
    }

    private WorkflowState promptErrors() {
        header("Configuration Required");
        for (String presetName : presetNames) {
            ValidationReport report = validation.validatePreset(presetName);
            if (report.isClean()) {
                continue;
            }
            Preset preset = store.getPreset(presetName);
            terminal.println(PresetRenderer.title(preset) + ":");
            if (report.hasCrossFieldError(presetName)) {
                printCrossFieldErrors(report);
                promptVisible(preset);
            } else {
                Set<String> failing = new LinkedHashSet<>();
                for (ValidationError error : report.getErrors()) {
                    failing.add(error.setting());
                }
                for (String name : failing) {
                    // an earlier answer may have hidden it
                    if (visibility.isVisible(name)) {
                        prompter.prompt(name);
                    }
                }
            }
            terminal.println();
        }
        return WorkflowState.VALIDATING;
    }

    private WorkflowState menu() {
        header("Configuration Menu");
        if (status != null) {
            terminal.println(status);
            status = null;
        }
        for (int i = 0; i < presetNames.size(); i++) {
            renderer.print(terminal, store.getPreset(presetNames.get(i)), i + 1);
            terminal.println();
        }

        if (autoConfirm) {
            lastReport = validation.validateAll(presetNames);
            if (lastReport.isClean()) {
                terminal.println("Auto-confirming configuration");
                return WorkflowState.CONFIRMED;
            }
            logger.warn("Auto-confirm skipped, configuration has {} error(s)", lastReport.getErrorCount());
        }

        String prompt = "Select preset (1-" + presetNames.size() + ", X to proceed, Q to abort): ";
        while (true) {
            String line = terminal.readLine(prompt);
            if (line == null) {
                throw new TerminalClosedException();
            }
            String selection = line.trim().toLowerCase(Locale.ROOT);
            if (selection.isEmpty()) {
                continue;
            }
            if (selection.equals("x")) {
                lastReport = validation.validateAll(presetNames);
                if (!lastReport.isClean()) {
                    status = "WARNING: " + ERRORS_WARNING;
                    return WorkflowState.MENU_DISPLAY;
                }
                terminal.println("Configuration confirmed");
                return WorkflowState.CONFIRMED;
            }
            if (selection.equals("q")) {
                terminal.println("Configuration aborted");
                return WorkflowState.ABORTED;
            }
            Integer index = parseSelection(selection);
            if (index != null) {
                selected = store.getPreset(presetNames.get(index));
                return WorkflowState.PRESET_EDIT_LOOP;
            }
            terminal.println("Invalid selection");
        }
    }

    private WorkflowState editPreset() {
        while (true) {
            terminal.println();
            header(PresetRenderer.title(selected));
            terminal.println(" Press ENTER to keep current value, or type new value");
            terminal.println();
            promptVisible(selected);

            ValidationReport report = validation.validatePreset(selected.getName());
            if (report.isClean()) {
                status = selected.getDisplay() + " updated";
                return WorkflowState.MENU_DISPLAY;
            }
            for (ValidationError error : report.getErrors()) {
                terminal.println("    Error: " + error.message());
            }
        }
    }

    private void promptVisible(Preset preset) {
        for (String name : preset.getSettings()) {
            if (visibility.isVisible(name)) {
                prompter.prompt(name);
            }
        }
    }

    private void printCrossFieldErrors(ValidationReport report) {
        for (ValidationError error : report.getErrors()) {
            if (error.kind() == ErrorKind.CROSS_FIELD) {
                terminal.println("    Error: " + error.message());
            }
        }
    }

    private Integer parseSelection(String selection) {
        if (!selection.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            int number = Integer.parseInt(selection);
            return number >= 1 && number <= presetNames.size() ? number - 1 : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void header(String title) {
        terminal.println("=== " + title + " ===");
    }
}

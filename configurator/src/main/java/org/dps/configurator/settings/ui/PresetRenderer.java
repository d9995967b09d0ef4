package org.dps.configurator.settings.ui;

import org.dps.configurator.settings.model.Preset;
import org.dps.configurator.settings.model.Setting;
import org.dps.configurator.settings.visibility.VisibilityEvaluator;

import java.util.ArrayList;
import java.util.List;

public class PresetRenderer {
    private final VisibilityEvaluator visibility;

    public PresetRenderer(VisibilityEvaluator visibility) {
        this.visibility = visibility;
    }

    public static String title(Preset preset) {
        String display = preset.getDisplay();
        return display.contains("Configuration") ? display : display + " Configuration";
    }

    public List<String> render(Preset preset, int number) {
        List<String> lines = new ArrayList<>();
        lines.add(number + ". " + title(preset) + ":");
        for (Setting setting : visibility.visibleSettings(preset.getName())) {
            lines.add("   > " + setting.getDisplay() + ": " + setting.displayValue());
        }
        return lines;
    }

    public void print(Terminal terminal, Preset preset, int number) {
        render(preset, number).forEach(terminal::println);
    }
}

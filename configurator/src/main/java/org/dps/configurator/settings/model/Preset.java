package org.dps.configurator.settings.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.dps.configurator.settings.validation.CrossFieldValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Getter
public class Preset {
    public static final Comparator<Preset> BY_PRIORITY =
            Comparator.comparingInt(Preset::getPriority).thenComparingInt(Preset::getRegistrationIndex);

    private final String name;
    private final String display;
    private final int priority;
    private final int registrationIndex;
    @Getter(AccessLevel.NONE)
    private final CrossFieldValidator validator;
    @Getter(AccessLevel.NONE)
    private final List<String> settings = new ArrayList<>();
    @Setter
    private boolean enabled = true;

    public Preset(String name, String display, int priority, int registrationIndex, CrossFieldValidator validator) {
        this.name = name;
        this.display = display == null || display.isBlank() ? defaultDisplay(name) : display;
        this.priority = priority;
        this.registrationIndex = registrationIndex;
        this.validator = validator;
    }

    public List<String> getSettings() {
        return Collections.unmodifiableList(settings);
    }

    public Optional<CrossFieldValidator> getValidator() {
        return Optional.ofNullable(validator);
    }

    public void addSetting(String settingName) {
        settings.add(settingName);
    }

    static String defaultDisplay(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        String spaced = name.replace('_', ' ');
        return spaced.substring(0, 1).toUpperCase(Locale.ROOT) + spaced.substring(1);
    }
}

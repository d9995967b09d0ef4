package org.dps.configurator.settings.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.regex.Pattern;

@Getter
@Builder(toBuilder = true)
public class SettingAttributes {
    private static final SettingAttributes NONE = SettingAttributes.builder().build();

    private final Integer min;
    private final Integer max;
    private final Integer minLength;
    private final Integer maxLength;
    private final Pattern pattern;
    @Builder.Default
    private final List<String> options = List.of();

    public static SettingAttributes none() {
        return NONE;
    }

    public boolean hasOptions() {
        return options != null && !options.isEmpty();
    }

    public int minOr(int fallback) {
        return min != null ? min : fallback;
    }

    public int maxOr(int fallback) {
        return max != null ? max : fallback;
    }

    public int minLengthOr(int fallback) {
        return minLength != null ? minLength : fallback;
    }
}

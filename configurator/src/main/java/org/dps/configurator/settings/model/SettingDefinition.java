package org.dps.configurator.settings.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class SettingDefinition {
    private final String name;
    private final String type;
    private final String display;
    @Builder.Default
    private final String defaultValue = "";
    @Builder.Default
    private final boolean exportable = true;
    private final boolean required;
    @Builder.Default
    private final SettingAttributes attributes = SettingAttributes.none();
    @Builder.Default
    private final List<String> visibleAll = List.of();
    @Builder.Default
    private final List<String> visibleAny = List.of();
}

package org.dps.configurator.settings.types;

import org.dps.configurator.settings.model.SettingAttributes;

import java.util.List;

public interface SettingType {

    String getName();

    boolean validate(String value, SettingAttributes attributes);

    default String normalize(String value) {
        return value;
    }

    default String display(String value, SettingAttributes attributes) {
        return value;
    }

    default String errorMessage(String value, SettingAttributes attributes) {
        return "Invalid value: " + value;
    }

    default String promptHint(SettingAttributes attributes) {
        return "";
    }

    default List<SettingWrite> apply(String value) {
        return List.of();
    }

    default void checkAttributes(String settingName, SettingAttributes attributes) {
    }

    default boolean isSecret() {
        return false;
    }
}

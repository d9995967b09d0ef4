package org.dps.configurator.settings.types;

public record SettingWrite(String setting, String value) {
}

package org.dps.configurator.settings;

import org.dps.configurator.settings.annotations.PresetCategory;
import org.dps.configurator.settings.annotations.SettingOptions;
import org.dps.configurator.settings.annotations.SettingSpec;

@PresetCategory(name = "boot", display = "Boot", priority = 30)
public class BootSettings {

    @SettingSpec(type = "toggle", display = "UEFI Mode", defaultValue = "true", order = 0)
    public static final String UEFI_MODE = "UEFI_MODE";

    @SettingSpec(type = "choice", display = "Bootloader", defaultValue = "systemd-boot", order = 1)
    @SettingOptions(values = {"systemd-boot", "grub", "refind"})
    public static final String BOOTLOADER = "BOOTLOADER";
}

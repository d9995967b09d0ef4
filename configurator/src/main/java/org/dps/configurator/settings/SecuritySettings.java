package org.dps.configurator.settings;

import org.dps.configurator.settings.annotations.PresetCategory;
import org.dps.configurator.settings.annotations.SettingOptions;
import org.dps.configurator.settings.annotations.SettingSpec;
import org.dps.configurator.settings.annotations.VisibleWhen;

@PresetCategory(name = "security", display = "Security", priority = 40)
public class SecuritySettings {

    @SettingSpec(type = "toggle", display = "Enable Secure Boot", defaultValue = "false", order = 0)
    public static final String SECURE_BOOT = "SECURE_BOOT";

    @SettingSpec(type = "choice", display = "Secure Boot Method", defaultValue = "lanzaboote", order = 1)
    @SettingOptions(values = {"lanzaboote", "sbctl"})
    @VisibleWhen(all = "SECURE_BOOT==true")
    public static final String SECURE_BOOT_METHOD = "SECURE_BOOT_METHOD";

    @SettingSpec(type = "toggle", display = "Enable Firewall", defaultValue = "true", order = 2)
    public static final String FIREWALL_ENABLE = "FIREWALL_ENABLE";

    @SettingSpec(type = "toggle", display = "Apply Security Hardening", defaultValue = "true", order = 3)
    public static final String HARDENING_ENABLE = "HARDENING_ENABLE";

    @SettingSpec(type = "toggle", display = "Enable Fail2Ban", defaultValue = "false", order = 4)
    public static final String FAIL2BAN_ENABLE = "FAIL2BAN_ENABLE";
}

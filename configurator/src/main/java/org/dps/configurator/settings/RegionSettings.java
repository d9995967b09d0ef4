package org.dps.configurator.settings;

import org.dps.configurator.settings.annotations.PresetCategory;
import org.dps.configurator.settings.annotations.SettingSpec;
import org.dps.configurator.settings.types.CountryType;

@PresetCategory(name = "region", display = "Region", priority = 50)
public class RegionSettings {

    @SettingSpec(type = "timezone", display = "Timezone", defaultValue = "UTC", order = 0)
    public static final String TIMEZONE = CountryType.TIMEZONE;

    @SettingSpec(type = "locale", display = "Primary Locale", defaultValue = "en_US.UTF-8", order = 1)
    public static final String LOCALE = CountryType.LOCALE;

    @SettingSpec(type = "text", display = "Additional Locales", order = 2)
    public static final String LOCALE_EXTRA = "LOCALE_EXTRA";

    @SettingSpec(type = "keyboard", display = "Keyboard Layout", defaultValue = "us", order = 3)
    public static final String KEYBOARD_LAYOUT = CountryType.KEYBOARD_LAYOUT;

    @SettingSpec(type = "keyboardVariant", display = "Keyboard Variant (optional)", order = 4)
    public static final String KEYBOARD_VARIANT = CountryType.KEYBOARD_VARIANT;
}

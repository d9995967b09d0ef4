package org.dps.configurator.settings;

import org.dps.configurator.settings.annotations.PresetCategory;
import org.dps.configurator.settings.annotations.SettingSpec;

@PresetCategory(name = "quick", display = "Quick Setup", priority = 5)
public class QuickSetupSettings {

    @SettingSpec(type = "country", display = "Country (quick setup)", exportable = false, order = 0)
    public static final String COUNTRY = "COUNTRY";
}

package org.dps.configurator.settings.types;

import org.dps.configurator.settings.model.SettingAttributes;

public class TextType implements SettingType {

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        return true;
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        return "(text input)";
    }
}

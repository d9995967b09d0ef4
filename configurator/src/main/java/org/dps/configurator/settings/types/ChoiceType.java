package org.dps.configurator.settings.types;

import org.dps.configurator.settings.MissingAttributeException;
import org.dps.configurator.settings.model.SettingAttributes;

public class ChoiceType implements SettingType {

    @Override
    public String getName() {
        return "choice";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        return attributes.hasOptions() && attributes.getOptions().contains(value);
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        return "Must be one of: " + String.join(", ", attributes.getOptions());
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        if (!attributes.hasOptions()) {
            return "(multiple choice)";
        }
        return "(" + String.join(", ", attributes.getOptions()) + ")";
    }

    @Override
    public void checkAttributes(String settingName, SettingAttributes attributes) {
        if (!attributes.hasOptions()) {
            throw new MissingAttributeException(settingName, getName(), "options");
        }
    }
}

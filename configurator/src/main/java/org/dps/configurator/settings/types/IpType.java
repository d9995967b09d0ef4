package org.dps.configurator.settings.types;

import org.dps.configurator.settings.model.SettingAttributes;

public class IpType implements SettingType {

    @Override
    public String getName() {
        return "ip";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        return Ipv4.isHostAddress(value);
    }

    @Override
    public String normalize(String value) {
        return value.trim();
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        return "Invalid IP address format (example: 192.168.1.1)";
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        return "(e.g., 192.168.1.10)";
    }
}

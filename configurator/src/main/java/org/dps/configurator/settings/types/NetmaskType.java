package org.dps.configurator.settings.types;

import org.dps.configurator.settings.model.SettingAttributes;

public class NetmaskType implements SettingType {

    @Override
    public String getName() {
        return "netmask";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        return Ipv4.isCidr(value) || Ipv4.isDottedMask(value);
    }

    @Override
    public String normalize(String value) {
        String trimmed = value.trim();
        if (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        if (Ipv4.isCidr(trimmed)) {
            return Ipv4.cidrToNetmask(Integer.parseInt(trimmed));
        }
        return trimmed;
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        return "Invalid network mask (use CIDR like 24 or dotted decimal like 255.255.255.0)";
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        return "(CIDR: 24 or dotted: 255.255.255.0)";
    }
}

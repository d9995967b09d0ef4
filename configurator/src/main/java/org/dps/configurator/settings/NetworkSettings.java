package org.dps.configurator.settings;

import org.dps.configurator.settings.annotations.*;
import org.dps.configurator.settings.types.Ipv4;
import org.dps.configurator.settings.validation.CrossFieldValidator;

import java.util.ArrayList;
import java.util.List;

@PresetCategory(name = "network", display = "Network", priority = 10)
public class NetworkSettings implements CrossFieldValidator {

    @SettingSpec(type = "hostname", display = "Hostname", defaultValue = "nixos", required = true, order = 0)
    public static final String HOSTNAME = "HOSTNAME";

    @SettingSpec(type = "choice", display = "Network Method", defaultValue = "dhcp", order = 1)
    @SettingOptions(values = {"dhcp", "static"})
    public static final String NETWORK_METHOD = "NETWORK_METHOD";

    @SettingSpec(type = "ip", display = "Primary DNS", defaultValue = "1.1.1.1", order = 2)
    public static final String NETWORK_DNS_PRIMARY = "NETWORK_DNS_PRIMARY";

    @SettingSpec(type = "ip", display = "Secondary DNS", defaultValue = "1.0.0.1", order = 3)
    public static final String NETWORK_DNS_SECONDARY = "NETWORK_DNS_SECONDARY";

    @SettingSpec(type = "ip", display = "IP Address", required = true, order = 4)
    @VisibleWhen(all = "NETWORK_METHOD==static")
    public static final String NETWORK_IP = "NETWORK_IP";

    @SettingSpec(type = "netmask", display = "Network Mask", defaultValue = "255.255.255.0", required = true, order = 5)
    @VisibleWhen(all = "NETWORK_METHOD==static")
    public static final String NETWORK_MASK = "NETWORK_MASK";

    @SettingSpec(type = "ip", display = "Gateway", required = true, order = 6)
    @VisibleWhen(all = "NETWORK_METHOD==static")
    public static final String NETWORK_GATEWAY = "NETWORK_GATEWAY";

    @Override
    public List<String> validate(ConfigStore store) {
        List<String> problems = new ArrayList<>();
        if (!"static".equals(store.get(NETWORK_METHOD))) {
            return problems;
        }
        String ip = store.get(NETWORK_IP);
        String mask = store.get(NETWORK_MASK);
        String gateway = store.get(NETWORK_GATEWAY);

        if (!ip.isEmpty() && ip.equals(gateway)) {
            problems.add("Gateway cannot be the same as IP address");
        } else if (!ip.isEmpty() && !mask.isEmpty() && !gateway.isEmpty()
                && !Ipv4.sameSubnet(ip, mask, gateway)) {
            problems.add("Gateway " + gateway + " must be in the same subnet as " + ip + "/" + mask);
        }
        return problems;
    }
}

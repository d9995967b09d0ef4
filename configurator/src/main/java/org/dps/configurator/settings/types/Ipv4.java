package org.dps.configurator.settings.types;

import java.util.OptionalLong;
import java.util.regex.Pattern;

public final class Ipv4 {
    private static final Pattern OCTET = Pattern.compile("0|[1-9][0-9]{0,2}");
    private static final Pattern CIDR = Pattern.compile("[0-9]{1,2}");
    private static final long ALL_ONES = 0xFFFFFFFFL;

    private Ipv4() {
    }

    public static OptionalLong toLong(String dotted) {
        if (dotted == null) {
            return OptionalLong.empty();
        }
        String[] octets = dotted.split("\\.", -1);
        if (octets.length != 4) {
            return OptionalLong.empty();
        }
        long result = 0;
        for (String octet : octets) {
            if (!OCTET.matcher(octet).matches()) {
                return OptionalLong.empty();
            }
            int value = Integer.parseInt(octet);
            if (value > 255) {
                return OptionalLong.empty();
            }
            result = (result << 8) | value;
        }
        return OptionalLong.of(result);
    }

    public static boolean isHostAddress(String dotted) {
        OptionalLong parsed = toLong(dotted);
        if (parsed.isEmpty()) {
            return false;
        }
        long value = parsed.getAsLong();
        long first = value >>> 24;
        long last = value & 0xFF;
        return first >= 1 && last != 0 && last != 255;
    }

    public static boolean isCidr(String value) {
        if (value == null || !CIDR.matcher(value).matches()) {
            return false;
        }
        int bits = Integer.parseInt(value);
        return bits >= 1 && bits <= 31;
    }

    public static boolean isDottedMask(String dotted) {
        OptionalLong parsed = toLong(dotted);
        if (parsed.isEmpty()) {
            return false;
        }
        long value = parsed.getAsLong();
        if (value == 0 || value == ALL_ONES) {
            return false;
        }
        return ((value | (value - 1)) & ALL_ONES) == ALL_ONES;
    }

    public static String cidrToNetmask(int bits) {
        long mask = bits == 0 ? 0 : (ALL_ONES << (32 - bits)) & ALL_ONES;
        return (mask >>> 24) + "." + ((mask >>> 16) & 0xFF) + "." + ((mask >>> 8) & 0xFF) + "." + (mask & 0xFF);
    }

    public static boolean sameSubnet(String address, String mask, String other) {
        OptionalLong a = toLong(address);
        OptionalLong m = toLong(mask);
        OptionalLong b = toLong(other);
        if (a.isEmpty() || m.isEmpty() || b.isEmpty()) {
            return false;
        }
        long maskValue = m.getAsLong();
        return (a.getAsLong() & maskValue) == (b.getAsLong() & maskValue);
    }
}

package org.dps.configurator.settings.types;

public class DiskType extends PatternType {

    public DiskType() {
        super("disk",
                "/dev/[A-Za-z0-9][A-Za-z0-9/_.-]*",
                "(e.g., /dev/sda, /dev/nvme0n1, /dev/vda)",
                "Invalid disk device (must be a path below /dev, e.g. /dev/sda)");
    }
}

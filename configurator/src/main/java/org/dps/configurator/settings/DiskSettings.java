package org.dps.configurator.settings;

import org.dps.configurator.settings.annotations.*;

@PresetCategory(name = "disk", display = "Disk", priority = 20)
public class DiskSettings {

    @SettingSpec(type = "disk", display = "Target Disk", required = true, order = 0)
    public static final String DISK_TARGET = "DISK_TARGET";

    @SettingSpec(type = "toggle", display = "Enable Encryption", defaultValue = "true", order = 1)
    public static final String ENCRYPTION = "ENCRYPTION";

    @SettingSpec(type = "choice", display = "Partition Strategy", defaultValue = "fast", order = 2)
    @SettingOptions(values = {"fast", "disko"})
    public static final String PARTITION_STRATEGY = "PARTITION_STRATEGY";

    @SettingSpec(type = "toggle", display = "Auto-approve Disk Purge", defaultValue = "false", order = 3)
    public static final String AUTO_APPROVE_DISK_PURGE = "AUTO_APPROVE_DISK_PURGE";

    @SettingSpec(type = "path", display = "Disko File (override)", required = true, order = 4)
    @VisibleWhen(all = "PARTITION_STRATEGY==disko")
    public static final String DISKO_USER_FILE = "DISKO_USER_FILE";

    @SettingSpec(type = "choice", display = "Filesystem Type", defaultValue = "btrfs", order = 5)
    @SettingOptions(values = {"btrfs", "ext4"})
    @VisibleWhen(all = "PARTITION_STRATEGY==fast")
    public static final String FS_TYPE = "FS_TYPE";

    @SettingSpec(type = "int", display = "Swap Size (MiB)", defaultValue = "0", order = 6)
    @SettingRange(min = 0)
    public static final String SWAP_SIZE_MIB = "SWAP_SIZE_MIB";

    @SettingSpec(type = "toggle", display = "Separate /home", defaultValue = "false", order = 7)
    public static final String SEPARATE_HOME = "SEPARATE_HOME";

    @SettingSpec(type = "diskSize", display = "/home Size (if separate)", defaultValue = "20G", order = 8)
    @VisibleWhen(all = "SEPARATE_HOME==true")
    public static final String HOME_SIZE = "HOME_SIZE";

    @SettingSpec(type = "choice", display = "Encryption Key Method", defaultValue = "urandom", order = 9)
    @SettingOptions(values = {"urandom", "openssl", "manual"})
    @VisibleWhen(all = "ENCRYPTION==true")
    public static final String ENCRYPTION_KEY_METHOD = "ENCRYPTION_KEY_METHOD";

    @SettingSpec(type = "int", display = "Encryption Key Length", defaultValue = "64", order = 10)
    @SettingRange(min = 32, max = 512)
    @VisibleWhen(all = "ENCRYPTION==true")
    public static final String ENCRYPTION_KEY_LENGTH = "ENCRYPTION_KEY_LENGTH";

    @SettingSpec(type = "toggle", display = "Use Passphrase", defaultValue = "false", order = 11)
    @VisibleWhen(all = "ENCRYPTION==true")
    public static final String ENCRYPTION_USE_PASSPHRASE = "ENCRYPTION_USE_PASSPHRASE";

    @SettingSpec(type = "choice", display = "Encryption Unlock Mode", defaultValue = "manual", order = 12)
    @SettingOptions(values = {"manual", "dropbear", "tpm", "keyfile"})
    @VisibleWhen(all = "ENCRYPTION==true")
    public static final String ENCRYPTION_UNLOCK_MODE = "ENCRYPTION_UNLOCK_MODE";

    @SettingSpec(type = "choice", display = "Passphrase Generation Method", defaultValue = "urandom", order = 13)
    @SettingOptions(values = {"urandom", "openssl", "manual"})
    @VisibleWhen(all = {"ENCRYPTION==true", "ENCRYPTION_USE_PASSPHRASE==true"})
    public static final String ENCRYPTION_PASSPHRASE_METHOD = "ENCRYPTION_PASSPHRASE_METHOD";

    @SettingSpec(type = "int", display = "Passphrase Length", defaultValue = "32", order = 14)
    @SettingRange(min = 16, max = 512)
    @VisibleWhen(all = {"ENCRYPTION==true", "ENCRYPTION_USE_PASSPHRASE==true"})
    public static final String ENCRYPTION_PASSPHRASE_LENGTH = "ENCRYPTION_PASSPHRASE_LENGTH";

    @SettingSpec(type = "secret", display = "Passphrase", exportable = false, required = true, order = 15)
    @VisibleWhen(all = {"ENCRYPTION==true", "ENCRYPTION_USE_PASSPHRASE==true", "ENCRYPTION_PASSPHRASE_METHOD==manual"})
    public static final String ENCRYPTION_PASSPHRASE = "ENCRYPTION_PASSPHRASE";
}

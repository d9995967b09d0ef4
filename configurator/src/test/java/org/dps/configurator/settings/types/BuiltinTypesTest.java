package org.dps.configurator.settings.types;

import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.model.SettingAttributes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinTypesTest {

    private static final SettingAttributes NONE = SettingAttributes.none();

    @Test
    void intChecksRangeAndReportsBounds() {
        IntType type = new IntType();
        SettingAttributes range = SettingAttributes.builder().min(1).max(65535).build();

        assertTrue(type.validate("8080", range));
        assertFalse(type.validate("99999", range));
        assertFalse(type.validate("12a", range));
        assertEquals("Must be between 1 and 65535", type.errorMessage("99999", range));
        assertEquals("Must be an integer (no letters or special characters)", type.errorMessage("12a", range));
        assertEquals("(1-65535)", type.promptHint(range));
        assertEquals("Must be >= 0", type.errorMessage("-1", SettingAttributes.builder().min(0).build()));
    }

    @Test
    void intRejectsInvertedRangeAtDeclaration() {
        assertThrows(ConfigurationException.class, () ->
                new IntType().checkAttributes("X", SettingAttributes.builder().min(10).max(1).build()));
    }

    @Test
    void portDefaultsToFullRange() {
        PortType type = new PortType();

        assertTrue(type.validate("22", NONE));
        assertFalse(type.validate("0", NONE));
        assertFalse(type.validate("65536", NONE));
        assertEquals("Port must be between 1 and 65535", type.errorMessage("65536", NONE));
    }

    @Test
    void toggleNormalizesSynonyms() {
        ToggleType type = new ToggleType();

        assertEquals("true", type.normalize("Enabled"));
        assertEquals("false", type.normalize("0"));
        assertTrue(type.validate("disabled", NONE));
        assertFalse(type.validate("maybe", NONE));
        assertEquals("✓", type.display("true", NONE));
        assertEquals("✗", type.display("false", NONE));
    }

    @Test
    void questionNormalizesToYesOrNo() {
        QuestionType type = new QuestionType();

        assertEquals("yes", type.normalize("Y"));
        assertEquals("no", type.normalize("n"));
        assertFalse(type.validate("perhaps", NONE));
    }

    @Test
    void choiceListsOptionsAndRequiresThem() {
        ChoiceType type = new ChoiceType();
        SettingAttributes options = SettingAttributes.builder().options(List.of("dhcp", "static")).build();

        assertTrue(type.validate("static", options));
        assertFalse(type.validate("ppp", options));
        assertEquals("Must be one of: dhcp, static", type.errorMessage("ppp", options));
        assertThrows(ConfigurationException.class, () -> type.checkAttributes("NETWORK_METHOD", NONE));
    }

    @Test
    void stringAppliesPatternAndLength() {
        StringType type = new StringType();
        SettingAttributes attrs = SettingAttributes.builder()
                .pattern(Pattern.compile("[a-z]+")).minLength(2).maxLength(4).build();

        assertTrue(type.validate("abc", attrs));
        assertFalse(type.validate("ABC", attrs));
        assertFalse(type.validate("abcde", attrs));
        assertEquals("Must match pattern: [a-z]+", type.errorMessage("ABC", attrs));
        assertEquals("Length must be between 2 and 4 characters", type.errorMessage("abcde", attrs));
    }

    @Test
    void hostnameIsLowercasedAndLimited() {
        HostnameType type = new HostnameType();

        assertEquals("node-1", type.normalize(" Node-1 "));
        assertTrue(type.validate("node-1", NONE));
        assertFalse(type.validate("-node", NONE));
        assertFalse(type.validate("a".repeat(64), NONE));
    }

    @Test
    void usernamePathAndUrlFormats() {
        assertTrue(new UsernameType().validate("admin", NONE));
        assertFalse(new UsernameType().validate("Admin", NONE));
        assertTrue(new PathType().validate("/etc/disko.nix", NONE));
        assertTrue(new PathType().validate("~/disko.nix", NONE));
        assertFalse(new PathType().validate("disko.nix", NONE));
        assertTrue(new UrlType().validate("https://example.org/repo.git", NONE));
        assertTrue(new UrlType().validate("ssh://git@example.org/repo", NONE));
        assertFalse(new UrlType().validate("ftp://example.org", NONE));
    }

    @Test
    void diskAndDiskSize() {
        assertTrue(new DiskType().validate("/dev/nvme0n1", NONE));
        assertFalse(new DiskType().validate("sda", NONE));
        assertEquals("20G", new DiskSizeType().normalize("20g"));
        assertTrue(new DiskSizeType().validate("512M", NONE));
        assertFalse(new DiskSizeType().validate("big", NONE));
    }

    @Test
    void regionFormats() {
        assertEquals("de_DE.UTF-8", new LocaleType().normalize("de_DE.utf8"));
        assertTrue(new LocaleType().validate("de_DE.UTF-8", NONE));
        assertFalse(new LocaleType().validate("german", NONE));
        assertTrue(new TimezoneType().validate("UTC", NONE));
        assertTrue(new TimezoneType().validate("America/Argentina/Buenos_Aires", NONE));
        assertFalse(new TimezoneType().validate("Berlin", NONE));
        assertEquals("de", new KeyboardType().normalize("DE"));
        assertTrue(new KeyboardVariantType().validate("nodeadkeys", NONE));
    }

    @Test
    void ipRejectsNetworkBroadcastAndLeadingZeros() {
        IpType type = new IpType();

        assertTrue(type.validate("192.168.1.1", NONE));
        assertFalse(type.validate("192.168.1.0", NONE));
        assertFalse(type.validate("192.168.1.255", NONE));
        assertFalse(type.validate("0.1.2.3", NONE));
        assertFalse(type.validate("192.168.01.1", NONE));
        assertFalse(type.validate("256.1.1.1", NONE));
        assertEquals("Invalid IP address format (example: 192.168.1.1)", type.errorMessage("x", NONE));
    }

    @Test
    void netmaskAcceptsCidrAndStoresDotted() {
        NetmaskType type = new NetmaskType();

        assertTrue(type.validate("24", NONE));
        assertTrue(type.validate("255.255.0.0", NONE));
        assertFalse(type.validate("255.0.255.0", NONE));
        assertEquals("255.255.255.0", type.normalize("24"));
        assertEquals("255.255.240.0", type.normalize("/20"));
    }

    @Test
    void secretIsMaskedAndHasMinimumLength() {
        SecretType type = new SecretType();

        assertTrue(type.isSecret());
        assertFalse(type.validate("short", NONE));
        assertTrue(type.validate("longenough", NONE));
        assertFalse(type.display("hunter22", NONE).contains("hunter"));
        assertEquals("(not set)", type.display("", NONE));
    }

    @Test
    void countryAppliesRegionalDefaults() {
        CountryType type = new CountryType();

        assertEquals("DE", type.normalize("de"));
        assertTrue(type.validate("DE", NONE));
        assertFalse(type.validate("XX", NONE));
        assertFalse(type.validate("DEU", NONE));
        assertEquals(List.of(
                new SettingWrite(CountryType.TIMEZONE, "Europe/Berlin"),
                new SettingWrite(CountryType.LOCALE, "de_DE.UTF-8"),
                new SettingWrite(CountryType.KEYBOARD_LAYOUT, "de"),
                new SettingWrite(CountryType.KEYBOARD_VARIANT, "nodeadkeys")), type.apply("DE"));
        assertTrue(type.apply("").isEmpty());
    }
}

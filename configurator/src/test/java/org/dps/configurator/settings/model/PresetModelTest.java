package org.dps.configurator.settings.model;

import org.dps.configurator.settings.ConfigStore;
import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.NetworkSettings;
import org.dps.configurator.settings.annotations.PresetCategory;
import org.dps.configurator.settings.annotations.SettingLength;
import org.dps.configurator.settings.annotations.SettingPattern;
import org.dps.configurator.settings.annotations.SettingRange;
import org.dps.configurator.settings.annotations.SettingSpec;
import org.dps.configurator.settings.annotations.VisibleWhen;
import org.dps.configurator.settings.types.SettingTypeCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PresetModelTest {

    @PresetCategory(name = "access", priority = 35)
    static class AccessSettings {
        @SettingSpec(type = "port", display = "SSH Port", defaultValue = "22", order = 2)
        @SettingRange(min = 1024)
        @VisibleWhen(all = "SSH_ENABLE==true")
        static final String SSH_PORT = "SSH_PORT";

        @SettingSpec(type = "toggle", display = "Enable SSH", defaultValue = "false", order = 1)
        static final String SSH_ENABLE = "SSH_ENABLE";

        @SettingSpec(type = "string", display = "Login Banner", order = 3)
        @SettingLength(max = 40)
        @SettingPattern("[ -~]*")
        static final String BANNER = "BANNER";

        static final String NOT_A_SETTING = "IGNORED";
    }

    @PresetCategory(name = "broken")
    static class InstanceFieldSettings {
        @SettingSpec(type = "text", display = "Oops")
        String oops = "OOPS";
    }

    @Test
    void fieldsAreSortedByOrder() {
        PresetModel model = new PresetModel(new AccessSettings());

        assertEquals("access", model.getName());
        assertEquals(35, model.getPriority());
        assertEquals(List.of("SSH_ENABLE", "SSH_PORT", "BANNER"),
                model.getFields().stream().map(SettingField::getName).toList());
        assertNull(model.getValidator());
    }

    @Test
    void annotationsBecomeTypedAttributesAndVisibility() {
        ConfigStore store = new ConfigStore(SettingTypeCatalog.withBuiltins());
        Preset preset = new PresetModel(new AccessSettings()).registerInto(store);

        assertEquals("Access", preset.getDisplay());
        assertEquals(List.of("SSH_ENABLE", "SSH_PORT", "BANNER"), preset.getSettings());
        Setting port = store.getSetting("SSH_PORT");
        assertEquals(1024, port.getAttributes().getMin());
        assertNull(port.getAttributes().getMax());
        assertEquals("SSH_ENABLE", port.getVisibility().all().get(0).setting());
        assertEquals(40, store.getSetting("BANNER").getAttributes().getMaxLength());
        assertEquals("[ -~]*", store.getMeta("BANNER", "pattern").orElseThrow());
        assertEquals("22", store.get("SSH_PORT"));
    }

    @Test
    void presetImplementingCrossFieldValidatorSuppliesIt() {
        PresetModel model = new PresetModel(new NetworkSettings());

        assertNotNull(model.getValidator());
    }

    @Test
    void choiceOptionsAreReadFromTheAnnotation() {
        ConfigStore store = new ConfigStore(SettingTypeCatalog.withBuiltins());
        new PresetModel(new NetworkSettings()).registerInto(store);

        assertEquals(List.of("dhcp", "static"), store.getMeta(NetworkSettings.NETWORK_METHOD, "options").orElseThrow());
        assertTrue(store.set(NetworkSettings.NETWORK_METHOD, "static", Origin.MANUAL).isAccepted());
        assertFalse(store.set(NetworkSettings.NETWORK_METHOD, "bridge", Origin.MANUAL).isAccepted());
    }

    @Test
    void nonStaticSettingFieldIsRejected() {
        assertThrows(ConfigurationException.class, () -> new PresetModel(new InstanceFieldSettings()));
    }

    @Test
    void classWithoutPresetAnnotationIsRejected() {
        assertThrows(ConfigurationException.class, () -> new PresetModel(new Object()));
    }
}

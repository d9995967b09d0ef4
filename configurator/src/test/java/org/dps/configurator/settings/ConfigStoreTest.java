package org.dps.configurator.settings;

import org.dps.configurator.settings.model.Origin;
import org.dps.configurator.settings.model.SettingAttributes;
import org.dps.configurator.settings.model.SettingDefinition;
import org.dps.configurator.settings.types.SettingTypeCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigStoreTest {

    private ConfigStore store;

    @BeforeEach
    void setUp() {
        store = new ConfigStore(SettingTypeCatalog.withBuiltins());
        store.createPreset("access", "Remote Access", 20, null);
        store.create("access", SettingDefinition.builder()
                .name("PORT")
                .type("int")
                .display("SSH Port")
                .defaultValue("22")
                .attributes(SettingAttributes.builder().min(1).max(65535).build())
                .build());
    }

    @Test
    void newSettingStartsAtDefaultWithDefaultOrigin() {
        assertEquals("22", store.get("PORT"));
        assertEquals(Origin.DEFAULT, store.getOrigin("PORT"));
        assertEquals("default", store.getOrigin("PORT").label());
    }

    @Test
    void outOfRangePromptValueIsRejectedAndKeepsPreviousValue() {
        WriteResult result = store.set("PORT", "99999", Origin.PROMPT);

        assertFalse(result.isAccepted());
        assertTrue(result.message().contains("between 1 and 65535"), result.message());
        assertEquals("22", store.get("PORT"));
        assertEquals(Origin.DEFAULT, store.getOrigin("PORT"));
    }

    @Test
    void validPromptValueIsStoredWithPromptOrigin() {
        WriteResult result = store.set("PORT", "8080", Origin.PROMPT);

        assertTrue(result.isAccepted());
        assertTrue(result.isChanged());
        assertEquals("8080", store.get("PORT"));
        assertEquals(Origin.PROMPT, store.getOrigin("PORT"));
    }

    @Test
    void invalidEnvironmentValueIsStoredForLaterValidation() {
        WriteResult result = store.set("PORT", "abc", Origin.ENV);

        assertEquals(WriteResult.Status.STORED_INVALID, result.status());
        assertEquals("abc", store.get("PORT"));
        assertEquals(Origin.ENV, store.getOrigin("PORT"));
        assertTrue(store.getCatalog().validate(store.getSetting("PORT")).isPresent());
    }

    @Test
    void emptyValueIsValidUnlessRequired() {
        store.create("access", SettingDefinition.builder().name("NOTE").type("int").display("Note").build());
        store.create("access", SettingDefinition.builder().name("USER").type("username").display("User")
                .required(true).build());

        assertTrue(store.set("NOTE", "", Origin.PROMPT).isAccepted());
        WriteResult required = store.set("USER", "", Origin.PROMPT);
        assertFalse(required.isAccepted());
        assertEquals("A value is required", required.message());
    }

    @Test
    void duplicateSettingNameIsRejected() {
        store.createPreset("other", "", 10, null);
        DuplicateSettingException e = assertThrows(DuplicateSettingException.class, () ->
                store.create("other", SettingDefinition.builder().name("PORT").type("port").display("Port").build()));
        assertTrue(e.getMessage().contains("PORT"));
    }

    @Test
    void duplicatePresetIsRejected() {
        assertThrows(DuplicatePresetException.class, () -> store.createPreset("access", "", 1, null));
    }

    @Test
    void unknownTypeFailsAtDeclaration() {
        assertThrows(UnknownTypeException.class, () ->
                store.create("access", SettingDefinition.builder().name("X").type("nope").display("X").build()));
    }

    @Test
    void choiceWithoutOptionsFailsAtDeclaration() {
        assertThrows(MissingAttributeException.class, () ->
                store.create("access", SettingDefinition.builder().name("MODE").type("choice").display("Mode").build()));
    }

    @Test
    void settingInUnknownPresetIsRejected() {
        assertThrows(ConfigurationException.class, () ->
                store.create("missing", SettingDefinition.builder().name("X").type("text").display("X").build()));
    }

    @Test
    void visibilityMayOnlyReferenceEarlierSettings() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () ->
                store.create("access", SettingDefinition.builder().name("KEY").type("text").display("Key")
                        .visibleAll(List.of("LATER==yes")).build()));
        assertTrue(e.getMessage().contains("LATER"));
    }

    @Test
    void unknownSettingLookupThrows() {
        assertThrows(UnknownSettingException.class, () -> store.get("MISSING"));
        assertThrows(UnknownSettingException.class, () -> store.set("MISSING", "1", Origin.MANUAL));
    }

    @Test
    void metaExposesTypedAttributes() {
        assertEquals(1, store.getMeta("PORT", "min").orElseThrow());
        assertEquals(65535, store.getMeta("PORT", "max").orElseThrow());
        assertTrue(store.getMeta("PORT", "options").isEmpty());
        assertTrue(store.getMeta("PORT", "pattern").isEmpty());
    }

    @Test
    void presetsSortByPriorityThenRegistrationOrder() {
        store.createPreset("late", "", 50, null);
        store.createPreset("early", "", 5, null);
        store.createPreset("tie", "", 20, null);

        List<String> names = store.presetsByPriority().stream().map(p -> p.getName()).toList();
        assertEquals(List.of("early", "access", "tie", "late"), names);
        assertEquals("Late", store.getPreset("late").getDisplay());
    }

    @Test
    void disabledPresetsAreSkipped() {
        store.createPreset("extra", "", 1, null);
        store.setPresetEnabled("extra", false);

        assertEquals(List.of("access"), store.enabledPresetsByPriority().stream().map(p -> p.getName()).toList());
    }

    @Test
    void listKeepsDeclarationOrder() {
        store.create("access", SettingDefinition.builder().name("B").type("text").display("B").build());
        store.create("access", SettingDefinition.builder().name("A").type("text").display("A").build());

        assertEquals(List.of("PORT", "B", "A"), store.list("access"));
        assertEquals(List.of("PORT", "B", "A"), store.list());
    }
}

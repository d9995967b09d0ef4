package org.dps.configurator.settings.visibility;

import org.dps.configurator.settings.ConfigStore;
import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.model.Operator;
import org.dps.configurator.settings.model.Origin;
import org.dps.configurator.settings.model.SettingAttributes;
import org.dps.configurator.settings.model.SettingDefinition;
import org.dps.configurator.settings.model.VisibilityCondition;
import org.dps.configurator.settings.types.SettingTypeCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VisibilityEvaluatorTest {

    private ConfigStore store;
    private VisibilityEvaluator visibility;

    @BeforeEach
    void setUp() {
        store = new ConfigStore(SettingTypeCatalog.withBuiltins());
        store.createPreset("network", "", 10, null);
        store.create("network", SettingDefinition.builder().name("NETWORK_METHOD").type("choice").display("Method")
                .defaultValue("dhcp")
                .attributes(SettingAttributes.builder().options(List.of("dhcp", "static")).build())
                .build());
        store.create("network", SettingDefinition.builder().name("MTU").type("int").display("MTU")
                .defaultValue("1500").build());
        store.create("network", SettingDefinition.builder().name("NETWORK_IP").type("ip").display("IP")
                .visibleAll(List.of("NETWORK_METHOD==static")).build());
        visibility = new VisibilityEvaluator(store);
    }

    @Test
    void settingWithoutConditionsIsVisible() {
        assertTrue(visibility.isVisible("NETWORK_METHOD"));
    }

    @Test
    void allConditionFollowsReferencedValue() {
        assertFalse(visibility.isVisible("NETWORK_IP"));

        store.set("NETWORK_METHOD", "static", Origin.MANUAL);

        assertTrue(visibility.isVisible("NETWORK_IP"));
        assertTrue(visibility.isVisible("NETWORK_IP"));
    }

    @Test
    void numericOperandsCompareAsNumbers() {
        store.create("network", SettingDefinition.builder().name("JUMBO").type("toggle").display("Jumbo")
                .visibleAll(List.of("MTU>900")).build());

        // lexicographically "1500" < "900"
        assertTrue(visibility.isVisible("JUMBO"));
        store.set("MTU", "576", Origin.MANUAL);
        assertFalse(visibility.isVisible("JUMBO"));
    }

    @Test
    void anyGroupNeedsOneMatchAndAllGroupMustHoldToo() {
        store.create("network", SettingDefinition.builder().name("DNS").type("ip").display("DNS")
                .visibleAll(List.of("MTU>=1000"))
                .visibleAny(List.of("NETWORK_METHOD==static", "MTU==9000"))
                .build());

        assertFalse(visibility.isVisible("DNS"));
        store.set("MTU", "9000", Origin.MANUAL);
        assertTrue(visibility.isVisible("DNS"));
        store.set("MTU", "500", Origin.MANUAL);
        store.set("NETWORK_METHOD", "static", Origin.MANUAL);
        assertFalse(visibility.isVisible("DNS"));
    }

    @Test
    void conditionsUseStoredValueOfHiddenSettings() {
        store.set("NETWORK_IP", "10.0.0.5", Origin.MANUAL);
        store.create("network", SettingDefinition.builder().name("IP_NOTE").type("text").display("Note")
                .visibleAll(List.of("NETWORK_IP==10.0.0.5")).build());

        assertFalse(visibility.isVisible("NETWORK_IP"));
        assertTrue(visibility.isVisible("IP_NOTE"));
    }

    @Test
    void visibleSettingsKeepsDeclarationOrder() {
        assertEquals(List.of("NETWORK_METHOD", "MTU"),
                visibility.visibleSettings("network").stream().map(s -> s.getName()).toList());
    }

    @Test
    void parserReadsAllOperators() {
        assertEquals(new VisibilityCondition("A", Operator.LE, "5"), ConditionParser.parse("A<=5"));
        assertEquals(new VisibilityCondition("A", Operator.NE, "x"), ConditionParser.parse("A!=x"));
        assertEquals(new VisibilityCondition("A_1", Operator.GT, "2"), ConditionParser.parse("A_1>2"));
        assertEquals(new VisibilityCondition("B", Operator.EQ, ""), ConditionParser.parse("B=="));
        assertThrows(ConfigurationException.class, () -> ConditionParser.parse("lower==x"));
        assertThrows(ConfigurationException.class, () -> ConditionParser.parse("A=x"));
    }

    @Test
    void comparisonFallsBackToLexicographic() {
        assertTrue(VisibilityEvaluator.compare("10", "9") > 0);
        assertTrue(VisibilityEvaluator.compare("10a", "9") < 0);
        assertEquals(0, VisibilityEvaluator.compare("1.0", "1"));
    }
}

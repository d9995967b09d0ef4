package org.dps.configurator.settings.types;

import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.UnknownTypeException;
import org.dps.configurator.settings.model.Setting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SettingTypeCatalog {
    private static final Logger logger = LoggerFactory.getLogger(SettingTypeCatalog.class);

    private final Map<String, SettingType> types = new LinkedHashMap<>();

    public static SettingTypeCatalog withBuiltins() {
        SettingTypeCatalog catalog = new SettingTypeCatalog();
        catalog.register(new TextType());
        catalog.register(new StringType());
        catalog.register(new IntType());
        catalog.register(new FloatType());
        catalog.register(new PortType());
        catalog.register(new ToggleType());
        catalog.register(new QuestionType());
        catalog.register(new ChoiceType());
        catalog.register(new HostnameType());
        catalog.register(new UsernameType());
        catalog.register(new PathType());
        catalog.register(new UrlType());
        catalog.register(new DiskSizeType());
        catalog.register(new DiskType());
        catalog.register(new LocaleType());
        catalog.register(new TimezoneType());
        catalog.register(new KeyboardType());
        catalog.register(new KeyboardVariantType());
        catalog.register(new CountryType());
        catalog.register(new IpType());
        catalog.register(new NetmaskType());
        catalog.register(new SecretType());
        return catalog;
    }

    public void register(SettingType type) {
        String name = type.getName();
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Setting type " + type.getClass().getName() + " has no name");
        }
        if (types.containsKey(name)) {
            throw new ConfigurationException("Setting type '" + name + "' is already registered");
        }
        types.put(name, type);
        logger.debug("Registered setting type '{}'", name);
    }

    public SettingType lookup(String name) {
        SettingType type = types.get(name);
        if (type == null) {
            throw new UnknownTypeException(name);
        }
        return type;
    }

    public boolean contains(String name) {
        return types.containsKey(name);
    }

    public List<String> typeNames() {
        return List.copyOf(types.keySet());
    }

    public Optional<String> validate(Setting setting) {
        lookup(setting.getTypeName());
        return setting.check(setting.getValue());
    }
}

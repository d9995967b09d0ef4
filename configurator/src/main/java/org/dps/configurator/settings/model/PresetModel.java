package org.dps.configurator.settings.model;

import org.dps.configurator.settings.ConfigStore;
import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.annotations.PresetCategory;
import org.dps.configurator.settings.annotations.SettingSpec;
import org.dps.configurator.settings.validation.CrossFieldValidator;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class PresetModel {
    private final Class<?> presetClass;
    private final PresetCategory annotation;
    private final List<SettingField> fields;
    private final Object instance;

    public PresetModel(Object instance) {
        this.presetClass = instance.getClass();
        this.annotation = presetClass.getAnnotation(PresetCategory.class);
        if (annotation == null) {
            throw new ConfigurationException(presetClass.getName() + " is not annotated with @PresetCategory");
        }
        this.instance = instance;
        this.fields = discoverFields();
    }

    private List<SettingField> discoverFields() {
        List<SettingField> settingFields = new ArrayList<>();

        for (Field field : presetClass.getDeclaredFields()) {
            if (field.isAnnotationPresent(SettingSpec.class)) {
                settingFields.add(new SettingField(field));
            }
        }

        settingFields.sort(Comparator.comparingInt(SettingField::getOrder));
        return settingFields;
    }

    public String getName() {
        return annotation.name();
    }

    public String getDisplay() {
        return annotation.display();
    }

    public int getPriority() {
        return annotation.priority();
    }

    public List<SettingField> getFields() {
        return fields;
    }

    public CrossFieldValidator getValidator() {
        return instance instanceof CrossFieldValidator validator ? validator : null;
    }

    public Preset registerInto(ConfigStore store) {
        Preset preset = store.createPreset(getName(), getDisplay(), getPriority(), getValidator());
        for (SettingField field : fields) {
            store.create(getName(), field.toDefinition());
        }
        return preset;
    }
}

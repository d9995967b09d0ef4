package org.dps.configurator.settings.model;

import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.annotations.*;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class SettingField {
    private final Field field;
    private final SettingSpec annotation;
    private final SettingRange rangeAnnotation;
    private final SettingLength lengthAnnotation;
    private final SettingPattern patternAnnotation;
    private final SettingOptions optionsAnnotation;
    private final VisibleWhen visibleAnnotation;

    public SettingField(Field field) {
        this.field = field;
        this.annotation = field.getAnnotation(SettingSpec.class);
        this.rangeAnnotation = field.getAnnotation(SettingRange.class);
        this.lengthAnnotation = field.getAnnotation(SettingLength.class);
        this.patternAnnotation = field.getAnnotation(SettingPattern.class);
        this.optionsAnnotation = field.getAnnotation(SettingOptions.class);
        this.visibleAnnotation = field.getAnnotation(VisibleWhen.class);
        if (!Modifier.isStatic(field.getModifiers()) || field.getType() != String.class) {
            throw new ConfigurationException("Setting field " + field.getDeclaringClass().getSimpleName()
                    + "." + field.getName() + " must be a static String constant");
        }
        field.setAccessible(true);
    }

    public String getName() {
        try {
            return (String) field.get(null);
        } catch (IllegalAccessException e) {
            throw new ConfigurationException("Failed to read setting name from field: " + field.getName(), e);
        }
    }

    public int getOrder() {
        return annotation.order();
    }

    public SettingDefinition toDefinition() {
        return SettingDefinition.builder()
                .name(getName())
                .type(annotation.type())
                .display(annotation.display())
                .defaultValue(annotation.defaultValue())
                .exportable(annotation.exportable())
                .required(annotation.required())
                .attributes(buildAttributes())
                .visibleAll(visibleAnnotation != null ? List.of(visibleAnnotation.all()) : List.of())
                .visibleAny(visibleAnnotation != null ? List.of(visibleAnnotation.any()) : List.of())
                .build();
    }

    private SettingAttributes buildAttributes() {
        SettingAttributes.SettingAttributesBuilder builder = SettingAttributes.builder();
        if (rangeAnnotation != null) {
            if (rangeAnnotation.min() != SettingRange.UNSET) {
                builder.min(rangeAnnotation.min());
            }
            if (rangeAnnotation.max() != SettingRange.UNSET) {
                builder.max(rangeAnnotation.max());
            }
        }
        if (lengthAnnotation != null) {
            if (lengthAnnotation.min() != SettingLength.UNSET) {
                builder.minLength(lengthAnnotation.min());
            }
            if (lengthAnnotation.max() != SettingLength.UNSET) {
                builder.maxLength(lengthAnnotation.max());
            }
        }
        if (patternAnnotation != null) {
            try {
                builder.pattern(Pattern.compile(patternAnnotation.value()));
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Setting " + getName() + " has an invalid pattern", e);
            }
        }
        if (optionsAnnotation != null) {
            builder.options(Arrays.asList(optionsAnnotation.values()));
        }
        return builder.build();
    }
}

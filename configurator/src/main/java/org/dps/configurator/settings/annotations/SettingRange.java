package org.dps.configurator.settings.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface SettingRange {
    int UNSET = Integer.MIN_VALUE;

    int min() default UNSET;

    int max() default UNSET;
}

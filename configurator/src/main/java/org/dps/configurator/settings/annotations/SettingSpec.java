package org.dps.configurator.settings.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface SettingSpec {
    String type();

    String display();

    String defaultValue() default "";

    int order() default 0;

    boolean exportable() default true;

    boolean required() default false;
}

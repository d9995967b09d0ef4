package org.dps.configurator.settings.types;

import org.dps.configurator.settings.model.SettingAttributes;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class CountryType implements SettingType {
    public static final String TIMEZONE = "TIMEZONE";
    public static final String LOCALE = "LOCALE";
    public static final String KEYBOARD_LAYOUT = "KEYBOARD_LAYOUT";
    public static final String KEYBOARD_VARIANT = "KEYBOARD_VARIANT";

    private static final Pattern CODE = Pattern.compile("[A-Za-z]{2}");

    @Override
    public String getName() {
        return "country";
    }

    @Override
    public boolean validate(String value, SettingAttributes attributes) {
        return CODE.matcher(value).matches() && CountryDefaults.forCode(value).isPresent();
    }

    @Override
    public String normalize(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String errorMessage(String value, SettingAttributes attributes) {
        if (!CODE.matcher(value).matches()) {
            return "Invalid country code. Use 2-letter ISO code or empty to manually configure";
        }
        return "Country code not in database. Use common codes: US, DE, CH, AT, UK, FR, ES, IT, NL, etc.";
    }

    @Override
    public String promptHint(SettingAttributes attributes) {
        return "(US, DE, UK, FR, ES, IT, NL, etc. - 2-letter ISO code)";
    }

    @Override
    public List<SettingWrite> apply(String value) {
        return CountryDefaults.forCode(value)
                .map(defaults -> List.of(
                        new SettingWrite(TIMEZONE, defaults.timezone()),
                        new SettingWrite(LOCALE, defaults.locale()),
                        new SettingWrite(KEYBOARD_LAYOUT, defaults.keyboardLayout()),
                        new SettingWrite(KEYBOARD_VARIANT, defaults.keyboardVariant())))
                .orElse(List.of());
    }
}

package org.dps.configurator.settings.types;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public record CountryDefaults(String timezone, String locale, String keyboardLayout, String keyboardVariant) {

    private static final Map<String, CountryDefaults> BY_CODE = Map.ofEntries(
            // North America
            Map.entry("US", new CountryDefaults("America/New_York", "en_US.UTF-8", "us", "")),
            Map.entry("CA", new CountryDefaults("America/Toronto", "en_CA.UTF-8", "us", "")),
            Map.entry("MX", new CountryDefaults("America/Mexico_City", "es_MX.UTF-8", "latam", "")),
            // Western Europe
            Map.entry("DE", new CountryDefaults("Europe/Berlin", "de_DE.UTF-8", "de", "nodeadkeys")),
            Map.entry("FR", new CountryDefaults("Europe/Paris", "fr_FR.UTF-8", "fr", "oss")),
            Map.entry("UK", new CountryDefaults("Europe/London", "en_GB.UTF-8", "uk", "")),
            Map.entry("GB", new CountryDefaults("Europe/London", "en_GB.UTF-8", "uk", "")),
            Map.entry("ES", new CountryDefaults("Europe/Madrid", "es_ES.UTF-8", "es", "")),
            Map.entry("IT", new CountryDefaults("Europe/Rome", "it_IT.UTF-8", "it", "")),
            Map.entry("NL", new CountryDefaults("Europe/Amsterdam", "nl_NL.UTF-8", "us", "intl")),
            Map.entry("BE", new CountryDefaults("Europe/Brussels", "fr_BE.UTF-8", "be", "")),
            Map.entry("CH", new CountryDefaults("Europe/Zurich", "de_CH.UTF-8", "ch", "de_nodeadkeys")),
            Map.entry("AT", new CountryDefaults("Europe/Vienna", "de_AT.UTF-8", "de", "nodeadkeys")),
            Map.entry("PT", new CountryDefaults("Europe/Lisbon", "pt_PT.UTF-8", "pt", "")),
            // Northern Europe
            Map.entry("SE", new CountryDefaults("Europe/Stockholm", "sv_SE.UTF-8", "se", "")),
            Map.entry("NO", new CountryDefaults("Europe/Oslo", "nb_NO.UTF-8", "no", "")),
            Map.entry("DK", new CountryDefaults("Europe/Copenhagen", "da_DK.UTF-8", "dk", "")),
            Map.entry("FI", new CountryDefaults("Europe/Helsinki", "fi_FI.UTF-8", "fi", "")),
            // Eastern Europe
            Map.entry("PL", new CountryDefaults("Europe/Warsaw", "pl_PL.UTF-8", "pl", "")),
            Map.entry("CZ", new CountryDefaults("Europe/Prague", "cs_CZ.UTF-8", "cz", "")),
            Map.entry("RU", new CountryDefaults("Europe/Moscow", "ru_RU.UTF-8", "ru", "")),
            Map.entry("UA", new CountryDefaults("Europe/Kiev", "uk_UA.UTF-8", "ua", "")),
            // Asia
            Map.entry("JP", new CountryDefaults("Asia/Tokyo", "ja_JP.UTF-8", "jp", "")),
            Map.entry("CN", new CountryDefaults("Asia/Shanghai", "zh_CN.UTF-8", "us", "")),
            Map.entry("KR", new CountryDefaults("Asia/Seoul", "ko_KR.UTF-8", "kr", "")),
            Map.entry("IN", new CountryDefaults("Asia/Kolkata", "en_IN.UTF-8", "us", "")),
            Map.entry("SG", new CountryDefaults("Asia/Singapore", "en_SG.UTF-8", "us", "")),
            // Oceania
            Map.entry("AU", new CountryDefaults("Australia/Sydney", "en_AU.UTF-8", "us", "")),
            Map.entry("NZ", new CountryDefaults("Pacific/Auckland", "en_NZ.UTF-8", "us", "")),
            // South America
            Map.entry("BR", new CountryDefaults("America/Sao_Paulo", "pt_BR.UTF-8", "br", "abnt2")),
            Map.entry("AR", new CountryDefaults("America/Argentina/Buenos_Aires", "es_AR.UTF-8", "latam", "")),
            Map.entry("CL", new CountryDefaults("America/Santiago", "es_CL.UTF-8", "latam", "")),
            // Middle East
            Map.entry("IL", new CountryDefaults("Asia/Jerusalem", "he_IL.UTF-8", "il", "")),
            Map.entry("TR", new CountryDefaults("Europe/Istanbul", "tr_TR.UTF-8", "tr", "")),
            Map.entry("AE", new CountryDefaults("Asia/Dubai", "en_AE.UTF-8", "us", "")),
            // Africa
            Map.entry("ZA", new CountryDefaults("Africa/Johannesburg", "en_ZA.UTF-8", "us", ""))
    );

    public static Optional<CountryDefaults> forCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(code.toUpperCase(Locale.ROOT)));
    }
}

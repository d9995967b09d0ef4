package org.dps.configurator.settings.types;

public class UrlType extends PatternType {

    public UrlType() {
        super("url",
                "(https?|git|ssh)://.+",
                "(http://, https://, git://, or ssh://)",
                "Invalid URL (must start with http://, https://, git://, or ssh://)");
    }
}

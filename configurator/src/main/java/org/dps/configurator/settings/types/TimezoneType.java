package org.dps.configurator.settings.types;

public class TimezoneType extends PatternType {

    public TimezoneType() {
        super("timezone",
                "UTC|[A-Z][a-zA-Z_]+/[A-Z][a-zA-Z_]+(/[A-Z][a-zA-Z_]+)?",
                "(e.g., America/New_York, Europe/Berlin, UTC)",
                "Invalid timezone. Use IANA format (e.g., America/New_York, Europe/Berlin, UTC)");
    }
}

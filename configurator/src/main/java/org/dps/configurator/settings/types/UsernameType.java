package org.dps.configurator.settings.types;

public class UsernameType extends PatternType {

    public UsernameType() {
        super("username",
                "[a-z_][a-z0-9_-]{1,31}",
                "(2-32 chars, lowercase, start with letter or underscore)",
                "Invalid username (2-32 chars, start with lowercase letter or underscore)");
    }
}

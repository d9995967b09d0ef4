package org.dps.configurator.settings.types;

public class PathType extends PatternType {

    public PathType() {
        super("path", "[/~.].*", "(absolute or relative path)", "Invalid path (must start with /, ~, or .)");
    }
}

package org.dps.configurator.settings.model;

import java.util.List;

public record VisibilityRule(List<VisibilityCondition> all, List<VisibilityCondition> any) {

    public static final VisibilityRule ALWAYS = new VisibilityRule(List.of(), List.of());

    public VisibilityRule {
        all = List.copyOf(all);
        any = List.copyOf(any);
    }

    public boolean isUnconditional() {
        return all.isEmpty() && any.isEmpty();
    }
}

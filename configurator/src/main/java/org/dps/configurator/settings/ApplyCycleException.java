package org.dps.configurator.settings;

import java.util.List;

public class ApplyCycleException extends ConfigurationException {
    private final List<String> chain;

    public ApplyCycleException(List<String> chain) {
        super("Apply hook cycle detected: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> getChain() {
        return chain;
    }
}

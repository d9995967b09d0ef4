package org.dps.configurator.settings.validation;

import org.dps.configurator.settings.ConfigStore;

import java.util.List;

@FunctionalInterface
public interface CrossFieldValidator {

    List<String> validate(ConfigStore store);
}

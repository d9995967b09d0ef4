package org.dps.configurator.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ConfiguratorOptions {
    private String envPrefix = "DPS";
    private boolean autoConfirm = false;
    private boolean exportComments = true;
    private List<String> disabledPresets = new ArrayList<>();
}

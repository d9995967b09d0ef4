package org.dps.configurator.settings.apply;

import org.dps.configurator.settings.ApplyCycleException;
import org.dps.configurator.settings.ConfigStore;
import org.dps.configurator.settings.WriteResult;
import org.dps.configurator.settings.model.Origin;
import org.dps.configurator.settings.model.Setting;
import org.dps.configurator.settings.types.SettingWrite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

public class ApplyHookDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ApplyHookDispatcher.class);

    private final ConfigStore store;
    private final Deque<String> inFlight = new ArrayDeque<>();

    public ApplyHookDispatcher(ConfigStore store) {
        this.store = store;
    }

    public void dispatch(Setting setting) {
        List<SettingWrite> writes = setting.getType().apply(setting.getValue());
        if (writes == null || writes.isEmpty()) {
            return;
        }
        if (inFlight.contains(setting.getName())) {
            throw cycle(setting.getName());
        }
        inFlight.push(setting.getName());
        try {
            logger.debug("Applying {} derived values from {}", writes.size(), setting.getName());
            for (SettingWrite write : writes) {
                if (inFlight.contains(write.setting())) {
                    throw cycle(write.setting());
                }
                WriteResult result = store.set(write.setting(), write.value(), Origin.AUTO);
                if (!result.isAccepted()) {
                    logger.warn("{} could not derive {}={}: {}", setting.getName(), write.setting(),
                            write.value(), result.message());
                }
            }
        } finally {
            inFlight.pop();
        }
    }

    private ApplyCycleException cycle(String target) {
        List<String> chain = new ArrayList<>(inFlight);
        Collections.reverse(chain);
        chain.add(target);
        return new ApplyCycleException(chain);
    }
}

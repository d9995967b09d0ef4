package org.dps.configurator.settings.visibility;

import org.dps.configurator.settings.ConfigStore;
import org.dps.configurator.settings.model.Setting;
import org.dps.configurator.settings.model.VisibilityCondition;
import org.dps.configurator.settings.model.VisibilityRule;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;

public class VisibilityEvaluator {
    private static final Pattern NUMBER = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

    private final ConfigStore store;

    public VisibilityEvaluator(ConfigStore store) {
        this.store = store;
    }

    public boolean isVisible(String name) {
        return isVisible(store.getSetting(name));
    }

    public boolean isVisible(Setting setting) {
        VisibilityRule rule = setting.getVisibility();
        if (rule.isUnconditional()) {
            return true;
        }
        boolean all = rule.all().stream().allMatch(this::holds);
        boolean any = rule.any().isEmpty() || rule.any().stream().anyMatch(this::holds);
        return all && any;
    }

    public List<Setting> visibleSettings(String presetName) {
        return store.list(presetName).stream()
                .map(store::getSetting)
                .filter(this::isVisible)
                .toList();
    }

    boolean holds(VisibilityCondition condition) {
        String current = store.get(condition.setting());
        return condition.operator().test(compare(current, condition.operand()));
    }

    static int compare(String left, String right) {
        if (NUMBER.matcher(left).matches() && NUMBER.matcher(right).matches()) {
            return new BigDecimal(left).compareTo(new BigDecimal(right));
        }
        return left.compareTo(right);
    }
}

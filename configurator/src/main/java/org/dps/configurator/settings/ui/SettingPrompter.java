package org.dps.configurator.settings.ui;

import org.dps.configurator.settings.ConfigStore;
import org.dps.configurator.settings.WriteResult;
import org.dps.configurator.settings.model.Origin;
import org.dps.configurator.settings.model.Setting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SettingPrompter {
    private static final Logger logger = LoggerFactory.getLogger(SettingPrompter.class);

    private final ConfigStore store;
    private final Terminal terminal;

    public SettingPrompter(ConfigStore store, Terminal terminal) {
        this.store = store;
        this.terminal = terminal;
    }

    public static String promptText(Setting setting) {
        String hint = setting.promptHint();
        String suffix = hint.isEmpty() ? ": " : " " + hint + ": ";
        return String.format("  %-20s [%s]%s", setting.getDisplay(), setting.displayValue(), suffix);
    }

    public boolean prompt(String settingName) {
        Setting setting = store.getSetting(settingName);
        while (true) {
            String before = setting.displayValue();
            String input = setting.getType().isSecret()
                    ? terminal.readSecret(promptText(setting))
                    : terminal.readLine(promptText(setting));
            if (input == null) {
                throw new TerminalClosedException();
            }
            if (input.isBlank()) {
                return false;
            }

            WriteResult result = store.set(settingName, input.trim(), Origin.PROMPT);
            if (result.isAccepted()) {
                if (result.isChanged()) {
                    String after = setting.displayValue();
                    terminal.println(result.previous().isEmpty()
                            ? "    -> Set: " + after
                            : "    -> Updated: " + before + " -> " + after);
                }
                return result.isChanged();
            }
            logger.debug("Rejected prompt input for {}: {}", settingName, result.message());
            terminal.println("    Error: " + result.message());
            terminal.println("    Please try again.");
        }
    }
}

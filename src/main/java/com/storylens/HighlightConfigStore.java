package com.storylens;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storylens.models.HighlightConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class HighlightConfigStore {
    private final ObjectMapper objectMapper;
    private final Path configPath;
    private final AppLogger logger = AppLogger.get();

    public HighlightConfigStore(Path dataPath, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.configPath = dataPath.resolve("highlight-config.json");
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Reads the config file, falling back to defaults when it is missing or unreadable.
     * Out-of-range values are clamped so a bad file cannot stall the editor.
     */
    public HighlightConfig loadOrDefault() {
        if (!Files.exists(configPath)) {
            return HighlightConfig.defaults();
        }
        try {
            HighlightConfig loaded = objectMapper.readValue(configPath.toFile(), HighlightConfig.class);
            return loaded != null ? sanitize(loaded) : HighlightConfig.defaults();
        } catch (IOException e) {
            logWarning("Could not read " + configPath + ", using defaults: " + e.getMessage());
            return HighlightConfig.defaults();
        }
    }

    public void save(HighlightConfig config) throws IOException {
        Files.createDirectories(configPath.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(configPath.toFile(), sanitize(config));
    }

    static HighlightConfig sanitize(HighlightConfig config) {
        HighlightConfig defaults = HighlightConfig.defaults();
        if (config.getDebounceMs() < 0) config.setDebounceMs(defaults.getDebounceMs());
        if (config.getWindowWords() < 1) config.setWindowWords(defaults.getWindowWords());
        if (config.getMinWindowWords() < 1) config.setMinWindowWords(defaults.getMinWindowWords());
        if (config.getMinWindowWords() > config.getWindowWords()) {
            config.setMinWindowWords(config.getWindowWords());
        }
        if (config.getParagraphSnapWords() < 0) config.setParagraphSnapWords(0);
        if (config.getWindowMarginWords() < 0) config.setWindowMarginWords(0);
        if (config.getMinPatternLength() < 1) config.setMinPatternLength(1);
        if (config.getMaxNameLength() < 1) config.setMaxNameLength(defaults.getMaxNameLength());
        if (config.getMaxTagLength() < 1) config.setMaxTagLength(defaults.getMaxTagLength());
        if (config.getMaxTags() < 0) config.setMaxTags(defaults.getMaxTags());
        if (config.getMaxWindowChars() < 0) config.setMaxWindowChars(0);
        if (config.getScanBudgetMs() < 0) config.setScanBudgetMs(0);
        if (config.getTooltipMaxLength() < 3) config.setTooltipMaxLength(defaults.getTooltipMaxLength());
        return config;
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[HighlightConfigStore] " + message);
        }
    }
}

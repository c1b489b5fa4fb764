package com.storylens.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Tunables for the reference highlighter. Persisted as .storylens/highlight-config.json.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HighlightConfig {
    private long debounceMs = 50;
    private int windowWords = 1000;
    private int minWindowWords = 100;
    private int paragraphSnapWords = 50;
    private int windowMarginWords = 100;
    private int minPatternLength = 2;
    private int maxNameLength = 200;
    private int maxTagLength = 50;
    private int maxTags = 50;
    private int maxWindowChars = 64_000;
    private long scanBudgetMs = 25;
    private int tooltipMaxLength = 200;

    public static HighlightConfig defaults() {
        return new HighlightConfig();
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public void setDebounceMs(long debounceMs) {
        this.debounceMs = debounceMs;
    }

    public int getWindowWords() {
        return windowWords;
    }

    public void setWindowWords(int windowWords) {
        this.windowWords = windowWords;
    }

    public int getMinWindowWords() {
        return minWindowWords;
    }

    public void setMinWindowWords(int minWindowWords) {
        this.minWindowWords = minWindowWords;
    }

    public int getParagraphSnapWords() {
        return paragraphSnapWords;
    }

    public void setParagraphSnapWords(int paragraphSnapWords) {
        this.paragraphSnapWords = paragraphSnapWords;
    }

    public int getWindowMarginWords() {
        return windowMarginWords;
    }

    public void setWindowMarginWords(int windowMarginWords) {
        this.windowMarginWords = windowMarginWords;
    }

    public int getMinPatternLength() {
        return minPatternLength;
    }

    public void setMinPatternLength(int minPatternLength) {
        this.minPatternLength = minPatternLength;
    }

    public int getMaxNameLength() {
        return maxNameLength;
    }

    public void setMaxNameLength(int maxNameLength) {
        this.maxNameLength = maxNameLength;
    }

    public int getMaxTagLength() {
        return maxTagLength;
    }

    public void setMaxTagLength(int maxTagLength) {
        this.maxTagLength = maxTagLength;
    }

    public int getMaxTags() {
        return maxTags;
    }

    public void setMaxTags(int maxTags) {
        this.maxTags = maxTags;
    }

    public int getMaxWindowChars() {
        return maxWindowChars;
    }

    public void setMaxWindowChars(int maxWindowChars) {
        this.maxWindowChars = maxWindowChars;
    }

    public long getScanBudgetMs() {
        return scanBudgetMs;
    }

    public void setScanBudgetMs(long scanBudgetMs) {
        this.scanBudgetMs = scanBudgetMs;
    }

    public int getTooltipMaxLength() {
        return tooltipMaxLength;
    }

    public void setTooltipMaxLength(int tooltipMaxLength) {
        this.tooltipMaxLength = tooltipMaxLength;
    }
}

package com.pipeduck.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options of the PPL analyzer.
 *
 * <p>Read from system properties by {@link #fromSystemProperties()}:
 * <ul>
 *   <li>{@code pipeduck.ppl.defaultHeadSize}: row count of a bare {@code head} (default 10)</li>
 * </ul>
 *
 * @param defaultHeadSize number of rows returned by {@code head} without an explicit count
 */
public record AnalyzerOptions(int defaultHeadSize) {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzerOptions.class);

    public static final String PROP_DEFAULT_HEAD_SIZE = "pipeduck.ppl.defaultHeadSize";

    public static final int DEFAULT_HEAD_SIZE = 10;

    public static final AnalyzerOptions DEFAULTS = new AnalyzerOptions(DEFAULT_HEAD_SIZE);

    public AnalyzerOptions {
        if (defaultHeadSize < 0) {
            throw new IllegalArgumentException("defaultHeadSize must be non-negative, got: " + defaultHeadSize);
        }
    }

    public static AnalyzerOptions fromSystemProperties() {
        String value = System.getProperty(PROP_DEFAULT_HEAD_SIZE);
        if (value != null) {
            try {
                int size = Integer.parseInt(value.trim());
                if (size >= 0) {
                    return new AnalyzerOptions(size);
                }
                logger.warn("Ignoring negative {}={}, using {}", PROP_DEFAULT_HEAD_SIZE, value, DEFAULT_HEAD_SIZE);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid {}={}, using {}", PROP_DEFAULT_HEAD_SIZE, value, DEFAULT_HEAD_SIZE);
            }
        }
        return DEFAULTS;
    }
}

package com.pipeduck.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Options of the index mapping translation.
 *
 * <p>Read from system properties by {@link #fromSystemProperties()}:
 * <ul>
 *   <li>{@code pipeduck.mapping.unsupportedTypes}: comma separated index type tags whose
 *       fields are dropped on deserialization (default: none)</li>
 * </ul>
 *
 * @param unsupportedFieldTypes index type tags to drop, lower case
 */
public record MappingOptions(Set<String> unsupportedFieldTypes) {

    public static final String PROP_UNSUPPORTED_TYPES = "pipeduck.mapping.unsupportedTypes";

    /** Default options: every known type tag is supported. */
    public static final MappingOptions DEFAULTS = new MappingOptions(Collections.emptySet());

    public MappingOptions {
        Set<String> normalized = new LinkedHashSet<>();
        if (unsupportedFieldTypes != null) {
            for (String tag : unsupportedFieldTypes) {
                String trimmed = tag.trim().toLowerCase(Locale.ROOT);
                if (!trimmed.isEmpty()) {
                    normalized.add(trimmed);
                }
            }
        }
        unsupportedFieldTypes = Collections.unmodifiableSet(normalized);
    }

    public static MappingOptions withUnsupportedTypes(String... typeTags) {
        return new MappingOptions(new LinkedHashSet<>(Arrays.asList(typeTags)));
    }

    public static MappingOptions fromSystemProperties() {
        String value = System.getProperty(PROP_UNSUPPORTED_TYPES);
        if (value == null || value.isBlank()) {
            return DEFAULTS;
        }
        return new MappingOptions(new LinkedHashSet<>(Arrays.asList(value.split(","))));
    }

    public boolean isSupported(String typeTag) {
        return !unsupportedFieldTypes.contains(typeTag.toLowerCase(Locale.ROOT));
    }
}

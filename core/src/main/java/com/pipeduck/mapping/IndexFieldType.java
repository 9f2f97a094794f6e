package com.pipeduck.mapping;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field type tags of the index mapping format that pipeduck understands.
 *
 * <p>Any tag not listed here is rejected by {@link IndexMappingConverter#deserialize(String)}
 * with an {@link com.pipeduck.exception.UnsupportedTypeException}.
 */
public enum IndexFieldType {
    BOOLEAN("boolean"),
    KEYWORD("keyword"),
    TEXT("text"),
    LONG("long"),
    INTEGER("integer"),
    SHORT("short"),
    BYTE("byte"),
    DOUBLE("double"),
    FLOAT("float"),
    HALF_FLOAT("half_float"),
    DATE("date"),
    OBJECT("object"),
    BINARY("binary"),
    IP("ip"),
    GEO_POINT("geo_point"),
    ALIAS("alias");

    private static final Map<String, IndexFieldType> BY_TAG = new HashMap<>();

    static {
        for (IndexFieldType type : values()) {
            BY_TAG.put(type.tag, type);
        }
    }

    private final String tag;

    IndexFieldType(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the tag as written in a mapping document.
     */
    public String tag() {
        return tag;
    }

    /**
     * Looks up a type by its mapping tag.
     *
     * @param tag the {@code "type"} value of a field mapping
     * @return the type, or empty for an unknown tag
     */
    public static Optional<IndexFieldType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(tag));
    }
}

package com.pipeduck.types;

/**
 * Latitude/longitude pair, the counterpart of the index {@code geo_point} field type.
 */
public final class GeoPointType implements DataType {

    private static final GeoPointType INSTANCE = new GeoPointType();

    private GeoPointType() {}

    public static GeoPointType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "geo_point";
    }

    @Override
    public int defaultSize() {
        return 16; // two doubles
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof GeoPointType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}

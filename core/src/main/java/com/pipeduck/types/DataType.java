package com.pipeduck.types;

/**
 * Sealed interface for all data types in the pipeduck type system.
 *
 * <p>This is the columnar side of the schema mapping layer: index field mappings are
 * translated into these types and back again. The hierarchy is closed so that every
 * translation table is checked for exhaustiveness by the compiler.
 *
 * <p>Families:
 * <ul>
 *   <li>Primitive types: BooleanType, ByteType, ShortType, IntegerType, LongType,
 *       FloatType, DoubleType, DecimalType, StringType, BinaryType</li>
 *   <li>Temporal types: DateType, TimestampType</li>
 *   <li>Store-specific types: IpAddressType, GeoPointType</li>
 *   <li>Complex types: ArrayType, MapType, StructType</li>
 *   <li>NullType for the untyped {@code null} literal, IntervalType for interval literals</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, ByteType, ShortType, IntegerType, LongType,
            FloatType, DoubleType, DecimalType, StringType,
            DateType, TimestampType, BinaryType,
            IpAddressType, GeoPointType,
            ArrayType, MapType, StructType, NullType, IntervalType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types (e.g., String, Array).
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }
}

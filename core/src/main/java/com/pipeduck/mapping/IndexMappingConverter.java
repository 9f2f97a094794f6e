package com.pipeduck.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pipeduck.config.MappingOptions;
import com.pipeduck.exception.UnsupportedTypeException;
import com.pipeduck.types.ArrayType;
import com.pipeduck.types.BinaryType;
import com.pipeduck.types.BooleanType;
import com.pipeduck.types.ByteType;
import com.pipeduck.types.DataType;
import com.pipeduck.types.DateType;
import com.pipeduck.types.DecimalType;
import com.pipeduck.types.DoubleType;
import com.pipeduck.types.FieldMetadata;
import com.pipeduck.types.FloatType;
import com.pipeduck.types.GeoPointType;
import com.pipeduck.types.IntegerType;
import com.pipeduck.types.IpAddressType;
import com.pipeduck.types.LongType;
import com.pipeduck.types.MapType;
import com.pipeduck.types.ShortType;
import com.pipeduck.types.StringType;
import com.pipeduck.types.StructField;
import com.pipeduck.types.StructType;
import com.pipeduck.types.TimestampType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Translates between index mapping documents and {@link StructType} schemas.
 *
 * <p>A mapping document has the shape
 * <pre>
 *   {"properties": {"name": {"type": "keyword"}, "address": {"properties": {...}}, ...}}
 * </pre>
 * A field spec without {@code "type"} is an implicit nested object.
 *
 * <p>Deserialization maps every supported type tag through a fixed table, drops fields
 * whose tag is configured as unsupported, and resolves {@code alias} fields against their
 * sibling fields (dangling aliases are dropped). The result lists normal fields first and
 * resolved aliases after them, both in document order.
 *
 * <p>Serialization is the inverse, using {@link FieldMetadata} to pick between tags that
 * collapse to the same columnar type. Lossy by design: decimals become {@code double},
 * maps become empty objects and arrays become their element mapping.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public class IndexMappingConverter {

    private static final Logger logger = LoggerFactory.getLogger(IndexMappingConverter.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final String PROPERTIES = "properties";
    private static final String TYPE = "type";
    private static final String FORMAT = "format";
    private static final String FIELDS = "fields";
    private static final String PATH = "path";
    private static final String DOC_VALUES = "doc_values";

    private final MappingOptions options;

    /**
     * Creates a converter configured from system properties.
     *
     * @see MappingOptions#fromSystemProperties()
     */
    public IndexMappingConverter() {
        this(MappingOptions.fromSystemProperties());
    }

    public IndexMappingConverter(MappingOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public MappingOptions options() {
        return options;
    }

    // ==================== Deserialization ====================

    /**
     * Parses a mapping document and converts its properties to a schema.
     *
     * @param mapping the mapping document as JSON text
     * @return the schema
     * @throws IllegalArgumentException if the text is not a JSON object
     * @throws UnsupportedTypeException if a field uses an unknown type tag or date format
     */
    public StructType deserialize(String mapping) {
        if (mapping == null || mapping.isBlank()) {
            throw new IllegalArgumentException("mapping must not be null or empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(mapping);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse mapping document: " + e.getOriginalMessage(), e);
        }
        return deserialize(root);
    }

    /**
     * Converts the {@code properties} of a parsed mapping document to a schema.
     *
     * @param mapping the mapping document, or any object spec holding {@code properties}
     * @return the schema
     */
    public StructType deserialize(JsonNode mapping) {
        if (mapping == null || !mapping.isObject()) {
            throw new IllegalArgumentException("mapping must be a JSON object");
        }
        JsonNode properties = mapping.path(PROPERTIES);
        if (properties.isMissingNode() || properties.isNull()) {
            return StructType.EMPTY;
        }
        if (!properties.isObject()) {
            throw new IllegalArgumentException("\"properties\" must be a JSON object");
        }

        Map<String, JsonNode> aliasProperties = new LinkedHashMap<>();
        Map<String, JsonNode> normalProperties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = properties.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (IndexFieldType.ALIAS.tag().equals(typeTag(entry.getValue()))) {
                aliasProperties.put(entry.getKey(), entry.getValue());
            } else {
                normalProperties.put(entry.getKey(), entry.getValue());
            }
        }

        List<StructField> fields = new ArrayList<>();
        Map<String, StructField> fieldsByName = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : normalProperties.entrySet()) {
            String tag = typeTag(entry.getValue());
            if (tag != null && !options.isSupported(tag)) {
                logger.debug("Dropping field '{}' of unsupported type '{}'", entry.getKey(), tag);
                continue;
            }
            StructField field = deserializeField(entry.getKey(), entry.getValue());
            fields.add(field);
            fieldsByName.put(field.name(), field);
        }

        // Aliases only survive when their target is a mapped sibling
        for (Map.Entry<String, JsonNode> entry : aliasProperties.entrySet()) {
            JsonNode pathNode = entry.getValue().path(PATH);
            String path = pathNode.isTextual() ? pathNode.asText() : null;
            StructField target = path != null ? fieldsByName.get(path) : null;
            if (target == null) {
                logger.debug("Dropping alias '{}': path '{}' does not name a mapped field", entry.getKey(), path);
                continue;
            }
            fields.add(new StructField(entry.getKey(), target.dataType(), true, FieldMetadata.alias(path)));
        }

        return new StructType(fields);
    }

    /**
     * Converts one field spec to a struct field.
     *
     * @param fieldName the field name
     * @param fieldProperties the field spec
     * @return the struct field, always nullable
     * @throws UnsupportedTypeException for an unknown type tag or date format
     */
    public StructField deserializeField(String fieldName, JsonNode fieldProperties) {
        JsonNode typeNode = fieldProperties.get(TYPE);
        if (typeNode == null || typeNode.isNull()) {
            return new StructField(fieldName, deserialize(fieldProperties), true);
        }
        if (!typeNode.isTextual()) {
            throw new UnsupportedTypeException(fieldName, typeNode.toString(),
                "unsupported data type: " + typeNode + " (field " + fieldName + ")");
        }

        String tag = typeNode.asText();
        IndexFieldType fieldType = IndexFieldType.fromTag(tag)
            .orElseThrow(() -> new UnsupportedTypeException(fieldName, tag,
                "unsupported data type: " + tag + " (field " + fieldName + ")"));

        FieldMetadata metadata = FieldMetadata.EMPTY;
        DataType dataType;
        switch (fieldType) {
            case BOOLEAN -> dataType = BooleanType.get();
            case KEYWORD -> dataType = StringType.get();
            case LONG -> dataType = LongType.get();
            case INTEGER -> dataType = IntegerType.get();
            case SHORT -> dataType = ShortType.get();
            case BYTE -> dataType = ByteType.get();
            case DOUBLE -> dataType = DoubleType.get();
            case FLOAT -> dataType = FloatType.get();
            case HALF_FLOAT -> {
                metadata = metadata.withHalfFloat();
                dataType = FloatType.get();
            }
            case DATE -> {
                JsonNode format = fieldProperties.path(FORMAT);
                dataType = DateFormatResolver.resolve(fieldName,
                    format.isTextual() ? format.asText() : DateFormatResolver.DEFAULT_DATE_FORMAT);
            }
            case TEXT -> {
                metadata = metadata.withTextField();
                JsonNode subFields = fieldProperties.path(FIELDS);
                if (subFields.isObject()) {
                    metadata = metadata.withMultiFields(deserializeMultiFields(fieldName, subFields));
                }
                dataType = StringType.get();
            }
            case OBJECT -> dataType = deserialize(fieldProperties);
            case BINARY -> dataType = BinaryType.get();
            case IP -> dataType = IpAddressType.get();
            case GEO_POINT -> dataType = GeoPointType.get();
            case ALIAS -> throw new IllegalStateException("alias field '" + fieldName + "' must be resolved against its siblings");
            default -> throw new UnsupportedTypeException(fieldName, tag, "unsupported data type: " + tag);
        }
        return new StructField(fieldName, dataType, true, metadata);
    }

    private Map<String, String> deserializeMultiFields(String fieldName, JsonNode subFields) {
        Map<String, String> multiFields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = subFields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> sub = it.next();
            JsonNode subType = sub.getValue().path(TYPE);
            if (!subType.isTextual()) {
                throw new UnsupportedTypeException(fieldName + "." + sub.getKey(), String.valueOf(subType),
                    "multi-field " + fieldName + "." + sub.getKey() + " declares no type");
            }
            multiFields.put(fieldName + "." + sub.getKey(), subType.asText());
        }
        return multiFields;
    }

    private static String typeTag(JsonNode fieldProperties) {
        JsonNode type = fieldProperties.get(TYPE);
        return type != null && type.isTextual() ? type.asText() : null;
    }

    // ==================== Serialization ====================

    /**
     * Converts a schema to a compact mapping document.
     *
     * @param schema the schema
     * @return the mapping document as compact JSON
     * @throws UnsupportedTypeException if a field type has no index representation
     */
    public String serialize(StructType schema) {
        ObjectNode node = serializeToNode(schema);
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write mapping document", e);
        }
    }

    /**
     * Converts a schema to a mapping document tree of the shape {@code {"properties": {...}}}.
     */
    public ObjectNode serializeToNode(StructType schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode properties = root.putObject(PROPERTIES);
        for (StructField field : schema.fields()) {
            properties.set(field.name(), serializeField(field.name(), field.dataType(), field.metadata()));
        }
        return root;
    }

    /**
     * Converts one field to its field spec.
     *
     * @param fieldName the field name, used for multi-field keys and error reporting
     * @param dataType the field type
     * @param metadata the round-trip hints of the field
     * @return the field spec
     */
    public ObjectNode serializeField(String fieldName, DataType dataType, FieldMetadata metadata) {
        if (metadata.isAlias()) {
            return typed(IndexFieldType.ALIAS).put(PATH, metadata.aliasPath());
        }

        if (dataType instanceof BooleanType) {
            return typed(IndexFieldType.BOOLEAN);
        }
        if (dataType instanceof StringType) {
            if (!metadata.textField()) {
                return typed(IndexFieldType.KEYWORD);
            }
            ObjectNode text = typed(IndexFieldType.TEXT);
            if (metadata.hasMultiFields()) {
                ObjectNode subFields = text.putObject(FIELDS);
                String prefix = fieldName + ".";
                metadata.multiFields().forEach((key, tag) -> {
                    String subName = key.startsWith(prefix) ? key.substring(prefix.length()) : key;
                    subFields.putObject(subName).put(TYPE, tag);
                });
            }
            return text;
        }
        if (dataType instanceof LongType) {
            return typed(IndexFieldType.LONG);
        }
        if (dataType instanceof IntegerType) {
            return typed(IndexFieldType.INTEGER);
        }
        if (dataType instanceof ShortType) {
            return typed(IndexFieldType.SHORT);
        }
        if (dataType instanceof ByteType) {
            return typed(IndexFieldType.BYTE);
        }
        if (dataType instanceof DoubleType || dataType instanceof DecimalType) {
            return typed(IndexFieldType.DOUBLE);
        }
        if (dataType instanceof FloatType) {
            return typed(metadata.halfFloat() ? IndexFieldType.HALF_FLOAT : IndexFieldType.FLOAT);
        }
        if (dataType instanceof TimestampType) {
            return typed(IndexFieldType.DATE).put(FORMAT, DateFormatResolver.TIMESTAMP_FORMAT);
        }
        if (dataType instanceof DateType) {
            return typed(IndexFieldType.DATE).put(FORMAT, DateFormatResolver.DATE_FORMAT);
        }
        if (dataType instanceof StructType struct) {
            return serializeToNode(struct);
        }
        if (dataType instanceof MapType) {
            // entries are dynamically mapped by the store
            return serializeToNode(StructType.EMPTY);
        }
        if (dataType instanceof ArrayType array) {
            return serializeField(fieldName, array.elementType(), FieldMetadata.EMPTY);
        }
        if (dataType instanceof BinaryType) {
            // doc values are required for script-based filtering on binary fields
            return typed(IndexFieldType.BINARY).put(DOC_VALUES, true);
        }
        if (dataType instanceof IpAddressType) {
            return typed(IndexFieldType.IP);
        }
        if (dataType instanceof GeoPointType) {
            return typed(IndexFieldType.GEO_POINT);
        }
        throw new UnsupportedTypeException(fieldName, dataType.typeName(),
            "unsupported data type: " + dataType.typeName() + " (field " + fieldName + ")");
    }

    private static ObjectNode typed(IndexFieldType type) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(TYPE, type.tag());
        return node;
    }
}

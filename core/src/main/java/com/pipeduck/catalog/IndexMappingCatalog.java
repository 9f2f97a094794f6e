package com.pipeduck.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeduck.mapping.IndexMappingConverter;
import com.pipeduck.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog whose tables are search indices described by their field mapping documents.
 *
 * <p>Mappings are converted to schemas through {@link IndexMappingConverter} when they are
 * registered, so a malformed mapping or an unknown field type fails registration rather
 * than a later query.
 */
public class IndexMappingCatalog implements Catalog {

    private static final Logger logger = LoggerFactory.getLogger(IndexMappingCatalog.class);

    private final IndexMappingConverter converter;
    private final Map<String, StructType> indices = new ConcurrentHashMap<>();

    public IndexMappingCatalog() {
        this(new IndexMappingConverter());
    }

    public IndexMappingCatalog(IndexMappingConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
    }

    /**
     * Registers an index from its mapping JSON.
     *
     * @throws IllegalArgumentException if the JSON is malformed
     * @throws com.pipeduck.exception.UnsupportedTypeException if a field type has no column type
     */
    public IndexMappingCatalog registerIndex(String indexName, String mappingJson) {
        return register(indexName, converter.deserialize(mappingJson));
    }

    public IndexMappingCatalog registerIndex(String indexName, JsonNode mapping) {
        return register(indexName, converter.deserialize(mapping));
    }

    private IndexMappingCatalog register(String indexName, StructType schema) {
        Objects.requireNonNull(indexName, "indexName must not be null");
        indices.put(indexName, schema);
        logger.debug("Registered index '{}' as {}", indexName, schema);
        return this;
    }

    /**
     * Returns the mapping document the given index would be created with.
     */
    public Optional<String> mappingOf(String indexName) {
        return resolveTable(indexName).map(converter::serialize);
    }

    @Override
    public Optional<StructType> resolveTable(String name) {
        return Optional.ofNullable(indices.get(name));
    }
}

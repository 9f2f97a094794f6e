package com.pipeduck.catalog;

import com.pipeduck.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog backed by schemas registered in memory. Table names are matched exactly.
 *
 * <pre>
 *   InMemoryCatalog catalog = new InMemoryCatalog()
 *       .register("orders", new StructType(
 *           new StructField("status", StringType.get()),
 *           new StructField("region", StringType.get())));
 * </pre>
 */
public class InMemoryCatalog implements Catalog {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCatalog.class);

    private final Map<String, StructType> tables = new ConcurrentHashMap<>();

    /**
     * Registers (or replaces) a table.
     *
     * @return this catalog, for chaining
     */
    public InMemoryCatalog register(String name, StructType schema) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        StructType previous = tables.put(name, schema);
        if (previous != null) {
            logger.debug("Replaced schema of table '{}'", name);
        } else {
            logger.debug("Registered table '{}' with {} columns", name, schema.size());
        }
        return this;
    }

    public boolean unregister(String name) {
        return tables.remove(name) != null;
    }

    public Set<String> tableNames() {
        return Collections.unmodifiableSet(new TreeSet<>(tables.keySet()));
    }

    @Override
    public Optional<StructType> resolveTable(String name) {
        return Optional.ofNullable(tables.get(name));
    }
}

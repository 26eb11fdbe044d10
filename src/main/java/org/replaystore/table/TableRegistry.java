package org.replaystore.table;

import java.io.File;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.replaystore.api.errors.NotFoundException;
import org.replaystore.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigUtil;

/**
 * The set of tables served by one process, looked up by name.
 * <p>
 * Tables are built from the {@code replaystore.tables} block of the application
 * configuration; each table block falls back to {@code replaystore.tableDefaults}:
 * <pre>
 * replaystore {
 *   tableDefaults { maxSize = 1000000, sampler { type = prioritized }, ... }
 *   tables {
 *     replay { maxSize = 10000, sampler { type = uniform } }
 *     queue  { maxTimesSampled = 1, rateLimiter { minDiff = 0, maxDiff = 100 } }
 *   }
 * }
 * </pre>
 */
public class TableRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TableRegistry.class);

    private final Map<String, Table> tables = new LinkedHashMap<>();

    /**
     * Builds every table defined in the configuration.
     *
     * @param config The application configuration (containing the {@code replaystore} block)
     * @throws IllegalArgumentException if a table definition is invalid
     */
    public TableRegistry(Config config) {
        try {
            Config root = config.getConfig("replaystore");
            Config defaults = root.getConfig("tableDefaults");
            Config tableConfigs = root.getConfig("tables");
            for (String name : root.getObject("tables").keySet()) {
                Config tableConfig = tableConfigs.getConfig(ConfigUtil.joinPath(name)).withFallback(defaults);
                tables.put(name, Table.fromConfig(name, tableConfig));
            }
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid table registry configuration", e);
        }
        log.info("Table registry created with {} tables: {}", tables.size(), tables.keySet());
    }

    /**
     * Builds the tables of the configuration resolved by {@link ConfigLoader#resolve(File)}.
     *
     * @param configFile Configuration file, or {@code null} to discover it
     * @return a registry holding the configured tables
     */
    public static TableRegistry load(File configFile) {
        return new TableRegistry(ConfigLoader.resolve(configFile));
    }

    /**
     * Wraps already constructed tables.
     *
     * @param tables The tables, names must be unique
     * @throws IllegalArgumentException if two tables share a name
     */
    public TableRegistry(List<Table> tables) {
        for (Table table : tables) {
            if (this.tables.putIfAbsent(table.name(), table) != null) {
                throw new IllegalArgumentException("Duplicate table name: " + table.name());
            }
        }
    }

    /**
     * Returns the table with the given name.
     *
     * @param name The table name
     * @return the table
     * @throws NotFoundException if no table has that name
     */
    public Table getTable(String name) throws NotFoundException {
        Table table = tables.get(name);
        if (table == null) {
            throw new NotFoundException(String.format(
                    "Table '%s' not found. Available tables: %s", name, tables.keySet()));
        }
        return table;
    }

    public Collection<Table> getTables() {
        return Collections.unmodifiableCollection(tables.values());
    }

    /**
     * Closes every table, cancelling their pending rate limited calls.
     */
    @Override
    public void close() {
        for (Table table : tables.values()) {
            table.close();
        }
        log.info("Table registry closed");
    }
}

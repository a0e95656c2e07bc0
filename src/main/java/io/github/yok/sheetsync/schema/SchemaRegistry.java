package io.github.yok.sheetsync.schema;

import com.google.common.collect.ImmutableList;
import io.github.yok.sheetsync.config.SchemaConfig;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide registry of the static table schemas.
 *
 * <p>
 * The registry is built once at start-up and checked for consistency: every required, primary-key
 * and foreign-key column must be one of the expected columns, every referenced table must be
 * declared, table names must be unique (case-insensitive) and the primary key must be required.
 * Any violation is reported as an {@link IllegalStateException} so that the run never starts with a
 * broken schema.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaRegistry {

    // Schemas keyed by lower-case table name, in declaration order
    private final Map<String, TableSchema> schemas = new LinkedHashMap<>();

    /**
     * Creates a registry from already built schemas.
     *
     * @param tables schemas in declaration order
     * @throws IllegalStateException if the schemas are inconsistent
     */
    public SchemaRegistry(List<TableSchema> tables) {
        for (TableSchema schema : tables) {
            String key = schema.getName().toLowerCase(Locale.ROOT);
            if (schemas.containsKey(key)) {
                throw new IllegalStateException(
                        "Duplicate table definition: '" + schema.getName() + "'.");
            }
            schemas.put(key, schema);
        }
        schemas.values().forEach(this::check);
        log.info("Schema registry loaded: {}", schemas.values().stream()
                .map(TableSchema::getName).collect(Collectors.toList()));
    }

    /**
     * Builds a registry from the bound {@code schemas} configuration.
     *
     * @param config bound configuration
     * @return registry
     * @throws IllegalStateException if the configuration is incomplete or inconsistent
     */
    public static SchemaRegistry fromConfig(SchemaConfig config) {
        if (config == null || config.getTables() == null || config.getTables().isEmpty()) {
            throw new IllegalStateException(
                    "No table schemas configured. Please set 'schemas.tables' in application.yml.");
        }
        List<TableSchema> tables = new ArrayList<>();
        for (SchemaConfig.TableDefinition def : config.getTables()) {
            tables.add(toSchema(def));
        }
        return new SchemaRegistry(tables);
    }

    /**
     * Returns all schemas in declaration order.
     *
     * @return schemas
     */
    public List<TableSchema> all() {
        return ImmutableList.copyOf(schemas.values());
    }

    /**
     * Looks up a schema by table name (case-insensitive).
     *
     * @param tableName table name
     * @return schema, or empty if not declared
     */
    public Optional<TableSchema> find(String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(schemas.get(tableName.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns the schema of a declared table.
     *
     * @param tableName table name
     * @return schema
     * @throws IllegalArgumentException if the table is not declared
     */
    public TableSchema get(String tableName) {
        return find(tableName).orElseThrow(() -> new IllegalArgumentException(
                "Unknown table '" + tableName + "'. Declared: " + schemas.values().stream()
                        .map(TableSchema::getName).collect(Collectors.toList())));
    }

    /**
     * Converts one bound table definition into an immutable schema.
     *
     * @param def bound definition
     * @return schema
     * @throws IllegalStateException if a column type is unknown or a column is unnamed
     */
    private static TableSchema toSchema(SchemaConfig.TableDefinition def) {
        if (def.getName() == null || def.getName().isBlank()) {
            throw new IllegalStateException("Every table definition needs a 'name'.");
        }
        List<String> columns = new ArrayList<>();
        Set<String> required = new LinkedHashSet<>();
        Map<String, ColumnType> types = new LinkedHashMap<>();
        List<ForeignKey> foreignKeys = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (SchemaConfig.ColumnDefinition col : def.getColumns()) {
            String name = col.getName() == null ? null : col.getName().trim();
            if (name == null || name.isEmpty()) {
                throw new IllegalStateException(
                        "Table '" + def.getName() + "' has a column without a name.");
            }
            if (!seen.add(name)) {
                throw new IllegalStateException(
                        "Table '" + def.getName() + "' declares column '" + name + "' twice.");
            }
            columns.add(name);
            try {
                types.put(name, ColumnType.fromTag(col.getType()));
                if (col.getReferences() != null && !col.getReferences().isBlank()) {
                    foreignKeys.add(ForeignKey.parse(name, col.getReferences()));
                }
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(
                        "Invalid definition of " + def.getName() + "." + name + ": "
                                + e.getMessage(), e);
            }
            if (col.isRequired()) {
                required.add(name);
            }
        }
        if (columns.isEmpty()) {
            throw new IllegalStateException(
                    "Table '" + def.getName() + "' must declare at least one column.");
        }
        return new TableSchema(def.getName().trim(), def.getSheet(), columns, required, types,
                foreignKeys, def.getPrimaryKey());
    }

    /**
     * Checks the cross-table consistency of one schema.
     *
     * @param schema schema to check
     * @throws IllegalStateException on inconsistency
     */
    private void check(TableSchema schema) {
        String table = schema.getName();
        for (String req : schema.getRequired()) {
            if (!schema.getColumns().contains(req)) {
                throw new IllegalStateException(
                        "Table '" + table + "': required column '" + req + "' is not declared.");
            }
        }
        schema.primaryKeyColumn().ifPresent(pk -> {
            if (!schema.getColumns().contains(pk)) {
                throw new IllegalStateException(
                        "Table '" + table + "': primary key '" + pk + "' is not declared.");
            }
            if (!schema.isRequired(pk)) {
                throw new IllegalStateException(
                        "Table '" + table + "': primary key '" + pk + "' must be required.");
            }
        });
        for (ForeignKey fk : schema.getForeignKeys().values()) {
            if (!schema.getColumns().contains(fk.getColumn())) {
                throw new IllegalStateException("Table '" + table + "': foreign key column '"
                        + fk.getColumn() + "' is not declared.");
            }
            if (find(fk.getReferencedTable()).isEmpty()) {
                throw new IllegalStateException("Table '" + table + "': column '"
                        + fk.getColumn() + "' references undeclared table '"
                        + fk.getReferencedTable() + "'.");
            }
        }
    }
}

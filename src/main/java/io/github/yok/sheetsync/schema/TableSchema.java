package io.github.yok.sheetsync.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * Immutable definition of one synchronized table.
 *
 * <p>
 * A schema lists the expected columns in order, the columns that must be present and non-null,
 * the declared type of each column, an optional primary-key column used for de-duplication and
 * the foreign keys checked against already loaded tables.
 * </p>
 *
 * <p>
 * Columns without an explicit type are {@link ColumnType#TEXT}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TableSchema {

    // Target table name in the store
    private final String name;

    // Sheet (tab) name in the source
    private final String sheet;

    // Expected columns, in declaration order
    private final ImmutableList<String> columns;

    // Columns that must be non-null after cleaning
    private final ImmutableSet<String> required;

    // Declared type per column
    private final ImmutableMap<String, ColumnType> types;

    // Foreign keys keyed by referencing column, in declaration order
    private final ImmutableMap<String, ForeignKey> foreignKeys;

    // Primary-key column used for de-duplication; null when none
    private final String primaryKey;

    /**
     * Creates a schema.
     *
     * @param name table name
     * @param sheet source sheet name; {@code null} or blank means the table name
     * @param columns expected columns in order
     * @param required required columns
     * @param types declared types; missing columns default to text
     * @param foreignKeys foreign keys
     * @param primaryKey primary-key column; may be {@code null}
     */
    public TableSchema(String name, String sheet, List<String> columns, Set<String> required,
            Map<String, ColumnType> types, List<ForeignKey> foreignKeys, String primaryKey) {
        Validate.notBlank(name, "Table name must not be blank.");
        Validate.notEmpty(columns, "Table '%s' must declare at least one column.", name);
        this.name = name;
        this.sheet = (sheet == null || sheet.isBlank()) ? name : sheet;
        this.columns = ImmutableList.copyOf(columns);
        this.required = required == null ? ImmutableSet.of() : ImmutableSet.copyOf(required);
        ImmutableMap.Builder<String, ColumnType> typeBuilder = ImmutableMap.builder();
        for (String column : this.columns) {
            ColumnType type = types == null ? null : types.get(column);
            typeBuilder.put(column, type == null ? ColumnType.TEXT : type);
        }
        this.types = typeBuilder.buildOrThrow();
        ImmutableMap.Builder<String, ForeignKey> fkBuilder = ImmutableMap.builder();
        if (foreignKeys != null) {
            foreignKeys.forEach(fk -> fkBuilder.put(fk.getColumn(), fk));
        }
        this.foreignKeys = fkBuilder.buildOrThrow();
        this.primaryKey = (primaryKey == null || primaryKey.isBlank()) ? null : primaryKey;
    }

    /**
     * Returns the declared type of a column.
     *
     * @param column column name
     * @return declared type, or {@link ColumnType#TEXT} for undeclared columns
     */
    public ColumnType typeOf(String column) {
        return types.getOrDefault(column, ColumnType.TEXT);
    }

    /**
     * Returns whether the column is required.
     *
     * @param column column name
     * @return {@code true} if required
     */
    public boolean isRequired(String column) {
        return required.contains(column);
    }

    /**
     * Returns whether this table references other tables.
     *
     * @return {@code true} if at least one foreign key is declared
     */
    public boolean hasForeignKeys() {
        return !foreignKeys.isEmpty();
    }

    /**
     * Returns the primary-key column.
     *
     * @return primary-key column, or empty when the table has none
     */
    public Optional<String> primaryKeyColumn() {
        return Optional.ofNullable(primaryKey);
    }
}

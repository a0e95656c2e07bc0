package io.github.yok.sheetsync.schema;

import lombok.Value;

/**
 * A foreign-key declaration of a table schema.
 *
 * <p>
 * The values of {@link #getColumn()} in the referencing table must exist in
 * {@link #getReferencedTable()}.{@link #getReferencedColumn()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ForeignKey {

    // Column of the referencing table
    String column;

    // Referenced (parent) table
    String referencedTable;

    // Key column of the referenced table
    String referencedColumn;

    /**
     * Parses a foreign-key target written as {@code table} or {@code table.column}.
     *
     * <p>
     * When the column part is omitted, the referenced column has the same name as the referencing
     * column.
     * </p>
     *
     * @param column referencing column
     * @param target {@code table} or {@code table.column}
     * @return parsed declaration
     * @throws IllegalArgumentException if {@code target} is blank or malformed
     */
    public static ForeignKey parse(String column, String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException(
                    "Foreign key target for column '" + column + "' must not be blank.");
        }
        String trimmed = target.trim();
        int dot = trimmed.indexOf('.');
        if (dot < 0) {
            return new ForeignKey(column, trimmed, column);
        }
        String table = trimmed.substring(0, dot).trim();
        String refColumn = trimmed.substring(dot + 1).trim();
        if (table.isEmpty() || refColumn.isEmpty() || refColumn.indexOf('.') >= 0) {
            throw new IllegalArgumentException("Malformed foreign key target '" + target
                    + "' for column '" + column + "'. Expected 'table' or 'table.column'.");
        }
        return new ForeignKey(column, table, refColumn);
    }

    /**
     * Returns {@code table.column} of the referenced key, for messages.
     *
     * @return qualified referenced column
     */
    public String describeTarget() {
        return referencedTable + "." + referencedColumn;
    }
}

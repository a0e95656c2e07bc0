package io.github.yok.sheetsync.core;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import lombok.Value;

/**
 * Typed projection of a source row that passed validation.
 *
 * <p>
 * Only columns with a non-null cleaned value are present; a missing column means "no value". The
 * source line is kept for error messages and is not a column.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class CleanedRecord {

    // 1-based source line
    int sourceRow;

    // column -> typed value, in schema column order
    Map<String, Object> values;

    /**
     * Creates a record.
     *
     * @param sourceRow 1-based source line
     * @param values non-null typed values in column order
     */
    public CleanedRecord(int sourceRow, Map<String, Object> values) {
        this.sourceRow = sourceRow;
        this.values = ImmutableMap.copyOf(values);
    }

    /**
     * Returns the value of a column.
     *
     * @param column column name
     * @return value, or empty when the column has no value
     */
    public Optional<Object> get(String column) {
        return Optional.ofNullable(values.get(column));
    }

    /**
     * Returns whether the record has a value for a column.
     *
     * @param column column name
     * @return {@code true} if present
     */
    public boolean has(String column) {
        return values.containsKey(column);
    }
}

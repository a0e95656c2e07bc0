package io.github.yok.sheetsync.core;

import java.util.Set;

/**
 * Supplies the key values currently present in a referenced table column.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface KeyLookup {

    /**
     * Returns the existing keys of a column, as trimmed strings.
     *
     * @param table referenced table
     * @param column key column
     * @return existing keys; never {@code null}
     */
    Set<String> keys(String table, String column);
}

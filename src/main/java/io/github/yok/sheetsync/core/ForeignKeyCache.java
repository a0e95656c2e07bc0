package io.github.yok.sheetsync.core;

import com.google.common.collect.ImmutableSet;
import io.github.yok.sheetsync.store.StoreClient;
import io.github.yok.sheetsync.store.StoreException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Run-scoped {@link KeyLookup} that reads each referenced column from the store once.
 *
 * <p>
 * On first use of a {@code (table, column)} pair, all values of that column are selected and
 * memoized for the rest of the run. Entries are never invalidated, which is correct only because
 * referenced tables are fully loaded before the tables that reference them. A failed read is not
 * memoized; it yields an empty set, so every reference to that column is rejected.
 * </p>
 *
 * <p>
 * Not thread-safe; one instance belongs to one run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class ForeignKeyCache implements KeyLookup {

    private final StoreClient store;

    // "table.column" (lower-case) -> existing keys
    private final Map<String, Set<String>> cache = new HashMap<>();

    @Override
    public Set<String> keys(String table, String column) {
        String cacheKey = table.toLowerCase(Locale.ROOT) + "." + column.toLowerCase(Locale.ROOT);
        Set<String> cached = cache.get(cacheKey);
        if (cached != null) {
            return cached;
        }
        log.info("Loading existing keys of {}.{}", table, column);
        List<Object> values;
        try {
            values = store.selectColumn(table, column);
        } catch (StoreException e) {
            log.warn("Failed to load keys of {}.{}: {}", table, column, e.getMessage(), e);
            return ImmutableSet.of();
        }
        Set<String> keys = values.stream().filter(Objects::nonNull)
                .map(ForeignKeyValidator::keyOf).filter(k -> !k.isEmpty())
                .collect(ImmutableSet.toImmutableSet());
        log.info("{}.{}: {} distinct keys", table, column, keys.size());
        cache.put(cacheKey, keys);
        return keys;
    }

    /**
     * Returns whether a column has been memoized.
     *
     * @param table referenced table
     * @param column key column
     * @return {@code true} if cached
     */
    public boolean isCached(String table, String column) {
        return cache.containsKey(
                table.toLowerCase(Locale.ROOT) + "." + column.toLowerCase(Locale.ROOT));
    }
}

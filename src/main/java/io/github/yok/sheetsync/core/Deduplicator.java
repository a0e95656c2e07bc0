package io.github.yok.sheetsync.core;

import io.github.yok.sheetsync.clean.CellCleaner;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * Collapses records sharing a primary-key value; the last occurrence wins.
 *
 * <p>
 * Rows appended later to a sheet are newer, so for each key the record seen last in input order is
 * kept. The output keeps the position of the first occurrence of each key. Key values are compared
 * after text cleaning of their canonical form, so {@code " cli_001 "} and {@code "cli_001"} are the
 * same key. Records without a key value cannot be grouped and pass through in place.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class Deduplicator {

    private final CellCleaner cleaner;

    /**
     * De-duplicates records.
     *
     * @param records validated records in source order
     * @param pkColumn primary-key column; {@code null} returns the input unchanged
     * @return unique records and the number of collapsed duplicates
     */
    public Result dedupe(List<CleanedRecord> records, String pkColumn) {
        if (pkColumn == null) {
            return new Result(new ArrayList<>(records), 0);
        }
        Map<Object, CleanedRecord> unique = new LinkedHashMap<>();
        int duplicates = 0;
        for (CleanedRecord record : records) {
            String key = cleaner.cleanText(CellCleaner.canonical(record.getValues().get(pkColumn)));
            if (key == null) {
                unique.put(new Object(), record);
                continue;
            }
            if (unique.containsKey(key)) {
                duplicates++;
            }
            unique.put(key, record);
        }
        return new Result(new ArrayList<>(unique.values()), duplicates);
    }

    /**
     * Result of {@link Deduplicator#dedupe(List, String)}.
     */
    @Value
    public static class Result {
        // Unique records in first-seen key order
        List<CleanedRecord> records;
        // Number of records replaced by a later record with the same key
        int duplicates;
    }
}

package io.github.yok.sheetsync.core;

import io.github.yok.sheetsync.schema.ForeignKey;
import io.github.yok.sheetsync.schema.TableSchema;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks the foreign-key columns of cleaned records against the keys already in the store.
 *
 * <p>
 * A record is kept only if every declared foreign-key column it contains holds a value present in
 * the referenced key set. A record without a value for a foreign-key column is not rejected for it.
 * One error is reported per dangling reference, so a record may produce several errors but is
 * counted once.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ForeignKeyValidator {

    /**
     * Validates references.
     *
     * @param records de-duplicated records
     * @param schema table schema
     * @param keyLookup existing keys per referenced column
     * @return records whose references all resolve, and one error per dangling reference
     */
    public Result validate(List<CleanedRecord> records, TableSchema schema, KeyLookup keyLookup) {
        if (!schema.hasForeignKeys()) {
            return new Result(new ArrayList<>(records), new ArrayList<>(), 0);
        }
        Map<ForeignKey, Set<String>> keySets = new LinkedHashMap<>();
        for (ForeignKey fk : schema.getForeignKeys().values()) {
            keySets.put(fk, keyLookup.keys(fk.getReferencedTable(), fk.getReferencedColumn()));
        }

        List<CleanedRecord> valid = new ArrayList<>();
        List<ValidationError> errors = new ArrayList<>();
        int rejected = 0;
        for (CleanedRecord record : records) {
            boolean ok = true;
            for (Map.Entry<ForeignKey, Set<String>> entry : keySets.entrySet()) {
                ForeignKey fk = entry.getKey();
                Object value = record.getValues().get(fk.getColumn());
                if (value == null) {
                    continue;
                }
                String key = keyOf(value);
                if (!entry.getValue().contains(key)) {
                    errors.add(new ValidationError(record.getSourceRow(), fk.getColumn(),
                            String.format("Row %d: invalid foreign key %s='%s' does not exist in %s",
                                    record.getSourceRow(), fk.getColumn(), key,
                                    fk.describeTarget())));
                    ok = false;
                }
            }
            if (ok) {
                valid.add(record);
            } else {
                rejected++;
            }
        }
        log.debug("[{}] FK check | valid={}, rejected={}", schema.getName(), valid.size(),
                rejected);
        return new Result(valid, errors, rejected);
    }

    /**
     * Returns the comparison form of a key value: the trimmed string, with numbers in plain
     * notation without trailing zeros.
     *
     * @param value key value (not {@code null})
     * @return comparison key
     */
    public static String keyOf(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros()
                    .toPlainString();
        }
        return String.valueOf(value).trim();
    }

    /**
     * Result of {@link ForeignKeyValidator#validate(List, TableSchema, KeyLookup)}.
     */
    @Value
    public static class Result {
        // Records whose references all resolve, in input order
        List<CleanedRecord> valid;
        // One error per dangling reference
        List<ValidationError> errors;
        // Number of rejected records
        int rejected;
    }
}

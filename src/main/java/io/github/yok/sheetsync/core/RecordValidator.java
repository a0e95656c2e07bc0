package io.github.yok.sheetsync.core;

import io.github.yok.sheetsync.clean.CellCleaner;
import io.github.yok.sheetsync.clean.HeaderMapping;
import io.github.yok.sheetsync.schema.TableSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;

/**
 * Applies a table schema and the {@link CellCleaner} to one raw row.
 *
 * <p>
 * Columns are visited in schema order. Each column is located in the row through the header
 * mapping (a column missing from the header is read as an empty cell), cleaned according to its
 * declared type, and checked against the required set. All columns are checked even after a
 * failure so that every problem of the row is reported in one pass.
 * </p>
 *
 * <p>
 * The resulting record omits columns whose cleaned value is {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class RecordValidator {

    private final CellCleaner cleaner;

    /**
     * Validates and cleans one row.
     *
     * @param row raw row (must not be blank; blank rows are dropped before validation)
     * @param header header mapping of the sheet
     * @param schema table schema
     * @return cleaned record, or the list of required columns that failed
     */
    public ValidationResult validate(RawRow row, HeaderMapping header, TableSchema schema) {
        Map<String, Object> values = new LinkedHashMap<>();
        List<ValidationError> errors = new ArrayList<>();

        for (String column : schema.getColumns()) {
            OptionalInt index = header.indexOf(column);
            String raw = index.isPresent() ? row.cell(index.getAsInt()).orElse(null) : null;
            Object cleaned = cleaner.clean(raw, schema.typeOf(column));

            if (cleaned == null) {
                if (schema.isRequired(column)) {
                    errors.add(new ValidationError(row.getPosition(), column,
                            String.format("Row %d: required column '%s' is empty or invalid. "
                                    + "Original value: '%s'", row.getPosition(), column,
                                    raw == null ? "" : raw)));
                }
                continue;
            }
            values.put(column, cleaned);
        }

        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }
        return ValidationResult.valid(new CleanedRecord(row.getPosition(), values));
    }
}

package io.github.yok.sheetsync.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of validating one raw row: either a cleaned record or the list of problems found.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationResult {

    // Cleaned record; null when invalid
    private final CleanedRecord record;

    // Problems found; empty when valid
    private final List<ValidationError> errors;

    /**
     * Creates a successful result.
     *
     * @param record cleaned record
     * @return result
     */
    public static ValidationResult valid(CleanedRecord record) {
        return new ValidationResult(record, ImmutableList.of());
    }

    /**
     * Creates a failed result.
     *
     * @param errors problems found (at least one)
     * @return result
     */
    public static ValidationResult invalid(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error.");
        }
        return new ValidationResult(null, ImmutableList.copyOf(errors));
    }

    /**
     * Returns whether the row is valid.
     *
     * @return {@code true} if a record was produced
     */
    public boolean isValid() {
        return record != null;
    }

    /**
     * Returns the cleaned record.
     *
     * @return record, or empty when invalid
     */
    public Optional<CleanedRecord> record() {
        return Optional.ofNullable(record);
    }
}

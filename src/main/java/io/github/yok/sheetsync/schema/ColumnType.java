package io.github.yok.sheetsync.schema;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Enumeration of the column types a table schema can declare.
 *
 * <p>
 * Each type is identified by a lower-case tag used in {@code application.yml} (for example
 * {@code decimal}). Tag matching is centralized here so that configuration binding and the cell
 * cleaner do not hardcode string comparisons.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum ColumnType {

    // Free text; whitespace-normalized string.
    TEXT("text"),

    // Floating-point number; accepts comma or dot as decimal separator.
    DECIMAL("decimal"),

    // Whole number.
    INTEGER("integer"),

    // Calendar date normalized to yyyy-MM-dd.
    DATE("date");

    // Tag used in configuration (lower-case).
    private final String tag;

    /**
     * Resolves a type from its configuration tag.
     *
     * @param tag type tag (case-insensitive, surrounding whitespace ignored); {@code null} or blank
     *        means {@link #TEXT}
     * @return matching type
     * @throws IllegalArgumentException if the tag is not a known type
     */
    public static ColumnType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return TEXT;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (ColumnType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown column type '" + tag + "'. Supported: "
                + Arrays.stream(values()).map(ColumnType::getTag).collect(Collectors.joining(", ")));
    }
}

package io.github.yok.sheetsync.clean;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;

/**
 * Position lookup of a source header row, keyed by normalized column name.
 *
 * <p>
 * Built once per sheet. When two headers normalize to the same key, the first (left-most) one wins
 * and the duplicate is logged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class HeaderMapping {

    // Original header cells
    private final List<String> header;

    // normalized name -> zero-based cell index
    private final Map<String, Integer> index = new HashMap<>();

    private HeaderMapping(List<String> header) {
        this.header = ImmutableList.copyOf(header);
        for (int i = 0; i < header.size(); i++) {
            String key = HeaderNormalizer.normalize(header.get(i));
            if (key.isEmpty()) {
                continue;
            }
            Integer previous = index.putIfAbsent(key, i);
            if (previous != null) {
                log.warn("Duplicate header '{}' at column {} ignored; using column {}.",
                        header.get(i), i + 1, previous + 1);
            }
        }
    }

    /**
     * Builds a mapping for a header row.
     *
     * @param header raw header cells; {@code null} cells are treated as blank
     * @return mapping
     */
    public static HeaderMapping of(List<String> header) {
        List<String> cells = new ArrayList<>(header.size());
        for (String cell : header) {
            cells.add(cell == null ? "" : cell);
        }
        return new HeaderMapping(cells);
    }

    /**
     * Returns the cell index of a column.
     *
     * @param column schema column name
     * @return zero-based index, or empty when the header has no such column
     */
    public OptionalInt indexOf(String column) {
        Integer i = index.get(HeaderNormalizer.normalize(column));
        return i == null ? OptionalInt.empty() : OptionalInt.of(i);
    }

    /**
     * Returns the original header cells.
     *
     * @return header cells
     */
    public List<String> getHeader() {
        return header;
    }
}

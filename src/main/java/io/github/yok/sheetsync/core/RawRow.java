package io.github.yok.sheetsync.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * One unprocessed source row and its 1-based sheet line, used in error messages.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RawRow {

    // 1-based line in the sheet (the header is line 1)
    int position;

    // Cells as read from the source
    List<String> cells;

    /**
     * Creates a row.
     *
     * @param position 1-based sheet line
     * @param cells raw cells
     */
    public RawRow(int position, List<String> cells) {
        this.position = position;
        this.cells = ImmutableList.copyOf(cells);
    }

    /**
     * Returns the cell at an index.
     *
     * @param index zero-based cell index
     * @return cell text, or empty when the row is shorter
     */
    public Optional<String> cell(int index) {
        return index < cells.size() ? Optional.of(cells.get(index)) : Optional.empty();
    }

    /**
     * Returns whether every cell is blank.
     *
     * @return {@code true} for rows without content
     */
    public boolean isBlank() {
        return cells.stream().allMatch(StringUtils::isBlank);
    }
}

package io.github.yok.sheetsync.source;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;
import org.apache.commons.lang3.Validate;

/**
 * Raw content of one sheet: the header row and every following row, blank rows included.
 *
 * <p>
 * Row {@code i} of {@link #getRows()} is sheet line {@code headerLine + 1 + i}. The header is
 * line 1 unless the source reports otherwise.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SheetData {

    // Header cells as found in the sheet
    List<String> header;

    // Data rows as found in the sheet
    List<List<String>> rows;

    // 1-based sheet line of the header
    int headerLine;

    /**
     * Creates sheet content whose header is line 1.
     *
     * @param header header cells
     * @param rows data rows
     */
    public SheetData(List<String> header, List<List<String>> rows) {
        this(header, rows, 1);
    }

    /**
     * Creates sheet content.
     *
     * @param header header cells
     * @param rows data rows following the header
     * @param headerLine 1-based sheet line of the header
     * @throws IllegalArgumentException if {@code headerLine} is less than 1
     */
    public SheetData(List<String> header, List<List<String>> rows, int headerLine) {
        Validate.isTrue(headerLine >= 1, "headerLine must be 1 or greater: %d", headerLine);
        this.headerLine = headerLine;
        this.header = ImmutableList.copyOf(header);
        ImmutableList.Builder<List<String>> builder = ImmutableList.builder();
        for (List<String> row : rows) {
            // cells may be null in ragged rows; keep them as empty strings
            builder.add(row.stream().map(c -> c == null ? "" : c)
                    .collect(ImmutableList.toImmutableList()));
        }
        this.rows = builder.build();
    }

    /**
     * Returns whether the sheet has neither header nor rows.
     *
     * @return {@code true} if empty
     */
    public boolean isEmpty() {
        return header.isEmpty() && rows.isEmpty();
    }

    /**
     * Returns the sheet line of a data row.
     *
     * @param index index into {@link #getRows()}
     * @return 1-based sheet line
     */
    public int lineOf(int index) {
        return headerLine + 1 + index;
    }
}

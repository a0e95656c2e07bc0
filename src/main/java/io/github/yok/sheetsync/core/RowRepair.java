package io.github.yok.sheetsync.core;

import java.util.ArrayList;
import java.util.List;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Repairs a known paste artefact of spreadsheet sources before validation.
 *
 * <p>
 * When several values are pasted into a single cell, the first cell of the row holds all of them
 * separated by runs of spaces or tabs. A first cell longer than {@value #MERGED_CELL_MIN_LENGTH}
 * characters that contains a double space or a tab is reduced to its first token.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class RowRepair {

    static final int MERGED_CELL_MIN_LENGTH = 50;

    @Generated
    private RowRepair() {}

    /**
     * Reduces a merged first cell to its first token.
     *
     * @param row raw row
     * @return the repaired row, or {@code row} itself when no repair applies
     */
    public static RawRow repairMergedFirstCell(RawRow row) {
        List<String> cells = row.getCells();
        if (cells.isEmpty()) {
            return row;
        }
        String first = cells.get(0);
        if (first.length() <= MERGED_CELL_MIN_LENGTH
                || !(first.contains("  ") || first.contains("\t"))) {
            return row;
        }
        String[] tokens = StringUtils.split(first);
        if (tokens == null || tokens.length == 0) {
            return row;
        }
        List<String> repaired = new ArrayList<>(cells);
        repaired.set(0, tokens[0]);
        return new RawRow(row.getPosition(), repaired);
    }
}

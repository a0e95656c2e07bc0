package io.github.yok.sheetsync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Counters of one table's sync pass. Counters only grow during the pass.
 *
 * <p>
 * Only the first {@code errorReportLimit} error messages are retained; the counts cover all of
 * them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class TableSyncStats {

    private final String table;

    private final int errorReportLimit;

    // Non-blank rows read from the sheet
    private int rowsRead;

    // Rows without any content; dropped, not an error
    private int emptyRows;

    private int validRows;

    private int invalidRows;

    // Records replaced by a later record with the same primary key
    private int duplicates;

    // Records rejected for dangling references
    private int fkErrors;

    private int inserted;

    private int insertErrors;

    // Why the load phase did not run; null when it ran
    @Setter
    private String skipReason;

    // Why the table could not be processed at all; null on success
    @Setter
    private String failure;

    private final List<ValidationError> validationErrors = new ArrayList<>();

    private final List<ValidationError> fkRejections = new ArrayList<>();

    /**
     * Creates empty statistics.
     *
     * @param table table name
     * @param errorReportLimit number of messages retained per kind
     */
    public TableSyncStats(String table, int errorReportLimit) {
        this.table = table;
        this.errorReportLimit = Math.max(0, errorReportLimit);
    }

    void addRowRead() {
        rowsRead++;
    }

    void addEmptyRow() {
        emptyRows++;
    }

    void addValid() {
        validRows++;
    }

    void addInvalid(List<ValidationError> errors) {
        invalidRows++;
        retain(validationErrors, errors);
    }

    void addDuplicates(int count) {
        duplicates += count;
    }

    void addFkRejections(int records, List<ValidationError> errors) {
        fkErrors += records;
        retain(fkRejections, errors);
    }

    void addLoad(int insertedCount, int insertErrorCount) {
        inserted += insertedCount;
        insertErrors += insertErrorCount;
    }

    /**
     * Returns the errors counted against this table.
     *
     * @return invalid rows + FK rejections + insert errors, plus one when the table failed
     */
    public int errorCount() {
        return invalidRows + fkErrors + insertErrors + (failure != null ? 1 : 0);
    }

    /**
     * Returns the retained validation messages.
     *
     * @return first messages, read-only
     */
    public List<ValidationError> getValidationErrors() {
        return Collections.unmodifiableList(validationErrors);
    }

    /**
     * Returns the retained foreign-key messages.
     *
     * @return first messages, read-only
     */
    public List<ValidationError> getFkRejections() {
        return Collections.unmodifiableList(fkRejections);
    }

    private void retain(List<ValidationError> target, List<ValidationError> errors) {
        for (ValidationError error : errors) {
            if (target.size() >= errorReportLimit) {
                return;
            }
            target.add(error);
        }
    }
}

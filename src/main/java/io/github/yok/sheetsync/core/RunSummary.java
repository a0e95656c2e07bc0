package io.github.yok.sheetsync.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Aggregated statistics of a run, per table in sync order.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RunSummary {

    private final List<TableSyncStats> tables;

    private final int totalInserted;

    private final int totalErrors;

    private final SyncOutcome outcome;

    /**
     * Folds per-table statistics into run totals.
     *
     * @param tables per-table statistics in sync order
     * @param warningThreshold threshold passed to {@link SyncOutcome#of(int, int)}
     */
    public RunSummary(List<TableSyncStats> tables, int warningThreshold) {
        this.tables = ImmutableList.copyOf(tables);
        this.totalInserted = tables.stream().mapToInt(TableSyncStats::getInserted).sum();
        this.totalErrors = tables.stream().mapToInt(TableSyncStats::errorCount).sum();
        this.outcome = SyncOutcome.of(totalErrors, warningThreshold);
    }
}

package io.github.yok.sheetsync.core;

import io.github.yok.sheetsync.clean.CellCleaner;
import io.github.yok.sheetsync.clean.HeaderMapping;
import io.github.yok.sheetsync.config.SyncConfig;
import io.github.yok.sheetsync.schema.ForeignKey;
import io.github.yok.sheetsync.schema.SchemaRegistry;
import io.github.yok.sheetsync.schema.TableDependencyResolver;
import io.github.yok.sheetsync.schema.TableSchema;
import io.github.yok.sheetsync.source.SheetData;
import io.github.yok.sheetsync.source.SourceException;
import io.github.yok.sheetsync.source.SourceReader;
import io.github.yok.sheetsync.store.StoreClient;
import io.github.yok.sheetsync.store.StoreException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the validation-and-load pipeline over the selected tables, parent tables first.
 *
 * <p>
 * <strong>Per table:</strong> read sheet → validate rows → de-duplicate by primary key → check
 * foreign keys against the store → clear and load. Tables are processed one after the other; a
 * table is fully loaded before the next one is read, so the foreign-key cache only ever sees
 * tables already loaded in this run.
 * </p>
 *
 * <p>
 * <strong>Failure policy:</strong> nothing aborts the run. Row, record and batch failures become
 * statistics; a table whose sheet cannot be read is marked failed and the run moves on. A table
 * with no record left after validation or after the foreign-key check is not loaded.
 * </p>
 *
 * <p>
 * Before the first table is loaded, all selected tables can be cleared child-first so that parent
 * tables are never cleared while child rows still reference them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SyncOrchestrator {

    // Static table definitions
    private final SchemaRegistry registry;

    // Spreadsheet boundary
    private final SourceReader source;

    // Relational store boundary
    private final StoreClient store;

    // Pipeline tunables (sync.*)
    private final SyncConfig syncConfig;

    private final RecordValidator validator;
    private final Deduplicator deduplicator;
    private final ForeignKeyValidator fkValidator;
    private final TableLoader loader;

    /**
     * Creates an orchestrator.
     *
     * @param registry table schemas
     * @param source spreadsheet source
     * @param store relational store
     * @param syncConfig pipeline settings
     * @throws IllegalArgumentException if the batch size is out of range
     */
    public SyncOrchestrator(SchemaRegistry registry, SourceReader source, StoreClient store,
            SyncConfig syncConfig) {
        this.registry = registry;
        this.source = source;
        this.store = store;
        this.syncConfig = syncConfig;
        CellCleaner cleaner =
                new CellCleaner(syncConfig.getDecimalWarnMin(), syncConfig.getDecimalWarnMax());
        this.validator = new RecordValidator(cleaner);
        this.deduplicator = new Deduplicator(cleaner);
        this.fkValidator = new ForeignKeyValidator();
        this.loader = new TableLoader(store, syncConfig.getBatchSize());
    }

    /**
     * Synchronizes tables.
     *
     * @param tableNames tables to sync; {@code null} or empty means every declared table
     * @param dryRun when {@code true}, nothing is cleared or inserted
     * @return per-table and aggregate statistics
     * @throws IllegalArgumentException if a table name is not declared
     */
    public RunSummary run(List<String> tableNames, boolean dryRun) {
        List<TableSchema> selected = (tableNames == null || tableNames.isEmpty())
                ? registry.all()
                : tableNames.stream().map(registry::get).collect(Collectors.toList());
        List<TableSchema> order = TableDependencyResolver.resolveLoadOrder(selected);
        log.info("=== Sync started (tables={}, dryRun={}) ===",
                order.stream().map(TableSchema::getName).collect(Collectors.toList()), dryRun);
        warnAboutUnselectedParents(order);

        if (!dryRun && syncConfig.isClearBeforeRun()) {
            clearInReverseOrder(order);
        }

        ForeignKeyCache fkCache = new ForeignKeyCache(store);
        List<TableSyncStats> results = new ArrayList<>();
        for (TableSchema schema : order) {
            TableSyncStats stats =
                    new TableSyncStats(schema.getName(), syncConfig.getErrorReportLimit());
            try {
                syncTable(schema, fkCache, dryRun, stats);
            } catch (RuntimeException e) {
                log.error("[{}] Unexpected error: {}", schema.getName(), e.getMessage(), e);
                stats.setFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            results.add(stats);
        }

        RunSummary summary = new RunSummary(results, syncConfig.getWarningThreshold());
        logSummary(summary);
        return summary;
    }

    /**
     * Runs the pipeline for one table.
     *
     * @param schema table schema
     * @param fkCache run-scoped key cache
     * @param dryRun skip the load phase
     * @param stats statistics to fill
     */
    void syncTable(TableSchema schema, KeyLookup fkCache, boolean dryRun, TableSyncStats stats) {
        String table = schema.getName();
        log.info("----- [{}] sheet '{}' -----", table, schema.getSheet());

        // 1) read
        SheetData sheet;
        try {
            sheet = source.listRows(schema.getSheet());
        } catch (SourceException e) {
            log.error("[{}] Read failed: {}", table, e.getMessage(), e);
            stats.setFailure(e.getMessage());
            return;
        }
        if (sheet.getHeader().isEmpty()) {
            skip(stats, "sheet is empty");
            return;
        }
        HeaderMapping header = HeaderMapping.of(sheet.getHeader());
        List<String> missing = schema.getColumns().stream()
                .filter(c -> header.indexOf(c).isEmpty()).collect(Collectors.toList());
        if (!missing.isEmpty()) {
            log.warn("[{}] Columns not found in sheet header (read as empty): {}", table,
                    missing);
        }

        // 2) validate
        List<CleanedRecord> cleaned = new ArrayList<>();
        List<ValidationError> validationErrors = new ArrayList<>();
        List<List<String>> rows = sheet.getRows();
        for (int i = 0; i < rows.size(); i++) {
            RawRow row = new RawRow(sheet.lineOf(i), rows.get(i));
            if (row.isBlank()) {
                stats.addEmptyRow();
                continue;
            }
            stats.addRowRead();
            if (syncConfig.isRepairMergedFirstCell()) {
                row = RowRepair.repairMergedFirstCell(row);
            }
            ValidationResult result = validator.validate(row, header, schema);
            if (result.isValid()) {
                stats.addValid();
                cleaned.add(result.getRecord());
            } else {
                stats.addInvalid(result.getErrors());
                validationErrors.addAll(result.getErrors());
            }
        }
        log.info("[{}] Validate | read={}, empty={}, valid={}, invalid={}", table,
                stats.getRowsRead(), stats.getEmptyRows(), stats.getValidRows(),
                stats.getInvalidRows());
        report(table, "validation", validationErrors);
        if (cleaned.isEmpty()) {
            skip(stats, "no valid records");
            return;
        }

        // 3) de-duplicate
        Deduplicator.Result deduped =
                deduplicator.dedupe(cleaned, schema.primaryKeyColumn().orElse(null));
        stats.addDuplicates(deduped.getDuplicates());
        if (deduped.getDuplicates() > 0) {
            log.info("[{}] Dedupe | {} duplicate(s) collapsed on '{}', {} unique", table,
                    deduped.getDuplicates(), schema.getPrimaryKey(),
                    deduped.getRecords().size());
        }

        // 4) foreign keys
        List<CleanedRecord> records = deduped.getRecords();
        if (schema.hasForeignKeys()) {
            ForeignKeyValidator.Result fk = fkValidator.validate(records, schema, fkCache);
            stats.addFkRejections(fk.getRejected(), fk.getErrors());
            log.info("[{}] FK check | valid={}, rejected={}", table, fk.getValid().size(),
                    fk.getRejected());
            report(table, "foreign key", fk.getErrors());
            records = fk.getValid();
            if (records.isEmpty()) {
                skip(stats, "no records after foreign key validation");
                return;
            }
        }

        if (log.isDebugEnabled()) {
            records.get(0).getValues().forEach((k, v) -> log.debug("[{}] sample | {} = {} ({})",
                    table, k, v, v.getClass().getSimpleName()));
        }

        // 5) load
        if (dryRun) {
            skip(stats, "dry run (" + records.size() + " records ready)");
            return;
        }
        TableLoader.Result load = loader.load(table, records);
        stats.addLoad(load.getInserted(), load.getInsertErrors());
    }

    /**
     * Clears the tables child-first; failures are logged and ignored.
     *
     * @param order tables in parent-first order
     */
    private void clearInReverseOrder(List<TableSchema> order) {
        List<TableSchema> reverse = new ArrayList<>(order);
        Collections.reverse(reverse);
        for (TableSchema schema : reverse) {
            try {
                store.clearTable(schema.getName());
                log.info("[{}] Pre-clear | cleared", schema.getName());
            } catch (StoreException e) {
                log.warn("[{}] Pre-clear failed, continuing: {}", schema.getName(),
                        e.getMessage());
            }
        }
    }

    private void warnAboutUnselectedParents(List<TableSchema> order) {
        Set<String> names = order.stream().map(s -> s.getName().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        for (TableSchema schema : order) {
            for (ForeignKey fk : schema.getForeignKeys().values()) {
                if (!names.contains(fk.getReferencedTable().toLowerCase(Locale.ROOT))) {
                    log.info("[{}] References {} which is not part of this run; "
                            + "its current store content is used.", schema.getName(),
                            fk.describeTarget());
                }
            }
        }
    }

    private void skip(TableSyncStats stats, String reason) {
        stats.setSkipReason(reason);
        log.warn("[{}] Load skipped: {}", stats.getTable(), reason);
    }

    private void report(String table, String kind, List<ValidationError> errors) {
        int limit = syncConfig.getErrorReportLimit();
        errors.stream().limit(limit)
                .forEach(e -> log.warn("[{}] {} error: {}", table, kind, e.getMessage()));
        if (errors.size() > limit) {
            log.warn("[{}] ... and {} more {} error(s)", table, errors.size() - limit, kind);
        }
    }

    /**
     * Outputs a consolidated log of per-table results and run totals.
     *
     * @param summary run summary
     */
    private void logSummary(RunSummary summary) {
        log.info("===== Summary =====");
        int maxNameLen = summary.getTables().stream().mapToInt(s -> s.getTable().length()).max()
                .orElse(0);
        String fmt = "  Table[%-" + maxNameLen + "s] read=%d valid=%d invalid=%d dup=%d "
                + "fkErrors=%d inserted=%d insertErrors=%d%s";
        for (TableSyncStats s : summary.getTables()) {
            String note = s.getFailure() != null ? "  FAILED: " + s.getFailure()
                    : s.getSkipReason() != null ? "  (" + s.getSkipReason() + ")" : "";
            log.info(String.format(fmt, s.getTable(), s.getRowsRead(), s.getValidRows(),
                    s.getInvalidRows(), s.getDuplicates(), s.getFkErrors(), s.getInserted(),
                    s.getInsertErrors(), note));
        }
        log.info("  Total inserted={} errors={} outcome={}", summary.getTotalInserted(),
                summary.getTotalErrors(), summary.getOutcome());
        log.info("=== Sync finished ===");
    }
}

package io.github.yok.sheetsync.core;

import com.google.common.collect.Lists;
import io.github.yok.sheetsync.store.StoreClient;
import io.github.yok.sheetsync.store.StoreException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Replaces the content of one table with validated records.
 *
 * <p>
 * <strong>Steps:</strong>
 * </p>
 * <ol>
 * <li>Clear the table. A failure is logged and the load continues.</li>
 * <li>Split the records into batches of {@code batchSize}.</li>
 * <li>Insert each batch in one request.</li>
 * <li>When a batch fails, insert its records one at a time; each failing record is counted and
 * logged with its values, the others are stored.</li>
 * </ol>
 *
 * <p>
 * Every input record ends up either inserted or in {@link Result#getFailed()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableLoader {

    static final int MAX_BATCH_SIZE = 1000;

    private static final int MAX_ERROR_MESSAGE_LENGTH = 200;

    private final StoreClient store;

    private final int batchSize;

    /**
     * Creates a loader.
     *
     * @param store target store
     * @param batchSize records per insert request, between 1 and {@value #MAX_BATCH_SIZE}
     * @throws IllegalArgumentException if {@code batchSize} is out of range
     */
    public TableLoader(StoreClient store, int batchSize) {
        Validate.inclusiveBetween(1, MAX_BATCH_SIZE, batchSize,
                "sync.batch-size must be between 1 and %d: %d", MAX_BATCH_SIZE, batchSize);
        this.store = store;
        this.batchSize = batchSize;
    }

    /**
     * Clears the table and inserts the records.
     *
     * @param table target table
     * @param records validated, de-duplicated records
     * @return load statistics
     */
    public Result load(String table, List<CleanedRecord> records) {
        boolean cleared = clear(table);

        int inserted = 0;
        List<CleanedRecord> failed = new ArrayList<>();
        List<List<CleanedRecord>> batches = Lists.partition(records, batchSize);
        int batchNo = 0;
        for (List<CleanedRecord> batch : batches) {
            batchNo++;
            try {
                store.insertBatch(table, toRows(batch));
                inserted += batch.size();
                log.info("[{}] Batch {}/{} | inserted={}", table, batchNo, batches.size(),
                        batch.size());
            } catch (StoreException e) {
                log.warn("[{}] Batch {}/{} failed ({}); inserting records individually", table,
                        batchNo, batches.size(), abbreviate(e));
                for (CleanedRecord record : batch) {
                    if (insertOne(table, record)) {
                        inserted++;
                    } else {
                        failed.add(record);
                    }
                }
            }
        }
        log.info("[{}] Load | inserted={}, insertErrors={}", table, inserted, failed.size());
        return new Result(cleared, inserted, failed);
    }

    private boolean clear(String table) {
        try {
            store.clearTable(table);
            log.info("[{}] Cleared", table);
            return true;
        } catch (StoreException e) {
            log.warn("[{}] Clear failed, continuing: {}", table, abbreviate(e));
            return false;
        }
    }

    private boolean insertOne(String table, CleanedRecord record) {
        try {
            store.insertBatch(table, List.of(record.getValues()));
            return true;
        } catch (StoreException e) {
            log.warn("[{}] Row {} rejected by store: {} | data={}", table, record.getSourceRow(),
                    abbreviate(e), record.getValues());
            return false;
        }
    }

    private static List<Map<String, Object>> toRows(List<CleanedRecord> batch) {
        return batch.stream().map(CleanedRecord::getValues).collect(Collectors.toList());
    }

    private static String abbreviate(Exception e) {
        Throwable root = e.getCause() != null ? e.getCause() : e;
        String message = root.getMessage() != null ? root.getMessage() : root.toString();
        return StringUtils.abbreviate(message, MAX_ERROR_MESSAGE_LENGTH);
    }

    /**
     * Result of {@link TableLoader#load(String, List)}.
     */
    @Value
    public static class Result {
        // Whether the clear step succeeded
        boolean cleared;
        // Number of stored records
        int inserted;
        // Records the store rejected individually
        List<CleanedRecord> failed;

        /**
         * Returns the number of records the store rejected.
         *
         * @return insert error count
         */
        public int getInsertErrors() {
            return failed.size();
        }
    }
}

/**
 * Sync pipeline package.
 *
 * <p>
 * Validates raw rows into cleaned records, collapses duplicates by primary key, rejects records
 * with dangling foreign keys and loads the survivors in batches. {@link SyncOrchestrator} runs
 * these steps per table, parent tables first, and collects the statistics of the run.
 * </p>
 *
 * <p>
 * Spreadsheet access and store access are delegated to {@code source} and {@code store}.
 * </p>
 */
package io.github.yok.sheetsync.core;

package io.github.yok.sheetsync;

import io.github.yok.sheetsync.config.ConnectionConfig;
import io.github.yok.sheetsync.config.SchemaConfig;
import io.github.yok.sheetsync.config.SourceConfig;
import io.github.yok.sheetsync.config.SyncConfig;
import io.github.yok.sheetsync.core.RunSummary;
import io.github.yok.sheetsync.core.SyncOrchestrator;
import io.github.yok.sheetsync.core.SyncOutcome;
import io.github.yok.sheetsync.schema.SchemaRegistry;
import io.github.yok.sheetsync.source.SourceReader;
import io.github.yok.sheetsync.source.SourceReaderFactory;
import io.github.yok.sheetsync.store.DbUnitConnectionFactory;
import io.github.yok.sheetsync.store.JdbcStoreClient;
import io.github.yok.sheetsync.store.StoreClient;
import io.github.yok.sheetsync.store.StoreException;
import io.github.yok.sheetsync.util.ErrorHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, builds the schema registry, opens the spreadsheet source and
 * the relational store, and runs {@link SyncOrchestrator}.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --tables [t1,t2,…]} or {@code -t [t1,t2,…]} syncs only the listed tables (still in
 * dependency order). If omitted, all declared tables are synced.</li>
 * <li>{@code --dry-run} runs every phase except clearing and inserting.</li>
 * </ul>
 *
 * <p>
 * Exit code: {@code 0} for SUCCESS and WARNING outcomes, {@code 1} for FAILURE, {@code 2} when
 * the run could not start.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ConnectionConfig
 * @see SourceConfig
 * @see SyncConfig
 * @see SchemaConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, SourceConfig.class, SyncConfig.class,
        SchemaConfig.class})
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILURE = 1;
    static final int EXIT_FATAL = 2;

    /**
     * Opens the store of a run.
     */
    @FunctionalInterface
    interface StoreOpener {
        StoreClient open() throws StoreException;
    }

    private final ConnectionConfig connectionConfig;
    private final SourceConfig sourceConfig;
    private final SyncConfig syncConfig;
    private final SchemaConfig schemaConfig;

    // Store and source providers (replaceable in tests)
    private final StoreOpener storeOpener;
    private final Function<SourceConfig, SourceReader> sourceProvider;

    private int exitCode;

    /**
     * Creates the runner with the JDBC store and the configured spreadsheet source.
     *
     * @param connectionConfig connection settings
     * @param sourceConfig source settings
     * @param syncConfig pipeline settings
     * @param schemaConfig table schemas
     */
    @Autowired
    public Main(ConnectionConfig connectionConfig, SourceConfig sourceConfig, SyncConfig syncConfig,
            SchemaConfig schemaConfig) {
        this(connectionConfig, sourceConfig, syncConfig, schemaConfig,
                () -> new JdbcStoreClient(new DbUnitConnectionFactory(connectionConfig).open()),
                SourceReaderFactory::create);
    }

    Main(ConnectionConfig connectionConfig, SourceConfig sourceConfig, SyncConfig syncConfig,
            SchemaConfig schemaConfig, StoreOpener storeOpener,
            Function<SourceConfig, SourceReader> sourceProvider) {
        this.connectionConfig = connectionConfig;
        this.sourceConfig = sourceConfig;
        this.syncConfig = syncConfig;
        this.schemaConfig = schemaConfig;
        this.storeOpener = storeOpener;
        this.sourceProvider = sourceProvider;
    }

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        List<String> tables = new ArrayList<>();
        boolean dryRun = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--tables":
                case "-t":
                    if (i + 1 < args.length) {
                        tables = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(s -> !s.isEmpty()).collect(Collectors.toList());
                    }
                    break;
                case "--dry-run":
                    dryRun = true;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        log.info("Tables: {}, Dry run: {}, Store: {}", tables.isEmpty() ? "all" : tables, dryRun,
                connectionConfig.getUrl());

        // Execute
        RunSummary summary;
        try {
            SchemaRegistry registry = SchemaRegistry.fromConfig(schemaConfig);
            tables.forEach(registry::get);
            try (SourceReader source = sourceProvider.apply(sourceConfig);
                    StoreClient store = storeOpener.open()) {
                summary = new SyncOrchestrator(registry, source, store, syncConfig).run(tables,
                        dryRun);
            }
        } catch (Exception e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            exitCode = EXIT_FATAL;
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
            return;
        }
        report(summary);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void report(RunSummary summary) {
        SyncOutcome outcome = summary.getOutcome();
        if (outcome == SyncOutcome.FAILURE) {
            exitCode = EXIT_FAILURE;
            ErrorHandler.errorAndExit(String.format(
                    "Sync failed: %d error(s), threshold %d. Inserted %d record(s).",
                    summary.getTotalErrors(), syncConfig.getWarningThreshold(),
                    summary.getTotalInserted()));
        } else if (outcome == SyncOutcome.WARNING) {
            log.warn("Sync completed with {} error(s). Inserted {} record(s).",
                    summary.getTotalErrors(), summary.getTotalInserted());
        } else {
            log.info("Sync completed successfully. Inserted {} record(s).",
                    summary.getTotalInserted());
        }
    }
}

package io.github.yok.sheetsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code sync} section in {@code application.yml}. Centralizes
 * the tunables of the validation-and-load pipeline.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "sync")
@Data
public class SyncConfig {

    /**
     * Number of records sent to the store in one insert request.
     */
    private int batchSize = 50;

    /**
     * Number of validation / foreign-key messages logged per table. Further messages are counted
     * only.
     */
    private int errorReportLimit = 5;

    /**
     * A run with fewer errors than this finishes with a warning; otherwise it fails.
     */
    private int warningThreshold = 100;

    /**
     * When {@code true}, all selected tables are cleared child-first before any table is loaded.
     */
    private boolean clearBeforeRun = true;

    /**
     * When {@code true}, a first cell holding several pasted values is reduced to its first token.
     */
    private boolean repairMergedFirstCell = true;

    /**
     * Lower bound of the advisory range for decimal values.
     */
    private double decimalWarnMin = 0;

    /**
     * Upper bound of the advisory range for decimal values.
     */
    private double decimalWarnMax = 1_000_000;
}

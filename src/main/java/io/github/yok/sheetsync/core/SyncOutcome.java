package io.github.yok.sheetsync.core;

/**
 * Overall verdict of a run.
 *
 * @author Yasuharu.Okawauchi
 */
public enum SyncOutcome {
    // No errors
    SUCCESS,
    // Some errors, fewer than the warning threshold
    WARNING,
    // Errors at or above the warning threshold
    FAILURE;

    /**
     * Classifies an error count.
     *
     * @param errors total errors of the run
     * @param warningThreshold runs with fewer errors than this are warnings
     * @return outcome
     */
    public static SyncOutcome of(int errors, int warningThreshold) {
        if (errors == 0) {
            return SUCCESS;
        }
        return errors < warningThreshold ? WARNING : FAILURE;
    }
}

package io.github.yok.sheetsync.core;

import lombok.Value;

/**
 * Why a row was excluded from the load.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ValidationError {

    // 1-based source line
    int row;

    // Column or rule that failed
    String column;

    // Human-readable description
    String message;

    @Override
    public String toString() {
        return message;
    }
}

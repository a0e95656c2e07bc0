package io.github.yok.sheetsync.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @AfterEach
    void tearDown() {
        ErrorHandler.restoreExitForCurrentThread();
    }

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        RuntimeException cause = new RuntimeException("connection refused");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> ErrorHandler.errorAndExit("Fatal error", cause));

        assertEquals("Fatal error", ex.getMessage());
        assertSame(cause, ex.getCause());
    }

    @Test
    void errorAndExit_異常ケース_exit無効でメッセージのみを指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();

        assertThrows(IllegalStateException.class, () -> ErrorHandler.errorAndExit("Sync failed"));
    }

    @Test
    void errorAndExit_正常ケース_exit有効でThrowableありを指定する_標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            ErrorHandler.errorAndExit("Fatal error",
                    new IllegalStateException("wrapper", new RuntimeException("root cause")));
        } finally {
            System.setErr(originalErr);
        }
        String output = err.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("ERROR: Fatal error"));
        assertTrue(output.contains("root cause"));
    }

    @Test
    void errorAndExit_正常ケース_exit有効でメッセージのみを指定する_標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            ErrorHandler.errorAndExit("Sync failed: 120 error(s)");
        } finally {
            System.setErr(originalErr);
        }
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Sync failed: 120 error(s)"));
    }
}

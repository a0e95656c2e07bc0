package io.github.yok.sheetsync.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class ColumnTypeTest {

    @Test
    void fromTag_正常ケース_大文字小文字と空白を含むタグ_対応する型が返ること() {
        assertEquals(ColumnType.DECIMAL, ColumnType.fromTag(" Decimal "));
        assertEquals(ColumnType.INTEGER, ColumnType.fromTag("integer"));
        assertEquals(ColumnType.DATE, ColumnType.fromTag("DATE"));
    }

    @Test
    void fromTag_正常ケース_nullまたは空白_TEXTが返ること() {
        assertEquals(ColumnType.TEXT, ColumnType.fromTag(null));
        assertEquals(ColumnType.TEXT, ColumnType.fromTag("  "));
    }

    @Test
    void fromTag_異常ケース_未知のタグ_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, () -> ColumnType.fromTag("money"));
        assertTrue(ex.getMessage().contains("money"));
        assertTrue(ex.getMessage().contains("decimal"));
    }
}

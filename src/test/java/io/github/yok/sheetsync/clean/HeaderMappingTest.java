package io.github.yok.sheetsync.clean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class HeaderMappingTest {

    @Test
    void normalize_正常ケース_表記ゆれのある列名_同じキーが返ること() {
        assertEquals("idcliente", HeaderNormalizer.normalize("ID Cliente"));
        assertEquals("idcliente", HeaderNormalizer.normalize("id_cliente"));
        assertEquals("idcliente", HeaderNormalizer.normalize("IDCLIENTE"));
        assertEquals("idcliente", HeaderNormalizer.normalize("\uFEFFid_cliente\t"));
    }

    @Test
    void normalize_正常ケース_null_空文字が返ること() {
        assertEquals("", HeaderNormalizer.normalize(null));
    }

    @Test
    void indexOf_正常ケース_表記ゆれのあるヘッダー_列位置が返ること() {
        HeaderMapping mapping = HeaderMapping.of(List.of("ID Cliente", "Nome_Cliente", "ESTADO"));

        assertEquals(OptionalInt.of(0), mapping.indexOf("id_cliente"));
        assertEquals(OptionalInt.of(1), mapping.indexOf("nome_cliente"));
        assertEquals(OptionalInt.of(2), mapping.indexOf("estado"));
    }

    @Test
    void indexOf_正常ケース_存在しない列_空が返ること() {
        HeaderMapping mapping = HeaderMapping.of(List.of("id_cliente"));

        assertFalse(mapping.indexOf("pais").isPresent());
    }

    @Test
    void indexOf_正常ケース_重複ヘッダー_最初の列が使われること() {
        HeaderMapping mapping = HeaderMapping.of(List.of("estado", "Estado ", "pais"));

        assertEquals(OptionalInt.of(0), mapping.indexOf("estado"));
        assertEquals(OptionalInt.of(2), mapping.indexOf("pais"));
    }

    @Test
    void of_正常ケース_nullセルを含む_空白として扱われること() {
        HeaderMapping mapping = HeaderMapping.of(Arrays.asList("id", null, "nome"));

        assertEquals(Arrays.asList("id", "", "nome"), mapping.getHeader());
        assertEquals(OptionalInt.of(2), mapping.indexOf("nome"));
    }
}

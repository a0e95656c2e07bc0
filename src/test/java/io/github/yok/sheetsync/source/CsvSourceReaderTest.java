package io.github.yok.sheetsync.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvSourceReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void listRows_正常ケース_空行と引用符を含むCSV_ヘッダーと全行が返ること() throws Exception {
        Files.writeString(tempDir.resolve("clientes.csv"),
                "\uFEFFid_cliente,nome_cliente,estado\n" + "cli_001,\"Silva, Ana\",SP\n" + "\n"
                        + "cli_002,\"Linha\nquebrada\",MG\n",
                StandardCharsets.UTF_8);

        SheetData sheet = new CsvSourceReader(tempDir, StandardCharsets.UTF_8).listRows("clientes");

        assertEquals(List.of("id_cliente", "nome_cliente", "estado"), sheet.getHeader());
        assertEquals(3, sheet.getRows().size());
        assertEquals(List.of("cli_001", "Silva, Ana", "SP"), sheet.getRows().get(0));
        assertTrue(sheet.getRows().get(1).stream().allMatch(String::isEmpty));
        assertEquals("Linha\nquebrada", sheet.getRows().get(2).get(1));
    }

    @Test
    void listRows_正常ケース_ファイル名の大文字小文字が異なる_読み込まれること() throws Exception {
        Files.writeString(tempDir.resolve("Produtos.CSV"), "id_produto\nprd_001\n",
                StandardCharsets.UTF_8);

        SheetData sheet =
                new CsvSourceReader(tempDir, StandardCharsets.UTF_8).listRows("produtos");

        assertEquals(List.of(List.of("prd_001")), sheet.getRows());
    }

    @Test
    void listRows_正常ケース_空ファイル_空のシートが返ること() throws Exception {
        Files.writeString(tempDir.resolve("vendas.csv"), "", StandardCharsets.UTF_8);

        SheetData sheet = new CsvSourceReader(tempDir, StandardCharsets.UTF_8).listRows("vendas");

        assertTrue(sheet.isEmpty());
    }

    @Test
    void listRows_正常ケース_指定した文字コード_正しく読み込まれること() throws Exception {
        Files.write(tempDir.resolve("clientes.csv"),
                "id_cliente,cidade\ncli_001,São Paulo\n".getBytes(StandardCharsets.ISO_8859_1));

        SheetData sheet =
                new CsvSourceReader(tempDir, StandardCharsets.ISO_8859_1).listRows("clientes");

        assertEquals("São Paulo", sheet.getRows().get(0).get(1));
    }

    @Test
    void listRows_異常ケース_ファイルなし_SourceExceptionが送出されること() {
        CsvSourceReader reader = new CsvSourceReader(tempDir, StandardCharsets.UTF_8);

        SourceException ex = assertThrows(SourceException.class, () -> reader.listRows("vendas"));
        assertTrue(ex.getMessage().contains("vendas"));
    }
}

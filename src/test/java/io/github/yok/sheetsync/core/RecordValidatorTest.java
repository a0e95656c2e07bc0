package io.github.yok.sheetsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sheetsync.clean.CellCleaner;
import io.github.yok.sheetsync.clean.HeaderMapping;
import io.github.yok.sheetsync.schema.ColumnType;
import io.github.yok.sheetsync.schema.ForeignKey;
import io.github.yok.sheetsync.schema.TableSchema;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RecordValidatorTest {

    private static final TableSchema VENDAS = new TableSchema("vendas", null,
            List.of("id_venda", "data_venda", "id_cliente", "id_produto", "canal_venda",
                    "quantidade", "preco_unitario"),
            Set.of("id_venda"),
            Map.of("data_venda", ColumnType.DATE, "quantidade", ColumnType.INTEGER,
                    "preco_unitario", ColumnType.DECIMAL),
            List.of(ForeignKey.parse("id_cliente", "clientes"),
                    ForeignKey.parse("id_produto", "produtos")),
            "id_venda");

    private static final HeaderMapping HEADER = HeaderMapping.of(List.of("ID Venda", "Data Venda",
            "ID Cliente", "ID Produto", "Canal Venda", "Quantidade", "Preco Unitario"));

    private final RecordValidator validator = new RecordValidator(new CellCleaner());

    @Test
    void validate_正常ケース_全列に値がある_型変換されたレコードが返ること() {
        RawRow row = new RawRow(2, List.of(" ven_001 ", "15/01/2024", "cli_001", "prd_001",
                "online", "3 un", "R$ 1.234,56"));

        ValidationResult result = validator.validate(row, HEADER, VENDAS);

        assertTrue(result.isValid());
        CleanedRecord record = result.record().orElseThrow();
        assertEquals(2, record.getSourceRow());
        assertEquals("ven_001", record.getValues().get("id_venda"));
        assertEquals("2024-01-15", record.getValues().get("data_venda"));
        assertEquals(3L, record.getValues().get("quantidade"));
        assertEquals(1234.56, record.getValues().get("preco_unitario"));
        assertEquals(List.of("id_venda", "data_venda", "id_cliente", "id_produto", "canal_venda",
                "quantidade", "preco_unitario"), List.copyOf(record.getValues().keySet()));
    }

    @Test
    void validate_異常ケース_必須列が空_エラーが返ること() {
        RawRow row = new RawRow(7,
                List.of("", "15/01/2024", "cli_001", "prd_001", "online", "1", "10"));

        ValidationResult result = validator.validate(row, HEADER, VENDAS);

        assertFalse(result.isValid());
        assertFalse(result.record().isPresent());
        assertEquals(1, result.getErrors().size());
        ValidationError error = result.getErrors().get(0);
        assertEquals(7, error.getRow());
        assertEquals("id_venda", error.getColumn());
        assertEquals("Row 7: required column 'id_venda' is empty or invalid. Original value: ''",
                error.getMessage());
    }

    @Test
    void validate_正常ケース_任意列が変換不能_列が省略されること() {
        RawRow row = new RawRow(3,
                List.of("ven_002", "31/02/2024", "", "prd_001", "loja", "abc", "xyz"));

        ValidationResult result = validator.validate(row, HEADER, VENDAS);

        assertTrue(result.isValid());
        CleanedRecord record = result.record().orElseThrow();
        assertFalse(record.has("data_venda"));
        assertFalse(record.has("id_cliente"));
        assertFalse(record.has("quantidade"));
        assertFalse(record.has("preco_unitario"));
        assertEquals("prd_001", record.get("id_produto").orElseThrow());
    }

    @Test
    void validate_異常ケース_必須の数値列が変換不能_元の値を含むエラーが返ること() {
        TableSchema schema = new TableSchema("produtos", null, List.of("id_produto", "preco_atual"),
                Set.of("id_produto", "preco_atual"), Map.of("preco_atual", ColumnType.DECIMAL),
                List.of(), "id_produto");
        HeaderMapping header = HeaderMapping.of(List.of("id_produto", "preco_atual"));

        ValidationResult result =
                validator.validate(new RawRow(4, List.of(" ", "n/a")), header, schema);

        assertEquals(2, result.getErrors().size());
        assertEquals("preco_atual", result.getErrors().get(1).getColumn());
        assertTrue(result.getErrors().get(1).getMessage().endsWith("Original value: 'n/a'"));
    }

    @Test
    void validate_正常ケース_ヘッダーにない列と短い行_空セルとして扱われること() {
        HeaderMapping header = HeaderMapping.of(List.of("id_venda", "canal_venda"));

        ValidationResult result = validator.validate(new RawRow(2, List.of("ven_009")), header,
                VENDAS);

        assertTrue(result.isValid());
        assertEquals(Map.of("id_venda", "ven_009"), result.getRecord().getValues());
    }
}

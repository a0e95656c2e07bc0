package io.github.yok.sheetsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import io.github.yok.sheetsync.clean.CellCleaner;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DeduplicatorTest {

    private final Deduplicator deduplicator = new Deduplicator(new CellCleaner());

    private static CleanedRecord record(int row, Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new CleanedRecord(row, values);
    }

    @Test
    void dedupe_正常ケース_同じ主キー_最後のレコードが残ること() {
        List<CleanedRecord> input = List.of(record(2, "id_cliente", "cli_001", "estado", "SP"),
                record(3, "id_cliente", "cli_002", "estado", "MG"),
                record(4, "id_cliente", "cli_001", "estado", "RJ"));

        Deduplicator.Result result = deduplicator.dedupe(input, "id_cliente");

        assertEquals(1, result.getDuplicates());
        assertEquals(2, result.getRecords().size());
        CleanedRecord first = result.getRecords().get(0);
        assertEquals("cli_001", first.getValues().get("id_cliente"));
        assertEquals("RJ", first.getValues().get("estado"));
        assertEquals(4, first.getSourceRow());
        assertEquals("cli_002", result.getRecords().get(1).getValues().get("id_cliente"));
    }

    @Test
    void dedupe_正常ケース_数値の主キー_正規形で比較されること() {
        List<CleanedRecord> input =
                List.of(record(2, "id", 10.0, "v", "a"), record(3, "id", 10.00, "v", "b"),
                        record(4, "id", 10L, "v", "c"));

        Deduplicator.Result result = deduplicator.dedupe(input, "id");

        assertEquals(1, result.getRecords().size());
        assertEquals(2, result.getDuplicates());
        assertEquals("c", result.getRecords().get(0).getValues().get("v"));
    }

    @Test
    void dedupe_正常ケース_主キーなし_入力がそのまま返ること() {
        List<CleanedRecord> input = List.of(record(2, "id_produto", "prd_001"),
                record(3, "id_produto", "prd_001"));

        Deduplicator.Result result = deduplicator.dedupe(input, null);

        assertEquals(input, result.getRecords());
        assertEquals(0, result.getDuplicates());
    }

    @Test
    void dedupe_正常ケース_キー値のないレコード_位置を保って通過すること() {
        List<CleanedRecord> input = List.of(record(2, "id", "a"), record(3, "v", "x"),
                record(4, "v", "y"), record(5, "id", "a"));

        Deduplicator.Result result = deduplicator.dedupe(input, "id");

        assertEquals(List.of(5, 3, 4), result.getRecords().stream()
                .map(CleanedRecord::getSourceRow).collect(Collectors.toList()));
        assertEquals(1, result.getDuplicates());
    }

    @Test
    void dedupe_正常ケース_出力と重複数の合計_入力件数と一致しキーが一意であること() {
        List<CleanedRecord> input = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            input.add(record(i + 2, "id", "k" + (i * 7 % 37), "n", i));
        }

        Deduplicator.Result result = deduplicator.dedupe(input, "id");

        assertEquals(input.size(), result.getRecords().size() + result.getDuplicates());
        Set<Object> keys = new HashSet<>();
        result.getRecords().forEach(r -> keys.add(r.getValues().get("id")));
        assertEquals(result.getRecords().size(), keys.size());
        assertEquals(37, keys.size());
    }
}

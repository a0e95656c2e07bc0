package io.github.yok.sheetsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import io.github.yok.sheetsync.store.StoreClient;
import io.github.yok.sheetsync.store.StoreException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TableLoaderTest {

    private static List<CleanedRecord> records(int count) {
        List<CleanedRecord> result = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            result.add(new CleanedRecord(i + 1,
                    Map.of("id_cliente", String.format("cli_%03d", i), "estado", "SP")));
        }
        return result;
    }

    @Test
    void load_正常ケース_120件をバッチ50で投入_3回に分けて全件投入されること() {
        InMemoryStoreClient store = new InMemoryStoreClient();
        store.rows("clientes").add(Map.of("id_cliente", "old"));

        TableLoader.Result result = new TableLoader(store, 50).load("clientes", records(120));

        assertTrue(result.isCleared());
        assertEquals(120, result.getInserted());
        assertEquals(0, result.getInsertErrors());
        assertEquals(List.of("clear:clientes", "insert:clientes:50", "insert:clientes:50",
                "insert:clientes:20"), store.calls);
        assertEquals(120, store.rows("clientes").size());
    }

    @Test
    void load_異常ケース_50件中30件目が拒否される_49件投入され1件エラーになること() {
        InMemoryStoreClient store = new InMemoryStoreClient();
        store.rejectRow = row -> "cli_030".equals(row.get("id_cliente"));
        List<CleanedRecord> input = records(50);

        TableLoader.Result result = new TableLoader(store, 50).load("clientes", input);

        assertEquals(49, result.getInserted());
        assertEquals(1, result.getInsertErrors());
        assertEquals(31, result.getFailed().get(0).getSourceRow());
        assertEquals(49, store.rows("clientes").size());
        assertFalse(store.rows("clientes").contains(input.get(29).getValues()));

        // every input record is either stored or failed
        Multiset<Map<String, Object>> expected = HashMultiset.create();
        input.forEach(r -> expected.add(r.getValues()));
        Multiset<Map<String, Object>> actual = HashMultiset.create(store.rows("clientes"));
        result.getFailed().forEach(r -> actual.add(r.getValues()));
        assertEquals(expected, actual);
    }

    @Test
    void load_異常ケース_クリア失敗_投入は継続されること() {
        InMemoryStoreClient store = new InMemoryStoreClient();
        store.failingClears.add("produtos");

        TableLoader.Result result = new TableLoader(store, 10).load("produtos", records(3));

        assertFalse(result.isCleared());
        assertEquals(3, result.getInserted());
    }

    @Test
    void load_正常ケース_空のレコード_クリアのみ実行されること() throws Exception {
        StoreClient store = mock(StoreClient.class);

        TableLoader.Result result = new TableLoader(store, 50).load("vendas", List.of());

        assertEquals(0, result.getInserted());
        verify(store).clearTable("vendas");
        verify(store, never()).insertBatch(eq("vendas"), anyList());
    }

    @Test
    void load_異常ケース_全レコード拒否_全件が失敗になること() throws Exception {
        StoreClient store = mock(StoreClient.class);
        doThrow(new StoreException("down", new IllegalStateException("db down"))).when(store)
                .insertBatch(eq("vendas"), anyList());

        TableLoader.Result result = new TableLoader(store, 2).load("vendas", records(3));

        assertEquals(0, result.getInserted());
        assertEquals(3, result.getInsertErrors());
    }

    @Test
    void コンストラクタ_異常ケース_範囲外のバッチサイズ_IllegalArgumentExceptionが送出されること() {
        StoreClient store = mock(StoreClient.class);

        assertThrows(IllegalArgumentException.class, () -> new TableLoader(store, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new TableLoader(store, TableLoader.MAX_BATCH_SIZE + 1));
    }
}

package io.github.yok.sheetsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import java.util.List;
import org.junit.jupiter.api.Test;

class RunSummaryTest {

    private static ValidationError error(int row) {
        return new ValidationError(row, "id", "Row " + row + ": error");
    }

    @Test
    void of_正常ケース_エラー件数と閾値_判定結果が返ること() {
        assertEquals(SyncOutcome.SUCCESS, SyncOutcome.of(0, 100));
        assertEquals(SyncOutcome.WARNING, SyncOutcome.of(99, 100));
        assertEquals(SyncOutcome.FAILURE, SyncOutcome.of(100, 100));
        assertEquals(SyncOutcome.FAILURE, SyncOutcome.of(1, 0));
    }

    @Test
    void コンストラクタ_正常ケース_複数テーブルの統計_合計が集計されること() {
        TableSyncStats clientes = new TableSyncStats("clientes", 5);
        clientes.addRowRead();
        clientes.addValid();
        clientes.addLoad(10, 2);
        TableSyncStats vendas = new TableSyncStats("vendas", 5);
        vendas.addInvalid(List.of(error(3)));
        vendas.addFkRejections(3, List.of(error(4), error(5), error(6)));
        vendas.addLoad(7, 0);
        TableSyncStats produtos = new TableSyncStats("produtos", 5);
        produtos.setFailure("Sheet not found");

        RunSummary summary = new RunSummary(List.of(clientes, vendas, produtos), 100);

        assertEquals(17, summary.getTotalInserted());
        assertEquals(2 + 1 + 3 + 1, summary.getTotalErrors());
        assertEquals(SyncOutcome.WARNING, summary.getOutcome());
        assertEquals(3, summary.getTables().size());
    }

    @Test
    void addInvalid_正常ケース_上限を超えるエラー_件数は全て数えメッセージは上限まで保持されること() {
        TableSyncStats stats = new TableSyncStats("vendas", 2);
        for (int i = 0; i < 5; i++) {
            stats.addInvalid(List.of(error(i + 2)));
        }

        assertEquals(5, stats.getInvalidRows());
        assertEquals(2, stats.getValidationErrors().size());
        assertEquals(5, stats.errorCount());
    }
}

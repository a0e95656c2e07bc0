package io.github.yok.sheetsync.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sheetsync.config.ConnectionConfig;
import io.github.yok.sheetsync.config.DataTypeFactoryMode;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.ext.h2.H2DataTypeFactory;
import org.dbunit.ext.mssql.MsSqlDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.oracle.Oracle10DataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;
import org.junit.jupiter.api.Test;

class DbUnitConnectionFactoryTest {

    @Test
    void dataTypeFactory_正常ケース_モードごと_対応するファクトリが返ること() {
        assertTrue(DbUnitConnectionFactory.dataTypeFactory(
                DataTypeFactoryMode.POSTGRESQL) instanceof PostgresqlDataTypeFactory);
        assertTrue(DbUnitConnectionFactory
                .dataTypeFactory(DataTypeFactoryMode.MYSQL) instanceof MySqlDataTypeFactory);
        assertTrue(DbUnitConnectionFactory
                .dataTypeFactory(DataTypeFactoryMode.H2) instanceof H2DataTypeFactory);
        assertTrue(DbUnitConnectionFactory
                .dataTypeFactory(DataTypeFactoryMode.ORACLE) instanceof Oracle10DataTypeFactory);
        assertTrue(DbUnitConnectionFactory
                .dataTypeFactory(DataTypeFactoryMode.SQLSERVER) instanceof MsSqlDataTypeFactory);
        assertTrue(DbUnitConnectionFactory.dataTypeFactory(null) instanceof PostgresqlDataTypeFactory);
    }

    @Test
    void escapePattern_正常ケース_モードごと_引用符のパターンが返ること() {
        assertEquals("\"?\"", DbUnitConnectionFactory.escapePattern(DataTypeFactoryMode.POSTGRESQL));
        assertEquals("`?`", DbUnitConnectionFactory.escapePattern(DataTypeFactoryMode.MYSQL));
        assertEquals("[?]", DbUnitConnectionFactory.escapePattern(DataTypeFactoryMode.SQLSERVER));
        assertNull(DbUnitConnectionFactory.escapePattern(DataTypeFactoryMode.H2));
        assertNull(DbUnitConnectionFactory.escapePattern(DataTypeFactoryMode.ORACLE));
    }

    @Test
    void configure_正常ケース_PostgreSQL_共通設定が適用されること() {
        DatabaseConfig cfg = new DatabaseConfig();

        DbUnitConnectionFactory.configure(cfg, DataTypeFactoryMode.POSTGRESQL);

        assertTrue(cfg.getProperty(
                DatabaseConfig.PROPERTY_DATATYPE_FACTORY) instanceof PostgresqlDataTypeFactory);
        assertEquals("\"?\"", cfg.getProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN));
        assertEquals(Boolean.TRUE, cfg.getProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS));
        assertEquals(Boolean.FALSE, cfg.getProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS));
    }

    @Test
    void open_正常ケース_H2_自動コミット無効の接続が返ること() throws Exception {
        ConnectionConfig config = new ConnectionConfig();
        config.setUrl("jdbc:h2:mem:factory_test");
        config.setUser("sa");
        config.setPassword("");
        config.setSchema("PUBLIC");
        config.setDataTypeFactoryMode(DataTypeFactoryMode.H2);

        DatabaseConnection conn = new DbUnitConnectionFactory(config).open();
        try {
            assertEquals(false, conn.getConnection().getAutoCommit());
            assertEquals("PUBLIC", conn.getSchema());
        } finally {
            conn.close();
        }
    }

    @Test
    void open_異常ケース_URL未設定_StoreExceptionが送出されること() {
        assertThrows(StoreException.class,
                () -> new DbUnitConnectionFactory(new ConnectionConfig()).open());
    }

    @Test
    void open_異常ケース_ドライバーが存在しない_StoreExceptionが送出されること() {
        ConnectionConfig config = new ConnectionConfig();
        config.setUrl("jdbc:none://localhost/db");
        config.setDriverClass("com.example.MissingDriver");

        StoreException ex = assertThrows(StoreException.class,
                () -> new DbUnitConnectionFactory(config).open());
        assertTrue(ex.getMessage().contains("com.example.MissingDriver"));
    }

    @Test
    void open_異常ケース_接続できないURL_StoreExceptionが送出されること() {
        ConnectionConfig config = new ConnectionConfig();
        config.setUrl("jdbc:unknown:nothing");

        assertThrows(StoreException.class, () -> new DbUnitConnectionFactory(config).open());
    }
}

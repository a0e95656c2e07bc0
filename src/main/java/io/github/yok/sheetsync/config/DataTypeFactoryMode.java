package io.github.yok.sheetsync.config;

/**
 * Enumerates the database products supported by the JDBC store.
 *
 * <p>
 * Each constant selects the DBUnit {@link org.dbunit.dataset.datatype.IDataTypeFactory} used to
 * convert cleaned values into column values on insert.
 * </p>
 *
 * <ul>
 * <li>POSTGRESQL: PostgreSQL (including hosted PostgreSQL such as Supabase)</li>
 * <li>MYSQL: MySQL</li>
 * <li>H2: H2 (local runs and tests)</li>
 * <li>ORACLE: Oracle Database</li>
 * <li>SQLSERVER: Microsoft SQL Server</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataTypeFactoryMode {
    // Use the DataTypeFactory for PostgreSQL
    POSTGRESQL,
    // Use the DataTypeFactory for MySQL
    MYSQL,
    // Use the DataTypeFactory for H2
    H2,
    // Use the DataTypeFactory for Oracle DB
    ORACLE,
    // Use the DataTypeFactory for Microsoft SQL Server
    SQLSERVER
}

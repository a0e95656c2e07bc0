package io.github.yok.sheetsync.store;

import io.github.yok.sheetsync.config.ConnectionConfig;
import io.github.yok.sheetsync.config.DataTypeFactoryMode;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;
import org.dbunit.ext.mssql.MsSqlDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.oracle.Oracle10DataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * Opens the JDBC connection of the target store and wraps it in a configured DBUnit
 * {@link DatabaseConnection}.
 *
 * <p>
 * The JDBC connection is opened with auto-commit disabled; {@link JdbcStoreClient} commits after
 * each successful operation and rolls back after each failed one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class DbUnitConnectionFactory {

    // Holder of JDBC connection settings
    private final ConnectionConfig connectionConfig;

    /**
     * Opens a new connection.
     *
     * @return configured DBUnit connection
     * @throws StoreException if the driver cannot be loaded or the connection fails
     */
    public DatabaseConnection open() throws StoreException {
        String url = connectionConfig.getUrl();
        if (StringUtils.isBlank(url)) {
            throw new StoreException(
                    "connection.url is not set. Please configure it in application.yml.");
        }
        loadDriver(connectionConfig.getDriverClass());
        Connection jdbc = null;
        try {
            jdbc = DriverManager.getConnection(url, connectionConfig.getUser(),
                    connectionConfig.getPassword());
            jdbc.setAutoCommit(false);
            String schema = StringUtils.trimToNull(connectionConfig.getSchema());
            DatabaseConnection dbConn = schema == null ? new DatabaseConnection(jdbc)
                    : new DatabaseConnection(jdbc, schema);
            configure(dbConn.getConfig(), connectionConfig.getDataTypeFactoryMode());
            log.info("Connected to {} (schema={}, mode={})", url, schema,
                    connectionConfig.getDataTypeFactoryMode());
            return dbConn;
        } catch (SQLException | DatabaseUnitException e) {
            closeQuietly(jdbc);
            throw new StoreException("Failed to connect to " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * Applies the settings shared by every store operation.
     *
     * @param cfg DBUnit configuration to fill
     * @param mode database product
     */
    static void configure(DatabaseConfig cfg, DataTypeFactoryMode mode) {
        IDataTypeFactory dataTypeFactory = dataTypeFactory(mode);
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        log.debug("DBUnit: DataTypeFactory set to {}", dataTypeFactory.getClass().getSimpleName());

        String escape = escapePattern(mode);
        if (escape != null) {
            cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, escape);
            log.debug("DBUnit: escape pattern = {}", escape);
        }

        // Empty text is cleaned to null before it gets here.
        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, true);

        // One statement per row; the batch is atomic through the surrounding transaction.
        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, false);
    }

    /**
     * Returns the DBUnit data type factory of a database product.
     *
     * @param mode database product; {@code null} means PostgreSQL
     * @return data type factory
     */
    static IDataTypeFactory dataTypeFactory(DataTypeFactoryMode mode) {
        if (mode == null) {
            return new PostgresqlDataTypeFactory();
        }
        switch (mode) {
            case MYSQL:
                return new MySqlDataTypeFactory();
            case H2:
                return new H2DataTypeFactory();
            case ORACLE:
                return new Oracle10DataTypeFactory();
            case SQLSERVER:
                return new MsSqlDataTypeFactory();
            case POSTGRESQL:
            default:
                return new PostgresqlDataTypeFactory();
        }
    }

    /**
     * Returns the identifier quoting pattern of a database product.
     *
     * <p>
     * H2 and Oracle fold unquoted identifiers to upper case, so configured lower-case table names
     * are sent unquoted there.
     * </p>
     *
     * @param mode database product
     * @return DBUnit escape pattern ({@code ?} stands for the identifier), or {@code null} for no
     *         quoting
     */
    static String escapePattern(DataTypeFactoryMode mode) {
        if (mode == null) {
            return "\"?\"";
        }
        switch (mode) {
            case MYSQL:
                return "`?`";
            case SQLSERVER:
                return "[?]";
            case H2:
            case ORACLE:
                return null;
            case POSTGRESQL:
            default:
                return "\"?\"";
        }
    }

    private static void loadDriver(String driverClass) throws StoreException {
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new StoreException("JDBC driver not found: " + driverClass, e);
        }
    }

    private static void closeQuietly(Connection jdbc) {
        if (jdbc == null) {
            return;
        }
        try {
            jdbc.close();
        } catch (SQLException e) {
            log.debug("Failed to close JDBC connection after connect failure", e);
        }
    }
}

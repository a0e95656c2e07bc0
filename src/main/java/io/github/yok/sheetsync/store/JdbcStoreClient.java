package io.github.yok.sheetsync.store;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.operation.DatabaseOperation;

/**
 * {@link StoreClient} backed by a JDBC connection, writing through DBUnit.
 *
 * <ul>
 * <li>{@link #clearTable(String)} runs DBUnit {@code DELETE_ALL}.</li>
 * <li>{@link #insertBatch(String, List)} runs DBUnit {@code INSERT} over an in-memory table; a
 * column absent from a row is sent as {@link ITable#NO_VALUE} so the column default applies.</li>
 * <li>{@link #selectColumn(String, String)} runs a plain {@code SELECT}.</li>
 * </ul>
 *
 * <p>
 * Each call is one transaction: committed on success, rolled back on failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcStoreClient implements StoreClient {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Abstraction for DBUnit write operations used by this client.
     */
    interface OperationExecutor {

        /**
         * Executes DBUnit DELETE_ALL.
         *
         * @param connection DBUnit connection
         * @param dataSet tables to clear
         * @throws Exception execution failure
         */
        void deleteAll(IDatabaseConnection connection, IDataSet dataSet) throws Exception;

        /**
         * Executes DBUnit INSERT.
         *
         * @param connection DBUnit connection
         * @param dataSet rows to write
         * @throws Exception execution failure
         */
        void insert(IDatabaseConnection connection, IDataSet dataSet) throws Exception;
    }

    private final IDatabaseConnection connection;

    // DBUnit operation executor (replaceable in tests)
    private final OperationExecutor operationExecutor;

    /**
     * Creates a client with the default DBUnit operations.
     *
     * @param connection DBUnit connection with auto-commit disabled
     */
    public JdbcStoreClient(IDatabaseConnection connection) {
        this(connection, new OperationExecutor() {
            @Override
            public void deleteAll(IDatabaseConnection conn, IDataSet dataSet) throws Exception {
                DatabaseOperation.DELETE_ALL.execute(conn, dataSet);
            }

            @Override
            public void insert(IDatabaseConnection conn, IDataSet dataSet) throws Exception {
                DatabaseOperation.INSERT.execute(conn, dataSet);
            }
        });
    }

    /**
     * Creates a client with a custom DBUnit operation executor.
     *
     * @param connection DBUnit connection with auto-commit disabled
     * @param operationExecutor executor for DBUnit write operations
     */
    JdbcStoreClient(IDatabaseConnection connection, OperationExecutor operationExecutor) {
        this.connection = connection;
        this.operationExecutor = operationExecutor;
    }

    @Override
    public void clearTable(String table) throws StoreException {
        checkIdentifier(table);
        try {
            operationExecutor.deleteAll(connection,
                    new DefaultDataSet(new DefaultTable(table, new Column[0])));
            commit();
        } catch (Exception e) {
            rollback();
            throw new StoreException("Failed to clear table " + table + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void insertBatch(String table, List<Map<String, Object>> rows) throws StoreException {
        checkIdentifier(table);
        if (rows.isEmpty()) {
            return;
        }
        try {
            operationExecutor.insert(connection, new DefaultDataSet(toTable(table, rows)));
            commit();
            log.debug("[{}] {} row(s) committed", table, rows.size());
        } catch (Exception e) {
            rollback();
            throw new StoreException(
                    "Failed to insert " + rows.size() + " row(s) into " + table + ": "
                            + e.getMessage(),
                    e);
        }
    }

    @Override
    public List<Object> selectColumn(String table, String column) throws StoreException {
        checkIdentifier(table);
        checkIdentifier(column);
        String sql = "SELECT " + quote(column) + " FROM " + quote(table);
        List<Object> values = new ArrayList<>();
        try (Statement stmt = jdbc().createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                values.add(rs.getObject(1));
            }
            commit();
        } catch (SQLException e) {
            rollback();
            throw new StoreException("Failed to read " + table + "." + column + ": "
                    + e.getMessage(), e);
        }
        log.debug("[{}] read {} value(s) of '{}'", table, values.size(), column);
        return values;
    }

    @Override
    public void close() throws StoreException {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StoreException("Failed to close connection: " + e.getMessage(), e);
        }
    }

    /**
     * Builds the in-memory DBUnit table of a batch. Columns are the union of the row keys, in
     * first-seen order.
     *
     * @param table table name
     * @param rows rows to insert
     * @return table
     * @throws DataSetException if a value cannot be added
     */
    static ITable toTable(String table, List<Map<String, Object>> rows) throws DataSetException {
        Set<String> names = new LinkedHashSet<>();
        rows.forEach(row -> names.addAll(row.keySet()));
        for (String name : names) {
            checkIdentifierUnchecked(name);
        }
        Column[] columns = names.stream().map(n -> new Column(n, DataType.UNKNOWN))
                .toArray(Column[]::new);
        DefaultTable result = new DefaultTable(table, columns);
        for (Map<String, Object> row : rows) {
            Object[] values = new Object[columns.length];
            for (int i = 0; i < columns.length; i++) {
                String name = columns[i].getColumnName();
                values[i] = row.containsKey(name) ? row.get(name) : ITable.NO_VALUE;
            }
            result.addRow(values);
        }
        return result;
    }

    private Connection jdbc() throws SQLException {
        return connection.getConnection();
    }

    private String quote(String identifier) {
        Object pattern = connection.getConfig().getProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN);
        if (pattern == null) {
            return identifier;
        }
        return pattern.toString().replace("?", identifier);
    }

    private void commit() throws SQLException {
        Connection jdbc = jdbc();
        if (!jdbc.getAutoCommit()) {
            jdbc.commit();
        }
    }

    private void rollback() {
        try {
            Connection jdbc = jdbc();
            if (!jdbc.getAutoCommit()) {
                jdbc.rollback();
            }
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private static void checkIdentifier(String identifier) throws StoreException {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new StoreException("Invalid identifier: '" + identifier + "'");
        }
    }

    private static void checkIdentifierUnchecked(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid identifier: '" + identifier + "'");
        }
    }
}

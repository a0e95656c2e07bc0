package io.github.yok.sheetsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds the connection settings of the target relational store.
 *
 * <pre>
 * connection:
 *   url: jdbc:postgresql://localhost:5432/ecommerce
 *   user: sync
 *   password: secret
 *   driverClass: org.postgresql.Driver
 *   schema: public
 *   dataTypeFactoryMode: POSTGRESQL
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // JDBC connection URL (e.g., jdbc:postgresql://localhost:5432/ecommerce)
    private String url;

    // Database user name
    private String user;

    // Database password
    private String password;

    // Fully qualified JDBC driver class name (e.g., org.postgresql.Driver); optional for JDBC 4
    private String driverClass;

    // Schema passed to DBUnit; null means the connection default
    private String schema;

    // Selects the DBUnit data type factory
    private DataTypeFactoryMode dataTypeFactoryMode = DataTypeFactoryMode.POSTGRESQL;
}

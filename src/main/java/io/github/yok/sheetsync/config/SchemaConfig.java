package io.github.yok.sheetsync.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the static table schemas from {@code application.yml}.
 *
 * <pre>
 * schemas:
 *   tables:
 *     - name: vendas
 *       primaryKey: id_venda
 *       columns:
 *         - name: id_venda
 *           required: true
 *         - name: id_cliente
 *           references: clientes
 *         - name: quantidade
 *           type: integer
 * </pre>
 *
 * <p>
 * Column properties are bound as list entries rather than map keys so that names containing
 * underscores are preserved verbatim.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "schemas")
@Data
public class SchemaConfig {

    /**
     * Table definitions, in declaration order.
     */
    private List<TableDefinition> tables = new ArrayList<>();

    /**
     * One table definition.
     */
    @Data
    public static class TableDefinition {
        // Table name in the store
        private String name;
        // Sheet name in the source; defaults to the table name
        private String sheet;
        // Column used to collapse duplicate rows; optional
        private String primaryKey;
        // Expected columns in order
        private List<ColumnDefinition> columns = new ArrayList<>();
    }

    /**
     * One column definition.
     */
    @Data
    public static class ColumnDefinition {
        // Column name
        private String name;
        // Type tag: text, decimal, integer or date
        private String type = "text";
        // Whether a non-null value is mandatory
        private boolean required;
        // Referenced key as "table" or "table.column"; optional
        private String references;
    }
}

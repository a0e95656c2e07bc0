package io.github.yok.sheetsync.config;

import io.github.yok.sheetsync.source.SourceFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that locates the spreadsheet source.
 *
 * <p>
 * {@code source.path} is either a directory containing one {@code <sheet>.csv} export per sheet or
 * an {@code .xlsx} workbook whose sheets are read by name. When {@code source.format} is omitted
 * the format is inferred from the path.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "source")
@Data
public class SourceConfig {

    // CSV directory or workbook file
    private String path;

    // Explicit source format; null means inferred from the path
    private SourceFormat format;

    // Character encoding of CSV exports
    private String encoding = "UTF-8";
}

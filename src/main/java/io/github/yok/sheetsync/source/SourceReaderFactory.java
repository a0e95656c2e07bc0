package io.github.yok.sheetsync.source;

import io.github.yok.sheetsync.config.SourceConfig;
import java.io.File;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Factory class that creates the {@link SourceReader} described by {@link SourceConfig}.
 *
 * <p>
 * When no format is configured, a directory is read as CSV exports and a file is read according
 * to its extension.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class SourceReaderFactory {

    private SourceReaderFactory() {
        // Utility class; do not instantiate.
    }

    /**
     * Creates a reader for the configured source.
     *
     * @param config source settings
     * @return reader
     * @throws IllegalStateException if the path is missing or the format cannot be determined
     */
    public static SourceReader create(SourceConfig config) {
        if (StringUtils.isBlank(config.getPath())) {
            throw new IllegalStateException(
                    "source.path is not configured. Please set 'source.path' in application.yml.");
        }
        Path path = Paths.get(config.getPath()).toAbsolutePath().normalize();
        SourceFormat format = config.getFormat() != null ? config.getFormat() : detect(path);
        log.info("Spreadsheet source: {} ({})", path, format);
        switch (format) {
            case XLSX:
                return new XlsxSourceReader(path);
            case CSV:
            default:
                return new CsvSourceReader(path, Charset.forName(config.getEncoding()));
        }
    }

    /**
     * Infers the format from the path.
     *
     * @param path source path
     * @return inferred format
     * @throws IllegalStateException if the path does not exist or has an unknown extension
     */
    static SourceFormat detect(Path path) {
        File file = path.toFile();
        if (file.isDirectory()) {
            return SourceFormat.CSV;
        }
        if (!file.exists()) {
            throw new IllegalStateException("Spreadsheet source does not exist: " + path);
        }
        String ext = FilenameUtils.getExtension(file.getName());
        for (SourceFormat format : SourceFormat.values()) {
            if (format != SourceFormat.CSV && format.matches(ext)) {
                return format;
            }
        }
        throw new IllegalStateException("Cannot determine source format of " + path
                + ". Use a directory of CSV exports or an .xlsx workbook.");
    }
}

package io.github.yok.sheetsync.source;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.input.BOMInputStream;

/**
 * {@link SourceReader} over a directory of CSV exports, one {@code <sheet>.csv} per sheet.
 *
 * <p>
 * Files are parsed with Apache Commons CSV in the default (RFC 4180) dialect. Empty lines are kept
 * as blank rows so that row positions match the sheet. A UTF-8 byte order mark is skipped. When no
 * file matches the sheet name exactly, a case-insensitive match is tried.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvSourceReader implements SourceReader {

    private static final CSVFormat FORMAT =
            CSVFormat.DEFAULT.builder().setIgnoreEmptyLines(false).build();

    // Directory containing the CSV exports
    private final Path directory;

    // Encoding of the exports
    private final Charset charset;

    /**
     * Creates a reader.
     *
     * @param directory directory containing {@code <sheet>.csv} files
     * @param charset file encoding
     */
    public CsvSourceReader(Path directory, Charset charset) {
        this.directory = directory;
        this.charset = charset;
    }

    @Override
    public SheetData listRows(String sheetName) throws SourceException {
        Path file = resolve(sheetName);
        log.info("Reading sheet [{}] from {}", sheetName, file);
        try (Reader reader = new InputStreamReader(
                BOMInputStream.builder().setPath(file).get(), charset);
                CSVParser parser = FORMAT.parse(reader)) {
            List<String> header = null;
            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>(record.size());
                for (String value : record) {
                    cells.add(value);
                }
                if (header == null) {
                    header = cells;
                } else {
                    rows.add(cells);
                }
            }
            return new SheetData(header == null ? List.of() : header, rows);
        } catch (IOException | RuntimeException e) {
            throw new SourceException("Failed to read sheet '" + sheetName + "' from " + file,
                    e);
        }
    }

    /**
     * Locates the export of a sheet.
     *
     * @param sheetName sheet name
     * @return existing file
     * @throws SourceException if no export exists
     */
    private Path resolve(String sheetName) throws SourceException {
        Path exact = directory.resolve(sheetName + ".csv");
        if (Files.isRegularFile(exact)) {
            return exact;
        }
        File[] candidates = directory.toFile().listFiles();
        if (candidates != null) {
            String wanted = sheetName.toLowerCase(Locale.ROOT);
            for (File candidate : candidates) {
                if (candidate.isFile()
                        && SourceFormat.CSV.matches(FilenameUtils.getExtension(candidate.getName()))
                        && FilenameUtils.getBaseName(candidate.getName()).toLowerCase(Locale.ROOT)
                                .equals(wanted)) {
                    return candidate.toPath();
                }
            }
        }
        throw new SourceException("Sheet '" + sheetName + "' not found: no " + sheetName
                + ".csv in " + directory);
    }
}

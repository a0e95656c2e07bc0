package io.github.yok.sheetsync.source;

/**
 * Boundary to the spreadsheet source.
 *
 * <p>
 * Implementations return the raw header and all raw rows of a sheet, blank rows included; no
 * cleaning or filtering happens here.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface SourceReader extends AutoCloseable {

    /**
     * Reads one sheet.
     *
     * @param sheetName sheet (tab) name
     * @return header and rows; an empty sheet yields an empty {@link SheetData}
     * @throws SourceException if the sheet does not exist or cannot be read
     */
    SheetData listRows(String sheetName) throws SourceException;

    /**
     * Releases resources held by the reader. The default implementation does nothing.
     */
    @Override
    default void close() {
        // nothing to release
    }
}

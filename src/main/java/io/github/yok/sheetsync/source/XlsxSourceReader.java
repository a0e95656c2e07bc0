package io.github.yok.sheetsync.source;

import java.io.IOException;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.CellValue;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;

/**
 * {@link SourceReader} over an Excel workbook; sheets are looked up by name (case-insensitive).
 *
 * <p>
 * Text cells are rendered through {@link DataFormatter}, with formulas evaluated. Numeric cells
 * are rendered from their stored value without display format, and date-formatted numeric cells
 * as {@code yyyy-MM-dd}, so that neither depends on the JVM or workbook locale. Missing rows are
 * returned as blank rows. The header is the first defined row; its sheet line is kept in
 * {@link SheetData#getHeaderLine()}.
 * </p>
 *
 * <p>
 * The workbook is opened lazily on first use and kept open until {@link #close()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class XlsxSourceReader implements SourceReader {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    // Workbook file
    private final Path workbookPath;

    private final DataFormatter formatter = new DataFormatter();

    private Workbook workbook;
    private FormulaEvaluator evaluator;

    /**
     * Creates a reader.
     *
     * @param workbookPath path of the {@code .xlsx} file
     */
    public XlsxSourceReader(Path workbookPath) {
        this.workbookPath = workbookPath;
    }

    @Override
    public SheetData listRows(String sheetName) throws SourceException {
        Sheet sheet = open().getSheet(sheetName);
        if (sheet == null) {
            throw new SourceException(
                    "Sheet '" + sheetName + "' not found in workbook " + workbookPath);
        }
        log.info("Reading sheet [{}] from {}", sheet.getSheetName(), workbookPath);
        int headerIndex = sheet.getFirstRowNum();
        if (headerIndex < 0) {
            return new SheetData(List.of(), List.of());
        }
        List<String> header = readRow(sheet.getRow(headerIndex));
        List<List<String>> rows = new ArrayList<>();
        for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
            rows.add(readRow(sheet.getRow(r)));
        }
        if (headerIndex > 0) {
            log.info("Sheet [{}]: header found on line {}", sheet.getSheetName(),
                    headerIndex + 1);
        }
        return new SheetData(header, rows, headerIndex + 1);
    }

    @Override
    public void close() {
        if (workbook != null) {
            try {
                workbook.close();
            } catch (IOException e) {
                log.warn("Failed to close workbook {}: {}", workbookPath, e.getMessage(), e);
            }
            workbook = null;
            evaluator = null;
        }
    }

    private Workbook open() throws SourceException {
        if (workbook == null) {
            try {
                workbook = WorkbookFactory.create(workbookPath.toFile(), null, true);
                evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            } catch (IOException | RuntimeException e) {
                throw new SourceException("Failed to open workbook " + workbookPath, e);
            }
        }
        return workbook;
    }

    private List<String> readRow(Row row) {
        List<String> cells = new ArrayList<>();
        if (row == null || row.getLastCellNum() < 0) {
            return cells;
        }
        for (int c = 0; c < row.getLastCellNum(); c++) {
            cells.add(render(row.getCell(c)));
        }
        return cells;
    }

    private String render(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        if (type == CellType.NUMERIC) {
            if (DateUtil.isCellDateFormatted(cell)) {
                return cell.getLocalDateTimeCellValue().toLocalDate().format(ISO_DATE);
            }
            // raw value; display formats would add locale-dependent grouping separators
            if (cell.getCellType() != CellType.FORMULA) {
                return NumberToTextConverter.toText(cell.getNumericCellValue());
            }
            CellValue result = evaluator.evaluate(cell);
            if (result != null && result.getCellType() == CellType.NUMERIC) {
                return NumberToTextConverter.toText(result.getNumberValue());
            }
        }
        return formatter.formatCellValue(cell, evaluator);
    }
}

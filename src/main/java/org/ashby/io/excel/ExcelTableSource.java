package org.ashby.io.excel;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.ashby.io.AbstractTableSource;
import org.ashby.io.RawTable;
import org.ashby.io.TableLoadException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Spreadsheet (xlsx / xls) implementation of TableSource.
 *
 * Reads the first sheet. Its first row holds the headers; every following
 * non-empty row is one material. Cell mapping:
 * - numeric -> Double
 * - text -> String
 * - boolean -> Boolean
 * - formula -> its cached result
 * - blank / error -> null
 */
public final class ExcelTableSource extends AbstractTableSource {

    private final Path path;
    private final DataFormatter formatter = new DataFormatter();

    public ExcelTableSource(Path path, String groupingColumn) {
        super(Objects.requireNonNull(path, "path must not be null").toString(), groupingColumn);
        this.path = path;
    }

    @Override
    protected RawTable read() throws IOException {
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new TableLoadException("Workbook has no sheets: " + path);
            }
            Sheet sheet = workbook.getSheetAt(0);

            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null || header.getLastCellNum() <= 0) {
                throw new TableLoadException("First sheet has no header row: " + path);
            }

            int width = header.getLastCellNum();
            List<String> columns = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                String name = formatter.formatCellValue(header.getCell(c)).strip();
                // same placeholder spreadsheet tools use for unnamed columns
                columns.add(name.isEmpty() ? "Unnamed: " + c : name);
            }

            List<List<Object>> rows = new ArrayList<>();
            for (int r = header.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;

                List<Object> values = new ArrayList<>(width);
                boolean empty = true;
                for (int c = 0; c < width; c++) {
                    Object value = cellValue(row.getCell(c));
                    if (value != null) empty = false;
                    values.add(value);
                }
                if (!empty) {
                    rows.add(values);
                }
            }

            try {
                return new RawTable(columns, rows);
            } catch (IllegalArgumentException e) {
                throw new TableLoadException("Invalid header row in '" + path + "': " + e.getMessage(), e);
            }
        }
    }

    private Object cellValue(Cell cell) {
        if (cell == null) return null;

        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }

        return switch (type) {
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? formatter.formatCellValue(cell)
                    : cell.getNumericCellValue();
            case STRING -> {
                String text = cell.getStringCellValue();
                yield text.isBlank() ? null : text;
            }
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }
}

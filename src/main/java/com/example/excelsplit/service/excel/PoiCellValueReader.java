package com.example.excelsplit.service.excel;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * 基于 POI usermodel 读取第一个工作表的原始值。数字按 Excel 的显示规则转成文本（2.0 -> "2"），
 * 不套用单元格的数字格式；公式单元格取缓存结果。
 */
@Slf4j
public class PoiCellValueReader implements CellValueReader, AutoCloseable {

    private final Workbook workbook;
    private final Sheet sheet;
    private final int rowCount;
    private final int colCount;

    private PoiCellValueReader(Workbook workbook, Sheet sheet) {
        this.workbook = workbook;
        this.sheet = sheet;
        this.rowCount = sheet.getPhysicalNumberOfRows() == 0 ? 0 : sheet.getLastRowNum() + 1;
        int maxCol = 0;
        for (Row row : sheet) {
            maxCol = Math.max(maxCol, row.getLastCellNum());
        }
        this.colCount = maxCol;
    }

    public static PoiCellValueReader open(Path path) {
        Workbook workbook = null;
        try {
            workbook = WorkbookFactory.create(path.toFile(), null, true);
            if (workbook.getNumberOfSheets() == 0) {
                throw new ExcelFileException("Excel 文件中没有工作表");
            }
            return new PoiCellValueReader(workbook, workbook.getSheetAt(0));
        } catch (IOException | EncryptedDocumentException | IllegalArgumentException e) {
            throw new ExcelFileException("打开 Excel 文件失败: " + e.getMessage(), e);
        } catch (ExcelFileException e) {
            closeQuietly(workbook);
            throw e;
        }
    }

    @Override
    public Optional<String> getString(int row, int col) {
        Cell cell = cellAt(row, col);
        if (cell == null) {
            return Optional.empty();
        }
        CellType type = effectiveType(cell);
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.isEmpty() ? Optional.empty() : Optional.of(text);
            case NUMERIC:
                return Optional.of(NumberToTextConverter.toText(cell.getNumericCellValue()));
            case BOOLEAN:
                return Optional.of(String.valueOf(cell.getBooleanCellValue()));
            default:
                return Optional.empty();
        }
    }

    @Override
    public OptionalDouble getFloat(int row, int col) {
        Cell cell = cellAt(row, col);
        if (cell == null) {
            return OptionalDouble.empty();
        }
        CellType type = effectiveType(cell);
        if (type == CellType.NUMERIC) {
            return OptionalDouble.of(cell.getNumericCellValue());
        }
        if (type == CellType.STRING) {
            String text = cell.getStringCellValue();
            if (text == null || text.isBlank()) {
                return OptionalDouble.empty();
            }
            try {
                return OptionalDouble.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public int colCount() {
        return colCount;
    }

    @Override
    public boolean isEmpty(int row, int col) {
        return getString(row, col).isEmpty();
    }

    @Override
    public void close() {
        closeQuietly(workbook);
    }

    private Cell cellAt(int row, int col) {
        if (row < 0 || col < 0) {
            return null;
        }
        Row r = sheet.getRow(row);
        return r == null ? null : r.getCell(col);
    }

    private static CellType effectiveType(Cell cell) {
        return cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
    }

    private static void closeQuietly(Workbook workbook) {
        if (workbook == null) {
            return;
        }
        try {
            workbook.close();
        } catch (IOException e) {
            log.warn("关闭工作簿失败: {}", e.getMessage());
        }
    }
}

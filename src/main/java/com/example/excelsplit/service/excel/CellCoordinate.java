package com.example.excelsplit.service.excel;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.CellReference;

import java.util.Optional;

public record CellCoordinate(int row, int col) {

    public static CellCoordinate of(int row, int col) {
        return new CellCoordinate(row, col);
    }

    // "AA1" -> (0, 26)，超出 xlsx 行列上限或带工作表名的引用视为无效
    public static Optional<CellCoordinate> parse(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        CellReference cellReference;
        try {
            cellReference = new CellReference(reference.trim());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (cellReference.getSheetName() != null
                || !withinSheet(cellReference.getRow(), cellReference.getCol())) {
            return Optional.empty();
        }
        return Optional.of(new CellCoordinate(cellReference.getRow(), cellReference.getCol()));
    }

    static boolean withinSheet(int row, int col) {
        SpreadsheetVersion version = SpreadsheetVersion.EXCEL2007;
        return row >= 0 && col >= 0 && row <= version.getLastRowIndex() && col <= version.getLastColumnIndex();
    }
}

package com.example.excelsplit.service.excel;

import org.apache.poi.ss.util.CellRangeAddress;

import java.util.Optional;

// 闭区间，从 0 开始
public record MergedRegion(int startRow, int startCol, int endRow, int endCol) {

    // 只接受 "A1:B3" 形式，起止顺序颠倒或超出行列上限的区域视为无效
    public static Optional<MergedRegion> parse(String range) {
        if (range == null || range.indexOf(':') < 0 || range.indexOf(':') != range.lastIndexOf(':')) {
            return Optional.empty();
        }
        CellRangeAddress address;
        try {
            address = CellRangeAddress.valueOf(range.trim());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (!CellCoordinate.withinSheet(address.getFirstRow(), address.getFirstColumn())
                || !CellCoordinate.withinSheet(address.getLastRow(), address.getLastColumn())
                || address.getFirstRow() > address.getLastRow()
                || address.getFirstColumn() > address.getLastColumn()) {
            return Optional.empty();
        }
        return Optional.of(new MergedRegion(address.getFirstRow(), address.getFirstColumn(),
                address.getLastRow(), address.getLastColumn()));
    }

    public boolean contains(int row, int col) {
        return row >= startRow && row <= endRow && col >= startCol && col <= endCol;
    }

    public boolean spansColumn(int col) {
        return col >= startCol && col <= endCol;
    }

    public int rowCount() {
        return endRow - startRow + 1;
    }

    public CellCoordinate start() {
        return new CellCoordinate(startRow, startCol);
    }
}

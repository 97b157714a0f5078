package com.example.excelsplit.service.excel;

public record StyledCellValue(CellValue value, CellStyle style, boolean weightCell, EmbeddedImage image) {

    public static StyledCellValue of(CellValue value, CellStyle style) {
        return new StyledCellValue(value, style, false, null);
    }

    public static StyledCellValue weight(double weight, CellStyle style) {
        return new StyledCellValue(CellValue.number(weight), style, true, null);
    }

    public static StyledCellValue withImage(CellStyle style, EmbeddedImage image) {
        return new StyledCellValue(CellValue.empty(), style, false, image);
    }

    public boolean hasImage() {
        return image != null;
    }
}

package com.example.excelsplit.service.excel;

import java.util.List;
import java.util.Map;

/**
 * 一次请求内从源文件解析出的工作表元数据，构造后不可变。
 *
 * @param mergedRegions      合并单元格区域
 * @param columnWidths       显式声明的列宽（字符数），键为从 0 开始的列号
 * @param defaultColumnWidth 未显式声明时使用的列宽
 * @param cellStyles         非默认样式的单元格
 * @param cellFormulas       单元格公式，均以 "=" 开头
 * @param cellImages         已解析出字节内容的图片
 * @param convertedImages    自动转换过格式的媒体文件说明
 * @param unsupportedImages  无法处理而被跳过的媒体文件名
 */
public record WorksheetMetadata(
        List<MergedRegion> mergedRegions,
        Map<Integer, Double> columnWidths,
        double defaultColumnWidth,
        Map<CellCoordinate, CellStyle> cellStyles,
        Map<CellCoordinate, String> cellFormulas,
        Map<CellCoordinate, EmbeddedImage> cellImages,
        List<String> convertedImages,
        List<String> unsupportedImages
) {

    public static final double FALLBACK_COLUMN_WIDTH = 8.43;

    public WorksheetMetadata {
        mergedRegions = List.copyOf(mergedRegions);
        columnWidths = Map.copyOf(columnWidths);
        cellStyles = Map.copyOf(cellStyles);
        cellFormulas = Map.copyOf(cellFormulas);
        cellImages = Map.copyOf(cellImages);
        convertedImages = List.copyOf(convertedImages);
        unsupportedImages = List.copyOf(unsupportedImages);
    }

    public static WorksheetMetadata empty() {
        return new WorksheetMetadata(List.of(), Map.of(), FALLBACK_COLUMN_WIDTH, Map.of(), Map.of(), Map.of(),
                List.of(), List.of());
    }

    public WorksheetMetadata withImages(Map<CellCoordinate, EmbeddedImage> images,
                                        List<String> converted,
                                        List<String> unsupported) {
        return new WorksheetMetadata(mergedRegions, columnWidths, defaultColumnWidth, cellStyles, cellFormulas,
                images, converted, unsupported);
    }

    public double columnWidth(int col) {
        return columnWidths.getOrDefault(col, defaultColumnWidth);
    }

    public MergedRegion findMergedRegion(int row, int col) {
        for (MergedRegion region : mergedRegions) {
            if (region.contains(row, col)) {
                return region;
            }
        }
        return null;
    }

    public CellStyle styleAt(int row, int col) {
        return cellStyles.get(new CellCoordinate(row, col));
    }

    public String formulaAt(int row, int col) {
        return cellFormulas.get(new CellCoordinate(row, col));
    }

    public EmbeddedImage imageAt(int row, int col) {
        return cellImages.get(new CellCoordinate(row, col));
    }
}

package com.example.excelsplit.service.excel;

import com.example.excelsplit.service.ProcessConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 按元数据把源工作表逐格转换为输出网格。
 * <p>
 * 合并单元格只有左上角持有数据：重量列按数量比例拆到每一行，箱数列只保留首行，其余列沿用左上角的值、公式或图片。
 * 第一列为空的行视为数据块结束，之后的行不再处理。
 */
@Slf4j
@Component
public class SheetTransformer {

    public List<List<StyledCellValue>> transform(CellValueReader reader,
                                                 WorksheetMetadata metadata,
                                                 ProcessConfig config,
                                                 List<String> logs) {
        config.validate();
        int weightCol = config.weightColumnIndex();
        int boxCol = config.boxColumnIndex();
        boolean copyImages = config.copyImages();

        Map<CellCoordinate, Double> weights = distributeWeights(reader, metadata.mergedRegions(), weightCol);

        List<List<StyledCellValue>> result = new ArrayList<>();
        int rowCount = reader.rowCount();
        int colCount = reader.colCount();
        for (int row = 0; row < rowCount; row++) {
            if (reader.isEmpty(row, 0)) {
                logs.add(String.format("第 %d 行第一列为空，停止处理", row + 1));
                break;
            }
            List<StyledCellValue> rowData = new ArrayList<>(colCount);
            for (int col = 0; col < colCount; col++) {
                CellStyle style = metadata.styleAt(row, col);
                EmbeddedImage image = copyImages ? metadata.imageAt(row, col) : null;
                String formula = metadata.formulaAt(row, col);

                MergedRegion region = metadata.findMergedRegion(row, col);
                if (region != null) {
                    rowData.add(transformMergedCell(reader, metadata, region, row, col, weightCol, boxCol,
                            weights, style, formula, image, copyImages));
                } else {
                    rowData.add(transformPlainCell(reader, row, col, style, formula, image));
                }
            }
            result.add(rowData);
        }

        logs.add(String.format("处理完成，共 %d 行数据", result.size()));
        return result;
    }

    private StyledCellValue transformPlainCell(CellValueReader reader, int row, int col,
                                               CellStyle style, String formula, EmbeddedImage image) {
        if (image != null) {
            return StyledCellValue.withImage(style, image);
        }
        if (formula != null) {
            // DISPIMG 没有解析到图片时无法复现，留空
            if (ImageReferenceGraph.isImageDisplayFormula(formula)) {
                return StyledCellValue.of(CellValue.empty(), style);
            }
            return StyledCellValue.of(CellValue.formula(formula), style);
        }
        return StyledCellValue.of(CellValue.sniff(reader.getString(row, col).orElse(null)), style);
    }

    private StyledCellValue transformMergedCell(CellValueReader reader,
                                                WorksheetMetadata metadata,
                                                MergedRegion region,
                                                int row,
                                                int col,
                                                int weightCol,
                                                int boxCol,
                                                Map<CellCoordinate, Double> weights,
                                                CellStyle style,
                                                String formula,
                                                EmbeddedImage image,
                                                boolean copyImages) {
        CellStyle startStyle = metadata.styleAt(region.startRow(), region.startCol());
        if (startStyle == null) {
            startStyle = style;
        }

        // 重量列：预先分摊好的值，强制 0.00
        if (col == weightCol) {
            Double weight = weights.get(new CellCoordinate(row, col));
            if (weight == null) {
                weight = reader.getFloat(row, col).orElse(0.0);
            }
            return StyledCellValue.weight(weight, startStyle);
        }

        // 箱数列：首行保留原值，其余行为 0，避免下游重复计数
        if (col == boxCol) {
            CellStyle boxStyle = metadata.styleAt(region.startRow(), col);
            if (row == region.startRow()) {
                String boxes = reader.getString(region.startRow(), col).orElse(null);
                return StyledCellValue.of(CellValue.sniff(boxes), boxStyle);
            }
            return StyledCellValue.of(CellValue.integer(0), boxStyle);
        }

        if (image != null) {
            return StyledCellValue.withImage(style, image);
        }
        EmbeddedImage startImage = copyImages ? metadata.imageAt(region.startRow(), region.startCol()) : null;
        if (startImage != null) {
            return StyledCellValue.withImage(startStyle, startImage);
        }

        if (formula != null && !ImageReferenceGraph.isImageDisplayFormula(formula)) {
            return StyledCellValue.of(CellValue.formula(formula), style);
        }
        String startFormula = metadata.formulaAt(region.startRow(), region.startCol());
        if (startFormula != null && !ImageReferenceGraph.isImageDisplayFormula(startFormula)) {
            return StyledCellValue.of(CellValue.formula(startFormula), startStyle);
        }

        String value = reader.getString(region.startRow(), region.startCol()).orElse(null);
        return StyledCellValue.of(CellValue.sniff(value), startStyle);
    }

    /**
     * 对每个跨越重量列的合并区域，按数量列（重量列前一列）的比例把区域总重量拆到每一行，四舍五入到两位小数。
     * 数量合计为 0 时每行都记 0。
     */
    Map<CellCoordinate, Double> distributeWeights(CellValueReader reader, List<MergedRegion> regions, int weightCol) {
        Map<CellCoordinate, Double> distributions = new HashMap<>();
        int quantityCol = weightCol - 1;
        for (MergedRegion region : regions) {
            if (!region.spansColumn(weightCol)) {
                continue;
            }
            // 合并区域的值只存在左上角
            double total = reader.getFloat(region.startRow(), region.startCol()).orElse(0.0);

            double summedQuantity = 0;
            for (int r = region.startRow(); r <= region.endRow(); r++) {
                summedQuantity += reader.getFloat(r, quantityCol).orElse(0.0);
            }

            if (summedQuantity == 0) {
                for (int r = region.startRow(); r <= region.endRow(); r++) {
                    distributions.put(new CellCoordinate(r, weightCol), 0.0);
                }
                continue;
            }

            double unit = total / summedQuantity;
            for (int r = region.startRow(); r <= region.endRow(); r++) {
                double quantity = reader.getFloat(r, quantityCol).orElse(0.0);
                distributions.put(new CellCoordinate(r, weightCol), roundToCents(unit * quantity));
            }
            log.debug("重量分摊 行 {}-{}: 总重 {}，总数量 {}，单位重量 {}",
                    region.startRow() + 1, region.endRow() + 1, total, summedQuantity, unit);
        }
        return distributions;
    }

    static double roundToCents(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

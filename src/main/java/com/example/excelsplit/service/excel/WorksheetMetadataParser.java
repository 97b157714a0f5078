package com.example.excelsplit.service.excel;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 流式解析工作表 XML：合并区域、单元格样式索引、公式、列宽。
 */
@Slf4j
public final class WorksheetMetadataParser {

    // xlsx 最大列数
    private static final int MAX_COLUMNS = 16384;

    private WorksheetMetadataParser() {
    }

    public static WorksheetMetadata parse(byte[] xml, StylesCatalog styles) {
        List<MergedRegion> mergedRegions = new ArrayList<>();
        Map<Integer, Double> columnWidths = new HashMap<>();
        Map<CellCoordinate, CellStyle> cellStyles = new HashMap<>();
        Map<CellCoordinate, String> cellFormulas = new HashMap<>();
        ParseState state = new ParseState();

        XmlPartScanner.forPart(PackageArchive.WORKSHEET_PART)
                .onStart("mergeCell", e -> {
                    if (e.within("mergeCells")) {
                        MergedRegion.parse(e.attribute("ref")).ifPresent(mergedRegions::add);
                    }
                })
                .onStart("sheetFormatPr", e -> {
                    Double width = e.doubleAttribute("defaultColWidth");
                    if (width != null) {
                        state.defaultColumnWidth = width;
                    }
                })
                .onStart("col", e -> {
                    Integer min = e.intAttribute("min");
                    Integer max = e.intAttribute("max");
                    Double width = e.doubleAttribute("width");
                    if (!e.hasParent("cols") || min == null || max == null || width == null || min < 1) {
                        return;
                    }
                    for (int col = min; col <= Math.min(max, MAX_COLUMNS); col++) {
                        columnWidths.put(col - 1, width);
                    }
                })
                .onStart("c", e -> {
                    if (!e.within("sheetData")) {
                        return;
                    }
                    state.reference = e.attribute("r");
                    state.styleIndex = e.intAttribute("s");
                    state.formula = null;
                })
                .onText("f", (e, text) -> {
                    if (e.hasParent("c")) {
                        state.formula = text;
                    }
                })
                .onEnd("c", e -> {
                    if (!e.within("sheetData")) {
                        return;
                    }
                    CellCoordinate.parse(state.reference).ifPresent(coordinate -> {
                        if (state.styleIndex != null) {
                            CellStyle style = styles.resolve(state.styleIndex);
                            if (!style.isDefault()) {
                                cellStyles.put(coordinate, style);
                            }
                        }
                        if (state.formula != null && !state.formula.isEmpty()) {
                            cellFormulas.put(coordinate, normalizeFormula(state.formula));
                        }
                    });
                    state.reference = null;
                    state.styleIndex = null;
                    state.formula = null;
                })
                .scan(xml);

        log.debug("工作表: {} 个合并区域, {} 个列宽, {} 个样式单元格, {} 个公式",
                mergedRegions.size(), columnWidths.size(), cellStyles.size(), cellFormulas.size());
        return new WorksheetMetadata(mergedRegions, columnWidths, state.defaultColumnWidth, cellStyles, cellFormulas,
                Map.of(), List.of(), List.of());
    }

    static String normalizeFormula(String formula) {
        return formula.startsWith("=") ? formula : "=" + formula;
    }

    private static final class ParseState {
        private double defaultColumnWidth = WorksheetMetadata.FALLBACK_COLUMN_WIDTH;
        private String reference;
        private Integer styleIndex;
        private String formula;
    }
}

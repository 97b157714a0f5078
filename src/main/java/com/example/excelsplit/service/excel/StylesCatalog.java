package com.example.excelsplit.service.excel;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.BuiltinFormats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * xl/styles.xml 中数字格式、填充与 cellXfs 三张表，按单元格的 s 索引还原出 {@link CellStyle}。
 * <p>
 * 只识别前景色为 RGB 的填充；主题色 (theme) 与索引色 (indexed) 不解析，按无背景色处理。
 */
@Slf4j
public final class StylesCatalog {

    private static final StylesCatalog EMPTY = new StylesCatalog(preloadedFormats(), List.of(), List.of());

    private final Map<Integer, String> numberFormats;
    private final List<String> fills;
    private final List<CellXf> cellXfs;

    private StylesCatalog(Map<Integer, String> numberFormats, List<String> fills, List<CellXf> cellXfs) {
        this.numberFormats = Collections.unmodifiableMap(numberFormats);
        this.fills = Collections.unmodifiableList(fills);
        this.cellXfs = Collections.unmodifiableList(cellXfs);
    }

    public static StylesCatalog empty() {
        return EMPTY;
    }

    public static StylesCatalog parse(byte[] xml) {
        Map<Integer, String> formats = preloadedFormats();
        List<String> fills = new ArrayList<>();
        List<CellXf> xfs = new ArrayList<>();
        FillState fill = new FillState();

        XmlPartScanner.forPart(PackageArchive.STYLES_PART)
                .onStart("numFmt", e -> {
                    Integer id = e.intAttribute("numFmtId");
                    String code = e.attribute("formatCode");
                    if (e.within("numFmts") && id != null && code != null) {
                        formats.put(id, code);
                    }
                })
                .onStart("fill", e -> fill.color = null)
                .onStart("patternFill", e -> {
                    if ("none".equals(e.attribute("patternType"))) {
                        fill.color = null;
                    }
                })
                .onStart("fgColor", e -> {
                    String rgb = e.attribute("rgb");
                    // ARGB，取后 6 位
                    if (e.within("fills") && rgb != null && rgb.length() >= 6) {
                        fill.color = rgb.substring(rgb.length() - 6).toUpperCase();
                    }
                })
                .onEnd("fill", e -> {
                    if (e.within("fills")) {
                        fills.add(fill.color);
                        fill.color = null;
                    }
                })
                .onStart("xf", e -> {
                    if (e.hasParent("cellXfs")) {
                        Integer numFmtId = e.intAttribute("numFmtId");
                        Integer fillId = e.intAttribute("fillId");
                        xfs.add(new CellXf(numFmtId == null ? 0 : numFmtId, fillId == null ? 0 : fillId));
                    }
                })
                .scan(xml);

        log.debug("styles.xml: {} 个数字格式, {} 个填充, {} 个 cellXfs", formats.size(), fills.size(), xfs.size());
        return new StylesCatalog(formats, fills, xfs);
    }

    public CellStyle resolve(int styleIndex) {
        if (styleIndex == 0) {
            return CellStyle.GENERAL_STYLE;
        }
        if (styleIndex < 0 || styleIndex >= cellXfs.size()) {
            return CellStyle.NONE;
        }
        CellXf xf = cellXfs.get(styleIndex);
        String format = numberFormats.get(xf.numFmtId());
        if (format == null) {
            // 未显式声明的内置格式（日期、百分比等）按 Excel 内置表补齐
            format = BuiltinFormats.getBuiltinFormat(xf.numFmtId());
        }
        String color = xf.fillId() >= 0 && xf.fillId() < fills.size() ? fills.get(xf.fillId()) : null;
        return new CellStyle(format, color);
    }

    public int cellXfCount() {
        return cellXfs.size();
    }

    private static Map<Integer, String> preloadedFormats() {
        Map<Integer, String> formats = new HashMap<>();
        formats.put(0, CellStyle.GENERAL);
        formats.put(1, "0");
        formats.put(2, "0.00");
        formats.put(49, "@");
        return formats;
    }

    private record CellXf(int numFmtId, int fillId) {
    }

    private static final class FillState {
        private String color;
    }
}

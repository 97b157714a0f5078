package com.example.excelsplit.service.excel;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.ClientAnchor;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.util.Units;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFClientAnchor;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFDrawing;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把转换后的网格写成新的 xlsx：还原列宽，统一行高，套用固定的居中/换行/细边框样式，并把图片嵌回原坐标。
 * <p>
 * 先写到同目录下的临时文件，成功后再移动到目标路径，失败时不会留下残缺的输出文件。
 */
@Slf4j
@Component
public class WorkbookWriter {

    public static final String SHEET_NAME = "Sheet1";
    public static final float ROW_HEIGHT_POINTS = 20f;
    public static final String WEIGHT_FORMAT = "0.00";

    // 图片按默认行高缩放，偏移量按约 60px 列宽、26px 行高估算居中
    static final int IMAGE_SIZE_PX = 18;
    static final int IMAGE_OFFSET_X_PX = 21;
    static final int IMAGE_OFFSET_Y_PX = 4;

    private static final int MAX_COLUMN_WIDTH = 255 * 256;

    public void write(List<List<StyledCellValue>> grid, WorksheetMetadata metadata, Path output, List<String> logs) {
        long imageCount = grid.stream().flatMap(List::stream).filter(StyledCellValue::hasImage).count();
        if (imageCount > 0) {
            logs.add(String.format("发现 %d 个图片待嵌入", imageCount));
        }

        Path temp = null;
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFSheet sheet = workbook.createSheet(SHEET_NAME);
            StyleCache styles = new StyleCache(workbook);

            int colCount = grid.stream().mapToInt(List::size).max().orElse(0);
            for (int col = 0; col < colCount; col++) {
                sheet.setColumnWidth(col, toColumnWidthUnits(metadata.columnWidth(col)));
            }

            XSSFDrawing drawing = null;
            for (int r = 0; r < grid.size(); r++) {
                XSSFRow row = sheet.createRow(r);
                row.setHeightInPoints(ROW_HEIGHT_POINTS);
                List<StyledCellValue> rowData = grid.get(r);
                for (int c = 0; c < rowData.size(); c++) {
                    StyledCellValue value = rowData.get(c);
                    if (value.hasImage()) {
                        writeValue(row.createCell(c), CellValue.empty(), styles.forCell(value));
                        if (drawing == null) {
                            drawing = sheet.createDrawingPatriarch();
                        }
                        ImageEmbedResult result = embedImage(workbook, drawing, r, c, value.image());
                        if (!result.embedded()) {
                            String message = String.format("嵌入图片失败 (%d, %d): %s", r + 1, c + 1,
                                    result.failureReason());
                            log.warn(message);
                            logs.add(message);
                        }
                        continue;
                    }
                    writeValue(row.createCell(c), value.value(), styles.forCell(value));
                }
            }

            logs.add("保存文件...");
            temp = Files.createTempFile(tempDirectoryFor(output), ".excel-split-", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                workbook.write(out);
            }
            Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING);
            temp = null;
        } catch (IOException e) {
            throw new ExcelWriteException("保存 Excel 文件失败: " + e.getMessage(), e);
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * 嵌入单张图片。数据不足 8 字节或 POI 无法接受时返回失败结果，不抛出异常。
     */
    ImageEmbedResult embedImage(XSSFWorkbook workbook, XSSFDrawing drawing, int row, int col, EmbeddedImage image) {
        try {
            validateImage(image);
            int pictureIndex = workbook.addPicture(image.data(), pictureTypeOf(image.format()));

            XSSFClientAnchor anchor = drawing.createAnchor(
                    Units.pixelToEMU(IMAGE_OFFSET_X_PX),
                    Units.pixelToEMU(IMAGE_OFFSET_Y_PX),
                    Units.pixelToEMU(IMAGE_OFFSET_X_PX + IMAGE_SIZE_PX),
                    Units.pixelToEMU(IMAGE_OFFSET_Y_PX + IMAGE_SIZE_PX),
                    col, row, col, row);
            anchor.setAnchorType(ClientAnchor.AnchorType.MOVE_AND_RESIZE);
            drawing.createPicture(anchor, pictureIndex);
            return ImageEmbedResult.ok();
        } catch (ImageEmbedException e) {
            return ImageEmbedResult.failed(e.getMessage());
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ImageEmbedResult.failed("插入图片失败: " + e.getMessage());
        }
    }

    private void validateImage(EmbeddedImage image) {
        if (image.data() == null || image.data().length == 0) {
            throw new ImageEmbedException("图片数据为空");
        }
        if (!image.hasUsableData()) {
            throw new ImageEmbedException("图片数据太短，无法识别格式");
        }
        if (image.format() == null) {
            throw new ImageEmbedException("未知的图片格式");
        }
    }

    private static int pictureTypeOf(ImageFormat format) {
        switch (format) {
            case PNG:
                return Workbook.PICTURE_TYPE_PNG;
            case JPEG:
                return Workbook.PICTURE_TYPE_JPEG;
            case GIF:
                return XSSFWorkbook.PICTURE_TYPE_GIF;
            case BMP:
                return XSSFWorkbook.PICTURE_TYPE_BMP;
            default:
                throw new ImageEmbedException("不支持的图片格式: " + format);
        }
    }

    private void writeValue(XSSFCell cell, CellValue value, XSSFCellStyle style) {
        cell.setCellStyle(style);
        switch (value.type()) {
            case TEXT:
                cell.setCellValue(value.text());
                break;
            case NUMBER:
            case INTEGER:
                cell.setCellValue(value.number());
                break;
            case FORMULA:
                // POI 写公式时不带等号
                String formula = value.text().startsWith("=") ? value.text().substring(1) : value.text();
                try {
                    cell.setCellFormula(formula);
                } catch (RuntimeException e) {
                    throw new ExcelWriteException(String.format("写入公式失败 %s: %s",
                            cell.getReference(), e.getMessage()), e);
                }
                break;
            default:
                // 空单元格也写入空串以保留边框和背景
                cell.setCellValue("");
                break;
        }
    }

    static int toColumnWidthUnits(double characters) {
        return (int) Math.min(MAX_COLUMN_WIDTH, Math.max(0, Math.round(characters * 256)));
    }

    private static Path tempDirectoryFor(Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent == null) {
            throw new IOException("无法获取输出目录: " + output);
        }
        return parent;
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("删除临时文件失败 {}: {}", temp, e.getMessage());
        }
    }

    /**
     * 按 (数字格式, 背景色, 是否重量) 复用单元格样式，避免超出 xlsx 的样式数量上限。
     */
    private static final class StyleCache {

        private final XSSFWorkbook workbook;
        private final Map<String, XSSFCellStyle> cache = new HashMap<>();

        private StyleCache(XSSFWorkbook workbook) {
            this.workbook = workbook;
        }

        private XSSFCellStyle forCell(StyledCellValue value) {
            CellStyle source = value.style();
            String format = value.weightCell()
                    ? WEIGHT_FORMAT
                    : source == null ? null : source.numberFormatIfCustom().orElse(null);
            String color = source == null ? null : source.backgroundColor();
            String key = format + "|" + color;
            return cache.computeIfAbsent(key, k -> create(format, color));
        }

        private XSSFCellStyle create(String format, String color) {
            XSSFCellStyle style = workbook.createCellStyle();
            style.setAlignment(HorizontalAlignment.CENTER);
            style.setVerticalAlignment(VerticalAlignment.CENTER);
            style.setWrapText(true);
            style.setBorderTop(BorderStyle.THIN);
            style.setBorderBottom(BorderStyle.THIN);
            style.setBorderLeft(BorderStyle.THIN);
            style.setBorderRight(BorderStyle.THIN);
            if (format != null) {
                style.setDataFormat(workbook.createDataFormat().getFormat(format));
            }
            byte[] rgb = parseColor(color);
            if (rgb != null) {
                style.setFillForegroundColor(new XSSFColor(rgb, null));
                style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            }
            return style;
        }

        private static byte[] parseColor(String hex) {
            if (hex == null) {
                return null;
            }
            String value = hex.startsWith("#") ? hex.substring(1) : hex;
            if (value.length() < 6) {
                return null;
            }
            try {
                return new byte[]{
                        (byte) Integer.parseInt(value.substring(0, 2), 16),
                        (byte) Integer.parseInt(value.substring(2, 4), 16),
                        (byte) Integer.parseInt(value.substring(4, 6), 16)
                };
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}

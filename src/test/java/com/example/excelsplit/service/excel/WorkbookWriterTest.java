package com.example.excelsplit.service.excel;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.util.Units;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFClientAnchor;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFDrawing;
import org.apache.poi.xssf.usermodel.XSSFPicture;
import org.apache.poi.xssf.usermodel.XSSFShape;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WorkbookWriterTest {

    @TempDir
    Path tempDir;

    private final WorkbookWriter writer = new WorkbookWriter();

    @Test
    void writesValuesWithFixedLayout() throws Exception {
        CellStyle yellow = new CellStyle(null, "FFFF00");
        List<List<StyledCellValue>> grid = List.of(
                List.of(StyledCellValue.of(CellValue.text("名称"), null),
                        StyledCellValue.of(CellValue.integer(5), new CellStyle("0.0%", null)),
                        StyledCellValue.weight(20.0, yellow),
                        StyledCellValue.of(CellValue.formula("=B1*2"), null)),
                List.of(StyledCellValue.of(CellValue.text("第二行"), null),
                        StyledCellValue.of(CellValue.empty(), yellow),
                        StyledCellValue.weight(12.345, null),
                        StyledCellValue.of(CellValue.number(1.5), CellStyle.GENERAL_STYLE)));
        WorksheetMetadata metadata = new WorksheetMetadata(List.of(), Map.of(0, 20.0), 8.43, Map.of(), Map.of(),
                Map.of(), List.of(), List.of());
        Path output = tempDir.resolve("out.xlsx");
        List<String> logs = new ArrayList<>();

        writer.write(grid, metadata, output, logs);

        assertEquals(List.of("保存文件..."), logs);
        try (InputStream in = Files.newInputStream(output);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            XSSFSheet sheet = workbook.getSheet(WorkbookWriter.SHEET_NAME);
            assertNotNull(sheet);
            assertEquals(20 * 256, sheet.getColumnWidth(0));
            assertEquals(WorkbookWriter.toColumnWidthUnits(8.43), sheet.getColumnWidth(1));
            assertEquals(20f, sheet.getRow(0).getHeightInPoints());
            assertEquals(20f, sheet.getRow(1).getHeightInPoints());

            assertEquals("名称", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals(5.0, sheet.getRow(0).getCell(1).getNumericCellValue());
            assertEquals("0.0%", sheet.getRow(0).getCell(1).getCellStyle().getDataFormatString());

            XSSFCell weight = sheet.getRow(0).getCell(2);
            assertEquals(20.0, weight.getNumericCellValue());
            XSSFCellStyle weightStyle = weight.getCellStyle();
            assertEquals(WorkbookWriter.WEIGHT_FORMAT, weightStyle.getDataFormatString());
            assertEquals(FillPatternType.SOLID_FOREGROUND, weightStyle.getFillPattern());
            XSSFColor color = weightStyle.getFillForegroundColorColor();
            assertArrayEquals(new byte[]{(byte) 0xFF, (byte) 0xFF, 0x00}, color.getRGB());

            assertEquals(12.345, sheet.getRow(1).getCell(2).getNumericCellValue());
            assertEquals("0.00", sheet.getRow(1).getCell(2).getCellStyle().getDataFormatString());

            XSSFCell formula = sheet.getRow(0).getCell(3);
            assertEquals(CellType.FORMULA, formula.getCellType());
            assertEquals("B1*2", formula.getCellFormula());

            XSSFCellStyle plain = sheet.getRow(0).getCell(0).getCellStyle();
            assertEquals(HorizontalAlignment.CENTER, plain.getAlignment());
            assertEquals(VerticalAlignment.CENTER, plain.getVerticalAlignment());
            assertTrue(plain.getWrapText());
            assertEquals(BorderStyle.THIN, plain.getBorderTop());
            assertEquals(BorderStyle.THIN, plain.getBorderLeft());
            assertEquals(FillPatternType.NO_FILL, plain.getFillPattern());

            // General 不写格式，与无样式单元格共用同一个样式
            assertEquals(plain.getIndex(), sheet.getRow(1).getCell(3).getCellStyle().getIndex());
        }
    }

    @Test
    void badImageIsLoggedAndTheRestIsWritten() throws Exception {
        EmbeddedImage tiny = new EmbeddedImage("ID_TINY", new byte[]{1, 2, 3, 4}, ImageFormat.PNG);
        EmbeddedImage good = new EmbeddedImage("ID_GOOD", XlsxFixtures.png(4, 4), ImageFormat.PNG);
        List<List<StyledCellValue>> grid = List.of(
                List.of(StyledCellValue.of(CellValue.text("A"), null), StyledCellValue.withImage(null, tiny)),
                List.of(StyledCellValue.of(CellValue.text("B"), null), StyledCellValue.withImage(null, good)));
        Path output = tempDir.resolve("images.xlsx");
        List<String> logs = new ArrayList<>();

        writer.write(grid, WorksheetMetadata.empty(), output, logs);

        assertEquals("发现 2 个图片待嵌入", logs.get(0));
        List<String> failures = logs.stream().filter(l -> l.startsWith("嵌入图片失败")).collect(Collectors.toList());
        assertEquals(1, failures.size());
        assertTrue(failures.get(0).startsWith("嵌入图片失败 (1, 2): "));
        assertEquals("保存文件...", logs.get(logs.size() - 1));

        try (InputStream in = Files.newInputStream(output);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            XSSFSheet sheet = workbook.getSheetAt(0);
            assertEquals("A", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("", sheet.getRow(0).getCell(1).getStringCellValue());
            assertEquals("B", sheet.getRow(1).getCell(0).getStringCellValue());
            assertEquals(1, workbook.getAllPictures().size());

            XSSFDrawing drawing = sheet.getDrawingPatriarch();
            List<XSSFShape> shapes = drawing.getShapes();
            assertEquals(1, shapes.size());
            XSSFClientAnchor anchor = ((XSSFPicture) shapes.get(0)).getClientAnchor();
            assertEquals(1, anchor.getRow1());
            assertEquals(1, anchor.getCol1());
            assertEquals(Units.pixelToEMU(WorkbookWriter.IMAGE_OFFSET_X_PX), anchor.getDx1());
            assertEquals(Units.pixelToEMU(WorkbookWriter.IMAGE_OFFSET_Y_PX), anchor.getDy1());
        }
    }

    @Test
    void embedImageReportsFailureInsteadOfThrowing() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFDrawing drawing = workbook.createSheet().createDrawingPatriarch();

            ImageEmbedResult empty = writer.embedImage(workbook, drawing, 0, 0,
                    new EmbeddedImage("x", new byte[0], ImageFormat.PNG));
            ImageEmbedResult ok = writer.embedImage(workbook, drawing, 0, 0,
                    new EmbeddedImage("y", XlsxFixtures.png(2, 2), ImageFormat.PNG));

            assertFalse(empty.embedded());
            assertEquals("图片数据为空", empty.failureReason());
            assertTrue(ok.embedded());
            assertNull(ok.failureReason());
        }
    }

    @Test
    void unparsableFormulaFailsWithoutLeavingOutput() {
        List<List<StyledCellValue>> grid = List.of(
                List.of(StyledCellValue.of(CellValue.formula("=SUM(A1:"), null)));
        Path output = tempDir.resolve("broken.xlsx");

        ExcelWriteException e = assertThrows(ExcelWriteException.class,
                () -> writer.write(grid, WorksheetMetadata.empty(), output, new ArrayList<>()));

        assertEquals("WRITE_ERROR", e.getCode());
        assertFalse(Files.exists(output));
    }

    @Test
    void columnWidthIsCappedAtExcelMaximum() {
        assertEquals(255 * 256, WorkbookWriter.toColumnWidthUnits(400));
        assertEquals(0, WorkbookWriter.toColumnWidthUnits(-1));
        assertEquals(2560, WorkbookWriter.toColumnWidthUnits(10));
    }
}

package com.example.excelsplit.service.excel;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorksheetMetadataParserTest {

    private static final String STYLES = "<styleSheet xmlns=\"" + XlsxFixtures.MAIN_NS + "\">"
            + "<numFmts><numFmt numFmtId=\"170\" formatCode=\"0.0%\"/></numFmts>"
            + "<fills><fill><patternFill patternType=\"none\"/></fill>"
            + "<fill><patternFill patternType=\"solid\"><fgColor rgb=\"FF00B050\"/></patternFill></fill></fills>"
            + "<cellXfs><xf numFmtId=\"0\" fillId=\"0\"/><xf numFmtId=\"170\" fillId=\"1\"/><xf numFmtId=\"0\" fillId=\"0\"/></cellXfs>"
            + "</styleSheet>";

    private static final String SHEET = XlsxFixtures.worksheet(
            "<sheetFormatPr defaultRowHeight=\"15\" defaultColWidth=\"10.5\"/>"
                    + "<cols><col min=\"1\" max=\"2\" width=\"20\" customWidth=\"1\"/><col min=\"5\" max=\"5\" width=\"3.25\"/></cols>"
                    + "<sheetData>"
                    + "<row r=\"1\"><c r=\"A1\" s=\"1\" t=\"s\"><v>0</v></c><c r=\"B1\" s=\"2\"><v>3</v></c></row>"
                    + "<row r=\"2\"><c r=\"C2\"><f>A1*2</f><v>6</v></c>"
                    + "<c r=\"D2\" t=\"str\"><f>_xlfn.DISPIMG(\"ID_1\",1)</f><v>=DISPIMG(\"ID_1\",1)</v></c></row>"
                    + "</sheetData>"
                    + "<mergeCells count=\"2\"><mergeCell ref=\"A3:A5\"/><mergeCell ref=\"M5:M7\"/></mergeCells>");

    private static WorksheetMetadata parse() {
        StylesCatalog styles = StylesCatalog.parse(STYLES.getBytes(StandardCharsets.UTF_8));
        return WorksheetMetadataParser.parse(SHEET.getBytes(StandardCharsets.UTF_8), styles);
    }

    @Test
    void collectsMergedRegions() {
        assertEquals(List.of(new MergedRegion(2, 0, 4, 0), new MergedRegion(4, 12, 6, 12)), parse().mergedRegions());
    }

    @Test
    void expandsColumnWidthRanges() {
        WorksheetMetadata metadata = parse();

        assertEquals(20.0, metadata.columnWidth(0));
        assertEquals(20.0, metadata.columnWidth(1));
        assertEquals(3.25, metadata.columnWidth(4));
        assertEquals(10.5, metadata.columnWidth(2));
        assertEquals(10.5, metadata.defaultColumnWidth());
    }

    @Test
    void storesOnlyNonDefaultStyles() {
        WorksheetMetadata metadata = parse();

        assertEquals(new CellStyle("0.0%", "00B050"), metadata.styleAt(0, 0));
        assertNull(metadata.styleAt(0, 1));
        assertEquals(1, metadata.cellStyles().size());
    }

    @Test
    void formulasArePrefixedWithEquals() {
        WorksheetMetadata metadata = parse();

        assertEquals("=A1*2", metadata.formulaAt(1, 2));
        assertEquals("=_xlfn.DISPIMG(\"ID_1\",1)", metadata.formulaAt(1, 3));
        assertNull(metadata.formulaAt(0, 0));
    }

    @Test
    void fallsBackToStandardColumnWidth() {
        WorksheetMetadata metadata = WorksheetMetadataParser.parse(
                XlsxFixtures.worksheet("<sheetData/>").getBytes(StandardCharsets.UTF_8), StylesCatalog.empty());

        assertEquals(WorksheetMetadata.FALLBACK_COLUMN_WIDTH, metadata.columnWidth(7));
        assertTrue(metadata.mergedRegions().isEmpty());
    }

    @Test
    void metadataCollectionsAreImmutable() {
        WorksheetMetadata metadata = parse();

        assertThrows(UnsupportedOperationException.class, () -> metadata.mergedRegions().clear());
        assertThrows(UnsupportedOperationException.class, () -> metadata.cellFormulas().clear());
    }
}

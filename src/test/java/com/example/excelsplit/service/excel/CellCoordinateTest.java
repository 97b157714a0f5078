package com.example.excelsplit.service.excel;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellCoordinateTest {

    @Test
    void parsesColumnLettersAsBase26() {
        assertEquals(CellCoordinate.of(0, 0), CellCoordinate.parse("A1").orElseThrow());
        assertEquals(CellCoordinate.of(1, 1), CellCoordinate.parse("B2").orElseThrow());
        assertEquals(CellCoordinate.of(9, 25), CellCoordinate.parse("Z10").orElseThrow());
        assertEquals(CellCoordinate.of(0, 26), CellCoordinate.parse("AA1").orElseThrow());
        assertEquals(CellCoordinate.of(99, 27), CellCoordinate.parse("ab100").orElseThrow());
    }

    @Test
    void ignoresAbsoluteMarkers() {
        assertEquals(CellCoordinate.of(1, 1), CellCoordinate.parse("$B$2").orElseThrow());
    }

    @Test
    void rejectsMalformedReferences() {
        assertTrue(CellCoordinate.parse(null).isEmpty());
        assertTrue(CellCoordinate.parse("").isEmpty());
        assertTrue(CellCoordinate.parse("A0").isEmpty());
        assertTrue(CellCoordinate.parse("12").isEmpty());
        assertTrue(CellCoordinate.parse("B").isEmpty());
        assertTrue(CellCoordinate.parse("1A").isEmpty());
        assertTrue(CellCoordinate.parse("A1B").isEmpty());
        assertTrue(CellCoordinate.parse("中1").isEmpty());
        assertTrue(CellCoordinate.parse("Sheet1!A1").isEmpty());
        assertTrue(CellCoordinate.parse("A99999999999").isEmpty());
    }

    @Test
    void rejectsReferencesOutsideTheSheet() {
        assertEquals(CellCoordinate.of(1048575, 16383), CellCoordinate.parse("XFD1048576").orElseThrow());
        assertTrue(CellCoordinate.parse("XFE1").isEmpty());
        assertTrue(CellCoordinate.parse("A1048577").isEmpty());
    }

    @Test
    void parsesMergedRange() {
        MergedRegion region = MergedRegion.parse("A1:B3").orElseThrow();

        assertEquals(new MergedRegion(0, 0, 2, 1), region);
        assertEquals(3, region.rowCount());
        assertTrue(region.contains(2, 1));
        assertFalse(region.contains(3, 0));
        assertTrue(region.spansColumn(1));
        assertFalse(region.spansColumn(2));
        assertEquals(CellCoordinate.of(0, 0), region.start());
    }

    @Test
    void rejectsIncompleteRange() {
        assertTrue(MergedRegion.parse("A1").isEmpty());
        assertTrue(MergedRegion.parse("A1:").isEmpty());
        assertTrue(MergedRegion.parse("A1:B2:C3").isEmpty());
        assertTrue(MergedRegion.parse(null).isEmpty());
    }

    @Test
    void rejectsInvalidRangeEnds() {
        assertTrue(MergedRegion.parse("中1:B2").isEmpty());
        assertTrue(MergedRegion.parse("A1:XFE2").isEmpty());
        assertTrue(MergedRegion.parse("C3:A1").isEmpty());
        assertTrue(MergedRegion.parse("A:B").isEmpty());
        assertEquals(new MergedRegion(1, 9, 3, 10), MergedRegion.parse("$J$2:$K$4").orElseThrow());
    }
}

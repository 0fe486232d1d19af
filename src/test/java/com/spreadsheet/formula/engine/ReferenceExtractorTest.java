package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.InvalidAddressException;
import com.spreadsheet.formula.exceptions.LexException;
import com.spreadsheet.formula.models.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceExtractorTest {

    private ReferenceExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ReferenceExtractor(new FormulaLexer());
    }

    @Test
    void testRangeIsExpanded() {
        assertEquals(Arrays.asList("A1", "A2", "A3"), extractor.extractReferences("=SUM(A1:A3)"));
    }

    @Test
    void testRectangleIsRowMajor() {
        assertEquals(Arrays.asList("A1", "B1", "A2", "B2"), extractor.extractReferences("=SUM(A1:B2)"));
        // Corners in any order cover the same cells
        assertEquals(Arrays.asList("A1", "B1", "A2", "B2"), extractor.extractReferences("=SUM(B2:A1)"));
    }

    @Test
    void testFormulaOrderAndDuplicatesAreKept() {
        assertEquals(Arrays.asList("B1", "A1", "B1"), extractor.extractReferences("=B1+A1*B1"));
    }

    @Test
    void testNoReferences() {
        assertEquals(Collections.emptyList(), extractor.extractReferences("=1+2"));
        assertEquals(Collections.emptyList(), extractor.extractReferences("=UPPER(\"A1\")"));
    }

    @Test
    void testAbsoluteMarkersAreIgnored() {
        List<CellAddress> refs = extractor.extractAddresses("=$A$1+B$2");
        assertEquals(Arrays.asList(CellAddress.fromText("A1"), CellAddress.fromText("B2")), refs);
    }

    @Test
    void testOversizedRangeIsRejected() {
        assertThrows(InvalidAddressException.class, () -> extractor.extractReferences("=SUM(A1:ZZZ100000000)"));
        assertThrows(InvalidAddressException.class, () -> extractor.extractReferences("=SUM(A1:ZZ1000000)"));
        // Exactly at the limit is still expanded
        assertEquals(1_000_000, ReferenceExtractor.expandRange(
                CellAddress.fromText("A1"), CellAddress.fromText("J100000")).size());
    }

    @Test
    void testLexErrorsPropagate() {
        assertThrows(LexException.class, () -> extractor.extractReferences("=A1 # 2"));
    }
}

package com.spreadsheet.formula.models;

import com.spreadsheet.formula.exceptions.InvalidAddressException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    @Test
    void testColumnLettersAreBase26WithoutZero() {
        assertEquals(0, CellAddress.lettersToColumn("A"));
        assertEquals(25, CellAddress.lettersToColumn("Z"));
        assertEquals(26, CellAddress.lettersToColumn("AA"));
        assertEquals(701, CellAddress.lettersToColumn("ZZ"));
        assertEquals(702, CellAddress.lettersToColumn("AAA"));

        assertEquals("A", CellAddress.columnToLetters(0));
        assertEquals("Z", CellAddress.columnToLetters(25));
        assertEquals("AA", CellAddress.columnToLetters(26));
        assertEquals("AAA", CellAddress.columnToLetters(702));
    }

    @Test
    void testTextRoundTrip() {
        CellAddress address = CellAddress.fromText("B12");
        assertEquals(11, address.getRow());
        assertEquals(1, address.getCol());
        assertEquals("B12", address.toText());
        assertEquals(address, CellAddress.fromText(new CellAddress(11, 1).toText()));
    }

    /**
     * Lowercase, row 0, missing parts and negative coordinates are all rejected.
     */
    @Test
    void testInvalidAddresses() {
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromText("A0"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromText("a1"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromText("12"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromText("AB"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromText(null));
        assertThrows(InvalidAddressException.class, () -> new CellAddress(-1, 0));
        assertFalse(CellAddress.isAddress("1A"));
        assertTrue(CellAddress.isAddress("XFD1048576"));
    }

    @Test
    void testOrderingIsRowMajor() {
        assertTrue(CellAddress.fromText("B1").compareTo(CellAddress.fromText("A2")) < 0);
        assertTrue(CellAddress.fromText("A2").compareTo(CellAddress.fromText("B2")) < 0);
        assertEquals(0, CellAddress.fromText("C3").compareTo(CellAddress.of(2, 2)));
    }
}

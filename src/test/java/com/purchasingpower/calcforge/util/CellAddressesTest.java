package com.purchasingpower.calcforge.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cell Addresses Tests")
class CellAddressesTest {

    private Locale originalLocale;

    @BeforeEach
    void setUp() {
        originalLocale = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(originalLocale);
    }

    @Test
    @DisplayName("Should upper-case column letters the same way under a Turkish default locale")
    void testNormalize_ShouldIgnoreDefaultLocale() {
        assertEquals("Data!I10", CellAddresses.normalize("$i$10", "Data"));
        assertEquals("Data!AI2:AI4", CellAddresses.normalize("'Data'!ai2:ai4", null));
        assertEquals("Data!I3", CellAddresses.qualify("Data", "i3"));
    }

    @Test
    @DisplayName("Should map lower-case column letters to their index")
    void testColumnIndex_ShouldHandleLowerCaseI() {
        assertEquals(9, CellAddresses.columnIndex("i"));
        assertEquals(35, CellAddresses.columnIndex("ai"));
        assertEquals("AI", CellAddresses.columnLetters(35));
    }
}

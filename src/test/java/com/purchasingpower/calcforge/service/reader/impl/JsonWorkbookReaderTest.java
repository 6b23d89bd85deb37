package com.purchasingpower.calcforge.service.reader.impl;

import com.purchasingpower.calcforge.exception.WorkbookReadException;
import com.purchasingpower.calcforge.model.workbook.CellDataType;
import com.purchasingpower.calcforge.model.workbook.RawCell;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Workbook Reader Tests")
class JsonWorkbookReaderTest {

    @TempDir
    Path tempDir;

    private JsonWorkbookReader reader;

    @BeforeEach
    void setUp() {
        reader = new JsonWorkbookReader();
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("Should read a JSON export and ignore unknown properties")
    void testRead_ShouldParseJson() throws IOException {
        Path file = write("budget.json", "{"
                + "\"fileName\": \"budget.xlsx\","
                + "\"exportedBy\": \"reader 2.1\","
                + "\"sheets\": [{\"name\": \"Budget\", \"cells\": ["
                + "{\"coordinate\": \"A1\", \"value\": \"Total\", \"bold\": true, \"dataType\": \"s\"},"
                + "{\"coordinate\": \"B1\", \"formula\": \"=SUM(B2:B3)\", \"dataType\": \"f\"},"
                + "{\"coordinate\": \"B2\", \"value\": 12.5, \"dataType\": \"n\"}"
                + "]}],"
                + "\"namedRanges\": [{\"name\": \"Items\", \"reference\": \"Budget!$B$2:$B$3\"}]"
                + "}");

        WorkbookStructure workbook = reader.read(file);

        assertEquals("budget.xlsx", workbook.getFileName());
        assertEquals(1, workbook.getSheets().size());
        assertEquals(3, workbook.getSheets().get(0).getCells().size());
        RawCell total = workbook.getSheets().get(0).getCells().get(0);
        assertTrue(total.isBold());
        assertEquals(CellDataType.TEXT, total.getDataType());
        RawCell sum = workbook.getSheets().get(0).getCells().get(1);
        assertTrue(sum.hasFormula());
        assertEquals(CellDataType.FORMULA, sum.getDataType());
        assertEquals(12.5, workbook.getSheets().get(0).getCells().get(2).getValue());
        assertEquals("Budget!$B$2:$B$3", workbook.getNamedRanges().get(0).getReference());
        assertTrue(workbook.getDataValidations().isEmpty());
    }

    @Test
    @DisplayName("Should read YAML exports by extension and default the file name")
    void testRead_ShouldParseYaml() throws IOException {
        Path file = write("rates.yaml", String.join("\n",
                "sheets:",
                "  - name: Rates",
                "    cells:",
                "      - coordinate: A1",
                "        value: 3",
                "      - coordinate: B1",
                "        formula: \"=A1*2\"",
                ""));

        WorkbookStructure workbook = reader.read(file);

        assertEquals("rates.yaml", workbook.getFileName());
        assertEquals("Rates", workbook.getSheets().get(0).getName());
        assertEquals("=A1*2", workbook.getSheets().get(0).getCells().get(1).getFormula());
    }

    @Test
    @DisplayName("Should fail when the export does not exist")
    void testRead_ShouldRejectMissingFile() {
        Path missing = tempDir.resolve("missing.json");

        WorkbookReadException error = assertThrows(WorkbookReadException.class, () -> reader.read(missing));
        assertEquals("Workbook export not found", error.getMessage());
        assertEquals(missing.toString(), error.getWorkbookPath());
    }

    @Test
    @DisplayName("Should fail on malformed JSON")
    void testRead_ShouldRejectMalformedJson() throws IOException {
        Path file = write("broken.json", "{\"sheets\": [");

        WorkbookReadException error = assertThrows(WorkbookReadException.class, () -> reader.read(file));
        assertTrue(error.getMessage().startsWith("Failed to parse workbook export"));
        assertNotNull(error.getCause());
    }

    @Test
    @DisplayName("Should fail when the export has no sheets")
    void testRead_ShouldRejectWorkbookWithoutSheets() throws IOException {
        Path file = write("empty.json", "{\"fileName\": \"empty.xlsx\", \"sheets\": []}");

        WorkbookReadException error = assertThrows(WorkbookReadException.class, () -> reader.read(file));
        assertEquals("Workbook has no sheets", error.getMessage());
    }
}

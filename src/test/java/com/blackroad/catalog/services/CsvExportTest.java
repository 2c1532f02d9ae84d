package com.blackroad.catalog.services;

import com.blackroad.catalog.models.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvExportTest {

    @TempDir
    Path dir;

    private Path db;
    private ProductCatalog catalog;

    @BeforeEach
    void setUp() {
        db = dir.resolve("catalog.db");
        catalog = new ProductCatalog(CatalogConfig.of(db));
    }

    private static List<String> lines(String csv) {
        return List.of(csv.split("\r\n"));
    }

    @Test
    void emptyCatalogExportsHeaderOnly() {
        assertEquals("SKU,Name,Category,Price,Cost,Margin%,Inventory,Unit,Status,Active\r\n", catalog.exportCsv());
    }

    @Test
    void rowsCarryFormattedNumbersAndDerivedFields() {
        catalog.add("w-1", "Widget", "Widgets", 100, 70, 12, "ea", "");
        catalog.add("g-1", "Gadget", "Gadgets", 3, 1, 4, "box", "");

        List<String> rows = lines(catalog.exportCsv());

        assertEquals(3, rows.size());
        assertEquals("G-1,Gadget,Gadgets,3.00,1.00,66.7,4,box,LOW_STOCK,True", rows.get(1));
        assertEquals("W-1,Widget,Widgets,100.00,70.00,30.0,12,ea,IN_STOCK,True", rows.get(2));
    }

    @Test
    void includesInactiveProductsExactlyOnce() throws Exception {
        for (int i = 0; i < 60; i++)
            catalog.add(String.format("S%02d", i), "Item " + i, "Bulk", 1.5, 0.5, i);
        CatalogTestSupport.deactivate(db, "S07");

        List<String> rows = lines(catalog.exportCsv());

        assertEquals(61, rows.size());
        long s07 = rows.stream().filter(r -> r.startsWith("S07,")).count();
        assertEquals(1, s07);
        assertTrue(rows.stream().anyMatch(r -> r.startsWith("S07,") && r.endsWith(",False")));
        for (String row : rows.subList(1, rows.size())) {
            String[] f = row.split(",");
            assertTrue(f[3].matches("\\d+\\.\\d{2}"), row);
            assertTrue(f[4].matches("\\d+\\.\\d{2}"), row);
            assertTrue(f[5].matches("-?\\d+\\.\\d"), row);
        }
    }

    @Test
    void fieldsWithSeparatorsAreQuoted() {
        Product p = new Product("Q-1", "Pens, blue \"fine\"", "Office", 2, 1, 0, "pk", "");
        String csv = CsvExporter.toCsv(List.of(p));

        assertEquals("Q-1,\"Pens, blue \"\"fine\"\"\",Office,2.00,1.00,50.0,0,pk,OUT_OF_STOCK,True",
                lines(csv).get(1));
    }

    @Test
    void writesFileAndReturnsSameText() throws IOException {
        catalog.add("F-1", "Filed", "Misc", 5, 2, 1);
        Path out = dir.resolve("out.csv");
        Files.writeString(out, "stale content that is longer than the export should be ....................");

        String csv = catalog.exportCsv(out);

        assertEquals(csv, Files.readString(out, StandardCharsets.UTF_8));
        assertTrue(csv.contains("F-1,Filed,Misc,5.00,2.00,60.0,1,ea,LOW_STOCK,True"));
    }

    @Test
    void missingParentDirectoryFailsWithIOException() {
        assertThrows(NoSuchFileException.class, () -> catalog.exportCsv(dir.resolve("nope").resolve("x.csv")));
    }

    @Test
    void nullPathOnlyReturnsText() throws IOException {
        assertEquals(catalog.exportCsv(), catalog.exportCsv(null));
    }
}

package com.blackroad.catalog.ui;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CatalogAppTest {

    @TempDir
    Path home;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Path db;

    @BeforeEach
    void setUp() {
        db = home.resolve("cli.db");
    }

    private int run(String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        String[] full = new String[args.length + 3];
        full[0] = "--db";
        full[1] = db.toString();
        full[2] = "--no-color";
        System.arraycopy(args, 0, full, 3, args.length);
        CatalogApp app = new CatalogApp(home,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return app.run(full);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void addThenListShowsProduct() {
        assertEquals(0, run("add", "wid-1", "Widget", "Widgets", "12.50", "--cost", "5", "--inventory", "3"));
        assertTrue(stdout().contains("✓ Product added: [WID-1] Widget  $12.50  stock: 3"));

        assertEquals(0, run("list"));
        assertTrue(stdout().contains("Products  (1 shown)"));
        assertTrue(stdout().contains("WID-1"));
        assertTrue(stdout().contains("margin: 60.0%"));
        assertTrue(stdout().contains("[LOW_STOCK]"));
    }

    @Test
    void emptyListSaysSo() {
        assertEquals(0, run("list"));
        assertTrue(stdout().contains("No products found."));
    }

    @Test
    void duplicateAddExitsWithFailure() {
        run("add", "D-1", "Dup", "Misc", "1");
        assertEquals(1, run("add", "d-1", "Dup again", "Misc", "1"));
        assertTrue(stdout().contains("✗ SKU 'D-1' already exists"));
    }

    @Test
    void updateAdjustsAndReportsNotFound() {
        run("add", "U-1", "Updatable", "Misc", "1", "--inventory", "4");

        assertEquals(0, run("update", "u-1", "-10"));
        assertTrue(stdout().contains("inventory: -10 → 0 ea  [OUT_OF_STOCK]"));

        assertEquals(1, run("update", "nope", "3"));
        assertTrue(stdout().contains("✗ SKU 'nope' not found"));
    }

    @Test
    void searchPrintsMatches() {
        run("add", "S-1", "Widget", "Misc", "1");
        run("add", "S-2", "Gadget", "Misc", "1");

        assertEquals(0, run("search", "wid"));
        assertTrue(stdout().contains("Search: 'wid'  (1 results)"));
        assertTrue(stdout().contains("S-1"));
        assertFalse(stdout().contains("S-2"));
    }

    @Test
    void statusPrintsCountsAndCategories() {
        run("add", "A", "Alpha", "Tools", "2", "--inventory", "20");
        run("add", "B", "Beta", "Tools", "1");

        assertEquals(0, run("status"));
        String s = stdout();
        assertTrue(s.contains("Active products  :  2"));
        assertTrue(s.contains("Out of stock     :  1"));
        assertTrue(s.contains("Inventory value  :  $40.00"));
        assertTrue(s.contains("Tools"));
        assertTrue(s.contains("██ 2"));
    }

    @Test
    void statusAsJson() {
        run("add", "A", "Alpha", "Tools", "2", "--inventory", "20");

        assertEquals(0, run("--json", "status"));
        assertTrue(stdout().contains("\"inventory_value\": 40.0"));
    }

    @Test
    void exportWritesCsvFile() throws Exception {
        run("add", "E-1", "Exported", "Misc", "3", "--cost", "1");
        Path target = home.resolve("catalog.csv");

        assertEquals(0, run("export", "-o", target.toString()));
        String csv = Files.readString(target);
        assertTrue(csv.startsWith("SKU,Name,Category,Price,Cost,Margin%,Inventory,Unit,Status,Active"));
        assertTrue(csv.contains("E-1,Exported,Misc,3.00,1.00,66.7,0,ea,OUT_OF_STOCK,True"));
    }

    @Test
    void exportToXlsxUsesSpreadsheet() {
        run("add", "X-1", "Sheet", "Misc", "3");
        Path target = home.resolve("catalog.xlsx");

        assertEquals(0, run("export", "--output", target.toString()));
        assertTrue(Files.exists(target));
    }

    @Test
    void importAddsProductsFromSpreadsheet() throws Exception {
        Path file = home.resolve("in.xlsx");
        try (Workbook wb = new XSSFWorkbook()) {
            wb.createSheet("Products").createRow(0).createCell(0).setCellValue("SKU");
            Row row = wb.getSheetAt(0).createRow(1);
            row.createCell(0).setCellValue("imp-1");
            row.createCell(1).setCellValue("Imported");
            row.createCell(2).setCellValue("Misc");
            row.createCell(3).setCellValue(2.0);
            try (OutputStream os = Files.newOutputStream(file)) {
                wb.write(os);
            }
        }

        assertEquals(0, run("import", file.toString()));
        assertTrue(stdout().contains("Imported 1 products"));

        run("search", "imp-1");
        assertTrue(stdout().contains("IMP-1"));
    }

    @Test
    void importOfMissingFileFails() {
        assertEquals(1, run("import", home.resolve("absent.xlsx").toString()));
        assertTrue(stdout().contains("✗ File not found"));
    }

    @Test
    void configFileSuppliesDatabaseLocation() throws Exception {
        Path cfg = home.resolve("custom.json");
        Files.writeString(cfg, "{\"dbPath\": \"from-config.db\"}");
        CatalogApp app = new CatalogApp(home,
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        assertEquals(0, app.run(new String[]{"--config", cfg.toString(), "add", "C-1", "Cfg", "Misc", "1"}));
        assertTrue(Files.exists(home.resolve("from-config.db")));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run("add", "ONLY-SKU"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Missing argument: NAME"));

        assertEquals(2, run("update", "X", "lots"));
        assertEquals(2, run("frobnicate"));
    }

    @Test
    void helpPrintsUsage() {
        assertEquals(0, run("help"));
        assertTrue(stdout().contains("usage: product-catalog"));
    }
}

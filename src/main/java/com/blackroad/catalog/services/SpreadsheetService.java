package com.blackroad.catalog.services;

import com.blackroad.catalog.models.ImportResult;
import com.blackroad.catalog.models.Product;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Importación y exportación del catálogo en Excel (.xlsx).
 * Columnas de importación: SKU, Name, Category, Price, Cost, Inventory, Unit, Description.
 */
public class SpreadsheetService {
    private static final Logger log = LoggerFactory.getLogger(SpreadsheetService.class);

    private final ProductCatalog catalog;
    private final EventBus bus;
    private final DataFormatter formatter = new DataFormatter();

    public SpreadsheetService(ProductCatalog catalog, EventBus bus) {
        this.catalog = catalog;
        this.bus = bus;
    }

    /* ======================= Importación ======================= */

    /** Agrega los SKUs nuevos de la primera hoja; los existentes no se modifican. */
    public ImportResult importFromExcel(Path xlsxPath) throws IOException {
        if (xlsxPath == null || !Files.exists(xlsxPath))
            throw new IOException("File not found: " + xlsxPath);

        ImportResult result = new ImportResult();
        try (InputStream in = Files.newInputStream(xlsxPath);
             Workbook wb = new XSSFWorkbook(in)) {
            if (wb.getNumberOfSheets() == 0)
                return result;
            Sheet sheet = wb.getSheetAt(0);

            Set<String> seen = new HashSet<>();
            for (Row row : sheet) {
                if (row.getRowNum() == 0)
                    continue; // header

                String sku = getString(row, 0);
                if (sku.isEmpty())
                    continue;
                String key = ProductCatalog.normalizeSku(sku);

                String name = getString(row, 1);
                String category = getString(row, 2);
                Double price = getDouble(row, 3, null);
                Double cost = getDouble(row, 4, 0.0);
                Double inventory = getDouble(row, 5, 0.0);
                if (name.isEmpty() || category.isEmpty() || price == null || cost == null || inventory == null) {
                    log.warn("Skipping invalid row {} (sku {})", row.getRowNum() + 1, key);
                    result.countInvalid();
                    continue;
                }

                if (!seen.add(key) || catalog.findBySku(key).isPresent()) {
                    result.countDuplicate();
                    continue;
                }

                String unit = getString(row, 6);
                try {
                    catalog.add(key, name, category, price, cost,
                            (int) Math.max(0, Math.round(inventory)),
                            unit.isEmpty() ? "ea" : unit, getString(row, 7));
                    result.countImported();
                } catch (DuplicateSkuException e) {
                    result.countDuplicate();
                }
            }
        }

        log.info("Imported {} from {}", result, xlsxPath);
        if (bus != null)
            bus.publish(EventBus.Topic.CATALOG_IMPORTED, result);
        return result;
    }

    private String getString(Row row, int idx) {
        Cell c = row.getCell(idx);
        return c == null ? "" : formatter.formatCellValue(c).trim();
    }

    /** Celda numérica o texto con punto/coma decimal; vacía devuelve {@code def}; ilegible, null. */
    private Double getDouble(Row row, int idx, Double def) {
        Cell c = row.getCell(idx);
        if (c == null)
            return def;
        if (c.getCellType() == CellType.NUMERIC)
            return c.getNumericCellValue();
        String s = formatter.formatCellValue(c).trim().replace(",", ".");
        if (s.isEmpty())
            return def;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /* ======================= Exportación ======================= */

    /** Mismas columnas que el CSV, con celdas numéricas. */
    public int exportExcel(Path xlsxPath) throws IOException {
        List<Product> products = catalog.list(null, false, ProductCatalog.UNLIMITED);
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet("Catalog");

            CellStyle money = wb.createCellStyle();
            money.setDataFormat(wb.createDataFormat().getFormat("0.00"));
            CellStyle pct = wb.createCellStyle();
            pct.setDataFormat(wb.createDataFormat().getFormat("0.0"));

            Row header = sheet.createRow(0);
            for (int i = 0; i < CsvExporter.HEADER.size(); i++)
                header.createCell(i).setCellValue(CsvExporter.HEADER.get(i));

            int r = 1;
            for (Product p : products) {
                Row row = sheet.createRow(r++);
                row.createCell(0).setCellValue(p.getSku());
                row.createCell(1).setCellValue(p.getName());
                row.createCell(2).setCellValue(p.getCategory());
                numeric(row, 3, p.getPrice(), money);
                numeric(row, 4, p.getCost(), money);
                numeric(row, 5, p.marginPct(), pct);
                row.createCell(6).setCellValue(p.getInventory());
                row.createCell(7).setCellValue(p.getUnit());
                row.createCell(8).setCellValue(p.inventoryStatus().name());
                row.createCell(9).setCellValue(p.isActive());
            }

            try (OutputStream out = Files.newOutputStream(xlsxPath)) {
                wb.write(out);
            }
        }
        log.info("Exported {} products to {}", products.size(), xlsxPath);
        return products.size();
    }

    private void numeric(Row row, int idx, double v, CellStyle style) {
        Cell c = row.createCell(idx);
        c.setCellValue(v);
        c.setCellStyle(style);
    }
}

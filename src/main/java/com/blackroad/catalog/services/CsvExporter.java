package com.blackroad.catalog.services;

import com.blackroad.catalog.models.Product;

import java.util.List;
import java.util.Locale;

/** Texto CSV (RFC 4180) del catálogo. */
public final class CsvExporter {
    public static final List<String> HEADER = List.of(
            "SKU", "Name", "Category", "Price", "Cost", "Margin%", "Inventory", "Unit", "Status", "Active");
    private static final String EOL = "\r\n";

    private CsvExporter() {}

    public static String toCsv(List<Product> products) {
        StringBuilder sb = new StringBuilder();
        appendRow(sb, HEADER);
        for (Product p : products) {
            appendRow(sb, List.of(
                    p.getSku(), p.getName(), p.getCategory(),
                    String.format(Locale.US, "%.2f", p.getPrice()),
                    String.format(Locale.US, "%.2f", p.getCost()),
                    String.format(Locale.US, "%.1f", p.marginPct()),
                    String.valueOf(p.getInventory()),
                    p.getUnit(),
                    p.inventoryStatus().name(),
                    p.isActive() ? "True" : "False"));
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<String> fields) {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(escape(fields.get(i)));
        }
        sb.append(EOL);
    }

    static String escape(String field) {
        if (field == null)
            return "";
        if (field.indexOf(',') >= 0 || field.indexOf('"') >= 0
                || field.indexOf('\n') >= 0 || field.indexOf('\r') >= 0) {
            return '"' + field.replace("\"", "\"\"") + '"';
        }
        return field;
    }
}

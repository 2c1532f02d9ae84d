package com.blackroad.catalog.ui;

import com.blackroad.catalog.models.CatalogStats;
import com.blackroad.catalog.models.ImportResult;
import com.blackroad.catalog.models.InventoryStatus;
import com.blackroad.catalog.models.Product;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Salida de consola con colores ANSI. */
public class TerminalRenderer {
    private static final String GREEN = "\033[92m";
    private static final String CYAN = "\033[96m";
    private static final String YELLOW = "\033[93m";
    private static final String RED = "\033[91m";
    private static final String BOLD = "\033[1m";
    private static final String DIM = "\033[2m";
    private static final String RESET = "\033[0m";

    private static final String RULE = "─".repeat(70);

    private final PrintStream out;
    private final boolean color;

    public TerminalRenderer(PrintStream out, boolean color) {
        this.out = out;
        this.color = color;
    }

    private String c(String code, String text) {
        return color ? code + text + RESET : text;
    }

    private String inventoryColor(InventoryStatus s) {
        switch (s) {
            case OUT_OF_STOCK:
                return RED;
            case LOW_STOCK:
                return YELLOW;
            default:
                return GREEN;
        }
    }

    private String marginColor(double margin) {
        if (margin >= 30) return GREEN;
        if (margin >= 10) return YELLOW;
        return RED;
    }

    public void header(String title) {
        out.println();
        out.println(c(BOLD + CYAN, RULE));
        out.println(c(BOLD + CYAN, "  " + title));
        out.println(c(BOLD + CYAN, RULE));
        out.println();
    }

    public void product(Product p) {
        String inv = inventoryColor(p.inventoryStatus());
        double margin = p.marginPct();
        out.println("  " + c(BOLD + CYAN, String.format("%-14s", p.getSku())) + "  " + c(GREEN, p.getName()));
        out.println("  " + " ".repeat(14) + "  cat: " + c(YELLOW, p.getCategory())
                + "  price: " + c(BOLD, String.format(Locale.US, "$%.2f", p.getPrice()))
                + "  margin: " + c(marginColor(margin), String.format(Locale.US, "%.1f%%", margin))
                + "  stock: " + c(inv, p.getInventory() + " " + p.getUnit())
                + "  [" + c(inv, p.inventoryStatus().name()) + "]");
        out.println();
    }

    public void productList(String title, List<Product> products) {
        header(title);
        if (products.isEmpty()) {
            out.println("  " + c(DIM, "No products found.") + "\n");
            return;
        }
        for (Product p : products)
            product(p);
    }

    public void added(Product p) {
        out.println();
        out.println(c(GREEN, "✓ Product added:") + " [" + p.getSku() + "] " + p.getName()
                + String.format(Locale.US, "  $%.2f", p.getPrice()) + "  stock: " + p.getInventory());
        out.println();
    }

    public void inventoryUpdated(Product p, int delta) {
        String inv = inventoryColor(p.inventoryStatus());
        out.println();
        out.println(c(GREEN, "✓ " + p.getSku()) + " inventory: " + (delta >= 0 ? "+" : "") + delta
                + " → " + p.getInventory() + " " + p.getUnit()
                + "  [" + c(inv, p.inventoryStatus().name()) + "]");
        out.println();
    }

    public void failure(String message) {
        out.println();
        out.println(c(RED, "✗ " + message));
        out.println();
    }

    public void success(String message) {
        out.println();
        out.println(c(GREEN, "✓ " + message));
        out.println();
    }

    public void status(CatalogStats s) {
        header("Product Catalog — Status");
        out.println("  " + c(YELLOW, "Active products  :") + "  " + s.getTotal());
        out.println("  " + c(GREEN, "In stock         :") + "  " + s.getInStock());
        out.println("  " + c(YELLOW, "Low stock        :") + "  " + s.getLowStock());
        out.println("  " + c(RED, "Out of stock     :") + "  " + s.getOutOfStock());
        out.println("  " + c(YELLOW, "Inventory value  :") + "  "
                + String.format(Locale.US, "$%,.2f", s.getInventoryValue()));
        if (!s.getCategories().isEmpty()) {
            out.println();
            out.println("  " + c(BOLD, "Categories:"));
            for (Map.Entry<String, Integer> e : s.getCategories().entrySet()) {
                String bar = "█".repeat(Math.min(e.getValue(), 25));
                out.println("    " + String.format("%-20s", e.getKey()) + " " + c(CYAN, bar) + " " + e.getValue());
            }
        }
        out.println();
    }

    public void imported(ImportResult r, String source) {
        success("Imported " + r.getImported() + " products from " + source
                + " (duplicates skipped: " + r.getDuplicates() + ", invalid rows: " + r.getInvalid() + ")");
    }

    public void raw(String text) {
        out.println(text);
    }
}

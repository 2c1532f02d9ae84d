package com.blackroad.catalog.models;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/** Resumen del catálogo, solo productos activos. */
public class CatalogStats {
    private final int total;
    private final int outOfStock;
    private final int lowStock;
    private final double inventoryValue;
    private final SortedMap<String, Integer> categories;

    public CatalogStats(int total, int outOfStock, int lowStock, double inventoryValue,
                        SortedMap<String, Integer> categories) {
        this.total = total;
        this.outOfStock = outOfStock;
        this.lowStock = lowStock;
        this.inventoryValue = inventoryValue;
        this.categories = Collections.unmodifiableSortedMap(
                categories == null ? new TreeMap<>() : new TreeMap<>(categories));
    }

    public int getTotal() { return total; }
    public int getOutOfStock() { return outOfStock; }
    public int getLowStock() { return lowStock; }
    public int getInStock() { return total - outOfStock - lowStock; }
    public double getInventoryValue() { return inventoryValue; }
    public SortedMap<String, Integer> getCategories() { return categories; }
}

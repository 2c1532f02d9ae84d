package com.blackroad.catalog.models;

public enum InventoryStatus {
    OUT_OF_STOCK, LOW_STOCK, IN_STOCK;

    /** Umbral por debajo del cual el stock se considera bajo. */
    public static final int LOW_STOCK_THRESHOLD = 10;

    public static InventoryStatus of(int inventory) {
        if (inventory <= 0) return OUT_OF_STOCK;
        if (inventory < LOW_STOCK_THRESHOLD) return LOW_STOCK;
        return IN_STOCK;
    }
}

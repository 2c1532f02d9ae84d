package com.blackroad.catalog.services;

public class DuplicateSkuException extends CatalogException {
    private final String sku;

    public DuplicateSkuException(String sku, Throwable cause) {
        super("SKU already exists: " + sku, cause);
        this.sku = sku;
    }

    public String getSku() { return sku; }
}

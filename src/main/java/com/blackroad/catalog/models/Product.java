package com.blackroad.catalog.models;

import java.time.LocalDateTime;

public class Product {
    private Long id;                 // asignado por la base al insertar
    private String sku;              // código único, siempre en mayúsculas
    private String name;
    private String category;
    private double price;
    private double cost;
    private int inventory;           // nunca negativo
    private String unit = "ea";
    private String description = "";
    private boolean active = true;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public Product() {}

    public Product(String sku, String name, String category, double price, double cost,
                   int inventory, String unit, String description) {
        this.sku = sku;
        this.name = name;
        this.category = category;
        this.price = price;
        this.cost = cost;
        this.inventory = inventory;
        this.unit = unit;
        this.description = description;
    }

    /** Margen sobre precio en %, 2 decimales. 0 si el precio no es positivo. */
    public double marginPct() {
        if (price <= 0)
            return 0.0;
        return Math.round((price - cost) / price * 100.0 * 100.0) / 100.0;
    }

    public InventoryStatus inventoryStatus() {
        return InventoryStatus.of(inventory);
    }

    public Long getId() { return id; }
    public String getSku() { return sku; }
    public String getName() { return name; }
    public String getCategory() { return category; }
    public double getPrice() { return price; }
    public double getCost() { return cost; }
    public int getInventory() { return inventory; }
    public String getUnit() { return unit; }
    public String getDescription() { return description; }
    public boolean isActive() { return active; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    public void setId(Long id) { this.id = id; }
    public void setSku(String sku) { this.sku = sku; }
    public void setName(String name) { this.name = name; }
    public void setCategory(String category) { this.category = category; }
    public void setPrice(double price) { this.price = price; }
    public void setCost(double cost) { this.cost = cost; }
    public void setInventory(int inventory) { this.inventory = inventory; }
    public void setUnit(String unit) { this.unit = unit; }
    public void setDescription(String description) { this.description = description; }
    public void setActive(boolean active) { this.active = active; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "Product[" + sku + " " + name + " (" + category + ") inv=" + inventory + "]";
    }
}

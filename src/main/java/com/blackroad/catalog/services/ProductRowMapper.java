package com.blackroad.catalog.services;

import com.blackroad.catalog.models.Product;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/** Mapeo fila de {@code products} a {@link Product}. */
final class ProductRowMapper {
    static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    /** Columnas en el orden que se seleccionan; todas las consultas usan esta lista. */
    static final String COLUMNS = "id, sku, name, category, price, cost, inventory, unit, "
            + "description, active, created_at, updated_at";

    private ProductRowMapper() {}

    static Product map(ResultSet rs) throws SQLException {
        Product p = new Product();
        p.setId(rs.getLong("id"));
        p.setSku(rs.getString("sku"));
        p.setName(rs.getString("name"));
        p.setCategory(rs.getString("category"));
        p.setPrice(rs.getDouble("price"));
        p.setCost(rs.getDouble("cost"));
        p.setInventory(rs.getInt("inventory"));
        p.setUnit(orEmpty(rs.getString("unit"), "ea"));
        p.setDescription(orEmpty(rs.getString("description"), ""));
        p.setActive(rs.getInt("active") != 0);
        p.setCreatedAt(parseTimestamp(rs.getString("created_at")));
        p.setUpdatedAt(parseTimestamp(rs.getString("updated_at")));
        return p;
    }

    static String formatTimestamp(LocalDateTime t) {
        return ISO.format(t);
    }

    private static LocalDateTime parseTimestamp(String s) {
        return s == null || s.isBlank() ? null : LocalDateTime.parse(s, ISO);
    }

    private static String orEmpty(String v, String def) {
        return v == null ? def : v;
    }
}

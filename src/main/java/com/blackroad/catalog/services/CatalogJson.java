package com.blackroad.catalog.services;

import com.blackroad.catalog.models.CatalogStats;
import com.blackroad.catalog.models.Product;
import com.google.gson.*;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/** Salida JSON del catálogo y lectura de configuración. */
public final class CatalogJson {
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    // Gson con adaptadores para LocalDateTime (evita errores de módulos)
    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(LocalDateTime.class,
                    (JsonSerializer<LocalDateTime>) (src, t, ctx) ->
                            src == null ? JsonNull.INSTANCE : new JsonPrimitive(ISO.format(src)))
            .registerTypeAdapter(LocalDateTime.class,
                    (JsonDeserializer<LocalDateTime>) (json, t, ctx) ->
                            (json == null || json.isJsonNull() || json.getAsString().isBlank())
                                    ? null : LocalDateTime.parse(json.getAsString(), ISO))
            .setPrettyPrinting()
            .create();

    private CatalogJson() {}

    public static Gson gson() {
        return GSON;
    }

    /** Incluye los campos derivados marginPct y status. */
    public static JsonObject toTree(Product p) {
        JsonObject o = GSON.toJsonTree(p).getAsJsonObject();
        o.addProperty("marginPct", p.marginPct());
        o.addProperty("status", p.inventoryStatus().name());
        return o;
    }

    public static String toJson(Product p) {
        return GSON.toJson(toTree(p));
    }

    public static String toJson(List<Product> products) {
        JsonArray arr = new JsonArray();
        for (Product p : products)
            arr.add(toTree(p));
        return GSON.toJson(arr);
    }

    public static String toJson(CatalogStats s) {
        JsonObject o = new JsonObject();
        o.addProperty("total", s.getTotal());
        o.addProperty("out_of_stock", s.getOutOfStock());
        o.addProperty("low_stock", s.getLowStock());
        o.addProperty("in_stock", s.getInStock());
        o.addProperty("inventory_value", s.getInventoryValue());
        o.add("categories", GSON.toJsonTree(s.getCategories()));
        return GSON.toJson(o);
    }
}

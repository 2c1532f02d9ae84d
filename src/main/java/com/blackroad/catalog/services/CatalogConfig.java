package com.blackroad.catalog.services;

import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Ubicación de la base y valores por defecto de la línea de comandos.
 * Se inyecta en {@link ProductCatalog}; el catálogo no lee estado global.
 */
public final class CatalogConfig {
    public static final int DEFAULT_LIST_LIMIT = 30;
    public static final String DEFAULT_EXPORT_PATH = "product_catalog.csv";

    private final Path dbPath;
    private final int listLimit;
    private final Path exportPath;

    public CatalogConfig(Path dbPath, int listLimit, Path exportPath) {
        this.dbPath = Objects.requireNonNull(dbPath, "dbPath");
        this.listLimit = listLimit;
        this.exportPath = exportPath == null ? Path.of(DEFAULT_EXPORT_PATH) : exportPath;
    }

    public static CatalogConfig of(Path dbPath) {
        return new CatalogConfig(dbPath, DEFAULT_LIST_LIMIT, Path.of(DEFAULT_EXPORT_PATH));
    }

    /** ~/.blackroad/product-catalog.db */
    public static CatalogConfig defaults(Path home) {
        return of(defaultDir(home).resolve("product-catalog.db"));
    }

    public static Path defaultDir(Path home) {
        return home.resolve(".blackroad");
    }

    /**
     * Lee un JSON {"dbPath": ..., "listLimit": ..., "exportPath": ...}. Las claves ausentes
     * toman los valores de {@code fallback}; las rutas relativas se resuelven contra la
     * carpeta del archivo. Si el archivo no existe devuelve {@code fallback}.
     */
    public static CatalogConfig load(Path file, CatalogConfig fallback) throws IOException {
        if (Files.notExists(file))
            return fallback;
        ConfigFile cf;
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            cf = CatalogJson.gson().fromJson(r, ConfigFile.class);
        } catch (JsonParseException e) {
            throw new IOException("Invalid config file: " + file, e);
        }
        if (cf == null)
            return fallback;

        Path base = file.toAbsolutePath().getParent();
        Path db = cf.dbPath == null || cf.dbPath.isBlank() ? fallback.dbPath : base.resolve(cf.dbPath);
        Path export = cf.exportPath == null || cf.exportPath.isBlank() ? fallback.exportPath : base.resolve(cf.exportPath);
        int limit = cf.listLimit == null ? fallback.listLimit : cf.listLimit;
        return new CatalogConfig(db, limit, export);
    }

    public CatalogConfig withDbPath(Path db) {
        return new CatalogConfig(db, listLimit, exportPath);
    }

    public Path getDbPath() { return dbPath; }
    public int getListLimit() { return listLimit; }
    public Path getExportPath() { return exportPath; }

    String jdbcUrl() {
        return "jdbc:sqlite:" + dbPath.toAbsolutePath();
    }

    // Forma del archivo en disco
    private static class ConfigFile {
        String dbPath;
        Integer listLimit;
        String exportPath;
    }
}

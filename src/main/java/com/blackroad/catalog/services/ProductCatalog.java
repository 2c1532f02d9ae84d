package com.blackroad.catalog.services;

import com.blackroad.catalog.models.CatalogStats;
import com.blackroad.catalog.models.InventoryStatus;
import com.blackroad.catalog.models.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.sql.*;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Catálogo de productos sobre un archivo SQLite.
 * Cada operación abre su propia conexión y la cierra al terminar.
 */
public class ProductCatalog {
    private static final Logger log = LoggerFactory.getLogger(ProductCatalog.class);

    public static final int DEFAULT_LIMIT = 50;
    /** Sin tope de filas (LIMIT -1 en SQLite). */
    public static final int UNLIMITED = -1;

    private static final String SCHEMA = "CREATE TABLE IF NOT EXISTS products ("
            + " id          INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " sku         TEXT UNIQUE NOT NULL,"
            + " name        TEXT NOT NULL,"
            + " category    TEXT NOT NULL,"
            + " price       REAL NOT NULL,"
            + " cost        REAL DEFAULT 0,"
            + " inventory   INTEGER DEFAULT 0,"
            + " unit        TEXT DEFAULT 'ea',"
            + " description TEXT DEFAULT '',"
            + " active      INTEGER DEFAULT 1,"
            + " created_at  TEXT NOT NULL,"
            + " updated_at  TEXT NOT NULL)";

    private final CatalogConfig config;
    private final EventBus bus;
    private final Clock clock;

    public ProductCatalog(CatalogConfig config) {
        this(config, null);
    }

    public ProductCatalog(CatalogConfig config, EventBus bus) {
        this(config, bus, Clock.systemDefaultZone());
    }

    public ProductCatalog(CatalogConfig config, EventBus bus, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.bus = bus;
        this.clock = clock;
        ensureParentDir();
        initialize();
    }

    private void ensureParentDir() {
        Path parent = config.getDbPath().toAbsolutePath().getParent();
        try {
            if (parent != null && Files.notExists(parent)) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new CatalogException("Could not create catalog directory: " + parent, e);
        }
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(config.jdbcUrl());
    }

    /* ======================= Esquema ======================= */

    /** Crea tabla e índices si faltan. Se puede llamar en cada arranque. */
    public void initialize() {
        try (Connection conn = connect(); Statement st = conn.createStatement()) {
            st.execute(SCHEMA);
            st.execute("CREATE INDEX IF NOT EXISTS idx_products_sku ON products(sku)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_products_category ON products(category)");
        } catch (SQLException e) {
            throw new CatalogException("Could not initialize catalog at " + config.getDbPath(), e);
        }
        log.debug("Catalog ready at {}", config.getDbPath());
    }

    /* ======================= Escritura ======================= */

    public Product add(String sku, String name, String category, double price) {
        return add(sku, name, category, price, 0.0, 0, "ea", "");
    }

    public Product add(String sku, String name, String category, double price, double cost, int inventory) {
        return add(sku, name, category, price, cost, inventory, "ea", "");
    }

    /**
     * Inserta un producto nuevo. Los rangos numéricos quedan a cargo de quien llama.
     *
     * @throws DuplicateSkuException si el SKU (sin distinguir mayúsculas) ya existe
     */
    public Product add(String sku, String name, String category, double price, double cost,
                       int inventory, String unit, String description) {
        if (sku == null || sku.isBlank())
            throw new IllegalArgumentException("sku is required");
        if (name == null)
            throw new IllegalArgumentException("name is required");
        if (category == null)
            throw new IllegalArgumentException("category is required");

        Product p = new Product(normalizeSku(sku), name, category, price, cost, inventory,
                unit == null ? "ea" : unit, description == null ? "" : description);
        LocalDateTime now = LocalDateTime.now(clock);
        p.setCreatedAt(now);
        p.setUpdatedAt(now);

        String sql = "INSERT INTO products (sku, name, category, price, cost, inventory, unit,"
                + " description, active, created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection conn = connect()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, p.getSku());
                ps.setString(2, p.getName());
                ps.setString(3, p.getCategory());
                ps.setDouble(4, p.getPrice());
                ps.setDouble(5, p.getCost());
                ps.setInt(6, p.getInventory());
                ps.setString(7, p.getUnit());
                ps.setString(8, p.getDescription());
                ps.setInt(9, p.isActive() ? 1 : 0);
                ps.setString(10, ProductRowMapper.formatTimestamp(now));
                ps.setString(11, ProductRowMapper.formatTimestamp(now));
                ps.executeUpdate();
            }
            try (Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
                rs.next();
                p.setId(rs.getLong(1));
            }
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                log.warn("Rejected duplicate SKU {}", p.getSku());
                throw new DuplicateSkuException(p.getSku(), e);
            }
            throw new CatalogException("Could not add product " + p.getSku(), e);
        }

        log.info("Added product {} ({})", p.getSku(), p.getName());
        if (bus != null)
            bus.publish(EventBus.Topic.PRODUCT_ADDED, p.getSku());
        return p;
    }

    /**
     * Suma {@code delta} al inventario sin bajar de 0 ni pasar de Integer.MAX_VALUE y refresca updated_at.
     * SKU desconocido devuelve vacío y no modifica nada.
     */
    public Optional<Product> adjustInventory(String sku, int delta) {
        if (sku == null || sku.isBlank())
            return Optional.empty();
        String target = normalizeSku(sku);
        String now = ProductRowMapper.formatTimestamp(LocalDateTime.now(clock));

        Optional<Product> result;
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement("UPDATE products"
                    + " SET inventory = MIN(MAX(0, inventory + ?), " + Integer.MAX_VALUE + "), updated_at = ?"
                    + " WHERE sku = ?")) {
                ps.setInt(1, delta);
                ps.setString(2, now);
                ps.setString(3, target);
                if (ps.executeUpdate() == 0) {
                    conn.rollback();
                    log.debug("Inventory adjust skipped, unknown SKU {}", target);
                    return Optional.empty();
                }
                result = findBySku(conn, target);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new CatalogException("Could not adjust inventory for " + target, e);
        }

        result.ifPresent(p -> log.info("Inventory {} {}{} -> {}", p.getSku(), delta >= 0 ? "+" : "", delta, p.getInventory()));
        if (bus != null)
            bus.publish(EventBus.Topic.INVENTORY_CHANGED, target);
        return result;
    }

    /* ======================= Lectura / Búsqueda ======================= */

    public Optional<Product> findBySku(String sku) {
        if (sku == null || sku.isBlank())
            return Optional.empty();
        try (Connection conn = connect()) {
            return findBySku(conn, normalizeSku(sku));
        } catch (SQLException e) {
            throw new CatalogException("Could not look up " + sku, e);
        }
    }

    private Optional<Product> findBySku(Connection conn, String normalized) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + ProductRowMapper.COLUMNS + " FROM products WHERE sku = ?")) {
            ps.setString(1, normalized);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(ProductRowMapper.map(rs)) : Optional.empty();
            }
        }
    }

    public List<Product> list() {
        return list(null, true, DEFAULT_LIMIT);
    }

    /**
     * Productos ordenados por categoría y nombre.
     *
     * @param category   filtro exacto; null o vacío no filtra
     * @param activeOnly excluye inactivos
     * @param limit      tope de filas, {@link #UNLIMITED} para todas
     */
    public List<Product> list(String category, boolean activeOnly, int limit) {
        StringBuilder sql = new StringBuilder("SELECT ").append(ProductRowMapper.COLUMNS)
                .append(" FROM products WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (activeOnly)
            sql.append(" AND active = 1");
        if (category != null && !category.isEmpty()) {
            sql.append(" AND category = ?");
            params.add(category);
        }
        sql.append(" ORDER BY category, name LIMIT ?");
        params.add(limit < 0 ? UNLIMITED : limit);
        return query(sql.toString(), params);
    }

    /**
     * Coincidencia literal por subcadena en sku, nombre, categoría o descripción.
     * LIKE de SQLite ignora mayúsculas ASCII; el resto debe coincidir tal cual.
     * Consulta vacía devuelve todo.
     */
    public List<Product> search(String query) {
        String pattern = "%" + escapeLike(query == null ? "" : query) + "%";
        String sql = "SELECT " + ProductRowMapper.COLUMNS + " FROM products"
                + " WHERE sku LIKE ? ESCAPE '\\' OR name LIKE ? ESCAPE '\\'"
                + " OR category LIKE ? ESCAPE '\\' OR description LIKE ? ESCAPE '\\'"
                + " ORDER BY name";
        return query(sql, List.of(pattern, pattern, pattern, pattern));
    }

    private List<Product> query(String sql, List<Object> params) {
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++)
                ps.setObject(i + 1, params.get(i));
            List<Product> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(ProductRowMapper.map(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new CatalogException("Catalog query failed", e);
        }
    }

    /* ======================= Exportación / Estadísticas ======================= */

    public String exportCsv() {
        return CsvExporter.toCsv(list(null, false, UNLIMITED));
    }

    /** Escribe el CSV en {@code outputPath} (sobrescribe) y devuelve el texto. */
    public String exportCsv(Path outputPath) throws IOException {
        String csv = exportCsv();
        if (outputPath != null) {
            Files.writeString(outputPath, csv, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            log.info("Exported catalog CSV to {}", outputPath);
        }
        return csv;
    }

    public CatalogStats stats() {
        try (Connection conn = connect()) {
            int total = count(conn, "SELECT COUNT(*) FROM products WHERE active = 1");
            int out = count(conn, "SELECT COUNT(*) FROM products WHERE active = 1 AND inventory = 0");
            int low = count(conn, "SELECT COUNT(*) FROM products WHERE active = 1 AND inventory > 0 AND inventory < "
                    + InventoryStatus.LOW_STOCK_THRESHOLD);

            double value;
            try (Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery("SELECT SUM(price * inventory) FROM products WHERE active = 1")) {
                value = rs.next() ? rs.getDouble(1) : 0.0; // SUM de cero filas es NULL -> 0.0
            }

            SortedMap<String, Integer> categories = new TreeMap<>();
            try (Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery(
                         "SELECT category, COUNT(*) AS cnt FROM products WHERE active = 1 GROUP BY category")) {
                while (rs.next())
                    categories.put(rs.getString("category"), rs.getInt("cnt"));
            }

            return new CatalogStats(total, out, low, round2(value), categories);
        } catch (SQLException e) {
            throw new CatalogException("Could not compute catalog stats", e);
        }
    }

    private int count(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /* ======================= Helpers internos ======================= */

    public CatalogConfig getConfig() { return config; }

    static String normalizeSku(String sku) {
        return sku.trim().toUpperCase(Locale.ROOT);
    }

    static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static boolean isUniqueViolation(SQLException e) {
        return e.getErrorCode() == SQLiteErrorCode.SQLITE_CONSTRAINT.code
                && e.getMessage() != null && e.getMessage().contains("UNIQUE");
    }

    private static double round2(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

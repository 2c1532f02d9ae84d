package com.blackroad.catalog.ui;

import com.blackroad.catalog.models.ImportResult;
import com.blackroad.catalog.models.Product;
import com.blackroad.catalog.services.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Punto de entrada de línea de comandos: product-catalog &lt;comando&gt; [args]. */
public class CatalogApp {
    private static final Logger log = LoggerFactory.getLogger(CatalogApp.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    static final String USAGE_TEXT = String.join("\n",
            "usage: product-catalog [--db PATH] [--config FILE] [--json] [--no-color] <command> [args]",
            "",
            "commands:",
            "  list    [-c CATEGORY] [--all] [-n LIMIT]      List products",
            "  add     SKU NAME CATEGORY PRICE [--cost X] [--inventory N] [--unit U] [--description D]",
            "  update  SKU DELTA                           Adjust inventory (+/-)",
            "  search  QUERY                               Search products",
            "  status                                      Catalog statistics",
            "  export  [-o PATH]                           Export catalog to CSV (.xlsx for Excel)",
            "  import  FILE.xlsx                           Add new products from a spreadsheet",
            "  help                                        Show this message");

    private final Path home;
    private final PrintStream out;
    private final PrintStream err;

    public CatalogApp(Path home, PrintStream out, PrintStream err) {
        this.home = home;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        Path home = Path.of(System.getProperty("user.home"));
        System.exit(new CatalogApp(home, System.out, System.err).run(args));
    }

    public int run(String[] args) {
        CommandLine cli;
        try {
            cli = CommandLine.parse(args);
        } catch (UsageException e) {
            return usage(e.getMessage());
        }

        if (cli.flag("--help") || cli.command().equals("help")) {
            out.println(USAGE_TEXT);
            return OK;
        }

        TerminalRenderer view = new TerminalRenderer(out, !cli.flag("--no-color"));
        try {
            CatalogConfig config = resolveConfig(cli);
            EventBus bus = new EventBus();
            ProductCatalog catalog = new ProductCatalog(config, bus);
            return dispatch(cli, catalog, new SpreadsheetService(catalog, bus), view);
        } catch (UsageException e) {
            return usage(e.getMessage());
        } catch (DuplicateSkuException e) {
            view.failure("SKU '" + e.getSku() + "' already exists");
            return FAILED;
        } catch (IllegalArgumentException e) {
            return usage(e.getMessage());
        } catch (IOException | CatalogException e) {
            log.error("Command '{}' failed", cli.command(), e);
            view.failure(e.getMessage());
            return FAILED;
        }
    }

    private int usage(String message) {
        err.println("error: " + message);
        err.println(USAGE_TEXT);
        return USAGE;
    }

    /** --db tiene prioridad sobre --config, que tiene prioridad sobre ~/.blackroad/product-catalog.json. */
    CatalogConfig resolveConfig(CommandLine cli) throws IOException {
        CatalogConfig defaults = CatalogConfig.defaults(home);
        Path file = cli.option("--config").map(Path::of)
                .orElse(CatalogConfig.defaultDir(home).resolve("product-catalog.json"));
        CatalogConfig config = CatalogConfig.load(file, defaults);
        Optional<String> db = cli.option("--db");
        return db.isPresent() ? config.withDbPath(Path.of(db.get())) : config;
    }

    private int dispatch(CommandLine cli, ProductCatalog catalog, SpreadsheetService sheets,
                         TerminalRenderer view) throws IOException {
        boolean json = cli.flag("--json");
        switch (cli.command()) {
            case "list": {
                List<Product> products = catalog.list(
                        cli.option("--category").orElse(null),
                        !cli.flag("--all"),
                        cli.intOption("--limit", catalog.getConfig().getListLimit()));
                if (json) view.raw(CatalogJson.toJson(products));
                else view.productList("Products  (" + products.size() + " shown)", products);
                return OK;
            }
            case "add": {
                Product p = catalog.add(
                        cli.positional(0, "SKU"),
                        cli.positional(1, "NAME"),
                        cli.positional(2, "CATEGORY"),
                        CommandLine.parseDouble(cli.positional(3, "PRICE"), "PRICE"),
                        cli.doubleOption("--cost", 0.0),
                        cli.intOption("--inventory", 0),
                        cli.option("--unit").orElse("ea"),
                        cli.option("--description").orElse(""));
                if (json) view.raw(CatalogJson.toJson(p));
                else view.added(p);
                return OK;
            }
            case "update": {
                String sku = cli.positional(0, "SKU");
                int delta = CommandLine.parseInt(cli.positional(1, "DELTA"), "DELTA");
                Optional<Product> p = catalog.adjustInventory(sku, delta);
                if (p.isEmpty()) {
                    view.failure("SKU '" + sku + "' not found");
                    return FAILED;
                }
                if (json) view.raw(CatalogJson.toJson(p.get()));
                else view.inventoryUpdated(p.get(), delta);
                return OK;
            }
            case "search": {
                String query = cli.positional(0, "QUERY");
                List<Product> results = catalog.search(query);
                if (json) view.raw(CatalogJson.toJson(results));
                else view.productList("Search: '" + query + "'  (" + results.size() + " results)", results);
                return OK;
            }
            case "status":
                if (json) view.raw(CatalogJson.toJson(catalog.stats()));
                else view.status(catalog.stats());
                return OK;
            case "export": {
                Path target = cli.option("--output").map(Path::of).orElse(catalog.getConfig().getExportPath());
                if (target.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xlsx"))
                    sheets.exportExcel(target);
                else
                    catalog.exportCsv(target);
                view.success("Exported to: " + target);
                return OK;
            }
            case "import": {
                Path source = Path.of(cli.positional(0, "FILE"));
                ImportResult r = sheets.importFromExcel(source);
                view.imported(r, source.toString());
                return OK;
            }
            default:
                throw new UsageException("Unknown command: " + cli.command());
        }
    }
}

package com.blackroad.catalog.ui;

import java.util.*;

/**
 * Argumentos ya separados: comando, posicionales, opciones con valor y banderas.
 * Un token como {@code -5} es posicional (delta negativo), no una opción.
 */
public class CommandLine {
    private static final Set<String> FLAGS = Set.of("--all", "--json", "--no-color", "--help");
    private static final Map<String, String> ALIASES = Map.of(
            "-c", "--category",
            "-n", "--limit",
            "-o", "--output",
            "-h", "--help");

    private final String command;
    private final List<String> positionals;
    private final Map<String, String> options;
    private final Set<String> flags;

    private CommandLine(String command, List<String> positionals, Map<String, String> options, Set<String> flags) {
        this.command = command;
        this.positionals = positionals;
        this.options = options;
        this.flags = flags;
    }

    public static CommandLine parse(String[] args) {
        List<String> pos = new ArrayList<>();
        Map<String, String> opts = new HashMap<>();
        Set<String> flags = new HashSet<>();

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("-") || a.equals("-") || isNumber(a)) {
                pos.add(a);
                continue;
            }
            String name = a;
            String value = null;
            int eq = a.indexOf('=');
            if (a.startsWith("--") && eq > 0) {
                name = a.substring(0, eq);
                value = a.substring(eq + 1);
            }
            name = ALIASES.getOrDefault(name, name);

            if (FLAGS.contains(name)) {
                flags.add(name);
            } else {
                if (value == null) {
                    if (i + 1 >= args.length)
                        throw new UsageException("Missing value for " + a);
                    value = args[++i];
                }
                opts.put(name, value);
            }
        }

        String cmd = pos.isEmpty() ? "help" : pos.remove(0);
        return new CommandLine(cmd, pos, opts, flags);
    }

    private static boolean isNumber(String s) {
        return s.matches("-\\d+(\\.\\d+)?");
    }

    public String command() { return command; }

    public List<String> positionals() { return positionals; }

    public String positional(int idx, String label) {
        if (idx >= positionals.size())
            throw new UsageException("Missing argument: " + label);
        return positionals.get(idx);
    }

    public Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public boolean flag(String name) {
        return flags.contains(name);
    }

    public int intOption(String name, int def) {
        String v = options.get(name);
        return v == null ? def : parseInt(v, name);
    }

    public double doubleOption(String name, double def) {
        String v = options.get(name);
        return v == null ? def : parseDouble(v, name);
    }

    public static int parseInt(String v, String label) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid integer for " + label + ": " + v);
        }
    }

    public static double parseDouble(String v, String label) {
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid number for " + label + ": " + v);
        }
    }
}

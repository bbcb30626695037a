package de.bsommerfeld.vorg.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL from classpath resources.
 *
 * <p>
 * Single statements live under {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code select-items-for-collection.sql}, and are returned as-is.
 * Multi-statement scripts such as {@code schema.sql} are split into
 * individual statements by {@link #loadScript(String)}, because a JDBC
 * {@link java.sql.Statement} only executes one statement per call.
 *
 * <p>
 * Every resource is read once and cached for the lifetime of the JVM.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> STATEMENTS = new ConcurrentHashMap<>();
    private static final ConcurrentHashMap<String, List<String>> SCRIPTS = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement from {@code sql/<name>.sql}, trimmed.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return STATEMENTS.computeIfAbsent(name, n -> readResource("sql/" + n + ".sql").trim());
    }

    /**
     * Returns the statements of a script resource in file order. Lines
     * starting with {@code --} are dropped. A statement ends at a line ending
     * in {@code ;}, except inside {@code CREATE TRIGGER} where it ends at the
     * closing {@code END;}.
     *
     * @param resource classpath path of the script, e.g. {@code schema.sql}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> loadScript(String resource) {
        return SCRIPTS.computeIfAbsent(resource, r -> List.copyOf(splitStatements(readResource(r))));
    }

    static List<String> splitStatements(String script) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (String line : script.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("--"))
                continue;

            if (current.length() > 0)
                current.append('\n');
            current.append(line);

            boolean inTrigger = current.toString().trim().toUpperCase(Locale.ROOT).startsWith("CREATE TRIGGER");
            boolean complete = inTrigger
                    ? trimmed.equalsIgnoreCase("END;")
                    : trimmed.endsWith(";");
            if (complete) {
                statements.add(current.toString().trim());
                current.setLength(0);
            }
        }

        if (!current.toString().isBlank())
            statements.add(current.toString().trim());
        return statements;
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}

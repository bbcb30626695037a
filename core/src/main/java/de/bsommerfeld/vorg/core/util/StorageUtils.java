package de.bsommerfeld.vorg.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the per-user directories vorg keeps its own files in
 * ({@code config.toml}, logs). Repository data lives wherever the user points
 * the CLI and is unrelated to these paths.
 *
 * <p>
 * Resolution per platform:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 * Returned directories are not created.
 */
public final class StorageUtils {

    /** Name of the database file inside a repository root. */
    public static final String DEFAULT_DATABASE_FILE = "vorg.db";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null)
                return Paths.get(appData, appName);
            return Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty())
            return Paths.get(xdgData, appName);
        return Paths.get(System.getProperty("user.home"), ".local", "share", appName);
    }

    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve("config.toml");
    }

    /**
     * Returns the database location for a repository root, using
     * {@code databaseFile} when given and {@value #DEFAULT_DATABASE_FILE}
     * otherwise.
     */
    public static Path resolveDatabase(Path repositoryRoot, String databaseFile) {
        String name = databaseFile == null || databaseFile.isBlank() ? DEFAULT_DATABASE_FILE : databaseFile;
        return repositoryRoot.resolve(name);
    }
}

package com.tokenx;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration handling platform-specific paths and settings.
 */
public class AppConfig {

    private static final String APP_NAME = "TokenX";
    public static final int DEFAULT_PORT = 8765;

    private final Path vaultPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final boolean clipboardImport;

    private AppConfig(Path vaultPath, Path logPath, int port, boolean devMode, boolean clipboardImport) {
        this.vaultPath = vaultPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
        this.clipboardImport = clipboardImport;
    }

    public Path getVaultPath() {
        return vaultPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public boolean isClipboardImport() {
        return clipboardImport;
    }

    /**
     * Get the default vault directory based on the operating system.
     * Windows: %APPDATA%\TokenX\vault
     * macOS: ~/Library/Application Support/TokenX/vault
     * Linux: ~/.local/share/TokenX/vault
     */
    public static Path getDefaultVaultPath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "vault");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME, "vault");
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "vault");
        }
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\TokenX\logs
     * macOS: ~/Library/Logs/TokenX
     * Linux: ~/.local/share/TokenX/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("tokenx.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }

        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }

        // Let the server fail later with a clear bind error
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path vaultPath = null;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;
        private boolean clipboardImport = true;

        public Builder vaultPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.vaultPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--vault-dir=")) {
                    vaultPath(arg.substring("--vault-dir=".length()));
                } else if ("--vault-dir".equals(arg) && i + 1 < args.length) {
                    vaultPath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    this.preferredPort = parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.preferredPort = parsePort(args[++i]);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                } else if ("--no-clipboard".equals(arg)) {
                    this.clipboardImport = false;
                }
            }
            return this;
        }

        private int parsePort(String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return preferredPort;
            }
        }

        public AppConfig build() throws IOException {
            Path vault = vaultPath != null ? vaultPath : getDefaultVaultPath();
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(vault, logPath, port, devMode, clipboardImport);
        }
    }
}

package com.storylens;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Host configuration: where the Story Bible lives, where logs go and which port to serve on.
 */
public class AppConfig {

    public static final String APP_NAME = "StoryLens";
    private static final String DATA_DIR = ".storylens";
    private static final int DEFAULT_PORT = 7070;

    private final Path workspacePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path workspacePath, Path logPath, int port, boolean devMode) {
        this.workspacePath = workspacePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getWorkspacePath() {
        return workspacePath;
    }

    /**
     * Per-workspace folder holding entities.json and highlight-config.json.
     */
    public Path getDataPath() {
        return dataPath(workspacePath);
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

    public static Path dataPath(Path workspaceRoot) {
        return workspaceRoot.resolve(DATA_DIR);
    }

    /**
     * Windows: %USERPROFILE%\Documents\StoryLens
     * macOS: ~/Documents/StoryLens
     * Linux: ~/StoryLens
     */
    public static Path getDefaultWorkspacePath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String profile = System.getenv("USERPROFILE");
            return Paths.get(profile != null ? profile : userHome, "Documents", APP_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME);
        }
        return Paths.get(userHome, APP_NAME);
    }

    /**
     * Windows: %APPDATA%\StoryLens\logs
     * macOS: ~/Library/Logs/StoryLens
     * Linux: ~/.local/share/StoryLens/logs
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
        }
        return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
    }

    /**
     * The preferred port if free, otherwise any free port the OS hands out.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            // Let the server fail on start with a clear bind error.
            return preferredPort;
        }
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static class Builder {
        private Path workspacePath = null;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;

        public Builder workspacePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.workspacePath = Paths.get(path).toAbsolutePath().normalize();
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

        /**
         * Accepts --workspace, --port (either "--flag value" or "--flag=value") and --dev.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--workspace=")) {
                    workspacePath(arg.substring("--workspace=".length()));
                } else if ("--workspace".equals(arg) && i + 1 < args.length) {
                    workspacePath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    port(parsePort(arg.substring("--port=".length())));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    port(parsePort(args[++i]));
                } else if ("--dev".equals(arg)) {
                    devMode(true);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + arg);
                }
            }
            return this;
        }

        private static int parsePort(String value) {
            try {
                int port = Integer.parseInt(value.trim());
                if (port < 1 || port > 65535) {
                    throw new IllegalArgumentException("Port out of range: " + value);
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + value, e);
            }
        }

        public AppConfig build() throws IOException {
            Path workspace = workspacePath != null ? workspacePath : getDefaultWorkspacePath();
            Files.createDirectories(dataPath(workspace));
            int port = findAvailablePort(preferredPort);
            Path logDir = getLogDirectory();
            Files.createDirectories(logDir);
            return new AppConfig(workspace, logDir.resolve("storylens.log"), port, devMode);
        }
    }
}

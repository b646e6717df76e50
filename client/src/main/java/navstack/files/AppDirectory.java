package navstack.files;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Locates the directory where the app keeps its settings and logs. */
public class AppDirectory {
    private static String appName;
    private static Path dir;

    /** The per-user base directory for application data on this OS. */
    public static Path getUserDataDir() {
        String os = System.getProperty("os.name").toLowerCase();
        if (os.contains("win")) {
            return Paths.get(System.getenv("APPDATA"));
        } else if (os.contains("mac")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support");
        } else {
            return Paths.get(System.getProperty("user.home"), ".local", "share");
        }
    }

    /** Remembers the app name and creates its directory if needed. */
    public static Path initAppDir(String appName) throws IOException {
        AppDirectory.appName = appName;
        Path dir = dir();
        if (!Files.exists(dir))
            Files.createDirectories(dir);
        else if (!Files.isWritable(dir))
            throw new IOException("App directory " + dir + " is not writeable");
        return dir;
    }

    public static Path dir() {
        if (dir != null)
            return dir;
        if (appName == null)
            throw new IllegalStateException("initAppDir has not been called");
        return getUserDataDir().resolve(appName);
    }

    /** Points the app at another directory, for tests or a command line override. */
    public static void overrideAppDir(Path newDir) {
        if (newDir == null)
            throw new NullPointerException();
        dir = newDir;
    }
}

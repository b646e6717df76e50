package navstack;

import javafx.stage.*;
import navstack.files.*;
import org.slf4j.*;

import java.io.*;
import java.nio.file.*;
import java.time.*;
import java.util.*;

/**
 * Stores user preferences in a properties file in the app directory. Every setter writes the file straight away.
 * Access from the UI thread.
 */
public class NavPrefs {
    private static final Logger log = LoggerFactory.getLogger(NavPrefs.class);

    public static final String FILE_NAME = "settings.txt";
    public static final Duration DEFAULT_TRANSITION_DURATION = Duration.ofMillis(500);

    private final Properties prefs = new Properties();
    private final Path path;
    private final boolean prefsFileFound;

    public NavPrefs() {
        this(AppDirectory.dir().resolve(FILE_NAME));
    }

    public NavPrefs(Path path) {
        this.path = path;
        boolean found = false;
        try (InputStream stream = Files.newInputStream(path)) {
            prefs.load(stream);
            found = true;
        } catch (IOException e) {
            log.info("Could not load preferences from {}, using defaults.", path);
        }
        prefsFileFound = found;
    }

    public boolean getPrefsFileFound() {
        return prefsFileFound;
    }

    private void store() {
        try (OutputStream stream = Files.newOutputStream(path)) {
            prefs.store(stream, " Navstack settings file");
        } catch (IOException e) {
            log.error("Could not save preferences!", e);
        }
    }

    /** The route the navigator starts at. May be a deep link such as /settings/about. */
    public String getInitialRoute() {
        return prefs.getProperty("initialRoute", Navigator.DEFAULT_ROUTE_NAME);
    }

    public void setInitialRoute(String route) {
        prefs.setProperty("initialRoute", route);
        store();
    }

    public Duration getTransitionDuration() {
        String time = prefs.getProperty("transitionMsec");
        if (time == null)
            return DEFAULT_TRANSITION_DURATION;
        try {
            return Duration.ofMillis(Long.parseLong(time));
        } catch (NumberFormatException e) {
            log.warn("Bad transition time in preferences: {}", time);
            return DEFAULT_TRANSITION_DURATION;
        }
    }

    public void setTransitionDuration(Duration time) {
        prefs.setProperty("transitionMsec", Long.toString(time.toMillis()));
        store();
    }

    public boolean isLogToConsole() {
        return Boolean.parseBoolean(prefs.getProperty("logToConsole", "false"));
    }

    public void setLogToConsole(boolean logToConsole) {
        prefs.setProperty("logToConsole", Boolean.toString(logToConsole));
        store();
    }

    private double readDouble(String name, double defaultVal) {
        return Double.parseDouble(prefs.getProperty(name, Double.toString(defaultVal)));
    }

    public void readStageSettings(Stage stage) {
        double x = readDouble("windowX", -1);
        double y = readDouble("windowY", -1);
        double w = readDouble("windowWidth", -1);
        double h = readDouble("windowHeight", -1);
        if (w != -1 && h != -1 && x != -1 && y != -1) {
            stage.setWidth(w);
            stage.setHeight(h);
            stage.setX(x);
            stage.setY(y);
        } else {
            stage.setWidth(800);
            stage.setHeight(600);
            stage.centerOnScreen();
        }
    }

    public void storeStageSettings(Stage stage) {
        prefs.setProperty("windowWidth", Double.toString(stage.getWidth()));
        prefs.setProperty("windowHeight", Double.toString(stage.getHeight()));
        prefs.setProperty("windowX", Double.toString(stage.getX()));
        prefs.setProperty("windowY", Double.toString(stage.getY()));
        log.info("Storing window metrics {}x{}", stage.getWidth(), stage.getHeight());
        store();
    }
}

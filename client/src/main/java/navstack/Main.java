package navstack;

import javafx.application.*;
import javafx.geometry.*;
import javafx.scene.*;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.stage.*;
import navstack.files.*;
import navstack.fx.*;
import navstack.route.*;
import navstack.utils.*;
import org.slf4j.Logger;
import org.slf4j.*;

import javax.annotation.*;
import java.io.*;
import java.util.*;
import java.util.logging.*;

import static navstack.utils.NavUtils.*;

/**
 * A small demo of the navigator: a home page, a settings page with an about page below it, a popup that returns a
 * result, and a page for unknown names. Run with --route=/settings/about to start on a deep link.
 */
public class Main extends Application {
    public static final Logger log = LoggerFactory.getLogger(Main.class);

    // Used for directory paths, not translated.
    public static final String APP_NAME = "Navstack Demo";

    public NavPrefs prefs;
    public Stage mainStage;
    private NavigatorPane navigatorPane;

    public static void main(String[] args) throws IOException {
        AppDirectory.initAppDir(APP_NAME);
        launch(args);   // -> takes us to start() on a new thread, with JFX initialised.
    }

    // Pinned to work around the JDK only holding loggers weakly.
    private static java.util.logging.Logger logger;

    private static void setupLogging(boolean logToConsole) {
        logger = java.util.logging.Logger.getLogger("");
        // Three log files of three megabytes each, rotating.
        FileHandler handler = unchecked(() ->
                new FileHandler(AppDirectory.dir().resolve("log.txt").toString(), 1024 * 1024 * 3, 3, true));
        uncheck(() -> handler.setEncoding("UTF-8"));
        handler.setFormatter(new BriefLogFormatter());
        // The console handler is installed by default and comes first.
        Handler console = logger.getHandlers()[0];
        logger.addHandler(handler);
        if (logToConsole)
            console.setFormatter(new BriefLogFormatter());
        else
            logger.removeHandler(console);
    }

    @Override
    public void start(Stage stage) throws Exception {
        mainStage = stage;
        AppDirectory.initAppDir(APP_NAME);
        prefs = new NavPrefs();
        Map<String, String> named = getParameters().getNamed();
        setupLogging(prefs.isLogToConsole() || named.containsKey("debuglog"));
        log.info("{} starting up. App dir is {}", APP_NAME, AppDirectory.dir());
        log.info("Command line arguments are: {}", String.join(" ", getParameters().getRaw()));
        log.info("We are running on: {} with Java {}", System.getProperty("os.name"), System.getProperty("java.version"));
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
                log.error("Uncaught exception on " + thread.getName(), throwable));

        navigatorPane = new NavigatorPane(this::generateRoute, this::unknownRoute);
        Navigator navigator = navigatorPane.getNavigator();
        navigator.setInitialRoute(named.getOrDefault("route", prefs.getInitialRoute()));
        navigator.addObserver(new LoggingObserver());

        Button back = new Button("Back");
        back.disableProperty().bind(navigatorPane.canPopProperty().not());
        back.setOnAction(ev -> goBack());
        Button popup = new Button("Ask a question");
        popup.setOnAction(ev -> askQuestion());
        ToolBar toolBar = new ToolBar(back, popup);

        BorderPane root = new BorderPane(navigatorPane);
        root.setTop(toolBar);
        Scene scene = new Scene(root);
        stage.setTitle(APP_NAME);
        stage.setScene(scene);
        prefs.readStageSettings(stage);
        stage.setOnCloseRequest(ev -> prefs.storeStageSettings(stage));
        stage.show();
    }

    @Override
    public void stop() throws Exception {
        if (navigatorPane != null)
            navigatorPane.getNavigator().dispose();
    }

    private void goBack() {
        navigatorPane.getNavigator().maybePop().thenAccept(handled -> {
            if (!handled) {
                log.info("Back from the first page, exiting");
                prefs.storeStageSettings(mainStage);
                Platform.exit();
            }
        });
    }

    private void askQuestion() {
        Navigator navigator = navigatorPane.getNavigator();
        FxPopupRoute<String> question = new FxPopupRoute<>(new RouteSettings("question", false), transitionTime(),
                host -> {
                    Button yes = new Button("Yes");
                    yes.setOnAction(ev -> navigator.pop("yes"));
                    Button no = new Button("No");
                    no.setOnAction(ev -> navigator.pop("no"));
                    VBox box = new VBox(10, new Label("Do you like stacks?"), new HBox(10, yes, no));
                    box.setPadding(new Insets(20));
                    box.setMaxSize(Region.USE_PREF_SIZE, Region.USE_PREF_SIZE);
                    box.setStyle("-fx-background-color: white; -fx-background-radius: 6;");
                    return box;
                });
        navigator.push(question).thenAccept(answer -> log.info("Popup answered: {}", answer));
    }

    private javafx.util.Duration transitionTime() {
        return javafx.util.Duration.millis(prefs.getTransitionDuration().toMillis());
    }

    @Nullable
    private Route<?> generateRoute(RouteSettings settings) {
        String name = settings.getName();
        if (name == null)
            return null;
        switch (name) {
            case "/":
                return page(settings, "Home", link("Settings", "/settings"));
            case "/settings":
                CheckBox console = new CheckBox("Log to console on next start");
                console.setSelected(prefs.isLogToConsole());
                console.setOnAction(ev -> prefs.setLogToConsole(console.isSelected()));
                Button startHere = new Button("Start on this page next time");
                startHere.setOnAction(ev -> prefs.setInitialRoute("/settings"));
                return page(settings, "Settings", console, startHere, link("About", "/settings/about"));
            case "/settings/about":
                Button home = new Button("Back to home");
                home.setOnAction(ev -> navigatorPane.getNavigator().popUntil(ModalRoute.withName("/")));
                return page(settings, "About", new Label(APP_NAME + ", a route stack for JavaFX."), home);
            default:
                return null;
        }
    }

    private Route<?> unknownRoute(RouteSettings settings) {
        Button home = new Button("Start again");
        home.setOnAction(ev -> navigatorPane.getNavigator().pushNamedAndRemoveUntil("/", route -> false));
        return page(settings, "Not found", new Label("There is no page called " + settings.getName()), home);
    }

    private Button link(String text, String routeName) {
        Button button = new Button(text);
        button.setOnAction(ev -> navigatorPane.getNavigator().pushNamed(routeName));
        return button;
    }

    private FxPageRoute<Void> page(RouteSettings settings, String title, Node... content) {
        return new FxPageRoute<>(settings, transitionTime(), host -> {
            Label heading = new Label(title);
            heading.setStyle("-fx-font-size: 24;");
            VBox box = new VBox(15, heading);
            box.getChildren().addAll(content);
            box.setPadding(new Insets(30));
            box.setStyle("-fx-background-color: white;");
            return box;
        });
    }
}

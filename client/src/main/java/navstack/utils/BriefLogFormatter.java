package navstack.utils;

import com.google.common.base.*;

import java.time.*;
import java.time.format.*;
import java.util.logging.*;

/** A java.util.logging formatter that writes one line per record: time, level, thread, logger and message. */
public class BriefLogFormatter extends Formatter {
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final ZoneId zone;

    public BriefLogFormatter() {
        this(ZoneId.systemDefault());
    }

    public BriefLogFormatter(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public String format(LogRecord record) {
        StringBuilder builder = new StringBuilder();
        builder.append(TIME.format(record.getInstant().atZone(zone)));
        builder.append(' ').append(Strings.padEnd(record.getLevel().getName(), 7, ' '));
        builder.append(" [").append(Thread.currentThread().getName()).append("] ");
        builder.append(shortName(record.getLoggerName()));
        builder.append(": ").append(formatMessage(record)).append('\n');
        if (record.getThrown() != null)
            builder.append(Throwables.getStackTraceAsString(record.getThrown()));
        return builder.toString();
    }

    // "navstack.route.TransitionRoute" -> "TransitionRoute"
    private static String shortName(String loggerName) {
        if (loggerName == null)
            return "root";
        int dot = loggerName.lastIndexOf('.');
        return dot < 0 ? loggerName : loggerName.substring(dot + 1);
    }
}

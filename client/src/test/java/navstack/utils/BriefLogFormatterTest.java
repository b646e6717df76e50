package navstack.utils;

import org.junit.Test;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.Assert.*;

public class BriefLogFormatterTest {
    private final BriefLogFormatter formatter = new BriefLogFormatter(ZoneOffset.UTC);

    @Test
    public void oneLinePerRecord() throws Exception {
        LogRecord record = new LogRecord(Level.INFO, "Pushed {0} over {1}");
        record.setParameters(new Object[]{"B", "A"});
        record.setLoggerName("navstack.LoggingObserver");
        record.setInstant(Instant.parse("2024-01-02T03:04:05.678Z"));
        String line = formatter.format(record);
        assertTrue(line, line.startsWith("03:04:05.678 INFO    ["));
        assertTrue(line, line.endsWith("] LoggingObserver: Pushed B over A\n"));
    }

    @Test
    public void includesStackTrace() throws Exception {
        LogRecord record = new LogRecord(Level.SEVERE, "Could not save preferences!");
        record.setLoggerName("navstack.NavPrefs");
        record.setThrown(new IOException("disk full"));
        String text = formatter.format(record);
        assertTrue(text.contains("NavPrefs: Could not save preferences!\n"));
        assertTrue(text.contains("java.io.IOException: disk full"));
    }
}

package io.datamap.logging;

import org.slf4j.ILoggerFactory;
import org.slf4j.IMarkerFactory;
import org.slf4j.event.Level;
import org.slf4j.helpers.BasicMarkerFactory;
import org.slf4j.helpers.NOPMDCAdapter;
import org.slf4j.spi.MDCAdapter;
import org.slf4j.spi.SLF4JServiceProvider;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test binding that records every log call at DEBUG and above.
 */
public final class CapturingSlf4jServiceProvider implements SLF4JServiceProvider {
    public static final String REQUESTED_API_VERSION = "2.0.0";

    private static final List<LoggedEvent> EVENTS = new CopyOnWriteArrayList<>();

    private final ILoggerFactory loggerFactory = CapturingLogger::new;
    private final BasicMarkerFactory markerFactory = new BasicMarkerFactory();
    private final NOPMDCAdapter mdcAdapter = new NOPMDCAdapter();

    public static List<LoggedEvent> events() {
        return List.copyOf(EVENTS);
    }

    public static List<LoggedEvent> events(Level level) {
        return EVENTS.stream().filter(event -> event.level() == level).toList();
    }

    public static void reset() {
        EVENTS.clear();
    }

    static void record(LoggedEvent event) {
        EVENTS.add(event);
    }

    @Override
    public void initialize() {
        // Nothing to set up
    }

    @Override
    public ILoggerFactory getLoggerFactory() {
        return loggerFactory;
    }

    @Override
    public IMarkerFactory getMarkerFactory() {
        return markerFactory;
    }

    @Override
    public MDCAdapter getMDCAdapter() {
        return mdcAdapter;
    }

    @Override
    public String getRequestedApiVersion() {
        return REQUESTED_API_VERSION;
    }

    public record LoggedEvent(String logger, Level level, String message) {
    }
}

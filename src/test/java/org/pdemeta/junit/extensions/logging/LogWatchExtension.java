package org.pdemeta.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is covered by {@link AllowLog} or
 * {@link ExpectLog}, and fails it if an {@link ExpectLog} event is missing.
 * <p>
 * Allowed and expected events are swallowed so they do not clutter the build output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.rules = Rules.resolve(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> problems = new ArrayList<>();
        for (Event e : events) {
            if (e.level.isGreaterOrEqual(Level.WARN) && !rules.isAllowed(e) && !rules.isExpected(e)) {
                problems.add("Unexpected log: " + e);
            }
        }
        for (ExpectLog expect : rules.expects) {
            long found = events.stream().filter(e -> Rules.matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (found < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), found));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(ExtensionContext context) {
        // The filter lives in the class-level store; method contexts see it through their parent.
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private record Event(String logger, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private record Rules(List<AllowLog> allows, List<ExpectLog> expects) {

        static Rules resolve(ExtensionContext context) {
            List<AllowLog> allows = new ArrayList<>();
            List<ExpectLog> expects = new ArrayList<>();
            context.getTestClass().ifPresent(c -> collect(c, allows, expects));
            context.getTestMethod().ifPresent(m -> collect(m, allows, expects));
            return new Rules(allows, expects);
        }

        private static void collect(AnnotatedElement element, List<AllowLog> allows, List<ExpectLog> expects) {
            allows.addAll(Arrays.asList(element.getAnnotationsByType(AllowLog.class)));
            expects.addAll(Arrays.asList(element.getAnnotationsByType(ExpectLog.class)));
        }

        boolean isAllowed(Event e) {
            return allows.stream().anyMatch(a -> matches(e, a.level(), a.loggerPattern(), a.messagePattern()));
        }

        boolean isExpected(Event e) {
            return expects.stream().anyMatch(x -> matches(e, x.level(), x.loggerPattern(), x.messagePattern()));
        }

        static boolean matches(Event e, LogLevel level, String loggerPattern, String messagePattern) {
            return e.level.isGreaterOrEqual(level.toLogback())
                    && Pattern.matches(loggerPattern, e.logger)
                    && Pattern.matches(messagePattern, e.message);
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format,
                                  Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(Level.INFO) || !level.isGreaterOrEqual(logger.getEffectiveLevel())) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            Rules current = rules;
            return current.isAllowed(event) || current.isExpected(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}

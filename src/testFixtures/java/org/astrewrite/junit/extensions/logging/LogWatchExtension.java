package org.astrewrite.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Watches the log output of a test through a Logback turbo filter.
 * <p>
 * A test fails if it logs at or above the {@link FailOnLog} level (WARN by default) without a
 * matching {@link AllowLog} or {@link ExpectLog}, or if an {@link ExpectLog} is not satisfied.
 * Allowed and expected events are swallowed so they do not clutter the build output.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchFilter filter = new WatchFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, WatchFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        List<String> problems = filter.rules.verify(filter.events);
        if (!problems.isEmpty()) {
            throw new AssertionError("Log verification failed:\n  " + String.join("\n  ", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String logger, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, logger, message);
        }
    }

    private record LogPattern(Level level, Pattern logger, Pattern message, int occurrences) {

        static LogPattern of(AllowLog allow) {
            return new LogPattern(toLogback(allow.level()), Pattern.compile(allow.loggerPattern()),
                    Pattern.compile(allow.messagePattern()), 0);
        }

        static LogPattern of(ExpectLog expect) {
            return new LogPattern(toLogback(expect.level()), Pattern.compile(expect.loggerPattern()),
                    Pattern.compile(expect.messagePattern()), expect.occurrences());
        }

        boolean matches(Event event) {
            return event.level().isGreaterOrEqual(level)
                    && logger.matcher(event.logger()).matches()
                    && message.matcher(event.message()).matches();
        }
    }

    private record Rules(Level failLevel, boolean disabled, List<LogPattern> allowed, List<LogPattern> expected) {

        static Rules resolve(ExtensionContext context) {
            Optional<AnnotatedElement> method = context.getElement();
            Optional<Class<?>> testClass = context.getTestClass();

            FailOnLog fail = method.map(m -> m.getAnnotation(FailOnLog.class))
                    .or(() -> testClass.map(c -> c.getAnnotation(FailOnLog.class)))
                    .orElse(null);

            List<LogPattern> allowed = new ArrayList<>();
            List<LogPattern> expected = new ArrayList<>();
            List<AnnotatedElement> sources = new ArrayList<>();
            testClass.ifPresent(sources::add);
            method.ifPresent(sources::add);
            for (AnnotatedElement source : sources) {
                for (AllowLog allow : source.getAnnotationsByType(AllowLog.class)) {
                    allowed.add(LogPattern.of(allow));
                }
                for (ExpectLog expect : source.getAnnotationsByType(ExpectLog.class)) {
                    expected.add(LogPattern.of(expect));
                }
            }
            return new Rules(
                    toLogback(fail != null ? fail.level() : LogLevel.WARN),
                    fail != null && fail.disabled(),
                    allowed,
                    expected);
        }

        boolean isTolerated(Event event) {
            return allowed.stream().anyMatch(m -> m.matches(event))
                    || expected.stream().anyMatch(m -> m.matches(event));
        }

        List<String> verify(List<Event> events) {
            List<String> problems = new ArrayList<>();
            if (!disabled) {
                for (Event event : events) {
                    if (event.level().isGreaterOrEqual(failLevel) && !isTolerated(event)) {
                        problems.add("Unexpected log: " + event);
                    }
                }
            }
            for (LogPattern expectation : expected) {
                long count = events.stream().filter(expectation::matches).count();
                if (count < expectation.occurrences()) {
                    problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d",
                            expectation.occurrences(), expectation.level(), expectation.logger(), expectation.message(), count));
                }
            }
            return problems;
        }
    }

    private static final class WatchFilter extends TurboFilter {

        private final Rules rules;
        private final List<Event> events = new CopyOnWriteArrayList<>();

        WatchFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(logger.getEffectiveLevel())) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message != null ? message : "");
            events.add(event);
            return rules.isTolerated(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}

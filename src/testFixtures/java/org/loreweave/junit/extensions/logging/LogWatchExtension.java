package org.loreweave.junit.extensions.logging;

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
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test on WARN or ERROR log events it did not declare.
 * <p>
 * Registered through extension auto-detection. A turbo filter on the Logback context captures
 * events for the lifetime of a test class; after each test the captured events are checked against
 * the {@link AllowLog}, {@link ExpectLog} and {@link FailOnLog} annotations of the method and class.
 * Permitted events are suppressed so that expected warnings do not clutter the build output.
 * </p>
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(LogWatchExtension.class.getName());
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
        CapturingFilter filter = filterOf(context);
        if (filter != null) {
            filter.rules = Rules.resolve(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filterOf(context);
        if (filter == null) {
            return;
        }
        Rules rules = Rules.resolve(context);
        List<Event> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : events) {
                if (event.level.isGreaterOrEqual(rules.minLevel) && !rules.permits(event)) {
                    problems.add("unexpected " + event);
                }
            }
        }
        for (Rule expected : rules.expects) {
            long count = events.stream().filter(expected::matches).count();
            if (count < expected.occurrences) {
                problems.add(String.format("expected %d x %s, found %d", expected.occurrences, expected, count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError("Log check failed:\n  " + String.join("\n  ", problems));
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

    private static CapturingFilter filterOf(ExtensionContext context) {
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        switch (level) {
            case INFO:
                return Level.INFO;
            case WARN:
                return Level.WARN;
            default:
                return Level.ERROR;
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
            Rules current = rules;
            if (format == null || !level.isGreaterOrEqual(current.minLevel)) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }

    private static final class Event {
        final String loggerName;
        final Level level;
        final String message;

        Event(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private static final class Rule {
        final Level level;
        final Pattern logger;
        final Pattern message;
        final int occurrences;

        Rule(LogLevel level, String loggerPattern, String messagePattern, int occurrences) {
            this.level = toLogback(level);
            this.logger = Pattern.compile(loggerPattern);
            this.message = Pattern.compile(messagePattern, Pattern.DOTALL);
            this.occurrences = occurrences;
        }

        boolean matches(Event event) {
            return event.level.isGreaterOrEqual(level)
                    && logger.matcher(event.loggerName).matches()
                    && message.matcher(event.message).matches();
        }

        @Override
        public String toString() {
            return String.format("[%s] logger=\"%s\" message=\"%s\"", level, logger, message);
        }
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final List<Rule> allows;
        final List<Rule> expects;

        private Rules(Level minLevel, boolean disabled, List<Rule> allows, List<Rule> expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        boolean permits(Event event) {
            return allows.stream().anyMatch(r -> r.matches(event)) || expects.stream().anyMatch(r -> r.matches(event));
        }

        /**
         * Method annotations are combined with class annotations; a method-level {@link FailOnLog} wins.
         */
        static Rules resolve(ExtensionContext context) {
            Optional<AnnotatedElement> element = context.getElement();
            Optional<Class<?>> testClass = context.getTestClass();

            FailOnLog fail = element.map(e -> e.getAnnotation(FailOnLog.class))
                    .orElse(testClass.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));

            List<Rule> allows = new ArrayList<>();
            List<Rule> expects = new ArrayList<>();
            List<AnnotatedElement> sources = new ArrayList<>();
            testClass.ifPresent(sources::add);
            element.filter(e -> !(e instanceof Class)).ifPresent(sources::add);
            for (AnnotatedElement source : sources) {
                for (AllowLog allow : source.getAnnotationsByType(AllowLog.class)) {
                    allows.add(new Rule(allow.level(), allow.loggerPattern(), allow.messagePattern(), 0));
                }
                for (ExpectLog expect : source.getAnnotationsByType(ExpectLog.class)) {
                    expects.add(new Rule(expect.level(), expect.loggerPattern(), expect.messagePattern(),
                            expect.occurrences()));
                }
            }
            return new Rules(
                    toLogback(fail != null ? fail.level() : LogLevel.WARN),
                    fail != null && fail.disabled(),
                    allows,
                    expects);
        }
    }
}

package org.modelplatform.junit.extensions.logging;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.platform.commons.support.AnnotationSupport;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

/**
 * Fails a test that logs WARN or ERROR events nobody declared.
 * <p>
 * Events are permitted by {@link AllowLog} on the test method or class, and required by
 * {@link ExpectLog} on the method.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String APPENDER = "appender";

    @Override
    public void beforeEach(ExtensionContext context) {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.setName("log-watch");
        appender.start();
        rootLogger().addAppender(appender);
        context.getStore(NAMESPACE).put(APPENDER, appender);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void afterEach(ExtensionContext context) {
        ListAppender<ILoggingEvent> appender =
                context.getStore(NAMESPACE).remove(APPENDER, ListAppender.class);
        if (appender == null) {
            return;
        }
        rootLogger().detachAppender(appender);
        appender.stop();

        List<Rule> allowed = new ArrayList<>();
        List<Rule> expected = new ArrayList<>();
        context.getTestClass().ifPresent(type -> AnnotationSupport
                .findRepeatableAnnotations(type, AllowLog.class)
                .forEach(a -> allowed.add(new Rule(a.level(), a.loggerPattern(), a.messagePattern()))));
        context.getTestMethod().ifPresent(method -> {
            AnnotationSupport.findRepeatableAnnotations(method, AllowLog.class)
                    .forEach(a -> allowed.add(new Rule(a.level(), a.loggerPattern(), a.messagePattern())));
            AnnotationSupport.findRepeatableAnnotations(method, ExpectLog.class)
                    .forEach(a -> expected.add(new Rule(a.level(), a.loggerPattern(), a.messagePattern())));
        });

        List<String> unexpected = new ArrayList<>();
        List<ILoggingEvent> events = new ArrayList<>(appender.list);
        for (ILoggingEvent event : events) {
            if (!event.getLevel().isGreaterOrEqual(Level.WARN)) {
                continue;
            }
            if (allowed.stream().noneMatch(r -> r.matches(event)) && expected.stream().noneMatch(r -> r.matches(event))) {
                unexpected.add(event.getLevel() + " " + event.getLoggerName() + ": " + event.getFormattedMessage());
            }
        }
        List<String> missing = new ArrayList<>();
        for (Rule rule : expected) {
            if (events.stream().noneMatch(rule::matches)) {
                missing.add(rule.toString());
            }
        }
        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            StringBuilder message = new StringBuilder();
            if (!unexpected.isEmpty()) {
                message.append("Unexpected log events: ").append(unexpected);
            }
            if (!missing.isEmpty()) {
                message.append(message.length() > 0 ? "; " : "").append("Expected log events missing: ").append(missing);
            }
            throw new AssertionError(message.toString());
        }
    }

    private static Logger rootLogger() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }

    private record Rule(LogLevel level, String loggerPattern, String messagePattern) {

        boolean matches(ILoggingEvent event) {
            return event.getLevel().equals(level.toLogback())
                    && Pattern.matches(loggerPattern, event.getLoggerName())
                    && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(event.getFormattedMessage()).matches();
        }
    }
}

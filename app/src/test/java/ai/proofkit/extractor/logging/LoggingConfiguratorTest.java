package ai.proofkit.extractor.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.proofkit.extractor.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreDefaults() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);
    }

    @Test
    void verboseRaisesApplicationLoggerToDebug() {
        LoggingConfigurator.configure(LogFormat.TEXT, true);

        assertThat(context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel()).isEqualTo(Level.DEBUG);

        LoggingConfigurator.configure(LogFormat.TEXT, false);

        assertThat(context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void jsonFormatSwapsRootAppenderEncoder() {
        LoggingConfigurator.configure(LogFormat.JSON, false);

        OutputStreamAppender<?> appender = stderrAppender();
        assertThat(appender.getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<?>) appender.getEncoder()).getLayout()).isInstanceOf(JsonLogLayout.class);

        LoggingConfigurator.configure(LogFormat.TEXT, false);

        assertThat(stderrAppender().getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
    }

    private OutputStreamAppender<?> stderrAppender() {
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        return (OutputStreamAppender<?>) root.getAppender("STDERR");
    }
}

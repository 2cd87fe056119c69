package com.phillippitts.reqlog.service.source;

import com.phillippitts.reqlog.exception.RequestLoggingException;
import com.phillippitts.reqlog.service.format.ColorMode;
import com.phillippitts.reqlog.service.report.OverflowPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoggingSettingsTest {

    @Test
    void defaultsMatchDocumentedValues() {
        LoggingSettings settings = LoggingSettings.defaults();

        assertThat(settings.enabled()).isTrue();
        assertThat(settings.level()).isEqualTo(LogLevel.INFO);
        assertThat(settings.backtraces()).isTrue();
        assertThat(settings.color()).isEqualTo(ColorMode.AUTO);
        assertThat(settings.queueCapacity()).isEqualTo(10_000);
        assertThat(settings.overflow()).isEqualTo(OverflowPolicy.DROP_NEWEST);
        assertThat(settings.threadNamePrefix()).isEqualTo("reqlog-writer-");
    }

    @Test
    void rejectsMissingLevel() {
        assertThatThrownBy(() -> LoggingSettings.defaults().withLevel(null))
                .isInstanceOf(RequestLoggingException.class)
                .hasMessageContaining("Log level");
    }

    @Test
    void rejectsMissingColorMode() {
        assertThatThrownBy(() -> LoggingSettings.defaults().withColor(null))
                .isInstanceOf(RequestLoggingException.class);
    }

    @Test
    void rejectsNonPositiveQueueCapacity() {
        assertThatThrownBy(() -> LoggingSettings.defaults().withQueue(0, OverflowPolicy.DROP_OLDEST))
                .isInstanceOf(RequestLoggingException.class)
                .hasMessageContaining("0");
        assertThatThrownBy(() -> LoggingSettings.defaults().withQueue(10, null))
                .isInstanceOf(RequestLoggingException.class);
    }

    @Test
    void blankThreadPrefixFallsBackToDefault() {
        LoggingSettings settings = new LoggingSettings(true, LogLevel.INFO, true, ColorMode.NEVER,
                5, OverflowPolicy.DROP_NEWEST, "  ");

        assertThat(settings.threadNamePrefix()).isEqualTo(LoggingSettings.DEFAULT_THREAD_NAME_PREFIX);
    }

    @Test
    void mapsLevelsToLog4j() {
        assertThat(LogLevel.WARNING.toLog4j()).isEqualTo(org.apache.logging.log4j.Level.WARN);
        assertThat(LogLevel.DEBUG.toLog4j()).isEqualTo(org.apache.logging.log4j.Level.DEBUG);
    }
}

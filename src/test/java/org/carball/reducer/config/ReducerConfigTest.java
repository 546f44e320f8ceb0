package org.carball.reducer.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

public class ReducerConfigTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ReducerConfig.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setAdditive(true);
    }

    @Test
    void shouldValidateDefaultsWithoutWarnings() {
        // When
        ReducerConfig.defaults().validate();

        // Then - only the DEBUG summary
        assertThat(logAppender.list).hasSize(1);
        assertThat(logAppender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void shouldWarnAboutOutOfRangeLimits() {
        // Given
        ReducerConfig config = ReducerConfig.builder()
                .previewRowLimit(5)
                .distinctValueLimit(5000)
                .queryTimeoutSeconds(0)
                .build();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .hasSize(3)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(message -> message.contains("Preview row limit (5)"))
                .anyMatch(message -> message.contains("Distinct value limit (5000)"))
                .anyMatch(message -> message.contains("without a time limit"));
    }

    @Test
    void shouldWarnWhenExportsShareUploadDirectory() {
        ReducerConfig config = ReducerConfig.builder()
                .inputDirectory("data")
                .outputDirectory("data")
                .build();

        config.validate();

        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .asString()
                .contains("same");
    }

    @Test
    void shouldSummarizeConfiguration() {
        ReducerConfig config = ReducerConfig.defaults().toBuilder().queryTimeoutSeconds(9).build();

        assertThat(config.getConfigurationSummary())
                .contains("Input: data/input")
                .contains("Timeout: 9s");
    }
}

package com.everflowx.esreindex.util;

import com.everflowx.esreindex.domain.ReindexJobConfig;
import com.everflowx.esreindex.exception.ReindexConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigValidatorTest {
    
    private final ConfigValidator validator = new ConfigValidator();
    
    private ReindexJobConfig validConfig() {
        ReindexJobConfig config = new ReindexJobConfig();
        config.setSourcePattern("logs-2020,logs-2021-*");
        config.setDestIndex("logs-all");
        return config;
    }
    
    @Test
    void acceptsValidConfig() {
        assertDoesNotThrow(() -> validator.validateJobConfig(validConfig()));
    }
    
    @Test
    void missingSourcePatternIsReported() {
        ReindexJobConfig config = validConfig();
        config.setSourcePattern(" ");
        
        ReindexConfigException e = assertThrows(ReindexConfigException.class, () -> validator.validateJobConfig(config));
        assertEquals("CONFIG_ERROR", e.getErrorCode());
        assertThat(e.getMessage(), containsString("es.reindex.source-pattern"));
    }
    
    @Test
    void missingDestinationIsReported() {
        ReindexJobConfig config = validConfig();
        config.setDestIndex(null);
        
        ReindexConfigException e = assertThrows(ReindexConfigException.class, () -> validator.validateJobConfig(config));
        assertThat(e.getMessage(), containsString("es.reindex.dest-index"));
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"Logs-All", "-logs", "_logs", "logs all", "logs/all"})
    void rejectsInvalidDestinationNames(String name) {
        ReindexJobConfig config = validConfig();
        config.setDestIndex(name);
        
        assertThrows(ReindexConfigException.class, () -> validator.validateJobConfig(config));
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"*", "logs-*,*", "Logs-*", "logs-*,,metrics-*"})
    void rejectsOverlyBroadOrMalformedPatterns(String pattern) {
        ReindexJobConfig config = validConfig();
        config.setSourcePattern(pattern);
        
        assertThrows(ReindexConfigException.class, () -> validator.validateJobConfig(config));
    }
    
    @Test
    void destinationMustDifferFromCheckpointIndex() {
        ReindexJobConfig config = validConfig();
        config.setCheckpointIndex("logs-all");
        
        assertThrows(ReindexConfigException.class, () -> validator.validateJobConfig(config));
    }
    
    @Test
    void pollIntervalMustBePositive() {
        ReindexJobConfig config = validConfig();
        config.setPollIntervalSeconds(0);
        
        ReindexConfigException e = assertThrows(ReindexConfigException.class, () -> validator.validateJobConfig(config));
        assertThat(e.getMessage(), containsString("poll-interval-seconds"));
    }
    
    @Test
    void negativeStallPollsAreRejected() {
        ReindexJobConfig config = validConfig();
        config.setStallPolls(-1);
        
        assertThrows(ReindexConfigException.class, () -> validator.validateJobConfig(config));
    }
    
    @ParameterizedTest
    @ValueSource(ints = {-1, 10001})
    void batchSizeOutsideRangeIsRejected(int batchSize) {
        ReindexJobConfig config = validConfig();
        config.setBatchSize(batchSize);
        
        ReindexConfigException e = assertThrows(ReindexConfigException.class, () -> validator.validateJobConfig(config));
        assertThat(e.getMessage(), containsString("es.reindex.batch-size"));
    }
}

package com.everflowx.esreindex.task;

import com.everflowx.esreindex.domain.JobOutcome;
import com.everflowx.esreindex.domain.ReindexJobConfig;
import com.everflowx.esreindex.exception.ReindexConfigException;
import com.everflowx.esreindex.manager.ReindexCoordinator;
import com.everflowx.esreindex.util.ConfigValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReindexCommandRunnerTest {
    
    @Mock
    private ReindexCoordinator reindexCoordinator;
    
    @Spy
    private ConfigValidator configValidator = new ConfigValidator();
    
    @InjectMocks
    private ReindexCommandRunner runner;
    
    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(runner, "sourcePattern", "logs-*");
        ReflectionTestUtils.setField(runner, "destIndex", "logs-all");
        ReflectionTestUtils.setField(runner, "checkpointIndex", "es_reindex_checkpoints");
        ReflectionTestUtils.setField(runner, "pollIntervalSeconds", 10L);
        ReflectionTestUtils.setField(runner, "openSettleSeconds", 5L);
        ReflectionTestUtils.setField(runner, "livenessWindowSeconds", 300L);
        ReflectionTestUtils.setField(runner, "destShards", 1);
        ReflectionTestUtils.setField(runner, "destReplicas", 1);
        ReflectionTestUtils.setField(runner, "destRefreshInterval", "1s");
    }
    
    @Test
    void passesPropertiesToCoordinatorAndReportsExitCode() {
        ReflectionTestUtils.setField(runner, "resume", true);
        ReflectionTestUtils.setField(runner, "stallPolls", 6);
        ReflectionTestUtils.setField(runner, "batchSize", 2000);
        when(reindexCoordinator.execute(any(), any())).thenReturn(JobOutcome.REFUSED);
        
        runner.run(new DefaultApplicationArguments());
        
        ArgumentCaptor<ReindexJobConfig> captor = ArgumentCaptor.forClass(ReindexJobConfig.class);
        verify(reindexCoordinator).execute(captor.capture(), any());
        ReindexJobConfig config = captor.getValue();
        assertEquals("logs-*", config.getSourcePattern());
        assertEquals("logs-all", config.getDestIndex());
        assertTrue(config.isResume());
        assertEquals(6, config.getStallPolls());
        assertEquals(2000, config.getBatchSize());
        assertEquals(1, runner.getExitCode());
    }
    
    @Test
    void completedRunExitsWithZero() {
        when(reindexCoordinator.execute(any(), any())).thenReturn(JobOutcome.COMPLETED);
        
        runner.run(new DefaultApplicationArguments());
        
        assertEquals(0, runner.getExitCode());
    }
    
    @Test
    void invalidConfigurationStopsBeforeAnyWork() {
        ReflectionTestUtils.setField(runner, "destIndex", "");
        
        assertThrows(ReindexConfigException.class, () -> runner.run(new DefaultApplicationArguments()));
        verifyNoInteractions(reindexCoordinator);
    }
}

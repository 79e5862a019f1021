package com.everflowx.esreindex.service.impl;

import com.everflowx.esreindex.domain.CheckpointStatus;
import com.everflowx.esreindex.domain.JobIdentity;
import com.everflowx.esreindex.domain.ReindexCheckpoint;
import com.everflowx.esreindex.exception.CheckpointStoreUnavailableException;
import com.everflowx.esreindex.exception.CheckpointWriteRejectedException;
import com.everflowx.esreindex.exception.EsConnectionException;
import com.everflowx.esreindex.support.InMemoryEsIndexService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Date;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointServiceImplTest {
    
    private static final String CHECKPOINT_INDEX = "es_reindex_checkpoints";
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    
    private InMemoryEsIndexService esIndexService;
    private CheckpointServiceImpl checkpointService;
    
    @BeforeEach
    void setUp() {
        esIndexService = new InMemoryEsIndexService();
        checkpointService = new CheckpointServiceImpl(esIndexService, CHECKPOINT_INDEX,
            Clock.fixed(T0, ZoneOffset.UTC), "host-a", 1111L);
        checkpointService.ensureStorage();
    }
    
    private ReindexCheckpoint sampleCheckpoint() {
        ReindexCheckpoint checkpoint = ReindexCheckpoint.newJob("job-1",
            Arrays.asList("logs-2021", "logs-2020", "logs-2022"), "logs-all");
        checkpoint.setCurrentSegment("logs-2021");
        checkpoint.setCurrentTaskHandle("node-1:42");
        checkpoint.setReopenOnFinish(true);
        checkpoint.setStatus(CheckpointStatus.CRASHED);
        checkpoint.setMessage("connection reset");
        return checkpoint;
    }
    
    @Test
    void ensureStorageCreatesIndexOnceAndToleratesExisting() {
        assertNotNull(esIndexService.index(CHECKPOINT_INDEX));
        assertDoesNotThrow(() -> checkpointService.ensureStorage());
        assertEquals(1, esIndexService.getCalls().stream().filter(c -> c.equals("create:" + CHECKPOINT_INDEX)).count());
    }
    
    @Test
    void saveThenLoadRoundTripsEveryField() {
        ReindexCheckpoint original = sampleCheckpoint();
        checkpointService.save(original);
        
        ReindexCheckpoint loaded = checkpointService.findMatching(original.getJobIdentity()).orElseThrow(AssertionError::new);
        
        assertEquals(original, loaded);
        assertEquals(Arrays.asList("logs-2020", "logs-2021", "logs-2022"), loaded.getSourceSegments());
        assertEquals("logs-all", loaded.getDestination());
        assertEquals("logs-2021", loaded.getCurrentSegment());
        assertEquals("node-1:42", loaded.getCurrentTaskHandle());
        assertTrue(loaded.isReopenOnFinish());
        assertEquals(CheckpointStatus.CRASHED, loaded.getStatus());
        assertEquals("connection reset", loaded.getMessage());
        assertEquals("host-a", loaded.getHost());
        assertEquals(1111L, loaded.getProcessId());
        assertEquals(Date.from(T0), loaded.getLastUpdate());
    }
    
    @Test
    void saveRefreshesOwnerAndTimestampButKeepsCreateTime() {
        ReindexCheckpoint checkpoint = sampleCheckpoint();
        checkpointService.save(checkpoint);
        
        Instant later = T0.plusSeconds(90);
        CheckpointServiceImpl otherProcess = new CheckpointServiceImpl(esIndexService, CHECKPOINT_INDEX,
            Clock.fixed(later, ZoneOffset.UTC), "host-b", 2222L);
        ReindexCheckpoint resumed = otherProcess.findMatching(checkpoint.getJobIdentity()).orElseThrow(AssertionError::new);
        otherProcess.save(resumed);
        
        ReindexCheckpoint reloaded = checkpointService.findMatching(checkpoint.getJobIdentity()).orElseThrow(AssertionError::new);
        assertEquals("host-b", reloaded.getHost());
        assertEquals(2222L, reloaded.getProcessId());
        assertEquals(Date.from(later), reloaded.getLastUpdate());
        assertEquals(Date.from(T0), reloaded.getCreateTime());
        assertEquals(checkpoint.getId(), reloaded.getId());
    }
    
    @Test
    void findMatchingIgnoresSegmentOrderAndOtherJobs() {
        checkpointService.save(ReindexCheckpoint.newJob("other", Arrays.asList("metrics-1"), "metrics-all"));
        checkpointService.save(sampleCheckpoint());
        
        Optional<ReindexCheckpoint> match = checkpointService.findMatching(
            JobIdentity.of(Arrays.asList("logs-2022", "logs-2021", "logs-2020"), "logs-all"));
        
        assertTrue(match.isPresent());
        assertEquals("job-1", match.get().getId());
        assertFalse(checkpointService.findMatching(
            JobIdentity.of(Arrays.asList("logs-2020", "logs-2021"), "logs-all")).isPresent());
        assertFalse(checkpointService.findMatching(
            JobIdentity.of(Arrays.asList("logs-2020", "logs-2021", "logs-2022"), "logs-other")).isPresent());
    }
    
    @Test
    void emptyStoreHasNoMatch() {
        InMemoryEsIndexService empty = new InMemoryEsIndexService();
        CheckpointServiceImpl service = new CheckpointServiceImpl(empty, CHECKPOINT_INDEX,
            Clock.fixed(T0, ZoneOffset.UTC), "host-a", 1L);
        
        assertFalse(service.findMatching(JobIdentity.of(Arrays.asList("a"), "b")).isPresent());
    }
    
    @Test
    void unreachableStoreIsNotReportedAsEmpty() {
        esIndexService.failOnce("getAll", CHECKPOINT_INDEX,
            EsConnectionException.transportFailure("读取文档", new IOException("Connection refused")));
        
        assertThrows(CheckpointStoreUnavailableException.class,
            () -> checkpointService.findMatching(JobIdentity.of(Arrays.asList("a"), "b")));
    }
    
    @Test
    void rejectedWriteIsReported() {
        esIndexService.failOnce("put", CHECKPOINT_INDEX,
            new EsConnectionException("ES_ERROR", "mapper_parsing_exception", 400, null));
        
        CheckpointWriteRejectedException e = assertThrows(CheckpointWriteRejectedException.class,
            () -> checkpointService.save(sampleCheckpoint()));
        assertEquals("CHECKPOINT_WRITE_REJECTED", e.getErrorCode());
    }
    
    @Test
    void transportFailureOnWriteIsUnavailable() {
        esIndexService.failOnce("put", CHECKPOINT_INDEX,
            EsConnectionException.transportFailure("写入文档", new IOException("timeout")));
        
        assertThrows(CheckpointStoreUnavailableException.class, () -> checkpointService.save(sampleCheckpoint()));
    }
    
    @Test
    void deleteIsIdempotent() {
        ReindexCheckpoint checkpoint = sampleCheckpoint();
        checkpointService.save(checkpoint);
        
        checkpointService.delete(checkpoint.getId());
        assertDoesNotThrow(() -> checkpointService.delete(checkpoint.getId()));
        assertTrue(checkpointService.listAll().isEmpty());
    }
}

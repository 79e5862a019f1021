package com.everflowx.esreindex.service.impl;

import cn.hutool.core.net.NetUtil;
import cn.hutool.core.util.RuntimeUtil;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import com.everflowx.esreindex.domain.JobIdentity;
import com.everflowx.esreindex.domain.ReindexCheckpoint;
import com.everflowx.esreindex.exception.CheckpointStoreUnavailableException;
import com.everflowx.esreindex.exception.CheckpointWriteRejectedException;
import com.everflowx.esreindex.exception.EsConnectionException;
import com.everflowx.esreindex.exception.EsReindexException;
import com.everflowx.esreindex.service.CheckpointService;
import com.everflowx.esreindex.service.EsIndexService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 断点续跑服务实现类 - 基于ES索引存储
 * 
 * @author everflowx
 */
@Slf4j
@Service
public class CheckpointServiceImpl implements CheckpointService {
    
    private final EsIndexService esIndexService;
    
    private final String checkpointIndex;
    
    private final Clock clock;
    
    /**
     * 当前进程的标识，随实例创建一次
     */
    private final String host;
    
    private final long processId;
    
    @Autowired
    public CheckpointServiceImpl(EsIndexService esIndexService,
                                 @Value("${es.reindex.checkpoint-index:es_reindex_checkpoints}") String checkpointIndex,
                                 Clock clock) {
        this(esIndexService, checkpointIndex, clock, NetUtil.getLocalHostName(), RuntimeUtil.getPid());
    }
    
    public CheckpointServiceImpl(EsIndexService esIndexService, String checkpointIndex, Clock clock,
                                 String host, long processId) {
        this.esIndexService = esIndexService;
        this.checkpointIndex = checkpointIndex;
        this.clock = clock;
        this.host = host;
        this.processId = processId;
    }
    
    @Override
    public Optional<ReindexCheckpoint> findMatching(JobIdentity jobIdentity) {
        for (ReindexCheckpoint checkpoint : listAll()) {
            if (jobIdentity.equals(checkpoint.getJobIdentity())) {
                log.debug("找到匹配的断点: {}", checkpoint.getId());
                return Optional.of(checkpoint);
            }
        }
        return Optional.empty();
    }
    
    @Override
    public List<ReindexCheckpoint> listAll() {
        List<JSONObject> documents;
        try {
            documents = esIndexService.getAll(checkpointIndex);
        } catch (EsReindexException e) {
            throw new CheckpointStoreUnavailableException(checkpointIndex, e);
        }
        
        List<ReindexCheckpoint> checkpoints = new ArrayList<>();
        for (JSONObject document : documents) {
            try {
                checkpoints.add(document.toJavaObject(ReindexCheckpoint.class));
            } catch (RuntimeException e) {
                log.warn("无法解析断点文档，已跳过: {}", document, e);
            }
        }
        return checkpoints;
    }
    
    @Override
    public void save(ReindexCheckpoint checkpoint) {
        Date now = Date.from(clock.instant());
        checkpoint.setLastUpdate(now);
        checkpoint.setHost(host);
        checkpoint.setProcessId(processId);
        if (checkpoint.getCreateTime() == null) {
            checkpoint.setCreateTime(now);
        }
        
        JSONObject document = (JSONObject) JSON.toJSON(checkpoint);
        try {
            esIndexService.put(checkpointIndex, checkpoint.getId(), document);
        } catch (EsConnectionException e) {
            if (e.isTransportFailure()) {
                throw new CheckpointStoreUnavailableException(checkpointIndex, e);
            }
            throw new CheckpointWriteRejectedException(checkpointIndex, checkpoint.getId(), e);
        } catch (EsReindexException e) {
            throw new CheckpointWriteRejectedException(checkpointIndex, checkpoint.getId(), e);
        }
        
        log.debug("保存断点信息: {} [{}] 当前索引: {}, 任务: {}", checkpoint.getId(), checkpoint.getStatus(),
            checkpoint.getCurrentSegment(), checkpoint.getCurrentTaskHandle());
    }
    
    @Override
    public void delete(String checkpointId) {
        esIndexService.delete(checkpointIndex, checkpointId);
        log.info("删除断点: {}", checkpointId);
    }
    
    @Override
    public void ensureStorage() {
        if (esIndexService.exists(checkpointIndex)) {
            return;
        }
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("index.number_of_shards", 1);
        settings.put("index.auto_expand_replicas", "0-1");
        try {
            esIndexService.create(checkpointIndex, settings);
        } catch (EsConnectionException e) {
            // 并发创建时另一个进程先建好了索引
            if (e.isTransportFailure() || !esIndexService.exists(checkpointIndex)) {
                throw e;
            }
            log.info("断点索引已由其他进程创建: {}", checkpointIndex);
            return;
        }
        log.info("创建断点索引: {}", checkpointIndex);
    }
}

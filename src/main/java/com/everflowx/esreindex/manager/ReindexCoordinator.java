package com.everflowx.esreindex.manager;

import cn.hutool.core.util.IdUtil;
import com.everflowx.esreindex.checkpoint.SegmentPlanner;
import com.everflowx.esreindex.domain.CheckpointStatus;
import com.everflowx.esreindex.domain.JobIdentity;
import com.everflowx.esreindex.domain.JobOutcome;
import com.everflowx.esreindex.domain.ProgressSnapshot;
import com.everflowx.esreindex.domain.ReindexCheckpoint;
import com.everflowx.esreindex.domain.ReindexJobConfig;
import com.everflowx.esreindex.domain.ReindexOptions;
import com.everflowx.esreindex.exception.IndexClosedException;
import com.everflowx.esreindex.exception.ReindexTaskFailedException;
import com.everflowx.esreindex.monitor.ReindexTaskMonitor;
import com.everflowx.esreindex.service.CheckpointService;
import com.everflowx.esreindex.service.EsIndexService;
import com.everflowx.esreindex.util.ExceptionHandler;
import com.everflowx.esreindex.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * reindex迁移协调器
 * 负责新建或续跑断点，逐个源索引提交reindex任务并等待完成，最后收尾目标索引。
 * <p>
 * 同一时刻只有一个reindex任务在运行；源索引按名称字典序处理。
 * 异常终止时断点保留（CRASHED / INTERRUPTED），以便排查和续跑；成功完成后删除断点。
 * 
 * @author everflowx
 */
@Slf4j
@Component
public class ReindexCoordinator {
    
    private final EsIndexService esIndexService;
    
    private final CheckpointService checkpointService;
    
    private final SegmentPlanner segmentPlanner;
    
    private final ReindexTaskMonitor taskMonitor;
    
    private final Sleeper sleeper;
    
    private final Clock clock;
    
    @Autowired
    public ReindexCoordinator(EsIndexService esIndexService, CheckpointService checkpointService,
                              SegmentPlanner segmentPlanner, ReindexTaskMonitor taskMonitor,
                              Sleeper sleeper, Clock clock) {
        this.esIndexService = esIndexService;
        this.checkpointService = checkpointService;
        this.segmentPlanner = segmentPlanner;
        this.taskMonitor = taskMonitor;
        this.sleeper = sleeper;
        this.clock = clock;
    }
    
    /**
     * 检测同标识的已有任务，决定新建或续跑，确认后执行到结束。
     * 返回REFUSED、DRY_RUN、DECLINED、NOTHING_TO_DO时没有做任何修改。
     */
    public JobOutcome execute(ReindexJobConfig config, Confirmation confirmation) {
        SortedSet<String> sources = new TreeSet<>(esIndexService.listMatching(config.getSourcePattern()));
        sources.remove(config.getDestIndex());
        sources.remove(config.getCheckpointIndex());
        if (sources.isEmpty()) {
            log.warn("没有匹配 {} 的源索引", config.getSourcePattern());
            return JobOutcome.NOTHING_TO_DO;
        }
        
        JobIdentity jobIdentity = config.toJobIdentity(sources);
        Optional<ReindexCheckpoint> existing = checkpointService.findMatching(jobIdentity);
        
        ReindexCheckpoint checkpoint;
        if (existing.isPresent()) {
            ReindexCheckpoint found = existing.get();
            if (!config.isResume()) {
                log.error("已存在相同源索引和目标索引的任务 {} [{}]，最后更新: {}，主机: {}，进程: {}，消息: {}",
                    found.getId(), found.getStatus(), found.getLastUpdate(), found.getHost(),
                    found.getProcessId(), found.getMessage());
                log.error("如需继续该任务，请加上 --es.reindex.resume=true 重新运行");
                return JobOutcome.REFUSED;
            }
            if (isPossiblyAlive(found, config)) {
                log.warn("断点 {} 状态为 {} 且 {} 刚刚更新过，主机 {} 进程 {} 可能仍在运行该任务",
                    found.getId(), found.getStatus(), found.getLastUpdate(), found.getHost(), found.getProcessId());
            }
            log.info("续跑任务 {}，上次状态: {}，当前索引: {}，消息: {}",
                found.getId(), found.getStatus(), found.getCurrentSegment(), found.getMessage());
            checkpoint = found;
        } else {
            if (config.isResume()) {
                log.warn("没有找到可续跑的断点，将作为新任务开始");
            }
            checkpoint = ReindexCheckpoint.newJob(IdUtil.fastSimpleUUID(), sources, config.getDestIndex());
        }
        
        logPlan(checkpoint);
        
        if (config.isDryRun()) {
            log.info("试运行模式，未做任何修改");
            return JobOutcome.DRY_RUN;
        }
        
        String prompt = String.format("将 %d 个源索引迁移到 %s，是否继续?",
            checkpoint.getSourceSegments().size(), checkpoint.getDestination());
        if (!config.isAssumeYes() && !confirmation.confirm(prompt)) {
            log.info("用户取消迁移");
            return JobOutcome.DECLINED;
        }
        
        return runToCompletion(checkpoint, config);
    }
    
    /**
     * 状态机主循环。中断时记录INTERRUPTED并返回；其他异常记录CRASHED后重新抛出。
     */
    public JobOutcome runToCompletion(ReindexCheckpoint checkpoint, ReindexJobConfig config) {
        try {
            checkpointService.ensureStorage();
            rememberDestinationReplicas(checkpoint, config);
            checkpoint.setStatus(CheckpointStatus.OK);
            checkpoint.setMessage(StringUtils.hasLength(checkpoint.getCurrentSegment()) ? "任务续跑" : "任务开始");
            checkpointService.save(checkpoint);
            
            prepareDestination(config);
            
            boolean taskRunning = StringUtils.hasText(checkpoint.getCurrentTaskHandle());
            while (!segmentPlanner.isJobComplete(checkpoint, taskRunning)) {
                ExceptionHandler.checkInterrupted("reindex迁移");
                if (StringUtils.hasText(checkpoint.getCurrentTaskHandle())) {
                    awaitCurrentTask(checkpoint, config);
                    taskRunning = false;
                }
                if (segmentPlanner.isJobComplete(checkpoint, false)) {
                    break;
                }
                if (!beginNextSegment(checkpoint, config)) {
                    break;
                }
                taskRunning = true;
            }
            
            finish(checkpoint, config);
            return JobOutcome.COMPLETED;
            
        } catch (InterruptedException e) {
            return markInterrupted(checkpoint);
            
        } catch (RuntimeException e) {
            if (Thread.interrupted()) {
                // ES客户端在等待响应时被中断，会把InterruptedException包装成RuntimeException
                log.warn("等待ES响应时被中断: {}", e.getMessage());
                return markInterrupted(checkpoint);
            }
            log.error("迁移任务异常终止，当前索引: {}", checkpoint.getCurrentSegment(), e);
            checkpoint.setStatus(CheckpointStatus.CRASHED);
            checkpoint.setMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            try {
                checkpointService.save(checkpoint);
            } catch (RuntimeException saveFailure) {
                log.error("保存异常状态失败，断点 {}", checkpoint.getId(), saveFailure);
                e.addSuppressed(saveFailure);
            }
            throw e;
        }
    }
    
    private JobOutcome markInterrupted(ReindexCheckpoint checkpoint) {
        log.warn("迁移被用户中断，当前索引: {}，ES端的reindex任务 {} 不会被取消",
            checkpoint.getCurrentSegment(), checkpoint.getCurrentTaskHandle());
        checkpoint.setStatus(CheckpointStatus.INTERRUPTED);
        checkpoint.setMessage("用户中断");
        checkpointService.save(checkpoint);
        Thread.currentThread().interrupt();
        return JobOutcome.INTERRUPTED;
    }
    
    /**
     * 切换批量写入设置之前记下收尾时要恢复的副本数，续跑时沿用断点中的值
     */
    private void rememberDestinationReplicas(ReindexCheckpoint checkpoint, ReindexJobConfig config) {
        if (checkpoint.getDestRestoreReplicas() != null) {
            return;
        }
        int replicas = config.getDestReplicas();
        if (esIndexService.exists(config.getDestIndex())) {
            Optional<String> existing = esIndexService.getSetting(config.getDestIndex(), "index.number_of_replicas");
            if (existing.isPresent()) {
                replicas = Integer.parseInt(existing.get());
                log.info("目标索引 {} 已存在，收尾时恢复其原副本数: {}", config.getDestIndex(), replicas);
            }
        }
        checkpoint.setDestRestoreReplicas(replicas);
    }
    
    /**
     * 目标索引不存在时创建，并切换为批量写入设置（不刷新、无副本）
     */
    private void prepareDestination(ReindexJobConfig config) {
        String dest = config.getDestIndex();
        Map<String, Object> bulkSettings = new LinkedHashMap<>();
        bulkSettings.put("index.refresh_interval", "-1");
        bulkSettings.put("index.number_of_replicas", 0);
        
        if (esIndexService.exists(dest)) {
            esIndexService.putSettings(dest, bulkSettings);
        } else {
            Map<String, Object> settings = new LinkedHashMap<>();
            settings.put("index.number_of_shards", config.getDestShards());
            settings.putAll(bulkSettings);
            esIndexService.create(dest, settings);
        }
    }
    
    /**
     * 等待断点中记录的任务结束，每次轮询都刷新断点
     */
    private void awaitCurrentTask(ReindexCheckpoint checkpoint, ReindexJobConfig config) throws InterruptedException {
        String taskHandle = checkpoint.getCurrentTaskHandle();
        String segment = checkpoint.getCurrentSegment();
        int position = segmentPlanner.position(checkpoint);
        int total = checkpoint.getSourceSegments().size();
        
        ProgressSnapshot result = taskMonitor.waitUntilFinished(taskHandle,
            Duration.ofSeconds(config.getPollIntervalSeconds()), config.getStallPolls(),
            snapshot -> recordProgress(checkpoint, snapshot, position, total));
        
        if (result.getFailureReason() != null) {
            rewindToPreviousSegment(checkpoint);
            throw new ReindexTaskFailedException(segment, taskHandle, result.getFailureReason());
        }
        log.info("源索引 {} 迁移完成 ({}/{})", segment, position, total);
    }
    
    /**
     * 失败的源索引退回到待迁移状态，续跑时重新提交
     */
    private void rewindToPreviousSegment(ReindexCheckpoint checkpoint) {
        if (checkpoint.isReopenOnFinish()) {
            closeReopenedSegment(checkpoint);
        }
        List<String> segments = checkpoint.getJobIdentity().getSourceSegments();
        int index = segments.indexOf(checkpoint.getCurrentSegment());
        checkpoint.setCurrentSegment(index > 0 ? segments.get(index - 1) : null);
        checkpoint.setCurrentTaskHandle(null);
    }
    
    private void recordProgress(ReindexCheckpoint checkpoint, ProgressSnapshot snapshot, int position, int total) {
        String message = String.format("%s -> %s (%d/%d) %s: %d/%d 文档 (%.1f%%), 已运行 %ds",
            checkpoint.getCurrentSegment(), checkpoint.getDestination(), position, total,
            snapshot.isRunning() ? "迁移中" : "已结束",
            snapshot.getItemsDone(), snapshot.getTotalItems(), snapshot.getProgressPercentage(),
            snapshot.getElapsedSeconds());
        if (snapshot.getFailureReason() != null) {
            message = message + ", 失败: " + snapshot.getFailureReason();
        }
        checkpoint.setStatus(CheckpointStatus.OK);
        checkpoint.setMessage(message);
        checkpointService.save(checkpoint);
        log.info(message);
    }
    
    /**
     * 开始迁移下一个源索引
     *
     * @return 没有下一个源索引时返回false
     */
    private boolean beginNextSegment(ReindexCheckpoint checkpoint, ReindexJobConfig config) throws InterruptedException {
        if (checkpoint.isReopenOnFinish()) {
            closeReopenedSegment(checkpoint);
        }
        
        Optional<String> next = segmentPlanner.nextSegment(checkpoint);
        if (!next.isPresent()) {
            return false;
        }
        String segment = next.get();
        
        boolean reopened = false;
        if (!esIndexService.isOpen(segment)) {
            log.info("源索引 {} 已关闭，临时打开，迁移完成后重新关闭", segment);
            esIndexService.open(segment);
            reopened = true;
            // open是异步的，过早提交reindex会静默地只处理0条文档
            sleeper.sleep(Duration.ofSeconds(config.getOpenSettleSeconds()));
        }
        
        if (config.isSourceReadOnly()) {
            esIndexService.putSettings(segment, Collections.singletonMap("index.blocks.write", true));
        }
        
        ReindexOptions options = ReindexOptions.defaults();
        options.setBatchSize(config.getBatchSize());
        String taskHandle = esIndexService.reindexAsync(segment, config.getDestIndex(), options);
        
        checkpoint.setCurrentSegment(segment);
        checkpoint.setCurrentTaskHandle(taskHandle);
        checkpoint.setReopenOnFinish(reopened);
        checkpoint.setStatus(CheckpointStatus.OK);
        int position = segmentPlanner.position(checkpoint);
        checkpoint.setMessage(String.format("开始迁移 %s -> %s (%d/%d)，任务: %s",
            segment, config.getDestIndex(), position, checkpoint.getSourceSegments().size(), taskHandle));
        checkpointService.save(checkpoint);
        log.info(checkpoint.getMessage());
        return true;
    }
    
    private void closeReopenedSegment(ReindexCheckpoint checkpoint) {
        String segment = checkpoint.getCurrentSegment();
        log.info("重新关闭源索引: {}", segment);
        esIndexService.close(segment);
        checkpoint.setReopenOnFinish(false);
    }
    
    /**
     * 全部源索引迁移完成后：段合并、恢复目标索引设置、删除断点
     */
    private void finish(ReindexCheckpoint checkpoint, ReindexJobConfig config) {
        if (checkpoint.isReopenOnFinish()) {
            closeReopenedSegment(checkpoint);
        }
        
        String dest = config.getDestIndex();
        checkpoint.setCurrentSegment(SegmentPlanner.EXHAUSTED);
        checkpoint.setCurrentTaskHandle(null);
        checkpoint.setStatus(CheckpointStatus.OK);
        checkpoint.setMessage("所有源索引迁移完成，正在收尾目标索引 " + dest);
        checkpointService.save(checkpoint);
        log.info(checkpoint.getMessage());
        
        esIndexService.forceMerge(dest);
        
        Map<String, Object> steadySettings = new LinkedHashMap<>();
        steadySettings.put("index.refresh_interval", config.getDestRefreshInterval());
        steadySettings.put("index.number_of_replicas", checkpoint.getDestRestoreReplicas() != null
            ? checkpoint.getDestRestoreReplicas() : config.getDestReplicas());
        esIndexService.putSettings(dest, steadySettings);
        
        if (config.isDestReadOnly()) {
            esIndexService.putSettings(dest, Collections.singletonMap("index.blocks.write", true));
        }
        
        long count = esIndexService.count(dest);
        checkpointService.delete(checkpoint.getId());
        log.info("迁移完成: {} 个源索引 -> {}，目标索引文档数: {}",
            checkpoint.getSourceSegments().size(), dest, count);
    }
    
    private boolean isPossiblyAlive(ReindexCheckpoint checkpoint, ReindexJobConfig config) {
        if (checkpoint.getStatus() != CheckpointStatus.OK || checkpoint.getLastUpdate() == null) {
            return false;
        }
        long ageMillis = clock.millis() - checkpoint.getLastUpdate().getTime();
        return ageMillis < Duration.ofSeconds(config.getLivenessWindowSeconds()).toMillis();
    }
    
    private void logPlan(ReindexCheckpoint checkpoint) {
        List<String> segments = checkpoint.getSourceSegments();
        // 断点损坏时不在这里报错，交给主循环记录CRASHED
        int position = SegmentPlanner.EXHAUSTED.equals(checkpoint.getCurrentSegment())
            ? segments.size() + 1
            : segments.indexOf(checkpoint.getCurrentSegment()) + 1;
        log.info("迁移计划: {} 个源索引 -> {}", segments.size(), checkpoint.getDestination());
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            String state = i + 1 < position ? "已完成" : (i + 1 == position ? "进行中" : "待迁移");
            try {
                log.info("  [{}] {} 文档数: {}", state, segment, esIndexService.count(segment));
            } catch (IndexClosedException e) {
                log.info("  [{}] {} (已关闭)", state, segment);
            }
        }
    }
}

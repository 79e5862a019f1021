package com.everflowx.esreindex.monitor;

import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import com.everflowx.esreindex.domain.ProgressSnapshot;
import com.everflowx.esreindex.exception.TaskStalledException;
import com.everflowx.esreindex.service.EsIndexService;
import com.everflowx.esreindex.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * reindex任务监控器 - 轮询ES后台任务并归一化为进度快照
 * 
 * @author everflowx
 */
@Slf4j
@Component
public class ReindexTaskMonitor {
    
    private final EsIndexService esIndexService;
    
    private final Sleeper sleeper;
    
    @Autowired
    public ReindexTaskMonitor(EsIndexService esIndexService, Sleeper sleeper) {
        this.esIndexService = esIndexService;
        this.sleeper = sleeper;
    }
    
    /**
     * 查询任务进度。句柄为空时不访问ES；任务已不存在时视为已结束。
     */
    public ProgressSnapshot poll(String taskHandle) {
        if (!StringUtils.hasText(taskHandle)) {
            return ProgressSnapshot.idle();
        }
        
        Optional<JSONObject> raw = esIndexService.taskStatus(taskHandle);
        if (!raw.isPresent()) {
            log.debug("任务 {} 无状态数据，视为已结束", taskHandle);
            return ProgressSnapshot.idle();
        }
        
        JSONObject body = raw.get();
        JSONObject task = body.getJSONObject("task");
        if (task == null) {
            return ProgressSnapshot.idle();
        }
        
        ProgressSnapshot snapshot = new ProgressSnapshot();
        snapshot.setRunning(!body.getBooleanValue("completed"));
        snapshot.setElapsedSeconds(TimeUnit.NANOSECONDS.toSeconds(task.getLongValue("running_time_in_nanos")));
        
        JSONObject status = task.getJSONObject("status");
        if (status != null) {
            snapshot.setTotalItems(status.getLongValue("total"));
            snapshot.setItemsDone(status.getLongValue("created")
                + status.getLongValue("updated")
                + status.getLongValue("deleted"));
        }
        
        if (!snapshot.isRunning()) {
            snapshot.setFailureReason(describeFailure(taskHandle, body));
        }
        return snapshot;
    }
    
    /**
     * 阻塞等待任务结束，不设超时
     */
    public ProgressSnapshot waitUntilFinished(String taskHandle, Duration pollInterval,
                                              Consumer<ProgressSnapshot> progressCallback) throws InterruptedException {
        return waitUntilFinished(taskHandle, pollInterval, 0, progressCallback);
    }
    
    /**
     * 阻塞等待任务结束
     *
     * @param stallPolls 连续多少次轮询已处理文档数不变即判定卡死，0表示不检测
     * @throws TaskStalledException 任务卡死
     */
    public ProgressSnapshot waitUntilFinished(String taskHandle, Duration pollInterval, int stallPolls,
                                              Consumer<ProgressSnapshot> progressCallback) throws InterruptedException {
        long lastItemsDone = -1;
        int unchangedPolls = 0;
        
        while (true) {
            ProgressSnapshot snapshot = poll(taskHandle);
            progressCallback.accept(snapshot);
            if (!snapshot.isRunning()) {
                return snapshot;
            }
            
            if (stallPolls > 0) {
                if (snapshot.getItemsDone() == lastItemsDone) {
                    unchangedPolls++;
                    if (unchangedPolls >= stallPolls) {
                        throw new TaskStalledException(taskHandle, unchangedPolls, lastItemsDone);
                    }
                } else {
                    lastItemsDone = snapshot.getItemsDone();
                    unchangedPolls = 0;
                }
            }
            
            sleeper.sleep(pollInterval);
        }
    }
    
    /**
     * 已结束任务的失败信息：任务级error，或文档级failures
     */
    private String describeFailure(String taskHandle, JSONObject body) {
        JSONObject error = body.getJSONObject("error");
        if (error != null) {
            String reason = error.getString("type") + ": " + error.getString("reason");
            log.error("reindex任务 {} 执行失败: {}", taskHandle, reason);
            return reason;
        }
        
        JSONObject response = body.getJSONObject("response");
        JSONArray failures = response == null ? null : response.getJSONArray("failures");
        if (failures != null && !failures.isEmpty()) {
            log.warn("reindex任务 {} 有 {} 条文档写入失败，第一条: {}", taskHandle, failures.size(), failures.get(0));
            return failures.size() + " 条文档写入失败";
        }
        return null;
    }
}

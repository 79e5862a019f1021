package com.everflowx.esreindex.domain;

import lombok.Data;

/**
 * reindex任务进度快照（不持久化）
 * 
 * @author everflowx
 */
@Data
public class ProgressSnapshot {
    
    private boolean running;
    
    private long elapsedSeconds;
    
    private long totalItems;
    
    /**
     * 已处理文档数 = created + updated + deleted
     */
    private long itemsDone;
    
    /**
     * 任务结束时ES报告的失败信息，成功时为空
     */
    private String failureReason;
    
    public static ProgressSnapshot idle() {
        return new ProgressSnapshot();
    }
    
    public double getProgressPercentage() {
        if (totalItems <= 0) {
            return 0.0;
        }
        return Math.min(100.0, itemsDone * 100.0 / totalItems);
    }
}

package com.everflowx.esreindex.domain;

import lombok.Data;

import java.util.Collection;

/**
 * reindex任务配置
 * 
 * @author everflowx
 */
@Data
public class ReindexJobConfig {
    
    /**
     * 源索引通配符，例如 logs-*
     */
    private String sourcePattern;
    
    /**
     * 目标索引名称
     */
    private String destIndex;
    
    /**
     * 是否续跑已存在的同标识任务
     */
    private boolean resume = false;
    
    /**
     * 只打印迁移计划，不做任何修改
     */
    private boolean dryRun = false;
    
    /**
     * 跳过交互确认
     */
    private boolean assumeYes = false;
    
    /**
     * 迁移前将源索引置为只读
     */
    private boolean sourceReadOnly = false;
    
    /**
     * 迁移完成后将目标索引置为只读
     */
    private boolean destReadOnly = false;
    
    /**
     * 断点索引名称
     */
    private String checkpointIndex = "es_reindex_checkpoints";
    
    /**
     * 任务状态轮询间隔（秒）
     */
    private long pollIntervalSeconds = 10;
    
    /**
     * 打开已关闭索引后等待的秒数。ES的open是异步的，过早提交reindex会静默处理0条文档。
     */
    private long openSettleSeconds = 5;
    
    /**
     * 连续多少次轮询无进展判定任务卡死，0表示不检测
     */
    private int stallPolls = 0;
    
    /**
     * reindex每批滚动读取的文档数，0表示使用ES默认值(1000)
     */
    private int batchSize = 0;
    
    /**
     * 断点在此时间窗口内更新过，视为可能仍有进程在运行（秒）
     */
    private long livenessWindowSeconds = 300;
    
    /**
     * 目标索引主分片数（仅在创建时使用）
     */
    private int destShards = 1;
    
    /**
     * 迁移完成后恢复的副本数
     */
    private int destReplicas = 1;
    
    /**
     * 迁移完成后恢复的刷新间隔
     */
    private String destRefreshInterval = "1s";
    
    public JobIdentity toJobIdentity(Collection<String> sourceSegments) {
        return JobIdentity.of(sourceSegments, destIndex);
    }
}

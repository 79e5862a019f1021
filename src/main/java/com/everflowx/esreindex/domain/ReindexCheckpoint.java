package com.everflowx.esreindex.domain;

import com.alibaba.fastjson.annotation.JSONField;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * reindex任务断点信息，每个任务一份，持久化在断点索引中
 * 
 * @author everflowx
 */
@Data
public class ReindexCheckpoint {
    
    /**
     * 断点ID，任务创建时生成，续跑时保持不变
     */
    @JSONField(name = "id")
    private String id;
    
    /**
     * 源索引列表（已排序）
     */
    @JSONField(name = "source_segments")
    private List<String> sourceSegments = new ArrayList<>();
    
    /**
     * 目标索引名
     */
    @JSONField(name = "destination")
    private String destination;
    
    /**
     * 当前正在处理的源索引，未开始时为空
     */
    @JSONField(name = "current_segment")
    private String currentSegment;
    
    /**
     * 当前reindex任务句柄（node:id）
     */
    @JSONField(name = "current_task_handle")
    private String currentTaskHandle;
    
    /**
     * 当前源索引是否由本工具临时打开，切换到下一个索引前需要重新关闭
     */
    @JSONField(name = "reopen_on_finish")
    private boolean reopenOnFinish;
    
    /**
     * 收尾时恢复的目标索引副本数。目标索引已存在时记录其原值，由本工具创建时为配置值
     */
    @JSONField(name = "dest_restore_replicas")
    private Integer destRestoreReplicas;
    
    @JSONField(name = "host")
    private String host;
    
    @JSONField(name = "process_id")
    private long processId;
    
    @JSONField(name = "status")
    private CheckpointStatus status = CheckpointStatus.OK;
    
    @JSONField(name = "message")
    private String message;
    
    /**
     * 最后更新时间，每次保存时刷新
     */
    @JSONField(name = "last_update")
    private Date lastUpdate;
    
    @JSONField(name = "create_time")
    private Date createTime;
    
    /**
     * 创建新任务的断点，源索引按字典序排序
     */
    public static ReindexCheckpoint newJob(String id, Collection<String> sourceSegments, String destination) {
        ReindexCheckpoint checkpoint = new ReindexCheckpoint();
        checkpoint.setId(id);
        checkpoint.setSourceSegments(JobIdentity.sorted(sourceSegments));
        checkpoint.setDestination(destination);
        checkpoint.setStatus(CheckpointStatus.OK);
        return checkpoint;
    }
    
    @JSONField(serialize = false, deserialize = false)
    public JobIdentity getJobIdentity() {
        return JobIdentity.of(sourceSegments, destination);
    }
}

package com.everflowx.esreindex.service;

import com.everflowx.esreindex.domain.JobIdentity;
import com.everflowx.esreindex.domain.ReindexCheckpoint;

import java.util.List;
import java.util.Optional;

/**
 * 断点续跑服务接口
 * 
 * @author everflowx
 */
public interface CheckpointService {
    
    /**
     * 查找任务标识相同的断点
     *
     * @throws com.everflowx.esreindex.exception.CheckpointStoreUnavailableException 断点索引无法查询
     */
    Optional<ReindexCheckpoint> findMatching(JobIdentity jobIdentity);
    
    /**
     * 保存断点信息（按ID覆盖），同时刷新最后更新时间、主机名和进程号
     *
     * @throws com.everflowx.esreindex.exception.CheckpointWriteRejectedException ES拒绝写入
     */
    void save(ReindexCheckpoint checkpoint);
    
    /**
     * 删除断点信息，断点不存在不视为错误
     */
    void delete(String checkpointId);
    
    /**
     * 确保断点索引存在
     */
    void ensureStorage();
    
    /**
     * 获取所有断点
     */
    List<ReindexCheckpoint> listAll();
}

package com.everflowx.esreindex.service;

import com.alibaba.fastjson.JSONObject;
import com.everflowx.esreindex.domain.ReindexOptions;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

/**
 * ES索引操作服务接口。
 * 失败以带类型的异常表示：{@link com.everflowx.esreindex.exception.IndexNotExistsException}、
 * {@link com.everflowx.esreindex.exception.IndexClosedException}、
 * {@link com.everflowx.esreindex.exception.EsConnectionException}。
 * 
 * @author everflowx
 */
public interface EsIndexService {
    
    /**
     * 索引是否存在（包括已关闭的索引）
     */
    boolean exists(String indexName);
    
    /**
     * 索引是否处于打开状态
     */
    boolean isOpen(String indexName);
    
    void open(String indexName);
    
    void close(String indexName);
    
    /**
     * 创建索引
     */
    void create(String indexName, Map<String, Object> settings);
    
    /**
     * 更新索引设置
     */
    void putSettings(String indexName, Map<String, Object> settings);
    
    /**
     * 读取单个索引设置（包括默认值），如 index.number_of_replicas
     */
    Optional<String> getSetting(String indexName, String settingName);
    
    /**
     * 统计文档数，索引已关闭时抛出IndexClosedException
     */
    long count(String indexName);
    
    /**
     * 强制段合并
     */
    void forceMerge(String indexName);
    
    /**
     * 提交异步reindex任务
     *
     * @return 任务句柄，格式 node:id
     */
    String reindexAsync(String sourceIndex, String destIndex, ReindexOptions options);
    
    /**
     * 查询任务状态原始数据（GET _tasks/{handle} 的响应体）；任务不存在时返回空
     */
    Optional<JSONObject> taskStatus(String taskHandle);
    
    /**
     * 列出匹配表达式的所有索引（包括已关闭的），按名称排序
     */
    SortedSet<String> listMatching(String pattern);
    
    /**
     * 用scroll分批读取索引中的所有文档；索引不存在时返回空列表
     */
    List<JSONObject> getAll(String indexName);
    
    /**
     * 按ID写入文档（存在则覆盖），写入后立即可见
     */
    void put(String indexName, String id, JSONObject document);
    
    /**
     * 删除文档，文档或索引不存在不视为错误
     */
    void delete(String indexName, String id);
}

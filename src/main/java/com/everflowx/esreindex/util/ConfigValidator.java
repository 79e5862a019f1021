package com.everflowx.esreindex.util;

import com.everflowx.esreindex.domain.ReindexJobConfig;
import com.everflowx.esreindex.exception.ReindexConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 配置验证工具类
 * 
 * @author everflowx
 */
@Slf4j
@Component
public class ConfigValidator {
    
    /**
     * 验证reindex任务配置
     */
    public void validateJobConfig(ReindexJobConfig config) {
        if (config == null) {
            throw new ReindexConfigException("迁移配置不能为空");
        }
        
        if (!StringUtils.hasText(config.getSourcePattern())) {
            throw ReindexConfigException.missingRequiredField("es.reindex.source-pattern");
        }
        validateIndexPattern(config.getSourcePattern());
        
        if (!StringUtils.hasText(config.getDestIndex())) {
            throw ReindexConfigException.missingRequiredField("es.reindex.dest-index");
        }
        validateIndexName(config.getDestIndex());
        
        if (!StringUtils.hasText(config.getCheckpointIndex())) {
            throw ReindexConfigException.missingRequiredField("es.reindex.checkpoint-index");
        }
        validateIndexName(config.getCheckpointIndex());
        
        if (config.getDestIndex().equals(config.getCheckpointIndex())) {
            throw new ReindexConfigException("目标索引不能与断点索引相同", "es.reindex.dest-index");
        }
        
        if (config.getPollIntervalSeconds() < 1 || config.getPollIntervalSeconds() > 3600) {
            throw ReindexConfigException.outOfRange("es.reindex.poll-interval-seconds",
                config.getPollIntervalSeconds(), 1, 3600);
        }
        
        if (config.getOpenSettleSeconds() < 0 || config.getOpenSettleSeconds() > 600) {
            throw ReindexConfigException.outOfRange("es.reindex.open-settle-seconds",
                config.getOpenSettleSeconds(), 0, 600);
        }
        
        if (config.getStallPolls() < 0) {
            throw ReindexConfigException.outOfRange("es.reindex.stall-polls",
                config.getStallPolls(), 0, Integer.MAX_VALUE);
        }
        
        if (config.getBatchSize() < 0 || config.getBatchSize() > 10000) {
            throw ReindexConfigException.outOfRange("es.reindex.batch-size", config.getBatchSize(), 0, 10000);
        }
        
        if (config.getDestShards() < 1 || config.getDestShards() > 1024) {
            throw ReindexConfigException.outOfRange("es.reindex.dest.shards", config.getDestShards(), 1, 1024);
        }
        
        if (config.getDestReplicas() < 0 || config.getDestReplicas() > 10) {
            throw ReindexConfigException.outOfRange("es.reindex.dest.replicas", config.getDestReplicas(), 0, 10);
        }
        
        if (!StringUtils.hasText(config.getDestRefreshInterval())) {
            throw ReindexConfigException.missingRequiredField("es.reindex.dest.refresh-interval");
        }
        
        log.debug("迁移配置验证通过: sourcePattern={}, destIndex={}, checkpointIndex={}, resume={}", 
                 config.getSourcePattern(), config.getDestIndex(), config.getCheckpointIndex(), config.isResume());
    }
    
    /**
     * 验证索引名称格式
     */
    public void validateIndexName(String indexName) {
        if (!StringUtils.hasText(indexName)) {
            throw new ReindexConfigException("索引名称不能为空");
        }
        
        // ES索引名称规则：小写字母、数字、-、_，不能以-、_、+开头
        if (!indexName.matches("^[a-z0-9]([a-z0-9_.-]*[a-z0-9])?$")) {
            throw new ReindexConfigException(
                String.format("索引名称格式无效: %s，必须以小写字母或数字开头，只能包含小写字母、数字、.、-、_", indexName),
                "indexName"
            );
        }
        
        if (indexName.length() > 255) {
            throw new ReindexConfigException(
                String.format("索引名称过长: %d字符，最大允许255字符", indexName.length()),
                "indexName"
            );
        }
    }
    
    /**
     * 验证源索引通配符，允许 * 和逗号分隔的多个表达式
     */
    public void validateIndexPattern(String pattern) {
        for (String part : pattern.split(",")) {
            String expression = part.trim();
            if (expression.isEmpty() || !expression.matches("^[a-z0-9*][a-z0-9_.*-]*$")) {
                throw new ReindexConfigException(
                    String.format("源索引表达式无效: %s", pattern), "es.reindex.source-pattern");
            }
            if ("*".equals(expression) || "_all".equals(expression)) {
                throw new ReindexConfigException("不允许迁移全部索引，请指定更具体的表达式", "es.reindex.source-pattern");
            }
        }
    }
}

package com.everflowx.esreindex.util;

import com.everflowx.esreindex.exception.EsConnectionException;
import com.everflowx.esreindex.exception.EsReindexException;
import com.everflowx.esreindex.exception.IndexClosedException;
import com.everflowx.esreindex.exception.IndexNotExistsException;
import com.everflowx.esreindex.exception.ReindexConfigException;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.ElasticsearchException;
import org.elasticsearch.ElasticsearchStatusException;
import org.elasticsearch.client.ResponseException;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * 异常处理工具类
 * 把ES客户端抛出的各类异常统一转换为带类型的业务异常，调用方按异常类型分支处理。
 * 不做任何重试：失败直接上抛，由操作人员决定是否续跑。
 * 
 * @author everflowx
 */
@Slf4j
public final class ExceptionHandler {
    
    private static final String INDEX_CLOSED_TYPE = "index_closed_exception";
    private static final String INDEX_NOT_FOUND_TYPE = "index_not_found_exception";
    
    private ExceptionHandler() {
    }
    
    /**
     * 执行ES操作，自动转换异常
     */
    public static <T> T safeExecute(Callable<T> operation, String operationName, String indexName) {
        try {
            return operation.call();
        } catch (Exception e) {
            throw convertToBusinessException(e, operationName, indexName);
        }
    }
    
    /**
     * 将通用异常转换为业务异常
     */
    public static RuntimeException convertToBusinessException(Exception e, String context, String indexName) {
        if (e instanceof EsReindexException) {
            return (EsReindexException) e;
        }
        
        if (e instanceof ElasticsearchStatusException) {
            ElasticsearchStatusException statusException = (ElasticsearchStatusException) e;
            return fromStatus(statusException.status().getStatus(),
                statusException.getDetailedMessage(), context, indexName, e);
        }
        
        if (e instanceof ResponseException) {
            ResponseException responseException = (ResponseException) e;
            return fromStatus(responseException.getResponse().getStatusLine().getStatusCode(),
                responseException.getMessage(), context, indexName, e);
        }
        
        if (e instanceof ElasticsearchException) {
            ElasticsearchException esException = (ElasticsearchException) e;
            return new EsConnectionException("ES_ERROR", 
                context + "时ES异常: " + esException.getDetailedMessage(), e);
        }
        
        if (e instanceof IOException) {
            return EsConnectionException.transportFailure(context, e);
        }
        
        if (e instanceof IllegalArgumentException) {
            return new ReindexConfigException(context + "时参数错误: " + e.getMessage());
        }
        
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        
        return new EsReindexException("UNKNOWN_ERROR", 
            context + "时发生未知异常: " + e.getMessage(), e);
    }
    
    /**
     * 根据HTTP状态码和ES错误类型归类
     */
    static RuntimeException fromStatus(int status, String detail, String context, String indexName, Exception cause) {
        String text = detail == null ? "" : detail;
        if (indexName != null && text.contains(INDEX_CLOSED_TYPE)) {
            return new IndexClosedException(indexName, cause);
        }
        if (indexName != null && (status == 404 || text.contains(INDEX_NOT_FOUND_TYPE))) {
            return new IndexNotExistsException(indexName, cause);
        }
        log.debug("{}失败, HTTP状态: {}, 详情: {}", context, status, text);
        return new EsConnectionException("ES_ERROR",
            String.format("%s时ES返回错误(HTTP %d): %s", context, status, text), status, cause);
    }
    
    /**
     * 线程中断检查
     */
    public static void checkInterrupted(String operationName) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException(operationName + "被中断");
        }
    }
}

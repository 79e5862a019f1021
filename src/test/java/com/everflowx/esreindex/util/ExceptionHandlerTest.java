package com.everflowx.esreindex.util;

import com.everflowx.esreindex.exception.EsConnectionException;
import com.everflowx.esreindex.exception.IndexClosedException;
import com.everflowx.esreindex.exception.IndexNotExistsException;
import com.everflowx.esreindex.exception.ReindexConfigException;
import org.elasticsearch.ElasticsearchStatusException;
import org.elasticsearch.rest.RestStatus;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExceptionHandlerTest {
    
    @Test
    void closedIndexIsTagged() {
        ElasticsearchStatusException e = new ElasticsearchStatusException(
            "Elasticsearch exception [type=index_closed_exception, reason=closed]", RestStatus.BAD_REQUEST);
        
        RuntimeException converted = ExceptionHandler.convertToBusinessException(e, "统计文档数", "logs-2020");
        
        assertThat(converted, instanceOf(IndexClosedException.class));
        assertEquals("logs-2020", ((IndexClosedException) converted).getIndexName());
    }
    
    @Test
    void missingIndexIsTagged() {
        ElasticsearchStatusException e = new ElasticsearchStatusException(
            "Elasticsearch exception [type=index_not_found_exception, reason=no such index [x]]", RestStatus.NOT_FOUND);
        
        assertThat(ExceptionHandler.convertToBusinessException(e, "打开索引", "x"), instanceOf(IndexNotExistsException.class));
    }
    
    @Test
    void otherServerErrorsKeepTheirStatus() {
        ElasticsearchStatusException e = new ElasticsearchStatusException(
            "Elasticsearch exception [type=cluster_block_exception, reason=blocked]", RestStatus.FORBIDDEN);
        
        RuntimeException converted = ExceptionHandler.convertToBusinessException(e, "更新索引设置", "logs-all");
        
        assertThat(converted, instanceOf(EsConnectionException.class));
        assertEquals(403, ((EsConnectionException) converted).getHttpStatus());
    }
    
    @Test
    void ioFailureIsTransportFailure() {
        RuntimeException converted = ExceptionHandler.convertToBusinessException(
            new ConnectException("Connection refused"), "写入文档", "idx");
        
        assertThat(converted, instanceOf(EsConnectionException.class));
        assertTrue(((EsConnectionException) converted).isTransportFailure());
    }
    
    @Test
    void businessExceptionsPassThrough() {
        IndexClosedException original = new IndexClosedException("a");
        assertSame(original, ExceptionHandler.convertToBusinessException(original, "ctx", "a"));
    }
    
    @Test
    void safeExecuteConvertsCheckedExceptions() {
        assertThrows(EsConnectionException.class, () -> ExceptionHandler.safeExecute(() -> {
            throw new IOException("broken pipe");
        }, "查询索引列表", "logs-*"));
        assertThrows(ReindexConfigException.class, () -> ExceptionHandler.safeExecute(() -> {
            throw new IllegalArgumentException("bad");
        }, "提交reindex任务", "logs-*"));
    }
}

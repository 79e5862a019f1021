package com.everflowx.esreindex.exception;

/**
 * 索引不存在异常
 * 
 * @author everflowx
 */
public class IndexNotExistsException extends EsReindexException {
    
    public IndexNotExistsException(String indexName) {
        super("INDEX_NOT_EXISTS", "索引不存在: " + indexName, indexName);
    }
    
    public IndexNotExistsException(String indexName, Throwable cause) {
        super("INDEX_NOT_EXISTS", "索引不存在: " + indexName, indexName, cause);
    }
}

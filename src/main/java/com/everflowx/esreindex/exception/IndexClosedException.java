package com.everflowx.esreindex.exception;

/**
 * 索引处于关闭状态，无法读写
 * 
 * @author everflowx
 */
public class IndexClosedException extends EsReindexException {
    
    public IndexClosedException(String indexName) {
        super("INDEX_CLOSED", "索引已关闭: " + indexName, indexName);
    }
    
    public IndexClosedException(String indexName, Throwable cause) {
        super("INDEX_CLOSED", "索引已关闭: " + indexName, indexName, cause);
    }
}

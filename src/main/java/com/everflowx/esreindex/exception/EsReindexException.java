package com.everflowx.esreindex.exception;

/**
 * reindex迁移异常基类
 * 
 * @author everflowx
 */
public class EsReindexException extends RuntimeException {
    
    private String errorCode;
    private String indexName;
    
    public EsReindexException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public EsReindexException(String errorCode, String message, String indexName) {
        super(message);
        this.errorCode = errorCode;
        this.indexName = indexName;
    }
    
    public EsReindexException(String errorCode, String message, String indexName, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.indexName = indexName;
    }
    
    public EsReindexException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    public String getIndexName() {
        return indexName;
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append("{");
        if (errorCode != null) {
            sb.append("errorCode='").append(errorCode).append("', ");
        }
        if (indexName != null) {
            sb.append("indexName='").append(indexName).append("', ");
        }
        sb.append("message='").append(getMessage()).append("'");
        sb.append("}");
        return sb.toString();
    }
}

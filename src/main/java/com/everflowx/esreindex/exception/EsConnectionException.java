package com.everflowx.esreindex.exception;

/**
 * ES连接或服务端异常（无法归类为索引不存在、索引已关闭的通用失败）
 * 
 * @author everflowx
 */
public class EsConnectionException extends EsReindexException {
    
    private final int httpStatus;
    
    public EsConnectionException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, 0, cause);
    }
    
    public EsConnectionException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(errorCode, message, cause);
        this.httpStatus = httpStatus;
    }
    
    /**
     * ES返回的HTTP状态码，传输层失败时为0
     */
    public int getHttpStatus() {
        return httpStatus;
    }
    
    public boolean isTransportFailure() {
        return httpStatus == 0;
    }
    
    public static EsConnectionException transportFailure(String context, Throwable cause) {
        return new EsConnectionException("ES_IO_ERROR",
            String.format("%s时连接ES失败: %s", context, cause.getMessage()), cause);
    }
}

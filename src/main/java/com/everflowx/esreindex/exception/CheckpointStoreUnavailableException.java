package com.everflowx.esreindex.exception;

/**
 * 断点存储无法访问（查询或写入时ES不可用）
 * 
 * @author everflowx
 */
public class CheckpointStoreUnavailableException extends EsReindexException {
    
    public CheckpointStoreUnavailableException(String checkpointIndex, Throwable cause) {
        super("CHECKPOINT_STORE_UNAVAILABLE",
              String.format("断点索引 %s 无法访问: %s", checkpointIndex, cause.getMessage()),
              checkpointIndex, cause);
    }
}

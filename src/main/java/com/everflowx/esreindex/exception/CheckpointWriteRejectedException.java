package com.everflowx.esreindex.exception;

/**
 * ES拒绝写入断点文档
 * 
 * @author everflowx
 */
public class CheckpointWriteRejectedException extends EsReindexException {
    
    public CheckpointWriteRejectedException(String checkpointIndex, String checkpointId, Throwable cause) {
        super("CHECKPOINT_WRITE_REJECTED",
              String.format("断点 %s 写入 %s 被拒绝: %s", checkpointId, checkpointIndex, cause.getMessage()),
              checkpointIndex, cause);
    }
}

package com.everflowx.esreindex.exception;

/**
 * reindex任务在ES端执行结束但报告了错误，该源索引的数据没有完整迁移
 * 
 * @author everflowx
 */
public class ReindexTaskFailedException extends EsReindexException {
    
    private final String taskHandle;
    
    public ReindexTaskFailedException(String sourceIndex, String taskHandle, String reason) {
        super("REINDEX_TASK_FAILED",
              String.format("源索引 %s 的reindex任务 %s 执行失败: %s", sourceIndex, taskHandle, reason),
              sourceIndex);
        this.taskHandle = taskHandle;
    }
    
    public String getTaskHandle() {
        return taskHandle;
    }
}

package com.everflowx.esreindex.exception;

/**
 * reindex任务连续多次轮询无进展
 * 
 * @author everflowx
 */
public class TaskStalledException extends EsReindexException {
    
    private final String taskHandle;
    
    public TaskStalledException(String taskHandle, int polls, long itemsDone) {
        super("TASK_STALLED",
              String.format("任务 %s 连续 %d 次轮询无进展，已处理文档数停留在 %d", taskHandle, polls, itemsDone));
        this.taskHandle = taskHandle;
    }
    
    public String getTaskHandle() {
        return taskHandle;
    }
}

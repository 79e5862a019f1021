package com.everflowx.esreindex.domain;

/**
 * 一次运行的结果及对应的进程退出码
 * 
 * @author everflowx
 */
public enum JobOutcome {
    COMPLETED("迁移完成", 0),
    DRY_RUN("试运行结束", 0),
    NOTHING_TO_DO("没有匹配的源索引", 0),
    REFUSED("存在同标识的未完成任务，未指定续跑", 1),
    DECLINED("用户取消", 1),
    INTERRUPTED("用户中断", 1);
    
    private final String description;
    private final int exitCode;
    
    JobOutcome(String description, int exitCode) {
        this.description = description;
        this.exitCode = exitCode;
    }
    
    public String getDescription() {
        return description;
    }
    
    public int getExitCode() {
        return exitCode;
    }
}

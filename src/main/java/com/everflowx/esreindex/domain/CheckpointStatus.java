package com.everflowx.esreindex.domain;

/**
 * 断点状态枚举
 * 
 * @author everflowx
 */
public enum CheckpointStatus {
    OK("运行正常"),
    CRASHED("异常终止"),
    INTERRUPTED("用户中断");
    
    private final String description;
    
    CheckpointStatus(String description) {
        this.description = description;
    }
    
    public String getDescription() {
        return description;
    }
}

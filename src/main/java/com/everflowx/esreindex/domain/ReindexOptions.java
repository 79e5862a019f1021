package com.everflowx.esreindex.domain;

import lombok.Data;

/**
 * 提交reindex任务的选项
 * 
 * @author everflowx
 */
@Data
public class ReindexOptions {
    
    /**
     * 目标端使用外部版本号，重复迁移的索引不会覆盖更新的写入
     */
    private boolean externalVersioning = true;
    
    /**
     * 版本冲突时跳过该文档而不是中止整个任务
     */
    private boolean proceedOnConflicts = true;
    
    /**
     * 每批滚动读取的文档数，0表示使用ES默认值
     */
    private int batchSize = 0;
    
    public static ReindexOptions defaults() {
        return new ReindexOptions();
    }
}

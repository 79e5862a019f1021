package com.everflowx.esreindex.exception;

/**
 * 迁移配置异常，在任何状态变更之前抛出
 * 
 * @author everflowx
 */
public class ReindexConfigException extends EsReindexException {
    
    public ReindexConfigException(String message) {
        super("CONFIG_ERROR", message);
    }
    
    public ReindexConfigException(String message, String fieldName) {
        super("CONFIG_ERROR", 
              String.format("配置错误 [%s]: %s", fieldName, message));
    }
    
    public static ReindexConfigException missingRequiredField(String fieldName) {
        return new ReindexConfigException(
            String.format("缺少必需的配置字段: %s", fieldName),
            fieldName
        );
    }
    
    public static ReindexConfigException outOfRange(String fieldName, long value, long min, long max) {
        return new ReindexConfigException(
            String.format("取值无效: %d, 必须在%d-%d之间", value, min, max),
            fieldName
        );
    }
}

package com.everflowx.esreindex.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 可替换的等待策略，测试中替换为不真正休眠的实现
 * 
 * @author everflowx
 */
@FunctionalInterface
public interface Sleeper {
    
    Sleeper SYSTEM = duration -> TimeUnit.MILLISECONDS.sleep(duration.toMillis());
    
    void sleep(Duration duration) throws InterruptedException;
}

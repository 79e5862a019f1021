package com.everflowx.esreindex.task;

import com.everflowx.esreindex.domain.JobOutcome;
import com.everflowx.esreindex.domain.ReindexJobConfig;
import com.everflowx.esreindex.manager.ReindexCoordinator;
import com.everflowx.esreindex.util.ConfigValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 命令行入口：从启动参数（--es.reindex.xxx=...）读取配置并执行一次reindex迁移
 * 
 * @author everflowx
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "es.reindex.runner.enabled", havingValue = "true", matchIfMissing = true)
public class ReindexCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    
    /**
     * Ctrl+C后等待主流程写完断点的最长时间
     */
    private static final long SHUTDOWN_GRACE_SECONDS = 30;
    
    @Autowired
    private ReindexCoordinator reindexCoordinator;
    
    @Autowired
    private ConfigValidator configValidator;
    
    @Value("${es.reindex.source-pattern:}")
    private String sourcePattern;
    
    @Value("${es.reindex.dest-index:}")
    private String destIndex;
    
    @Value("${es.reindex.resume:false}")
    private boolean resume;
    
    @Value("${es.reindex.dry-run:false}")
    private boolean dryRun;
    
    @Value("${es.reindex.yes:false}")
    private boolean assumeYes;
    
    @Value("${es.reindex.source-read-only:false}")
    private boolean sourceReadOnly;
    
    @Value("${es.reindex.dest-read-only:false}")
    private boolean destReadOnly;
    
    @Value("${es.reindex.checkpoint-index:es_reindex_checkpoints}")
    private String checkpointIndex;
    
    @Value("${es.reindex.poll-interval-seconds:10}")
    private long pollIntervalSeconds;
    
    @Value("${es.reindex.open-settle-seconds:5}")
    private long openSettleSeconds;
    
    @Value("${es.reindex.stall-polls:0}")
    private int stallPolls;
    
    @Value("${es.reindex.batch-size:0}")
    private int batchSize;
    
    @Value("${es.reindex.liveness-window-seconds:300}")
    private long livenessWindowSeconds;
    
    @Value("${es.reindex.dest.shards:1}")
    private int destShards;
    
    @Value("${es.reindex.dest.replicas:1}")
    private int destReplicas;
    
    @Value("${es.reindex.dest.refresh-interval:1s}")
    private String destRefreshInterval;
    
    private volatile int exitCode = 0;
    
    @Override
    public void run(ApplicationArguments args) {
        ReindexJobConfig config = buildJobConfig();
        configValidator.validateJobConfig(config);
        
        CountDownLatch finished = new CountDownLatch(1);
        Thread worker = Thread.currentThread();
        Thread shutdownHook = new Thread(() -> interruptAndWait(worker, finished), "reindex-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        
        try {
            JobOutcome outcome = reindexCoordinator.execute(config, this::askOnConsole);
            exitCode = outcome.getExitCode();
            log.info("运行结束: {} (退出码 {})", outcome.getDescription(), exitCode);
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }
    
    @Override
    public int getExitCode() {
        return exitCode;
    }
    
    ReindexJobConfig buildJobConfig() {
        ReindexJobConfig config = new ReindexJobConfig();
        config.setSourcePattern(sourcePattern);
        config.setDestIndex(destIndex);
        config.setResume(resume);
        config.setDryRun(dryRun);
        config.setAssumeYes(assumeYes);
        config.setSourceReadOnly(sourceReadOnly);
        config.setDestReadOnly(destReadOnly);
        config.setCheckpointIndex(checkpointIndex);
        config.setPollIntervalSeconds(pollIntervalSeconds);
        config.setOpenSettleSeconds(openSettleSeconds);
        config.setStallPolls(stallPolls);
        config.setBatchSize(batchSize);
        config.setLivenessWindowSeconds(livenessWindowSeconds);
        config.setDestShards(destShards);
        config.setDestReplicas(destReplicas);
        config.setDestRefreshInterval(destRefreshInterval);
        return config;
    }
    
    /**
     * Ctrl+C：中断主流程，等它把INTERRUPTED写入断点
     */
    private void interruptAndWait(Thread worker, CountDownLatch finished) {
        if (finished.getCount() == 0) {
            return;
        }
        log.warn("收到退出信号，正在保存断点...");
        worker.interrupt();
        try {
            if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.error("等待断点保存超时({}秒)，直接退出", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
    
    private void removeShutdownHook(Thread shutdownHook) {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM正在退出，保留shutdown hook");
        }
    }
    
    private boolean askOnConsole(String prompt) {
        System.out.print(prompt + " [y/N] ");
        System.out.flush();
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String answer = reader.readLine();
            return answer != null && ("y".equalsIgnoreCase(answer.trim()) || "yes".equalsIgnoreCase(answer.trim()));
        } catch (IOException e) {
            log.warn("读取确认输入失败，按取消处理: {}", e.getMessage());
            return false;
        }
    }
}

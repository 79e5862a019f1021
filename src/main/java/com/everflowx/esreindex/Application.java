package com.everflowx.esreindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.elasticsearch.ElasticsearchRestClientAutoConfiguration;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * 启动类
 * <p>
 * 关闭Spring自带的shutdown hook：Ctrl+C时由{@link com.everflowx.esreindex.task.ReindexCommandRunner}
 * 先把中断状态写入断点，ES客户端必须在此之后才能关闭。
 *
 * @author everflowx
 */
@SpringBootApplication(exclude = ElasticsearchRestClientAutoConfiguration.class)
public class Application {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(Application.class);
        application.setRegisterShutdownHook(false);
        ConfigurableApplicationContext context = application.run(args);
        System.exit(SpringApplication.exit(context));
    }
}

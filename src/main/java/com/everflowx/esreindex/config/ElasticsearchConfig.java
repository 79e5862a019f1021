package com.everflowx.esreindex.config;

import com.everflowx.esreindex.exception.ReindexConfigException;
import com.everflowx.esreindex.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.HttpAsyncResponseConsumerFactory;
import org.elasticsearch.client.RequestOptions;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.elasticsearch.client.RestHighLevelClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Elasticsearch配置类
 * 单集群连接：源索引、目标索引和断点索引都在同一个集群上
 *
 * @author everflowx
 */
@Slf4j
@Configuration
public class ElasticsearchConfig {

    /**
     * 集群地址，逗号分隔，例如 http://es1:9200,http://es2:9200
     */
    @Value("${elasticsearch.hosts:}")
    private String hosts;
    
    @Value("${elasticsearch.username:}")
    private String username;
    
    @Value("${elasticsearch.password:}")
    private String password;

    // 响应缓冲区配置
    @Value("${elasticsearch.response.buffer.limit:104857600}") // 默认100MB
    private int responseBufferLimit;
    
    // 超时配置
    @Value("${elasticsearch.timeout.connect:30000}") // 连接超时，默认30秒
    private int connectTimeout;
    
    @Value("${elasticsearch.timeout.socket:600000}") // Socket超时，默认10分钟，forcemerge可能很慢
    private int socketTimeout;

    /**
     * ES客户端
     */
    @Bean(destroyMethod = "close")
    public RestHighLevelClient elasticsearchClient() {
        HttpHost[] httpHosts = parseHosts(hosts);
        RestClientBuilder builder = RestClient.builder(httpHosts);

        builder.setHttpClientConfigCallback(httpClientBuilder -> {
            // 如果配置了用户名密码，则添加认证
            if (StringUtils.hasText(username) && StringUtils.hasText(password)) {
                CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
                credentialsProvider.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(username, password));
                httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider);
            }
            return httpClientBuilder;
        });

        builder.setRequestConfigCallback(requestConfigBuilder ->
            requestConfigBuilder
                .setConnectTimeout(connectTimeout)
                .setSocketTimeout(socketTimeout));

        log.info("创建ES客户端 - Hosts: {}, 认证: {}, 超时: {}/{}ms",
                hosts, StringUtils.hasText(username) ? "basic" : "无", connectTimeout, socketTimeout);

        return new RestHighLevelClient(builder);
    }
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
    
    /**
     * 解析集群地址，未指定scheme时默认http，未指定端口时默认9200
     */
    static HttpHost[] parseHosts(String hosts) {
        if (!StringUtils.hasText(hosts)) {
            throw ReindexConfigException.missingRequiredField("elasticsearch.hosts");
        }
        List<HttpHost> result = new ArrayList<>();
        for (String raw : hosts.split(",")) {
            String host = raw.trim();
            if (host.isEmpty()) {
                continue;
            }
            if (!host.contains("://")) {
                host = "http://" + host;
            }
            HttpHost httpHost;
            try {
                httpHost = HttpHost.create(host);
            } catch (IllegalArgumentException e) {
                throw new ReindexConfigException("集群地址格式无效: " + raw, "elasticsearch.hosts");
            }
            if (httpHost.getPort() < 0) {
                httpHost = new HttpHost(httpHost.getHostName(), 9200, httpHost.getSchemeName());
            }
            result.add(httpHost);
        }
        if (result.isEmpty()) {
            throw ReindexConfigException.missingRequiredField("elasticsearch.hosts");
        }
        return result.toArray(new HttpHost[0]);
    }

    /**
     * 获取配置了自定义缓冲区的RequestOptions
     */
    public RequestOptions getCustomRequestOptions() {
        RequestOptions.Builder builder = RequestOptions.DEFAULT.toBuilder();
        builder.setHttpAsyncResponseConsumerFactory(
            new HttpAsyncResponseConsumerFactory.HeapBufferedResponseConsumerFactory(responseBufferLimit));
        return builder.build();
    }
}

package com.everflowx.esreindex.service.impl;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import com.everflowx.esreindex.config.ElasticsearchConfig;
import com.everflowx.esreindex.domain.ReindexOptions;
import com.everflowx.esreindex.exception.IndexNotExistsException;
import com.everflowx.esreindex.service.EsIndexService;
import com.everflowx.esreindex.util.ExceptionHandler;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.util.EntityUtils;
import org.elasticsearch.ElasticsearchException;
import org.elasticsearch.ElasticsearchStatusException;
import org.elasticsearch.action.admin.indices.forcemerge.ForceMergeRequest;
import org.elasticsearch.action.admin.indices.open.OpenIndexRequest;
import org.elasticsearch.action.admin.indices.settings.get.GetSettingsRequest;
import org.elasticsearch.action.admin.indices.settings.get.GetSettingsResponse;
import org.elasticsearch.action.admin.indices.settings.put.UpdateSettingsRequest;
import org.elasticsearch.action.delete.DeleteRequest;
import org.elasticsearch.action.delete.DeleteResponse;
import org.elasticsearch.action.index.IndexRequest;
import org.elasticsearch.action.search.ClearScrollRequest;
import org.elasticsearch.action.search.SearchRequest;
import org.elasticsearch.action.search.SearchResponse;
import org.elasticsearch.action.search.SearchScrollRequest;
import org.elasticsearch.action.support.WriteRequest;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.RequestOptions;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.ResponseException;
import org.elasticsearch.client.RestHighLevelClient;
import org.elasticsearch.client.core.CountRequest;
import org.elasticsearch.client.indices.CloseIndexRequest;
import org.elasticsearch.client.indices.CreateIndexRequest;
import org.elasticsearch.client.indices.GetIndexRequest;
import org.elasticsearch.client.tasks.TaskSubmissionResponse;
import org.elasticsearch.index.VersionType;
import org.elasticsearch.index.query.QueryBuilders;
import org.elasticsearch.index.reindex.ReindexRequest;
import org.elasticsearch.rest.RestStatus;
import org.elasticsearch.search.SearchHit;
import org.elasticsearch.search.builder.SearchSourceBuilder;
import org.elasticsearch.xcontent.XContentType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 基于RestHighLevelClient的ES索引操作实现
 * 
 * @author everflowx
 */
@Slf4j
@Service
public class EsIndexServiceImpl implements EsIndexService {
    
    private static final String SCROLL_KEEP_ALIVE = "1m";
    
    private final RestHighLevelClient client;
    
    private final ElasticsearchConfig elasticsearchConfig;
    
    /**
     * 读取文档索引时每批返回的文档数
     */
    @Value("${es.reindex.document-fetch-size:1000}")
    private int documentFetchSize = 1000;
    
    @Autowired
    public EsIndexServiceImpl(RestHighLevelClient client, ElasticsearchConfig elasticsearchConfig) {
        this.client = client;
        this.elasticsearchConfig = elasticsearchConfig;
    }
    
    private RequestOptions options() {
        return elasticsearchConfig.getCustomRequestOptions();
    }
    
    @Override
    public boolean exists(String indexName) {
        return ExceptionHandler.safeExecute(
            () -> client.indices().exists(new GetIndexRequest(indexName), options()),
            "检查索引是否存在", indexName);
    }
    
    @Override
    public boolean isOpen(String indexName) {
        JSONArray rows = catIndices(indexName, "status");
        if (rows.isEmpty()) {
            throw new IndexNotExistsException(indexName);
        }
        return "open".equals(rows.getJSONObject(0).getString("status"));
    }
    
    @Override
    public void open(String indexName) {
        ExceptionHandler.safeExecute(
            () -> client.indices().open(new OpenIndexRequest(indexName), options()),
            "打开索引", indexName);
        log.info("已打开索引: {}", indexName);
    }
    
    @Override
    public void close(String indexName) {
        ExceptionHandler.safeExecute(
            () -> client.indices().close(new CloseIndexRequest(indexName), options()),
            "关闭索引", indexName);
        log.info("已关闭索引: {}", indexName);
    }
    
    @Override
    public void create(String indexName, Map<String, Object> settings) {
        CreateIndexRequest request = new CreateIndexRequest(indexName).settings(settings);
        ExceptionHandler.safeExecute(() -> client.indices().create(request, options()), "创建索引", indexName);
        log.info("已创建索引: {}, 设置: {}", indexName, settings);
    }
    
    @Override
    public void putSettings(String indexName, Map<String, Object> settings) {
        UpdateSettingsRequest request = new UpdateSettingsRequest(indexName).settings(settings);
        ExceptionHandler.safeExecute(() -> client.indices().putSettings(request, options()), "更新索引设置", indexName);
        log.info("已更新索引设置: {}, 设置: {}", indexName, settings);
    }
    
    @Override
    public Optional<String> getSetting(String indexName, String settingName) {
        GetSettingsRequest request = new GetSettingsRequest()
            .indices(indexName)
            .names(settingName)
            .includeDefaults(true);
        GetSettingsResponse response = ExceptionHandler.safeExecute(
            () -> client.indices().getSettings(request, options()), "读取索引设置", indexName);
        return Optional.ofNullable(response.getSetting(indexName, settingName));
    }
    
    @Override
    public long count(String indexName) {
        return ExceptionHandler.safeExecute(
            () -> client.count(new CountRequest(indexName), options()).getCount(),
            "统计文档数", indexName);
    }
    
    @Override
    public void forceMerge(String indexName) {
        ForceMergeRequest request = new ForceMergeRequest(indexName);
        request.maxNumSegments(1);
        ExceptionHandler.safeExecute(() -> client.indices().forcemerge(request, options()), "强制段合并", indexName);
        log.info("索引段合并完成: {}", indexName);
    }
    
    @Override
    public String reindexAsync(String sourceIndex, String destIndex, ReindexOptions reindexOptions) {
        ReindexRequest request = new ReindexRequest();
        request.setSourceIndices(sourceIndex);
        request.setDestIndex(destIndex);
        if (reindexOptions.isExternalVersioning()) {
            request.setDestVersionType(VersionType.EXTERNAL);
        }
        if (reindexOptions.isProceedOnConflicts()) {
            request.setConflicts("proceed");
        }
        if (reindexOptions.getBatchSize() > 0) {
            request.setSourceBatchSize(reindexOptions.getBatchSize());
        }
        
        TaskSubmissionResponse response = ExceptionHandler.safeExecute(
            () -> client.submitReindexTask(request, options()), "提交reindex任务", sourceIndex);
        log.info("已提交reindex任务: {} -> {}, 任务: {}", sourceIndex, destIndex, response.getTask());
        return response.getTask();
    }
    
    @Override
    public Optional<JSONObject> taskStatus(String taskHandle) {
        if (!taskHandle.matches("^[^:/\\s]+:\\d+$")) {
            log.warn("任务句柄格式无效: {}", taskHandle);
            return Optional.empty();
        }
        Request request = new Request("GET", "/_tasks/" + taskHandle);
        try {
            Response response = client.getLowLevelClient().performRequest(request);
            return Optional.of(JSON.parseObject(EntityUtils.toString(response.getEntity())));
        } catch (ResponseException e) {
            int status = e.getResponse().getStatusLine().getStatusCode();
            if (status == RestStatus.NOT_FOUND.getStatus()) {
                log.debug("任务 {} 已不存在", taskHandle);
                return Optional.empty();
            }
            throw ExceptionHandler.convertToBusinessException(e, "查询任务状态", null);
        } catch (IOException e) {
            throw ExceptionHandler.convertToBusinessException(e, "查询任务状态", null);
        }
    }
    
    @Override
    public SortedSet<String> listMatching(String pattern) {
        SortedSet<String> names = new TreeSet<>();
        JSONArray rows;
        try {
            rows = catIndices(pattern, "index");
        } catch (IndexNotExistsException e) {
            return names;
        }
        for (int i = 0; i < rows.size(); i++) {
            names.add(rows.getJSONObject(i).getString("index"));
        }
        return names;
    }
    
    @Override
    public List<JSONObject> getAll(String indexName) {
        SearchSourceBuilder source = new SearchSourceBuilder()
            .query(QueryBuilders.matchAllQuery())
            .sort("_doc")
            .size(documentFetchSize);
        SearchRequest request = new SearchRequest(indexName).source(source).scroll(SCROLL_KEEP_ALIVE);
        
        List<JSONObject> documents = new ArrayList<>();
        String scrollId = null;
        try {
            SearchResponse response = client.search(request, options());
            scrollId = response.getScrollId();
            SearchHit[] hits = response.getHits().getHits();
            
            while (hits.length > 0) {
                for (SearchHit hit : hits) {
                    documents.add(JSON.parseObject(hit.getSourceAsString()));
                }
                if (hits.length < documentFetchSize) {
                    break;
                }
                SearchScrollRequest scrollRequest = new SearchScrollRequest(scrollId).scroll(SCROLL_KEEP_ALIVE);
                response = client.scroll(scrollRequest, options());
                scrollId = response.getScrollId();
                hits = response.getHits().getHits();
            }
        } catch (ElasticsearchStatusException e) {
            if (e.status() == RestStatus.NOT_FOUND) {
                return new ArrayList<>();
            }
            throw ExceptionHandler.convertToBusinessException(e, "读取文档", indexName);
        } catch (IOException e) {
            throw ExceptionHandler.convertToBusinessException(e, "读取文档", indexName);
        } finally {
            clearScroll(scrollId);
        }
        
        log.debug("读取索引 {} 的全部文档: {} 条", indexName, documents.size());
        return documents;
    }
    
    @Override
    public void put(String indexName, String id, JSONObject document) {
        IndexRequest request = new IndexRequest(indexName)
            .id(id)
            .source(document.toJSONString(), XContentType.JSON)
            .setRefreshPolicy(WriteRequest.RefreshPolicy.IMMEDIATE);
        ExceptionHandler.safeExecute(() -> client.index(request, options()), "写入文档", indexName);
    }
    
    @Override
    public void delete(String indexName, String id) {
        DeleteRequest request = new DeleteRequest(indexName, id)
            .setRefreshPolicy(WriteRequest.RefreshPolicy.IMMEDIATE);
        try {
            DeleteResponse response = client.delete(request, options());
            log.debug("删除文档 {}/{}: {}", indexName, id, response.getResult());
        } catch (ElasticsearchStatusException e) {
            if (e.status() != RestStatus.NOT_FOUND) {
                throw ExceptionHandler.convertToBusinessException(e, "删除文档", indexName);
            }
            log.debug("删除文档时索引不存在: {}", indexName);
        } catch (IOException e) {
            throw ExceptionHandler.convertToBusinessException(e, "删除文档", indexName);
        }
    }
    
    private void clearScroll(String scrollId) {
        if (scrollId == null) {
            return;
        }
        ClearScrollRequest request = new ClearScrollRequest();
        request.addScrollId(scrollId);
        try {
            client.clearScroll(request, options());
        } catch (IOException | ElasticsearchException e) {
            // scroll上下文到期后由ES自行释放
            log.warn("清理scroll上下文失败: {}", e.getMessage());
        }
    }
    
    /**
     * GET _cat/indices/{expression}，包括已关闭的索引
     */
    private JSONArray catIndices(String expression, String columns) {
        Request request = new Request("GET", "/_cat/indices/" + expression);
        request.addParameter("h", columns);
        request.addParameter("format", "json");
        request.addParameter("expand_wildcards", "all");
        request.addParameter("s", "index");
        return ExceptionHandler.safeExecute(() -> {
            Response response = client.getLowLevelClient().performRequest(request);
            return JSON.parseArray(EntityUtils.toString(response.getEntity()));
        }, "查询索引列表", expression);
    }
}

package com.memsearch.config;

import com.memsearch.query.QueryNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 引擎运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class EngineConfig {
    private List<String> fields = new ArrayList<>(Constants.DEFAULT_FIELDS);
    private int indexThreads = Constants.DEFAULT_INDEX_THREADS;
    private int queryLimit = Constants.DEFAULT_QUERY_LIMIT;
    private QueryNode.BoolOp defaultOperator = QueryNode.BoolOp.AND;

    public List<String> getFields() {
        return List.copyOf(fields);
    }

    public void setFields(List<String> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("索引字段不能为空");
        }
        this.fields = new ArrayList<>(fields);
    }

    public int getIndexThreads() {
        return indexThreads;
    }

    public void setIndexThreads(int indexThreads) {
        if (indexThreads < 1 || indexThreads > Constants.MAX_INDEX_THREADS) {
            throw new IllegalArgumentException("索引线程数必须在 1 到 " + Constants.MAX_INDEX_THREADS + " 之间: " + indexThreads);
        }
        this.indexThreads = indexThreads;
    }

    public int getQueryLimit() {
        return queryLimit;
    }

    public void setQueryLimit(int queryLimit) {
        if (queryLimit < 0 || queryLimit > Constants.MAX_SEARCH_LIMIT) {
            throw new IllegalArgumentException("返回结果数必须在 0 到 " + Constants.MAX_SEARCH_LIMIT + " 之间: " + queryLimit);
        }
        this.queryLimit = queryLimit;
    }

    public QueryNode.BoolOp getDefaultOperator() {
        return defaultOperator;
    }

    public void setDefaultOperator(QueryNode.BoolOp defaultOperator) {
        if (defaultOperator == null) {
            throw new IllegalArgumentException("默认布尔操作符不能为null");
        }
        this.defaultOperator = defaultOperator;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}

package com.memsearch.config;

import java.util.List;

/**
 * 全局常量定义
 * 
 * 包含索引字段、查询参数、Top-K参数和线程参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 词典参数 ====================
    /** 词典查找未命中时返回的词项ID */
    public static final int TERM_NOT_FOUND = -1;

    // ==================== 索引参数 ====================
    /** 默认索引字段 */
    public static final List<String> DEFAULT_FIELDS = List.of("body");
    /** 文本语料中第二列对应的字段名 */
    public static final String META_FIELD = "meta";
    /** 倒排列表初始容量 */
    public static final int POSTING_LIST_INITIAL_CAPACITY = 4;
    /** 并行构建时每个分区的最少文档数，低于此值不拆分 */
    public static final int MIN_DOCS_PER_PARTITION = 256;

    // ==================== 查询参数 ====================
    /** 默认返回结果数 */
    public static final int DEFAULT_QUERY_LIMIT = 10;
    /** 返回结果数上限 */
    public static final int MAX_SEARCH_LIMIT = 10_000;
    /** 查询字符串最大长度 */
    public static final int MAX_QUERY_LENGTH = 1_024;

    // ==================== Top-K参数 ====================
    /** Sieve 堆的初始容量，之后随候选增长，不按 K 预分配 */
    public static final int SIEVE_INITIAL_HEAP_CAPACITY = 16;

    // ==================== 线程参数 ====================
    /** 默认索引工作线程数，单线程构建 */
    public static final int DEFAULT_INDEX_THREADS = 1;
    /** 索引线程数安全上限 */
    public static final int MAX_INDEX_THREADS = Math.max(1, Runtime.getRuntime().availableProcessors() * 2);
}

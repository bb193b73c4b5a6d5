package com.memsearch.query;

import java.util.List;
import java.util.Objects;

/**
 * 一次排序检索的结果。hits 按得分降序，最多 limit 条；totalMatches 是布尔检索命中的全部文档数。
 */
public record SearchResult(String query, List<SearchHit> hits, int totalMatches, long elapsedMs) {

    public SearchResult {
        Objects.requireNonNull(query, "query");
        hits = List.copyOf(hits);
        if (totalMatches < hits.size()) {
            throw new IllegalArgumentException("totalMatches=" + totalMatches + " 小于返回条数 " + hits.size());
        }
    }
}

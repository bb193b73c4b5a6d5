package com.memsearch.ranking;

/**
 * 带分数的候选项。
 */
public record ScoredItem<T>(double score, T item) {
}

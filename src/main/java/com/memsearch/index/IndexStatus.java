package com.memsearch.index;

/**
 * 索引统计信息。
 */
public record IndexStatus(int documentCount, int termCount, long postingCount) {
}

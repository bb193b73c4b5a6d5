package com.memsearch.index;

/**
 * 非位置倒排索引中的一条倒排项。
 *
 * @param documentId 文档ID
 * @param termFrequency 词项在该文档索引字段中的出现次数，至少为1
 */
public record Posting(int documentId, int termFrequency) {
    public Posting {
        if (documentId < 0) {
            throw new IllegalArgumentException("documentId不能为负数: " + documentId);
        }
        if (termFrequency < 1) {
            throw new IllegalArgumentException("termFrequency必须为正数, documentId=" + documentId + ", value=" + termFrequency);
        }
    }

    @Override
    public String toString() {
        return "(" + documentId + ", " + termFrequency + ")";
    }
}

package com.memsearch.index;

import com.memsearch.config.Constants;

import java.util.Arrays;

/**
 * 倒排列表的追加式构建器。只接受严格递增的文档ID，因此产出的列表天然有序。
 */
final class PostingListBuilder {
    private int[] docIds = new int[Constants.POSTING_LIST_INITIAL_CAPACITY];
    private int[] termFreqs = new int[Constants.POSTING_LIST_INITIAL_CAPACITY];
    private int size;

    /**
     * 追加一条倒排项。
     *
     * @throws IllegalArgumentException 文档ID不大于上一条或词频非正时抛出
     */
    void append(int documentId, int termFrequency) {
        if (size > 0 && documentId <= docIds[size - 1]) {
            throw new IllegalArgumentException("倒排追加必须按文档ID严格递增, last=" + docIds[size - 1]
                    + ", current=" + documentId);
        }
        if (termFrequency < 1) {
            throw new IllegalArgumentException("termFreq必须为正数, documentId=" + documentId + ", value=" + termFrequency);
        }
        if (size == docIds.length) {
            int newCapacity = docIds.length * 2;
            docIds = Arrays.copyOf(docIds, newCapacity);
            termFreqs = Arrays.copyOf(termFreqs, newCapacity);
        }
        docIds[size] = documentId;
        termFreqs[size] = termFrequency;
        size++;
    }

    int size() {
        return size;
    }

    PostingList build() {
        return new PostingList(Arrays.copyOf(docIds, size), Arrays.copyOf(termFreqs, size));
    }
}

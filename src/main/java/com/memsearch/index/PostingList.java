package com.memsearch.index;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 倒排列表，包含文档ID与对应词频。
 *
 * @param docIds 严格递增的文档ID数组
 * @param termFreqs 与docIds同长度的词频数组
 */
public record PostingList(int[] docIds, int[] termFreqs) implements Iterable<Posting> {
    /** 空倒排列表，供未登录词使用 */
    public static final PostingList EMPTY = new PostingList(new int[0], new int[0]);

    /**
     * 构造时执行校验并复制输入数据，避免外部修改。
     */
    public PostingList {
        if (docIds == null || termFreqs == null) {
            throw new IllegalArgumentException("docIds与termFreqs不能为null");
        }
        if (docIds.length != termFreqs.length) {
            throw new IllegalArgumentException("docIds与termFreqs长度不一致: " + docIds.length + " vs " + termFreqs.length);
        }
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (termFreqs[index] < 1) {
                throw new IllegalArgumentException("termFreq必须为正数，位置=" + index + ", value=" + termFreqs[index]);
            }
            if (index > 0 && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
        }
        docIds = Arrays.copyOf(docIds, docIds.length);
        termFreqs = Arrays.copyOf(termFreqs, termFreqs.length);
    }

    /**
     * 返回倒排项数量，即文档频率。
     */
    public int size() {
        return docIds.length;
    }

    public boolean isEmpty() {
        return docIds.length == 0;
    }

    /**
     * 获取指定位置的倒排项。
     *
     * @param index 倒排项下标
     * @return 倒排项
     */
    public Posting get(int index) {
        return new Posting(docIds[index], termFreqs[index]);
    }

    /**
     * 返回按文档ID升序的惰性迭代器，每次调用都从头开始。
     */
    @Override
    public Iterator<Posting> iterator() {
        return new Iterator<>() {
            private int cursor;

            @Override
            public boolean hasNext() {
                return cursor < docIds.length;
            }

            @Override
            public Posting next() {
                if (cursor >= docIds.length) {
                    throw new NoSuchElementException();
                }
                Posting posting = new Posting(docIds[cursor], termFreqs[cursor]);
                cursor++;
                return posting;
            }
        };
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }

    @Override
    public int[] termFreqs() {
        return Arrays.copyOf(termFreqs, termFreqs.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingList that)) {
            return false;
        }
        return Arrays.equals(docIds, that.docIds) && Arrays.equals(termFreqs, that.termFreqs);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(docIds) + Arrays.hashCode(termFreqs);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[");
        for (int index = 0; index < docIds.length; index++) {
            if (index > 0) {
                builder.append(", ");
            }
            builder.append('(').append(docIds[index]).append(", ").append(termFreqs[index]).append(')');
        }
        return builder.append(']').toString();
    }
}

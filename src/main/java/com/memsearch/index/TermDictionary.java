package com.memsearch.index;

import com.memsearch.config.Constants;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 词典，把词项映射为稠密整数ID。N 个不同词项对应 {0, ..., N - 1}，
 * ID 按首次出现顺序分配，不复用也不重编号。
 *
 * <p>非线程安全；索引构建完成后只读，可被并发读取。</p>
 */
public final class TermDictionary implements Iterable<Map.Entry<String, Integer>> {
    /** 词项不存在时的返回值 */
    public static final int NOT_FOUND = Constants.TERM_NOT_FOUND;

    private final Map<String, Integer> idsByTerm = new HashMap<>();
    private final List<String> termsById = new ArrayList<>();

    /**
     * 返回不同词项数量。
     */
    public int size() {
        return termsById.size();
    }

    /**
     * 词项已存在时返回原ID，否则分配下一个顺序ID。
     *
     * @param term 词项
     * @return 词项ID，取值范围 [0, size())
     */
    public int addIfAbsent(String term) {
        requireTerm(term);
        Integer existing = idsByTerm.get(term);
        if (existing != null) {
            return existing;
        }
        int termId = termsById.size();
        idsByTerm.put(term, termId);
        termsById.add(term);
        return termId;
    }

    /**
     * 查找词项ID，不修改词典。
     *
     * @param term 词项
     * @return 词项ID，不存在时返回 {@link #NOT_FOUND}
     */
    public int getTermId(String term) {
        requireTerm(term);
        return idsByTerm.getOrDefault(term, NOT_FOUND);
    }

    /**
     * 按ID反查词项。
     */
    public String getTerm(int termId) {
        if (termId < 0 || termId >= termsById.size()) {
            throw new IllegalArgumentException("termId越界: " + termId + ", size=" + termsById.size());
        }
        return termsById.get(termId);
    }

    /**
     * 按ID升序枚举 (词项, ID)。
     */
    @Override
    public Iterator<Map.Entry<String, Integer>> iterator() {
        Iterator<String> terms = termsById.iterator();
        return new Iterator<>() {
            private int nextId;

            @Override
            public boolean hasNext() {
                return terms.hasNext();
            }

            @Override
            public Map.Entry<String, Integer> next() {
                return new AbstractMap.SimpleImmutableEntry<>(terms.next(), nextId++);
            }
        };
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("{");
        for (int termId = 0; termId < termsById.size(); termId++) {
            if (termId > 0) {
                builder.append(", ");
            }
            builder.append(termsById.get(termId)).append('=').append(termId);
        }
        return builder.append('}').toString();
    }

    private static void requireTerm(String term) {
        if (term == null) {
            throw new IllegalArgumentException("词项不能为null");
        }
    }
}

package com.memsearch.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 由若干命名字段组成的文档。索引的是字段的规范化形式，这里保留原始字段用于展示。
 *
 * @param documentId 语料分配的文档ID
 * @param fields 字段名到原始文本的映射
 */
public record Document(
        int documentId,
        Map<String, String> fields
) {
    public Document {
        if (documentId < 0) {
            throw new IllegalArgumentException("documentId不能为负数: " + documentId);
        }
        if (fields == null) {
            throw new IllegalArgumentException("fields不能为null, documentId=" + documentId);
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Document of(int documentId, String field, String value) {
        return new Document(documentId, Map.of(field, value));
    }

    /**
     * 读取字段，缺失时返回默认值。
     */
    public String getField(String name, String defaultValue) {
        String value = fields.get(name);
        return value == null ? defaultValue : value;
    }
}

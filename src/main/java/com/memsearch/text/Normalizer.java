package com.memsearch.text;

/**
 * 文本规范化契约。两个方法都必须是输入的纯函数，保证文档与查询得到相同的词项。
 */
public interface Normalizer {

    /**
     * 整段文本规范化，供下游分词假定统一的文本表示。
     */
    String canonicalize(String buffer);

    /**
     * 将单个词元规范化为索引词项。
     */
    String normalize(String token);
}

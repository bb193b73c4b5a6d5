package com.memsearch.index;

import com.memsearch.text.Normalizer;
import com.memsearch.text.Tokenizer;

import java.util.Iterator;
import java.util.List;

/**
 * 倒排索引的只读契约。
 */
public interface InvertedIndex {

    /**
     * 处理文本并按顺序返回规范化后的词项。查询与文档必须经过完全相同的处理。
     */
    List<String> getTerms(String buffer);

    /**
     * 返回词项倒排列表的迭代器，按文档ID升序。未登录词返回空迭代器。
     */
    Iterator<Posting> getPostingsIterator(String term);

    /**
     * 返回包含该词项的文档数，未登录词返回0。
     */
    int getDocumentFrequency(String term);

    /**
     * 建索引时使用的分词器，查询分析必须复用它。
     */
    Tokenizer getTokenizer();

    Normalizer getNormalizer();
}

package com.memsearch.document;

/**
 * 文档集合契约。文档ID从0开始按先到先得分配且没有空洞，迭代顺序即ID升序。
 */
public interface Corpus extends Iterable<Document> {

    /**
     * 返回文档总数。
     */
    int size();

    /**
     * 按ID获取文档。
     *
     * @param documentId 取值范围 [0, size())
     * @throws IllegalArgumentException ID越界时抛出
     */
    Document getDocument(int documentId);
}

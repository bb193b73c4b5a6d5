package com.memsearch.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 内存文档仓库，仅适用于小规模语料。
 */
public final class InMemoryCorpus implements Corpus {
    private final List<Document> documents = new ArrayList<>();

    @Override
    public int size() {
        return documents.size();
    }

    @Override
    public Document getDocument(int documentId) {
        if (documentId < 0 || documentId >= documents.size()) {
            throw new IllegalArgumentException("documentId越界: " + documentId + ", size=" + documents.size());
        }
        return documents.get(documentId);
    }

    /**
     * 追加文档，文档ID必须恰好等于当前文档数。
     */
    public void addDocument(Document document) {
        if (document == null) {
            throw new IllegalArgumentException("document不能为null");
        }
        if (document.documentId() != documents.size()) {
            throw new IllegalArgumentException("documentId必须连续分配, expected=" + documents.size()
                    + ", actual=" + document.documentId());
        }
        documents.add(document);
    }

    @Override
    public Iterator<Document> iterator() {
        return Collections.unmodifiableList(documents).iterator();
    }
}

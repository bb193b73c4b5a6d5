package com.memsearch.query;

import com.memsearch.document.Document;

public record SearchHit(
        int documentId,
        double score,
        Document document
) {
}

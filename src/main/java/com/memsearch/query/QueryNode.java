package com.memsearch.query;

public sealed interface QueryNode permits QueryNode.TermQuery, QueryNode.BooleanQuery {

    /** 布尔操作类型 */
    enum BoolOp {
        AND,
        OR
    }

    record TermQuery(String text) implements QueryNode {
    }

    record BooleanQuery(BoolOp op, QueryNode left, QueryNode right) implements QueryNode {
    }
}

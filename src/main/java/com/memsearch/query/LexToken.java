package com.memsearch.query;

import com.memsearch.text.TokenRange;

import java.util.Objects;

/**
 * 查询词法单元。
 *
 * <p>{@code TERM} 的 text 已按建索引时的方式规范化，可直接查倒排；
 * 操作符与括号保留查询中的原文。range 指向规范化输入中的字符区间。</p>
 */
public record LexToken(Kind kind, String text, TokenRange range) {

    public enum Kind {
        TERM,
        AND,
        OR,
        LPAREN,
        RPAREN,
        END
    }

    public LexToken {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(range, "range");
    }

    static LexToken end(int position) {
        return new LexToken(Kind.END, "", new TokenRange(position, position));
    }

    public int position() {
        return range.start();
    }
}

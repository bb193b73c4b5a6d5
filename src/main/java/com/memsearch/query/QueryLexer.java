package com.memsearch.query;

import com.memsearch.text.Normalizer;
import com.memsearch.text.TokenRange;
import com.memsearch.text.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 用索引自身的分词器与规范化器切分查询。
 *
 * <p>分词器给出的每个词元要么是 AND/OR（不区分大小写），要么是规范化后的查询词；
 * 词元之间的间隙里只识别括号，其余字符与文档中的标点一样丢弃。
 * 因此 {@code foo-bar} 得到两个相邻查询词，由解析器按默认操作符组合。</p>
 */
public class QueryLexer {
    private final Tokenizer tokenizer;
    private final Normalizer normalizer;

    public QueryLexer(Tokenizer tokenizer, Normalizer normalizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    /**
     * 切分查询，末尾总是追加一个 {@code END}。
     *
     * @throws QueryParseException 查询为 null 时抛出
     */
    public List<LexToken> tokenize(String query) {
        if (query == null) {
            throw new QueryParseException("查询字符串不能为null", 0, "", "请输入非空查询");
        }
        String buffer = normalizer.canonicalize(query);
        List<LexToken> tokens = new ArrayList<>();
        int cursor = 0;
        for (TokenRange range : tokenizer.ranges(buffer)) {
            collectParentheses(buffer, cursor, range.start(), tokens);
            tokens.add(classify(buffer.substring(range.start(), range.end()), range));
            cursor = range.end();
        }
        collectParentheses(buffer, cursor, buffer.length(), tokens);
        tokens.add(LexToken.end(buffer.length()));
        return tokens;
    }

    private void collectParentheses(String buffer, int from, int to, List<LexToken> tokens) {
        for (int index = from; index < to; index++) {
            char symbol = buffer.charAt(index);
            if (symbol == '(') {
                tokens.add(new LexToken(LexToken.Kind.LPAREN, "(", new TokenRange(index, index + 1)));
            } else if (symbol == ')') {
                tokens.add(new LexToken(LexToken.Kind.RPAREN, ")", new TokenRange(index, index + 1)));
            }
        }
    }

    private LexToken classify(String word, TokenRange range) {
        if ("AND".equalsIgnoreCase(word)) {
            return new LexToken(LexToken.Kind.AND, word, range);
        }
        if ("OR".equalsIgnoreCase(word)) {
            return new LexToken(LexToken.Kind.OR, word, range);
        }
        return new LexToken(LexToken.Kind.TERM, normalizer.normalize(word), range);
    }
}

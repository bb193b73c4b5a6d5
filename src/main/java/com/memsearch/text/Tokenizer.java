package com.memsearch.text;

import java.util.ArrayList;
import java.util.List;

public interface Tokenizer {

    /**
     * 返回输入文本中每个词元的原文区间，按出现顺序排列。
     */
    List<TokenRange> ranges(String buffer);

    /**
     * 返回组成词元的字符串。
     */
    default List<String> strings(String buffer) {
        List<TokenRange> ranges = ranges(buffer);
        List<String> strings = new ArrayList<>(ranges.size());
        for (TokenRange range : ranges) {
            strings.add(buffer.substring(range.start(), range.end()));
        }
        return strings;
    }

    /**
     * 返回词元字符串及其原文区间。
     */
    default List<Token> tokens(String buffer) {
        List<TokenRange> ranges = ranges(buffer);
        List<Token> tokens = new ArrayList<>(ranges.size());
        for (TokenRange range : ranges) {
            tokens.add(new Token(buffer.substring(range.start(), range.end()), range));
        }
        return tokens;
    }
}

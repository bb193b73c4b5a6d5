package com.memsearch.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于正则的单词分词器，按 Unicode 单词字符切分。
 */
public class WordTokenizer implements Tokenizer {

    private static final Pattern WORD_PATTERN = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * 扫描连续单词字符，输出原文偏移。
     */
    @Override
    public List<TokenRange> ranges(String buffer) {
        if (buffer == null || buffer.isEmpty()) {
            return List.of();
        }

        List<TokenRange> ranges = new ArrayList<>();
        Matcher wordMatcher = WORD_PATTERN.matcher(buffer);
        while (wordMatcher.find()) {
            ranges.add(new TokenRange(wordMatcher.start(), wordMatcher.end()));
        }
        return List.copyOf(ranges);
    }
}

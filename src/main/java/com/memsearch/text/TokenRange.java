package com.memsearch.text;

/**
 * 词元在原文中的半开区间 [start, end)。
 */
public record TokenRange(int start, int end) {
    public TokenRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("非法词元区间: [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}

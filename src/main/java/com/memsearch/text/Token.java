package com.memsearch.text;

public record Token(
    String text,
    TokenRange range
) {
}

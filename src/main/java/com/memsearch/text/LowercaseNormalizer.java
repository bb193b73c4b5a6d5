package com.memsearch.text;

import java.util.Locale;

/**
 * 仅做大小写折叠的规范化器。
 */
public class LowercaseNormalizer implements Normalizer {

    /**
     * 整段文本保持原样。
     */
    @Override
    public String canonicalize(String buffer) {
        return buffer == null ? "" : buffer;
    }

    @Override
    public String normalize(String token) {
        return token.toLowerCase(Locale.ROOT);
    }
}

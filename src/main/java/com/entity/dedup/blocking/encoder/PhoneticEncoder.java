package com.entity.dedup.blocking.encoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Phonetic fingerprint of a value: each word is phonetically encoded, the per-word codes
 * are truncated to {@code maxTokenLength}, sorted and concatenated, and the result is
 * truncated to {@code maxLength}.
 *
 * <p>Sorting the word codes makes the fingerprint insensitive to word order, so
 * "Smith John" and "John Smyth" share a code.</p>
 */
public class PhoneticEncoder implements KeyEncoder {
    private static final Logger log = LoggerFactory.getLogger(PhoneticEncoder.class);

    public static final int DEFAULT_MAX_TOKEN_LENGTH = 2;
    public static final int DEFAULT_MAX_LENGTH = 4;

    private final PhoneticAlgorithm algorithm;
    private final int maxTokenLength;
    private final int maxLength;

    public PhoneticEncoder() {
        this(PhoneticAlgorithm.DOUBLE_METAPHONE);
    }

    public PhoneticEncoder(PhoneticAlgorithm algorithm) {
        this(algorithm, DEFAULT_MAX_TOKEN_LENGTH, DEFAULT_MAX_LENGTH);
    }

    public PhoneticEncoder(PhoneticAlgorithm algorithm, int maxTokenLength, int maxLength) {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm is required");
        }
        if (maxTokenLength <= 0 || maxLength <= 0) {
            throw new IllegalArgumentException("maxTokenLength and maxLength must be > 0");
        }
        this.algorithm = algorithm;
        this.maxTokenLength = maxTokenLength;
        this.maxLength = maxLength;
    }

    @Override
    public String encode(String value) {
        List<String> codes = new ArrayList<>();
        for (String word : Tokens.lowerCaseWords(value)) {
            String code;
            try {
                code = algorithm.encodeWord(word);
            } catch (IllegalArgumentException e) {
                // unmappable characters: the word contributes no code
                log.debug("phonetic.skip algorithm={} word='{}' reason={}", algorithm, word, e.getMessage());
                continue;
            }
            if (code != null && !code.isEmpty()) {
                codes.add(Tokens.head(code, maxTokenLength));
            }
        }
        Collections.sort(codes);
        return Tokens.head(String.join("", codes).trim(), maxLength);
    }

    @Override
    public String getName() {
        return "phonetic:" + algorithm.name().toLowerCase();
    }

    public PhoneticAlgorithm getAlgorithm() {
        return algorithm;
    }
}

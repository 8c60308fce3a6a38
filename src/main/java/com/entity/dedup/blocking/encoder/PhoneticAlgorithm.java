package com.entity.dedup.blocking.encoder;

import org.apache.commons.codec.language.Caverphone2;
import org.apache.commons.codec.language.DoubleMetaphone;
import org.apache.commons.codec.language.Metaphone;
import org.apache.commons.codec.language.Nysiis;
import org.apache.commons.codec.language.RefinedSoundex;
import org.apache.commons.codec.language.Soundex;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Phonetic algorithms available for blocking, backed by Apache Commons Codec.
 */
public enum PhoneticAlgorithm {
    SOUNDEX(new Soundex()::soundex),
    REFINED_SOUNDEX(new RefinedSoundex()::soundex),
    METAPHONE(new Metaphone()::metaphone),
    DOUBLE_METAPHONE(new DoubleMetaphone()::doubleMetaphone),
    NYSIIS(new Nysiis()::nysiis),
    CAVERPHONE2(new Caverphone2()::encode);

    private final UnaryOperator<String> codec;

    PhoneticAlgorithm(UnaryOperator<String> codec) {
        this.codec = codec;
    }

    /**
     * Encodes a single word. May return null or empty for words without letters.
     *
     * @throws IllegalArgumentException if the word contains characters the algorithm cannot map
     */
    public String encodeWord(String word) {
        return codec.apply(word);
    }

    /**
     * Parses an algorithm name such as {@code double_metaphone} or {@code soundex}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static PhoneticAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Phonetic algorithm name is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (PhoneticAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown phonetic algorithm: " + name);
    }
}

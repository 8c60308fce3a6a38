package com.entity.dedup.blocking;

import com.entity.dedup.blocking.encoder.KeyEncoder;
import com.entity.dedup.blocking.encoder.PhoneticAlgorithm;
import com.entity.dedup.blocking.encoder.PhoneticEncoder;

import java.util.List;

/**
 * Factory methods for building blocking rules.
 *
 * <pre>
 * BlockingRule rule = BlockingRules.phonetic("name").and(BlockingRules.exact("dob"))
 *         .or(BlockingRules.firstNChars("name", 3).and(BlockingRules.exact("dob")))
 *         .or(BlockingRules.abbreviation("name", 3));
 * </pre>
 */
public final class BlockingRules {

    private BlockingRules() {
    }

    public static BlockingRule exact(String attribute) {
        return new BlockingRule.Exact(attribute);
    }

    /**
     * Conjunction of exact-match rules over the given attributes (dot-paths allowed).
     * This is what a plain list of blocking attributes means.
     *
     * @throws IllegalArgumentException if the list is empty
     */
    public static BlockingRule exactAll(List<String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            throw new IllegalArgumentException("at least one blocking attribute is required");
        }
        BlockingRule rule = exact(attributes.get(0));
        for (int i = 1; i < attributes.size(); i++) {
            rule = rule.and(exact(attributes.get(i)));
        }
        return rule;
    }

    public static BlockingRule phonetic(String attribute) {
        return new BlockingRule.Phonetic(attribute, new PhoneticEncoder());
    }

    public static BlockingRule phonetic(String attribute, PhoneticAlgorithm algorithm) {
        return new BlockingRule.Phonetic(attribute, new PhoneticEncoder(algorithm));
    }

    public static BlockingRule firstNChars(String attribute, int n) {
        return new BlockingRule.FirstNChars(attribute, n);
    }

    public static BlockingRule abbreviation(String attribute, int letters) {
        return new BlockingRule.Abbreviation(attribute, letters);
    }

    public static BlockingRule encoded(String attribute, KeyEncoder encoder) {
        return new BlockingRule.Encoded(attribute, encoder);
    }

    /**
     * Left-folded conjunction of all rules.
     */
    public static BlockingRule allOf(BlockingRule first, BlockingRule... rest) {
        BlockingRule rule = first;
        for (BlockingRule next : rest) {
            rule = rule.and(next);
        }
        return rule;
    }

    /**
     * Left-folded disjunction of all rules.
     */
    public static BlockingRule anyOf(BlockingRule first, BlockingRule... rest) {
        BlockingRule rule = first;
        for (BlockingRule next : rest) {
            rule = rule.or(next);
        }
        return rule;
    }
}

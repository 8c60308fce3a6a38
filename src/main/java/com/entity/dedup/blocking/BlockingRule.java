package com.entity.dedup.blocking;

import com.entity.dedup.blocking.encoder.AbbreviationEncoder;
import com.entity.dedup.blocking.encoder.FirstNCharsEncoder;
import com.entity.dedup.blocking.encoder.KeyEncoder;
import com.entity.dedup.blocking.encoder.PhoneticEncoder;

import java.util.Objects;

/**
 * Blocking rule algebra. A rule maps a record to zero or more {@link com.entity.dedup.core.model.BlockKey}s;
 * zero keys means the record does not match the rule.
 *
 * <p>Leaf variants derive a key from one attribute. {@link And} builds the tuple of its
 * operands' keys and matches only when both operands do. {@link Or} places the record in
 * every block either operand produces, which raises recall at the cost of records sharing
 * several blocks.</p>
 *
 * <p>Rules are plain data; {@link BlockKeys#of} evaluates them.</p>
 */
public sealed interface BlockingRule {

    /**
     * Conjunction: records must agree on both rules.
     */
    default BlockingRule and(BlockingRule other) {
        return new And(this, other);
    }

    /**
     * Disjunction: records are blocked under each rule independently.
     */
    default BlockingRule or(BlockingRule other) {
        return new Or(this, other);
    }

    /**
     * Human-readable form, e.g. {@code (exact:phone & phonetic:double_metaphone:name)}.
     */
    String describe();

    /**
     * Leaf rules read a single attribute.
     */
    sealed interface AttributeRule extends BlockingRule {

        String attribute();

        /**
         * Label prefixed to every key the rule produces, so that identical values
         * coming from different rules never share a block.
         */
        String label();

        /**
         * Encoder applied to the value's text, or {@code null} to use the text as-is.
         */
        KeyEncoder encoder();

        @Override
        default String describe() {
            return label();
        }
    }

    /**
     * Exact match on the attribute's text value.
     */
    record Exact(String attribute) implements AttributeRule {
        public Exact {
            requireAttribute(attribute);
        }

        @Override
        public String label() {
            return "exact:" + attribute;
        }

        @Override
        public KeyEncoder encoder() {
            return null;
        }
    }

    /**
     * Match on the phonetic fingerprint of the attribute.
     */
    record Phonetic(String attribute, PhoneticEncoder phoneticEncoder) implements AttributeRule {
        public Phonetic {
            requireAttribute(attribute);
            Objects.requireNonNull(phoneticEncoder, "phoneticEncoder is required");
        }

        @Override
        public String label() {
            return phoneticEncoder.getName() + ":" + attribute;
        }

        @Override
        public KeyEncoder encoder() {
            return phoneticEncoder;
        }
    }

    /**
     * Match on the first {@code n} characters of each word of the attribute.
     */
    record FirstNChars(String attribute, int n) implements AttributeRule {
        public FirstNChars {
            requireAttribute(attribute);
            if (n <= 0) {
                throw new IllegalArgumentException("n must be > 0");
            }
        }

        @Override
        public String label() {
            return "first" + n + "chars:" + attribute;
        }

        @Override
        public KeyEncoder encoder() {
            return new FirstNCharsEncoder(n);
        }
    }

    /**
     * Match on the {@code letters}-letter abbreviation of the attribute.
     */
    record Abbreviation(String attribute, int letters) implements AttributeRule {
        public Abbreviation {
            requireAttribute(attribute);
            if (letters <= 0) {
                throw new IllegalArgumentException("letters must be > 0");
            }
        }

        @Override
        public String label() {
            return "abbrev" + letters + ":" + attribute;
        }

        @Override
        public KeyEncoder encoder() {
            return new AbbreviationEncoder(letters);
        }
    }

    /**
     * Match on any caller-supplied encoding of the attribute.
     */
    record Encoded(String attribute, KeyEncoder keyEncoder) implements AttributeRule {
        public Encoded {
            requireAttribute(attribute);
            Objects.requireNonNull(keyEncoder, "keyEncoder is required");
        }

        @Override
        public String label() {
            return keyEncoder.getName() + ":" + attribute;
        }

        @Override
        public KeyEncoder encoder() {
            return keyEncoder;
        }
    }

    record And(BlockingRule left, BlockingRule right) implements BlockingRule {
        public And {
            Objects.requireNonNull(left, "left is required");
            Objects.requireNonNull(right, "right is required");
        }

        @Override
        public String describe() {
            return "(" + left.describe() + " & " + right.describe() + ")";
        }
    }

    record Or(BlockingRule left, BlockingRule right) implements BlockingRule {
        public Or {
            Objects.requireNonNull(left, "left is required");
            Objects.requireNonNull(right, "right is required");
        }

        @Override
        public String describe() {
            return "(" + left.describe() + " | " + right.describe() + ")";
        }
    }

    private static void requireAttribute(String attribute) {
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("attribute is required");
        }
    }
}

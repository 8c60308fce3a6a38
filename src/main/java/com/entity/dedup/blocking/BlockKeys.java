package com.entity.dedup.blocking;

import com.entity.dedup.blocking.encoder.KeyEncoder;
import com.entity.dedup.core.model.BlockKey;
import com.entity.dedup.core.model.SourceRecord;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Evaluates a {@link BlockingRule} against a record.
 */
public final class BlockKeys {

    private BlockKeys() {
    }

    /**
     * Computes the keys a record receives under a rule.
     *
     * @return keys in a stable order; empty when the record does not match
     */
    public static Set<BlockKey> of(BlockingRule rule, SourceRecord record) {
        if (rule instanceof BlockingRule.AttributeRule leaf) {
            return leafKeys(leaf, record);
        }
        if (rule instanceof BlockingRule.And and) {
            Set<BlockKey> left = of(and.left(), record);
            if (left.isEmpty()) {
                return Set.of();
            }
            Set<BlockKey> right = of(and.right(), record);
            if (right.isEmpty()) {
                return Set.of();
            }
            Set<BlockKey> product = new LinkedHashSet<>();
            for (BlockKey l : left) {
                for (BlockKey r : right) {
                    product.add(l.concat(r));
                }
            }
            return product;
        }
        if (rule instanceof BlockingRule.Or or) {
            Set<BlockKey> union = new LinkedHashSet<>(of(or.left(), record));
            union.addAll(of(or.right(), record));
            return union;
        }
        throw new IllegalStateException("Unsupported rule: " + rule);
    }

    private static Set<BlockKey> leafKeys(BlockingRule.AttributeRule rule, SourceRecord record) {
        String text = textOf(record.get(rule.attribute()));
        if (text == null) {
            return Set.of();
        }
        KeyEncoder encoder = rule.encoder();
        String code = encoder == null ? text : encoder.encode(text);
        if (code == null || code.isEmpty()) {
            return Set.of();
        }
        return Set.of(BlockKey.of(rule.label(), code));
    }

    /**
     * Text form of a value for blocking; null for missing, blank or empty-collection values.
     * Collections block on their first non-blank element.
     */
    static String textOf(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> values) {
            for (Object element : values) {
                String text = textOf(element);
                if (text != null) {
                    return text;
                }
            }
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}

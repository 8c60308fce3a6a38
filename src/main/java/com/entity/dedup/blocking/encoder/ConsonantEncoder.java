package com.entity.dedup.blocking.encoder;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Consonant skeleton: upper-cased value with vowels removed after the first letter.
 *
 * <p>Variant 1 treats A, E, I, O, U as vowels; variant 2 adds W and Y; variant 3 adds H.
 * With {@code keepDoubles=false} runs of the same letter collapse to one.</p>
 */
public class ConsonantEncoder implements KeyEncoder {

    private final Set<Character> vowels;
    private final boolean keepDoubles;

    public ConsonantEncoder() {
        this(1, true);
    }

    public ConsonantEncoder(int variant, boolean keepDoubles) {
        if (variant < 1 || variant > 3) {
            throw new IllegalArgumentException("variant must be 1, 2 or 3");
        }
        Set<Character> set = new HashSet<>(Set.of('A', 'E', 'I', 'O', 'U'));
        if (variant > 1) {
            set.add('W');
            set.add('Y');
        }
        if (variant > 2) {
            set.add('H');
        }
        this.vowels = Set.copyOf(set);
        this.keepDoubles = keepDoubles;
    }

    @Override
    public String encode(String value) {
        String word = value.trim().toUpperCase(Locale.ROOT);
        if (word.isEmpty()) {
            return "";
        }
        StringBuilder collapsed = new StringBuilder();
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (keepDoubles || collapsed.length() == 0 || collapsed.charAt(collapsed.length() - 1) != c) {
                collapsed.append(c);
            }
        }
        StringBuilder code = new StringBuilder().append(collapsed.charAt(0));
        for (int i = 1; i < collapsed.length(); i++) {
            char c = collapsed.charAt(i);
            if (!vowels.contains(c)) {
                code.append(c);
            }
        }
        return code.toString();
    }

    @Override
    public String getName() {
        return "consonant";
    }
}

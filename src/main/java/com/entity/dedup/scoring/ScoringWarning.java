package com.entity.dedup.scoring;

/**
 * Diagnostic for a comparator that failed on one pair. The attribute was scored 0 and the
 * run continued.
 *
 * @param blockId     sub-block in which the pair was compared
 * @param firstIndex  input index of the first record
 * @param secondIndex input index of the second record
 * @param attribute   attribute whose comparator failed
 * @param message     failure description
 */
public record ScoringWarning(String blockId, int firstIndex, int secondIndex, String attribute, String message) {

    @Override
    public String toString() {
        return "ScoringWarning{block=" + blockId + ", pair=(" + firstIndex + "," + secondIndex
                + "), attribute=" + attribute + ", message=" + message + '}';
    }
}

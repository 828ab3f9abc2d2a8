package com.codeauditor.core.model;

/**
 * Counts reported after committing one scan and its findings.
 *
 * @param scanId generated id of the stored scan row
 * @param submitted findings handed to the gateway
 * @param newlyPersisted findings actually inserted; the rest already existed
 */
public record PersistOutcome(long scanId, int submitted, int newlyPersisted) {

    public int duplicates() {
        return submitted - newlyPersisted;
    }
}

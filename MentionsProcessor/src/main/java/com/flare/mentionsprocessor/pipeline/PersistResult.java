package com.flare.mentionsprocessor.pipeline;

/**
 * Outcome of persisting one mention.
 *
 * @param rowId id of the inserted row, null on failure
 * @param error failure description, null on success
 */
public record PersistResult(Object rowId, String error) {

    public static PersistResult persisted(Object rowId) {
        return new PersistResult(rowId, null);
    }

    public static PersistResult failed(String error) {
        return new PersistResult(null, error != null ? error : "unknown persistence error");
    }

    public boolean isPersisted() {
        return error == null;
    }
}

package com.flare.mentionsprocessor.store;

/**
 * Payload returned by the persistence store for a single insert.
 * A call that did not throw can still report failure through {@link #error()}.
 */
public record InsertResult(Object id, String error) {

    public static InsertResult inserted(Object id) {
        return new InsertResult(id, null);
    }

    public static InsertResult failed(String error) {
        return new InsertResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}

package com.flowledger.exception;

/**
 * Structured failure from the downstream record-creation interface.
 */
public class RecordCreationException extends RuntimeException {

    public enum Kind {
        ENTITY_NOT_FOUND,
        VALIDATION_REJECTED,
        TRANSIENT
    }

    private final Kind kind;
    private final String entityLogicalName;

    public RecordCreationException(Kind kind, String entityLogicalName, String message) {
        super(message);
        this.kind = kind;
        this.entityLogicalName = entityLogicalName;
    }

    public RecordCreationException(Kind kind, String entityLogicalName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.entityLogicalName = entityLogicalName;
    }

    public Kind getKind() {
        return kind;
    }

    public String getEntityLogicalName() {
        return entityLogicalName;
    }
}

package com.bulk.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorSeverity {
    /** Row failed schema, type or business-rule validation (or was flagged with a warning). */
    VALIDATION,
    /** Infrastructure failure that exhausted its retry budget. */
    TRANSIENT,
    /** Row the database refused outright, e.g. a constraint or malformed-value error. */
    FATAL;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

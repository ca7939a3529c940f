package com.lntracker.ingestion.adapter;

/**
 * Three-way split of transport failures. Only {@link #TRANSIENT} is retried automatically.
 */
public enum ErrorKind {
    TRANSIENT,
    USER_CANCELLED,
    FATAL
}

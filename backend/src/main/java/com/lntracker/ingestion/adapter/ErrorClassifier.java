package com.lntracker.ingestion.adapter;

import java.util.Optional;

/**
 * Backend-specific interpretation of transport failures. Stream dispatchers only see this
 * interface, never the transport's own exception types.
 */
public interface ErrorClassifier {

    ErrorKind classify(Throwable error);

    /**
     * Typed error for failures callers may want to match on, e.g. "peer already connected".
     */
    default Optional<RuntimeException> toDomainError(Throwable error) {
        return Optional.empty();
    }
}

package com.lntracker.ingestion.adapter;

public class EdgeNotFoundException extends RuntimeException {

    public EdgeNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

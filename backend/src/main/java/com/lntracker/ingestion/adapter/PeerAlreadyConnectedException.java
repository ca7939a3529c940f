package com.lntracker.ingestion.adapter;

public class PeerAlreadyConnectedException extends RuntimeException {

    public PeerAlreadyConnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}

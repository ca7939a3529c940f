package com.lntracker.ingestion.adapter;

/**
 * Thrown when a call to lnd fails, either at the HTTP level or with an error object in the
 * response. Carries the gRPC status so callers can classify it.
 */
public class RpcException extends RuntimeException {

    private final RpcStatus status;
    private final String details;

    public RpcException(RpcStatus status, String details) {
        super(format(status, details));
        this.status = status;
        this.details = details;
    }

    public RpcException(RpcStatus status, String details, Throwable cause) {
        super(format(status, details), cause);
        this.status = status;
        this.details = details;
    }

    public RpcStatus getStatus() {
        return status;
    }

    public String getDetails() {
        return details;
    }

    private static String format(RpcStatus status, String details) {
        return "RpcError code: " + status + "; details: " + details;
    }
}

package com.lntracker.ingestion.adapter;

/**
 * gRPC status codes as reported by lnd, also inside REST error bodies ({@code {"code": 14, ...}}).
 */
public enum RpcStatus {
    OK(0),
    CANCELLED(1),
    UNKNOWN(2),
    INVALID_ARGUMENT(3),
    DEADLINE_EXCEEDED(4),
    NOT_FOUND(5),
    ALREADY_EXISTS(6),
    PERMISSION_DENIED(7),
    RESOURCE_EXHAUSTED(8),
    FAILED_PRECONDITION(9),
    ABORTED(10),
    OUT_OF_RANGE(11),
    UNIMPLEMENTED(12),
    INTERNAL(13),
    UNAVAILABLE(14),
    DATA_LOSS(15),
    UNAUTHENTICATED(16);

    private final int code;

    RpcStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static RpcStatus fromCode(int code) {
        for (RpcStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        return UNKNOWN;
    }

    /**
     * Fallback when the body carries no gRPC code (proxy errors, plain HTTP failures).
     */
    public static RpcStatus fromHttpStatus(int httpStatus) {
        switch (httpStatus) {
            case 400:
                return INVALID_ARGUMENT;
            case 401:
                return UNAUTHENTICATED;
            case 403:
                return PERMISSION_DENIED;
            case 404:
                return NOT_FOUND;
            case 409:
                return ABORTED;
            case 429:
                return RESOURCE_EXHAUSTED;
            case 499:
                return CANCELLED;
            case 501:
                return UNIMPLEMENTED;
            case 503:
                return UNAVAILABLE;
            case 504:
                return DEADLINE_EXCEEDED;
            default:
                return httpStatus >= 500 ? INTERNAL : UNKNOWN;
        }
    }
}

package com.lntracker.ingestion.adapter.lnd;

import com.lntracker.ingestion.adapter.EdgeNotFoundException;
import com.lntracker.ingestion.adapter.ErrorClassifier;
import com.lntracker.ingestion.adapter.ErrorKind;
import com.lntracker.ingestion.adapter.PeerAlreadyConnectedException;
import com.lntracker.ingestion.adapter.RpcException;
import com.lntracker.ingestion.adapter.RpcStatus;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies lnd failures by gRPC status. Authentication and request errors are fatal,
 * a cancelled call is the user stopping the stream, anything else is worth a retry.
 */
public class LndErrorClassifier implements ErrorClassifier {

    private static final Set<RpcStatus> FATAL = Set.of(
            RpcStatus.UNAUTHENTICATED,
            RpcStatus.PERMISSION_DENIED,
            RpcStatus.INVALID_ARGUMENT,
            RpcStatus.UNIMPLEMENTED
    );

    private static final String PEER_ALREADY_CONNECTED = "already connected to peer";
    private static final String EDGE_NOT_FOUND = "edge not found";

    @Override
    public ErrorKind classify(Throwable error) {
        RpcException rpc = findRpcException(error);
        if (rpc == null) {
            return ErrorKind.TRANSIENT;
        }
        if (rpc.getStatus() == RpcStatus.CANCELLED) {
            return ErrorKind.USER_CANCELLED;
        }
        return FATAL.contains(rpc.getStatus()) ? ErrorKind.FATAL : ErrorKind.TRANSIENT;
    }

    @Override
    public Optional<RuntimeException> toDomainError(Throwable error) {
        RpcException rpc = findRpcException(error);
        if (rpc == null || rpc.getDetails() == null) {
            return Optional.empty();
        }
        String details = rpc.getDetails().toLowerCase(Locale.ROOT);
        if (rpc.getStatus() == RpcStatus.UNKNOWN && details.contains(PEER_ALREADY_CONNECTED)) {
            return Optional.of(new PeerAlreadyConnectedException(rpc.getDetails(), rpc));
        }
        if (details.contains(EDGE_NOT_FOUND)) {
            return Optional.of(new EdgeNotFoundException(rpc.getDetails(), rpc));
        }
        return Optional.empty();
    }

    private static RpcException findRpcException(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof RpcException) {
                return (RpcException) t;
            }
            t = t.getCause();
        }
        return null;
    }
}

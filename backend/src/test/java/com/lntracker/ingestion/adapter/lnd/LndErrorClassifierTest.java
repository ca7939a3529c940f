package com.lntracker.ingestion.adapter.lnd;

import com.lntracker.ingestion.adapter.EdgeNotFoundException;
import com.lntracker.ingestion.adapter.ErrorKind;
import com.lntracker.ingestion.adapter.PeerAlreadyConnectedException;
import com.lntracker.ingestion.adapter.RpcException;
import com.lntracker.ingestion.adapter.RpcStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class LndErrorClassifierTest {

    private final LndErrorClassifier classifier = new LndErrorClassifier();

    @Test
    void classify_cancelled_isUserCancelled() {
        assertThat(classifier.classify(new RpcException(RpcStatus.CANCELLED, "closed")))
                .isEqualTo(ErrorKind.USER_CANCELLED);
    }

    @ParameterizedTest
    @EnumSource(value = RpcStatus.class, names = {"UNAUTHENTICATED", "PERMISSION_DENIED", "INVALID_ARGUMENT", "UNIMPLEMENTED"})
    void classify_authAndRequestErrors_areFatal(RpcStatus status) {
        assertThat(classifier.classify(new RpcException(status, "no"))).isEqualTo(ErrorKind.FATAL);
    }

    @ParameterizedTest
    @EnumSource(value = RpcStatus.class, names = {"UNAVAILABLE", "DEADLINE_EXCEEDED", "INTERNAL", "UNKNOWN", "RESOURCE_EXHAUSTED"})
    void classify_otherStatuses_areTransient(RpcStatus status) {
        assertThat(classifier.classify(new RpcException(status, "try later"))).isEqualTo(ErrorKind.TRANSIENT);
    }

    @Test
    void classify_nonRpcError_isTransient() {
        assertThat(classifier.classify(new IllegalStateException("Timeout on blocking read")))
                .isEqualTo(ErrorKind.TRANSIENT);
    }

    @Test
    void classify_wrappedRpcError_usesCauseStatus() {
        RuntimeException wrapped = new RuntimeException("outer",
                new RpcException(RpcStatus.UNAUTHENTICATED, "verification failed"));

        assertThat(classifier.classify(wrapped)).isEqualTo(ErrorKind.FATAL);
    }

    @Test
    void toDomainError_peerAlreadyConnected() {
        RpcException error = new RpcException(RpcStatus.UNKNOWN, "already connected to peer: 02abc@1.2.3.4:9735");

        assertThat(classifier.toDomainError(error)).get().isInstanceOf(PeerAlreadyConnectedException.class);
    }

    @Test
    void toDomainError_peerAlreadyConnectedWithOtherStatus_isNotMapped() {
        RpcException error = new RpcException(RpcStatus.UNAVAILABLE, "already connected to peer");

        assertThat(classifier.toDomainError(error)).isEmpty();
    }

    @Test
    void toDomainError_edgeNotFound() {
        RpcException error = new RpcException(RpcStatus.UNKNOWN, "unable to find edge: edge not found");

        assertThat(classifier.toDomainError(error)).get().isInstanceOf(EdgeNotFoundException.class);
    }

    @Test
    void toDomainError_otherErrors_empty() {
        assertThat(classifier.toDomainError(new RpcException(RpcStatus.UNAUTHENTICATED, "bad macaroon"))).isEmpty();
        assertThat(classifier.toDomainError(new IllegalStateException("x"))).isEmpty();
    }
}

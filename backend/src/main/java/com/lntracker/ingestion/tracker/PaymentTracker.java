package com.lntracker.ingestion.tracker;

import com.lntracker.common.CloseableIterator;
import com.lntracker.domain.PaymentRecord;
import com.lntracker.domain.TrackedRecord;
import com.lntracker.domain.TrackerCategory;
import com.lntracker.ingestion.adapter.lnd.LndPayment;
import com.lntracker.ingestion.stream.ItemConverter;
import com.lntracker.ingestion.stream.StreamConverter;
import com.lntracker.ingestion.stream.StreamDispatcher;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Stores payments once they reached SUCCEEDED or FAILED.
 * <p>
 * Reconciliation re-reads the trailing window starting at {@link #getNextReconIndex()},
 * which moves forward over leading final payments. The first in-flight payment pins it,
 * so the next cycle picks that payment up again.
 */
@Slf4j
public class PaymentTracker extends AbstractLndTracker {

    private final StreamDispatcher<LndPayment> dispatcher;
    private volatile long nextReconIndex;

    public PaymentTracker(TrackerContext context, StreamDispatcher<LndPayment> dispatcher) {
        super(context);
        this.dispatcher = dispatcher;
    }

    @Override
    public TrackerCategory getCategory() {
        return TrackerCategory.PAYMENTS;
    }

    @Override
    protected CloseableIterator<TrackedRecord> preSyncSource() {
        long indexOffset = context.store().getCheckpoint(TrackerCategory.PAYMENTS, nodeId());
        log.debug("Starting payments presync from index {} for {}", indexOffset, nodeId());
        ItemConverter<LndPayment, TrackedRecord> converter = skipFailures(this::convert);
        return new StreamConverter<>(context.node().payments(null).request(null, null, indexOffset),
                p -> converter.convert(p, false));
    }

    @Override
    protected Supplier<CloseableIterator<TrackedRecord>> newStreamFactory() {
        return subscribe(dispatcher, this::convert, this::newReconciliationSource);
    }

    @Override
    protected void resetState() {
        nextReconIndex = 0;
    }

    long getNextReconIndex() {
        return nextReconIndex;
    }

    private CloseableIterator<TrackedRecord> newReconciliationSource() {
        long indexOffset = nextReconIndex;
        long creationDateStart = context.clock().instant()
                .minus(context.properties().getReconWindow())
                .getEpochSecond();
        log.debug("Starting payments reconciliation from index {} for {}", indexOffset, nodeId());
        ItemConverter<LndPayment, TrackedRecord> converter = skipFailures(this::convert);
        AtomicBoolean inFlightFound = new AtomicBoolean();
        return new StreamConverter<>(context.node().payments(creationDateStart).request(null, null, indexOffset), p -> {
            if (!inFlightFound.get()) {
                if (p.isFinal()) {
                    nextReconIndex = p.paymentIndex();
                } else {
                    inFlightFound.set(true);
                    log.debug("Reconciliation found first in-flight payment {}; next reconciliation starts at {}",
                            p.paymentIndex(), nextReconIndex);
                }
            }
            return converter.convert(p, true);
        });
    }

    private List<TrackedRecord> convert(LndPayment p, boolean reconRunning) {
        if (!p.isFinal()) {
            return List.of();
        }
        String nodeId = nodeId();
        if (reconRunning && context.store().exists(TrackerCategory.PAYMENTS, nodeId, p.paymentIndex())) {
            return List.of();
        }
        if (reconRunning) {
            log.debug("Payment reconciliation: payment {} not found", p.paymentIndex());
        }
        PaymentRecord record = new PaymentRecord();
        record.setId(PaymentRecord.idFor(nodeId, p.paymentIndex()));
        record.setNodeId(nodeId);
        record.setPaymentIndex(p.paymentIndex());
        record.setPaymentHash(p.paymentHash());
        record.setPaymentRequest(p.paymentRequest() == null || p.paymentRequest().isEmpty() ? null : p.paymentRequest());
        record.setValueMsat(p.valueMsat());
        record.setFeeMsat(p.feeMsat());
        record.setStatus(p.status());
        record.setFailureReason(p.failureReason());
        record.setCreatedAt(Instant.ofEpochSecond(0, p.creationTimeNs()));
        record.setRecordedAt(context.clock().instant());
        return List.of(record);
    }
}

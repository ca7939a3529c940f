package com.lntracker.ingestion.tracker;

import com.lntracker.common.CloseableIterator;
import com.lntracker.domain.InvoiceRecord;
import com.lntracker.domain.TrackedRecord;
import com.lntracker.domain.TrackerCategory;
import com.lntracker.ingestion.adapter.lnd.LndInvoice;
import com.lntracker.ingestion.stream.ItemConverter;
import com.lntracker.ingestion.stream.StreamConverter;
import com.lntracker.ingestion.stream.StreamDispatcher;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Stores settled invoices. Reconciliation works like {@link PaymentTracker}'s, keyed by add index.
 */
@Slf4j
public class InvoiceTracker extends AbstractLndTracker {

    private final StreamDispatcher<LndInvoice> dispatcher;
    private volatile long nextReconIndex;

    public InvoiceTracker(TrackerContext context, StreamDispatcher<LndInvoice> dispatcher) {
        super(context);
        this.dispatcher = dispatcher;
    }

    @Override
    public TrackerCategory getCategory() {
        return TrackerCategory.INVOICES;
    }

    @Override
    protected CloseableIterator<TrackedRecord> preSyncSource() {
        long indexOffset = context.store().getCheckpoint(TrackerCategory.INVOICES, nodeId());
        log.debug("Starting invoices presync from index {} for {}", indexOffset, nodeId());
        ItemConverter<LndInvoice, TrackedRecord> converter = skipFailures(this::convert);
        return new StreamConverter<>(context.node().invoices(null).request(null, null, indexOffset),
                i -> converter.convert(i, false));
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
        log.debug("Starting invoices reconciliation from index {} for {}", indexOffset, nodeId());
        ItemConverter<LndInvoice, TrackedRecord> converter = skipFailures(this::convert);
        AtomicBoolean unsettledFound = new AtomicBoolean();
        return new StreamConverter<>(context.node().invoices(creationDateStart).request(null, null, indexOffset), i -> {
            if (!unsettledFound.get()) {
                if (i.isSettled()) {
                    nextReconIndex = i.addIndex();
                } else {
                    unsettledFound.set(true);
                    log.debug("Reconciliation found first unsettled invoice {}; next reconciliation starts at {}",
                            i.addIndex(), nextReconIndex);
                }
            }
            return converter.convert(i, true);
        });
    }

    private List<TrackedRecord> convert(LndInvoice i, boolean reconRunning) {
        if (!i.isSettled()) {
            return List.of();
        }
        String nodeId = nodeId();
        if (reconRunning && context.store().exists(TrackerCategory.INVOICES, nodeId, i.addIndex())) {
            return List.of();
        }
        if (reconRunning) {
            log.debug("Invoice reconciliation: add index {}, settle index {} not found", i.addIndex(), i.settleIndex());
        }
        InvoiceRecord record = new InvoiceRecord();
        record.setId(InvoiceRecord.idFor(nodeId, i.addIndex()));
        record.setNodeId(nodeId);
        record.setAddIndex(i.addIndex());
        record.setSettleIndex(i.settleIndex());
        record.setPaymentHash(i.rHash() != null ? HexFormat.of().formatHex(Base64.getDecoder().decode(i.rHash())) : null);
        record.setPaymentRequest(i.paymentRequest());
        record.setValueMsat(i.valueMsat());
        record.setAmtPaidMsat(i.amtPaidMsat());
        record.setCreatedAt(Instant.ofEpochSecond(i.creationDate()));
        record.setSettledAt(Instant.ofEpochSecond(i.settleDate()));
        record.setRecordedAt(context.clock().instant());
        return List.of(record);
    }
}

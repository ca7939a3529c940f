package com.lntracker.ingestion.tracker;

import com.lntracker.domain.OnchainTransactionRecord;
import com.lntracker.domain.RawEventRecord;
import com.lntracker.domain.TrackerCategory;
import com.lntracker.ingestion.adapter.lnd.LndOnchainTransaction;
import com.lntracker.ingestion.stream.StreamDispatcher;

/**
 * Live wallet transactions. Nothing is written unless {@code store-transactions} is set.
 */
public class OnchainTransactionTracker extends RawEventTracker<LndOnchainTransaction> {

    public OnchainTransactionTracker(TrackerContext context, StreamDispatcher<LndOnchainTransaction> dispatcher) {
        super(context, dispatcher);
    }

    @Override
    public TrackerCategory getCategory() {
        return TrackerCategory.ONCHAIN_TRANSACTIONS;
    }

    @Override
    protected RawEventRecord newRecord() {
        return new OnchainTransactionRecord();
    }

    @Override
    protected boolean isStoreEnabled() {
        return context.properties().isStoreTransactions();
    }
}

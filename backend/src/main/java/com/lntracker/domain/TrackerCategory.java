package com.lntracker.domain;

/**
 * Event categories ingested per node, with the collection each one is written to.
 */
public enum TrackerCategory {

    PAYMENTS("payments", PaymentRecord.class),
    INVOICES("invoices", InvoiceRecord.class),
    FORWARDS("forwards", ForwardRecord.class),
    HTLC_EVENTS("htlc events", HtlcEventRecord.class),
    CHANNEL_EVENTS("channel events", ChannelEventRecord.class),
    PEER_EVENTS("peer events", PeerEventRecord.class),
    ONCHAIN_TRANSACTIONS("onchain transactions", OnchainTransactionRecord.class),
    GRAPH_UPDATES("graph topology updates", GraphUpdateRecord.class);

    private final String itemsName;
    private final Class<? extends TrackedRecord> documentType;

    TrackerCategory(String itemsName, Class<? extends TrackedRecord> documentType) {
        this.itemsName = itemsName;
        this.documentType = documentType;
    }

    /** Plural name used in log lines. */
    public String getItemsName() {
        return itemsName;
    }

    public Class<? extends TrackedRecord> getDocumentType() {
        return documentType;
    }
}

package com.lntracker.ingestion.tracker;

import com.lntracker.common.CancellationToken;
import com.lntracker.ingestion.adapter.lnd.ForwardingHistoryRequest;
import com.lntracker.ingestion.adapter.lnd.ForwardingHistoryResponse;
import com.lntracker.ingestion.adapter.lnd.ListInvoicesRequest;
import com.lntracker.ingestion.adapter.lnd.ListInvoicesResponse;
import com.lntracker.ingestion.adapter.lnd.ListPaymentsRequest;
import com.lntracker.ingestion.adapter.lnd.ListPaymentsResponse;
import com.lntracker.ingestion.adapter.lnd.LndForwardingEvent;
import com.lntracker.ingestion.adapter.lnd.LndInvoice;
import com.lntracker.ingestion.adapter.lnd.LndNodeAdapter;
import com.lntracker.ingestion.adapter.lnd.LndPayment;
import com.lntracker.ingestion.adapter.lnd.NodeInfo;
import com.lntracker.ingestion.pagination.Page;
import com.lntracker.ingestion.pagination.Paginator;
import lombok.extern.slf4j.Slf4j;

/**
 * The tracked lnd node: its adapter, its identity (fetched once, on first use) and
 * paginators over its list calls.
 */
@Slf4j
public class LndNode {

    private final LndNodeAdapter adapter;
    private final int pageSize;
    private final CancellationToken cancellationToken;
    private volatile String pubkey;

    public LndNode(LndNodeAdapter adapter, int pageSize, CancellationToken cancellationToken) {
        this.adapter = adapter;
        this.pageSize = pageSize;
        this.cancellationToken = cancellationToken;
    }

    public LndNodeAdapter adapter() {
        return adapter;
    }

    /**
     * Identity pubkey of the node; calls {@code getinfo} until it succeeds once.
     */
    public String pubkey() {
        String key = pubkey;
        if (key == null) {
            synchronized (this) {
                if (pubkey == null) {
                    NodeInfo info = adapter.getInfo();
                    log.info("Connected to lnd node {} ({}) at block height {}",
                            info.alias(), info.identityPubkey(), info.blockHeight());
                    pubkey = info.identityPubkey();
                }
                key = pubkey;
            }
        }
        return key;
    }

    /**
     * @param creationDateStart unix seconds, null for all payments
     */
    public Paginator<ListPaymentsRequest, ListPaymentsResponse, LndPayment> payments(Long creationDateStart) {
        return new Paginator<>(
                adapter::listPayments,
                r -> new Page<>(r.payments(), r.lastIndexOffset()),
                (offset, size) -> new ListPaymentsRequest(true, offset, size, creationDateStart),
                pageSize,
                cancellationToken);
    }

    /**
     * @param creationDateStart unix seconds, null for all invoices
     */
    public Paginator<ListInvoicesRequest, ListInvoicesResponse, LndInvoice> invoices(Long creationDateStart) {
        return new Paginator<>(
                adapter::listInvoices,
                r -> new Page<>(r.invoices(), r.lastIndexOffset()),
                (offset, size) -> new ListInvoicesRequest(offset, size, creationDateStart),
                pageSize,
                cancellationToken);
    }

    public Paginator<ForwardingHistoryRequest, ForwardingHistoryResponse, LndForwardingEvent> forwards() {
        return new Paginator<>(
                adapter::forwardingHistory,
                r -> new Page<>(r.forwardingEvents(), r.lastOffsetIndex()),
                (offset, size) -> new ForwardingHistoryRequest(offset, size),
                pageSize,
                cancellationToken);
    }
}

package com.lntracker.ingestion.adapter.lnd;

import com.lntracker.common.CloseableIterator;

/**
 * Transport to one lnd node. Page calls block until the response arrives; subscriptions
 * return a blocking iterator whose {@code close()} cancels server-side delivery.
 * Failures surface as {@link com.lntracker.ingestion.adapter.RpcException}, at any point of a stream.
 */
public interface LndNodeAdapter {

    NodeInfo getInfo();

    ListPaymentsResponse listPayments(ListPaymentsRequest request);

    ListInvoicesResponse listInvoices(ListInvoicesRequest request);

    ForwardingHistoryResponse forwardingHistory(ForwardingHistoryRequest request);

    CloseableIterator<LndPayment> trackPayments();

    CloseableIterator<LndInvoice> subscribeInvoices();

    CloseableIterator<LndHtlcEvent> subscribeHtlcEvents();

    CloseableIterator<LndChannelEvent> subscribeChannelEvents();

    CloseableIterator<LndPeerEvent> subscribePeerEvents();

    CloseableIterator<LndOnchainTransaction> subscribeTransactions();

    CloseableIterator<LndGraphUpdate> subscribeChannelGraph();
}

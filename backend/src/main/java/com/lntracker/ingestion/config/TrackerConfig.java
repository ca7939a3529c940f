package com.lntracker.ingestion.config;

import com.lntracker.common.CancellationToken;
import com.lntracker.common.CloseableIterator;
import com.lntracker.common.RetryPolicy;
import com.lntracker.ingestion.adapter.ErrorClassifier;
import com.lntracker.ingestion.adapter.lnd.LndChannelEvent;
import com.lntracker.ingestion.adapter.lnd.LndGraphUpdate;
import com.lntracker.ingestion.adapter.lnd.LndHtlcEvent;
import com.lntracker.ingestion.adapter.lnd.LndInvoice;
import com.lntracker.ingestion.adapter.lnd.LndNodeAdapter;
import com.lntracker.ingestion.adapter.lnd.LndOnchainTransaction;
import com.lntracker.ingestion.adapter.lnd.LndPayment;
import com.lntracker.ingestion.adapter.lnd.LndPeerEvent;
import com.lntracker.ingestion.store.TrackerStore;
import com.lntracker.ingestion.stream.StreamDispatcher;
import com.lntracker.ingestion.stream.StreamTerminatedException;
import com.lntracker.ingestion.tracker.ChannelEventTracker;
import com.lntracker.ingestion.tracker.ForwardTracker;
import com.lntracker.ingestion.tracker.GraphTopologyTracker;
import com.lntracker.ingestion.tracker.HtlcEventTracker;
import com.lntracker.ingestion.tracker.InvoiceTracker;
import com.lntracker.ingestion.tracker.LndNode;
import com.lntracker.ingestion.tracker.OnchainTransactionTracker;
import com.lntracker.ingestion.tracker.PaymentTracker;
import com.lntracker.ingestion.tracker.PeerEventTracker;
import com.lntracker.ingestion.tracker.TrackerContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Wires one dispatcher per lnd subscription and one tracker per enabled category.
 */
@Configuration
@EnableConfigurationProperties({ TrackerProperties.class, IngestionRetryProperties.class })
public class TrackerConfig {

    @Bean
    public CancellationToken cancellationToken() {
        return new CancellationToken();
    }

    @Bean
    public RetryPolicy ingestionRetryPolicy(CancellationToken cancellationToken, IngestionRetryProperties properties) {
        return RetryPolicy.builder(cancellationToken)
                .maxRetries(properties.getMaxRetries())
                .delay(properties.getDelay())
                .toleranceWindow(properties.getToleranceWindow())
                .abortOn(Set.of(StreamTerminatedException.class))
                .build();
    }

    @Bean
    public LndNode lndNode(LndNodeAdapter adapter, TrackerProperties properties, CancellationToken cancellationToken) {
        return new LndNode(adapter, properties.getPageSize(), cancellationToken);
    }

    @Bean
    public TrackerContext trackerContext(LndNode lndNode, TrackerStore store, RetryPolicy ingestionRetryPolicy,
                                         CancellationToken cancellationToken, TrackerProperties properties) {
        return new TrackerContext(lndNode, store, ingestionRetryPolicy, cancellationToken, properties, Clock.systemUTC());
    }

    @Bean
    public StreamDispatcher<LndPayment> trackPaymentsDispatcher(LndNodeAdapter adapter, DispatcherFactory factory) {
        return factory.create("trackpayments", adapter::trackPayments);
    }

    @Bean
    public StreamDispatcher<LndInvoice> subscribeInvoicesDispatcher(LndNodeAdapter adapter, DispatcherFactory factory) {
        return factory.create("subscribeinvoices", adapter::subscribeInvoices);
    }

    @Bean
    public StreamDispatcher<LndHtlcEvent> subscribeHtlcEventsDispatcher(LndNodeAdapter adapter, DispatcherFactory factory) {
        return factory.create("subscribehtlcevents", adapter::subscribeHtlcEvents);
    }

    @Bean
    public StreamDispatcher<LndChannelEvent> subscribeChannelEventsDispatcher(LndNodeAdapter adapter, DispatcherFactory factory) {
        return factory.create("subscribechannelevents", adapter::subscribeChannelEvents);
    }

    @Bean
    public StreamDispatcher<LndPeerEvent> subscribePeerEventsDispatcher(LndNodeAdapter adapter, DispatcherFactory factory) {
        return factory.create("subscribepeerevents", adapter::subscribePeerEvents);
    }

    @Bean
    public StreamDispatcher<LndOnchainTransaction> subscribeTransactionsDispatcher(LndNodeAdapter adapter, DispatcherFactory factory) {
        return factory.create("subscribetransactions", adapter::subscribeTransactions);
    }

    @Bean
    public StreamDispatcher<LndGraphUpdate> subscribeChannelGraphDispatcher(LndNodeAdapter adapter, DispatcherFactory factory) {
        return factory.create("subscribechannelgraph", adapter::subscribeChannelGraph);
    }

    @Bean
    public DispatcherFactory dispatcherFactory(ErrorClassifier errorClassifier, RetryPolicy ingestionRetryPolicy,
                                               CancellationToken cancellationToken, TrackerProperties properties) {
        return new DispatcherFactory(errorClassifier, ingestionRetryPolicy, cancellationToken, properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "lntracker.tracker.payments", name = "enabled", matchIfMissing = true)
    public PaymentTracker paymentTracker(TrackerContext context, StreamDispatcher<LndPayment> trackPaymentsDispatcher) {
        return new PaymentTracker(context, trackPaymentsDispatcher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "lntracker.tracker.invoices", name = "enabled", matchIfMissing = true)
    public InvoiceTracker invoiceTracker(TrackerContext context, StreamDispatcher<LndInvoice> subscribeInvoicesDispatcher) {
        return new InvoiceTracker(context, subscribeInvoicesDispatcher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "lntracker.tracker.forwards", name = "enabled", matchIfMissing = true)
    public ForwardTracker forwardTracker(TrackerContext context) {
        return new ForwardTracker(context);
    }

    @Bean
    @ConditionalOnProperty(prefix = "lntracker.tracker.htlc-events", name = "enabled", matchIfMissing = true)
    public HtlcEventTracker htlcEventTracker(TrackerContext context, StreamDispatcher<LndHtlcEvent> subscribeHtlcEventsDispatcher) {
        return new HtlcEventTracker(context, subscribeHtlcEventsDispatcher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "lntracker.tracker.channel-events", name = "enabled", matchIfMissing = true)
    public ChannelEventTracker channelEventTracker(TrackerContext context,
                                                   StreamDispatcher<LndChannelEvent> subscribeChannelEventsDispatcher) {
        return new ChannelEventTracker(context, subscribeChannelEventsDispatcher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "lntracker.tracker.peer-events", name = "enabled", matchIfMissing = true)
    public PeerEventTracker peerEventTracker(TrackerContext context,
                                             StreamDispatcher<LndPeerEvent> subscribePeerEventsDispatcher) {
        return new PeerEventTracker(context, subscribePeerEventsDispatcher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "lntracker.tracker.onchain-transactions", name = "enabled", matchIfMissing = true)
    public OnchainTransactionTracker onchainTransactionTracker(TrackerContext context,
                                                               StreamDispatcher<LndOnchainTransaction> subscribeTransactionsDispatcher) {
        return new OnchainTransactionTracker(context, subscribeTransactionsDispatcher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "lntracker.tracker.graph-updates", name = "enabled", matchIfMissing = true)
    public GraphTopologyTracker graphTopologyTracker(TrackerContext context,
                                                     StreamDispatcher<LndGraphUpdate> subscribeChannelGraphDispatcher) {
        return new GraphTopologyTracker(context, subscribeChannelGraphDispatcher);
    }

    /**
     * Builds dispatchers that share the classifier, retry policy and tracker timings.
     */
    public static class DispatcherFactory {

        private final ErrorClassifier errorClassifier;
        private final RetryPolicy retryPolicy;
        private final CancellationToken cancellationToken;
        private final TrackerProperties properties;

        DispatcherFactory(ErrorClassifier errorClassifier, RetryPolicy retryPolicy,
                          CancellationToken cancellationToken, TrackerProperties properties) {
            this.errorClassifier = errorClassifier;
            this.retryPolicy = retryPolicy;
            this.cancellationToken = cancellationToken;
            this.properties = properties;
        }

        public <T> StreamDispatcher<T> create(String name, Supplier<CloseableIterator<T>> upstream) {
            return new StreamDispatcher<>(name, upstream, errorClassifier, retryPolicy, cancellationToken,
                    properties.getGracePeriod(), properties.getQueuePollTimeout());
        }
    }
}

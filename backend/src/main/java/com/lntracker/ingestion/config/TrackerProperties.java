package com.lntracker.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tracker and dispatcher tuning.
 */
@ConfigurationProperties(prefix = "lntracker.tracker")
@NoArgsConstructor
@Getter
@Setter
public class TrackerProperties {

    /** Max items per page request. */
    private int pageSize = 1000;

    /** Rows per bulk write during pre-sync. */
    private int batchSize = 1000;

    /** How far back reconciliation re-reads payments and invoices. */
    private Duration reconWindow = Duration.ofDays(30);

    /** Delay before a subscriber opens its reconciliation source, so live items can queue up. */
    private Duration gracePeriod = Duration.ofSeconds(5);

    /** Bounded wait on a subscriber queue before liveness is re-checked. */
    private Duration queuePollTimeout = Duration.ofSeconds(15);

    /** Poll interval of the tailing forwarding history reader. */
    private Duration forwardPollInterval = Duration.ofSeconds(21);

    /** Log a progress line every N streamed items. */
    private int progressLogInterval = 100;

    private boolean storeHtlcEvents = true;

    private boolean storeChannelEvents = true;

    private boolean storeTransactions = false;

    private Category payments = new Category();
    private Category invoices = new Category();
    private Category forwards = new Category();
    private Category htlcEvents = new Category();
    private Category channelEvents = new Category();
    private Category peerEvents = new Category();
    private Category onchainTransactions = new Category();
    private Category graphUpdates = new Category();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Category {
        private boolean enabled = true;
    }
}

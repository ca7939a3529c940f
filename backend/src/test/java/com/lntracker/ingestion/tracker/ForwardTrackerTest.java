package com.lntracker.ingestion.tracker;

import com.lntracker.domain.ForwardRecord;
import com.lntracker.ingestion.adapter.lnd.LndForwardingEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ForwardTrackerTest {

    private final TrackerFixture fixture = new TrackerFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static LndForwardingEvent forward(long timestampNs) {
        return new LndForwardingEvent(timestampNs, "100", "200", 10_000, 9_990, 10);
    }

    private List<ForwardRecord> stored() {
        return fixture.store.rowsOf(ForwardRecord.class, FakeLndNode.PUBKEY);
    }

    @Test
    void preSyncStart_readsHistoryFromStoredCount() {
        fixture.node.forwards.addAll(List.of(forward(1), forward(2), forward(3)));
        ForwardTracker tracker = new ForwardTracker(fixture.context());
        tracker.preSyncStart();
        fixture.node.forwards.add(forward(4));
        fixture.node.forwardRequests.clear();

        tracker.preSyncStart();

        assertThat(stored()).hasSize(4);
        assertThat(fixture.node.forwardRequests.get(0).indexOffset()).isEqualTo(3L);
    }

    @Test
    void preSyncStart_mapsFeeAndChannels() {
        fixture.node.forwards.add(forward(42));

        new ForwardTracker(fixture.context()).preSyncStart();

        ForwardRecord record = stored().get(0);
        assertThat(record.getId()).isEqualTo(ForwardRecord.idFor(FakeLndNode.PUBKEY, 42, "100", "200"));
        assertThat(record.getFeeMsat()).isEqualTo(10L);
        assertThat(record.getAmtInMsat() - record.getAmtOutMsat()).isEqualTo(record.getFeeMsat());
    }

    @Test
    void start_pollsForNewForwardsUntilCancelled() {
        fixture.node.forwards.add(forward(1));
        ForwardTracker tracker = new ForwardTracker(fixture.context());
        tracker.preSyncStart();

        CompletableFuture<Void> run = fixture.runAsync(tracker::start);
        fixture.node.forwards.add(forward(2));
        fixture.node.forwards.add(forward(3));

        await().atMost(Duration.ofSeconds(5)).until(() -> stored().size() == 3);
        assertThat(fixture.store.addedOne).hasSize(2);

        fixture.token.cancel();
        assertThat(run).succeedsWithin(Duration.ofSeconds(5));
    }
}

package com.lntracker.ingestion.job;

import com.lntracker.domain.TrackerCategory;
import com.lntracker.domain.TrackerStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrackerStatusRegistryTest {

    private final TrackerStatusRegistry registry = new TrackerStatusRegistry();

    @Test
    void update_failedIsSticky() {
        registry.markFailed(TrackerCategory.INVOICES, new IllegalStateException("budget spent"));

        registry.update(TrackerCategory.INVOICES, TrackerStatus.RUNNING);

        assertThat(registry.get(TrackerCategory.INVOICES)).get()
                .satisfies(e -> {
                    assertThat(e.status()).isEqualTo(TrackerStatus.FAILED);
                    assertThat(e.lastError()).isEqualTo("budget spent");
                });
    }

    @Test
    void snapshot_emptyRegistry_isEmpty() {
        assertThat(registry.snapshot()).isEmpty();
        assertThat(registry.get(TrackerCategory.PAYMENTS)).isEmpty();
    }

    @Test
    void snapshot_isACopy() {
        registry.update(TrackerCategory.PAYMENTS, TrackerStatus.PRE_SYNC);
        var snapshot = registry.snapshot();

        registry.update(TrackerCategory.PAYMENTS, TrackerStatus.RUNNING);

        assertThat(snapshot.get(TrackerCategory.PAYMENTS).status()).isEqualTo(TrackerStatus.PRE_SYNC);
    }
}

package com.lntracker.ingestion.store;

import com.lntracker.config.CaffeineConfig;
import com.lntracker.domain.ForwardRecord;
import com.lntracker.domain.InvoiceRecord;
import com.lntracker.domain.PaymentRecord;
import com.lntracker.domain.PeerEventRecord;
import com.lntracker.domain.TrackedRecord;
import com.lntracker.domain.TrackerCategory;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import({MongoTrackerStore.class, CaffeineConfig.class})
class MongoTrackerStoreIntegrationTest {

    private static final String NODE = "02node";

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;

    @Autowired
    MongoTrackerStore store;

    @BeforeEach
    void cleanUp() {
        mongoTemplate.dropCollection(PaymentRecord.class);
        mongoTemplate.dropCollection(InvoiceRecord.class);
        mongoTemplate.dropCollection(ForwardRecord.class);
        mongoTemplate.dropCollection(PeerEventRecord.class);
    }

    private static PaymentRecord payment(String node, long index, String status) {
        PaymentRecord p = new PaymentRecord();
        p.setId(PaymentRecord.idFor(node, index));
        p.setNodeId(node);
        p.setPaymentIndex(index);
        p.setPaymentHash("hash" + index);
        p.setStatus(status);
        p.setValueMsat(1000);
        p.setCreatedAt(Instant.parse("2025-05-01T00:00:00Z"));
        return p;
    }

    private static ForwardRecord forward(long timestampNs) {
        ForwardRecord f = new ForwardRecord();
        f.setId(ForwardRecord.idFor(NODE, timestampNs, "1", "2"));
        f.setNodeId(NODE);
        f.setTimestampNs(timestampNs);
        f.setChanIdIn("1");
        f.setChanIdOut("2");
        return f;
    }

    @Test
    void getCheckpoint_emptyStore_isZero() {
        assertThat(store.getCheckpoint(TrackerCategory.PAYMENTS, NODE)).isZero();
        assertThat(store.getCheckpoint(TrackerCategory.FORWARDS, NODE)).isZero();
    }

    @Test
    void getCheckpoint_paymentsIsMaxIndexPerNode() {
        store.addBatch(List.of(payment(NODE, 3, "SUCCEEDED"), payment(NODE, 12, "FAILED"),
                payment("03other", 40, "SUCCEEDED")));

        assertThat(store.getCheckpoint(TrackerCategory.PAYMENTS, NODE)).isEqualTo(12L);
    }

    @Test
    void getCheckpoint_forwardsIsStoredCount() {
        store.addBatch(List.of(forward(1), forward(2), forward(3)));

        assertThat(store.getCheckpoint(TrackerCategory.FORWARDS, NODE)).isEqualTo(3L);
    }

    @Test
    @DisplayName("re-adding the same rows is an upsert: no duplicates and no error")
    void addBatch_sameRowsTwice_isIdempotent() {
        List<TrackedRecord> rows = new ArrayList<>();
        rows.add(payment(NODE, 1, "SUCCEEDED"));
        rows.add(forward(10));

        store.addBatch(rows);
        store.addBatch(rows);
        store.addOne(payment(NODE, 1, "SUCCEEDED"));

        assertThat(mongoTemplate.count(new org.springframework.data.mongodb.core.query.Query(), PaymentRecord.class))
                .isEqualTo(1L);
        assertThat(mongoTemplate.count(new org.springframework.data.mongodb.core.query.Query(), ForwardRecord.class))
                .isEqualTo(1L);
    }

    @Test
    void addOne_existingRow_updatesFields() {
        store.addOne(payment(NODE, 5, "IN_FLIGHT"));
        store.addOne(payment(NODE, 5, "SUCCEEDED"));

        PaymentRecord stored = mongoTemplate.findById(PaymentRecord.idFor(NODE, 5), PaymentRecord.class);
        assertThat(stored).isNotNull();
        assertThat(stored.getStatus()).isEqualTo("SUCCEEDED");
        assertThat(stored.getCreatedAt()).isEqualTo(Instant.parse("2025-05-01T00:00:00Z"));
        Document raw = mongoTemplate.getCollection("payments").find(new Document("_id", stored.getId())).first();
        assertThat(raw).isNotNull().doesNotContainKey("_class");
    }

    @Test
    void exists_findsStoredPaymentsAndInvoices() {
        InvoiceRecord invoice = new InvoiceRecord();
        invoice.setId(InvoiceRecord.idFor(NODE, 8));
        invoice.setNodeId(NODE);
        invoice.setAddIndex(8);
        store.addOne(invoice);
        store.addOne(payment(NODE, 2, "SUCCEEDED"));

        assertThat(store.exists(TrackerCategory.PAYMENTS, NODE, 2)).isTrue();
        assertThat(store.exists(TrackerCategory.PAYMENTS, NODE, 3)).isFalse();
        assertThat(store.exists(TrackerCategory.INVOICES, NODE, 8)).isTrue();
        assertThat(store.exists(TrackerCategory.INVOICES, "03other", 8)).isFalse();
    }

    @Test
    void exists_unindexedCategory_isRejected() {
        assertThatThrownBy(() -> store.exists(TrackerCategory.FORWARDS, NODE, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addOne_rawEvent_storesInheritedFieldsInItsCollection() {
        PeerEventRecord event = new PeerEventRecord();
        event.setId(NODE + ":1:abc");
        event.setNodeId(NODE);
        event.setType("PEER_ONLINE");
        event.setReceivedAt(Instant.parse("2025-05-01T00:00:00Z"));
        event.setPayload(new Document("pub_key", "03peer"));

        store.addOne(event);

        Document raw = mongoTemplate.getCollection("peer_events").find(new Document("_id", event.getId())).first();
        assertThat(raw).isNotNull();
        assertThat(raw.getString("type")).isEqualTo("PEER_ONLINE");
        assertThat(raw.get("payload", Document.class).getString("pub_key")).isEqualTo("03peer");
    }
}

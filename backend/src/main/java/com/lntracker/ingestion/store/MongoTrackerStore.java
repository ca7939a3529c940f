package com.lntracker.ingestion.store;

import com.lntracker.config.CaffeineConfig;
import com.lntracker.domain.InvoiceRecord;
import com.lntracker.domain.PaymentRecord;
import com.lntracker.domain.TrackedRecord;
import com.lntracker.domain.TrackerCategory;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

/**
 * MongoDB store. Batches go out as one unordered bulk upsert per collection.
 * Positive {@link #exists} answers are cached; a stored row never disappears.
 */
@Slf4j
@Service
public class MongoTrackerStore implements TrackerStore {

    private final MongoTemplate mongoTemplate;
    private final Cache existsCache;

    public MongoTrackerStore(MongoTemplate mongoTemplate, CacheManager cacheManager) {
        this.mongoTemplate = mongoTemplate;
        this.existsCache = cacheManager.getCache(CaffeineConfig.RECONCILIATION_EXISTS_CACHE);
    }

    @Override
    public long getCheckpoint(TrackerCategory category, String nodeId) {
        Query byNode = Query.query(Criteria.where("nodeId").is(nodeId));
        return switch (category) {
            case PAYMENTS -> maxOf(byNode, "paymentIndex", PaymentRecord.class, PaymentRecord::getPaymentIndex);
            case INVOICES -> maxOf(byNode, "addIndex", InvoiceRecord.class, InvoiceRecord::getAddIndex);
            default -> mongoTemplate.count(byNode, category.getDocumentType());
        };
    }

    @Override
    public void addBatch(Collection<? extends TrackedRecord> rows) {
        if (rows.isEmpty()) {
            return;
        }
        Map<Class<?>, List<TrackedRecord>> byType = new LinkedHashMap<>();
        for (TrackedRecord row : rows) {
            byType.computeIfAbsent(row.getClass(), type -> new ArrayList<>()).add(row);
        }
        for (Map.Entry<Class<?>, List<TrackedRecord>> entry : byType.entrySet()) {
            BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, entry.getKey());
            for (TrackedRecord row : entry.getValue()) {
                ops.upsert(byId(row), toUpdate(row));
            }
            ops.execute();
            log.debug("Upserted {} {}", entry.getValue().size(), entry.getKey().getSimpleName());
        }
    }

    @Override
    public void addOne(TrackedRecord row) {
        mongoTemplate.upsert(byId(row), toUpdate(row), row.getClass());
    }

    @Override
    public boolean exists(TrackerCategory category, String nodeId, long index) {
        String id = switch (category) {
            case PAYMENTS -> PaymentRecord.idFor(nodeId, index);
            case INVOICES -> InvoiceRecord.idFor(nodeId, index);
            default -> throw new IllegalArgumentException(category + " rows are not indexed");
        };
        String cacheKey = category + ":" + id;
        if (existsCache != null && existsCache.get(cacheKey) != null) {
            return true;
        }
        boolean found = mongoTemplate.exists(Query.query(Criteria.where("_id").is(id)), category.getDocumentType());
        if (found && existsCache != null) {
            existsCache.put(cacheKey, Boolean.TRUE);
        }
        return found;
    }

    private <T> long maxOf(Query byNode, String field, Class<T> type, ToLongFunction<T> getter) {
        T top = mongoTemplate.findOne(byNode.with(Sort.by(Sort.Direction.DESC, field)).limit(1), type);
        return top != null ? getter.applyAsLong(top) : 0L;
    }

    private static Query byId(TrackedRecord row) {
        if (row.getId() == null || row.getId().isBlank()) {
            throw new IllegalArgumentException("Row without id: " + row.getClass().getSimpleName());
        }
        return Query.query(Criteria.where("_id").is(row.getId()));
    }

    private Update toUpdate(TrackedRecord row) {
        Document document = new Document();
        mongoTemplate.getConverter().write(row, document);
        document.remove("_id");
        document.remove("_class");
        Update update = new Update();
        document.forEach(update::set);
        return update;
    }
}

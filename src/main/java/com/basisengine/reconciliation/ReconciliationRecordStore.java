package com.basisengine.reconciliation;

import com.basisengine.config.ExecutionProperties;
import com.basisengine.domain.model.ReconciliationRecord;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.springframework.stereotype.Component;

/**
 * Bounded in-memory history of reconciliation records, newest first. Oldest records are evicted
 * once {@code reconciliation.history-size} is reached.
 */
@Component
public class ReconciliationRecordStore {

    private final int capacity;
    private final ConcurrentLinkedDeque<ReconciliationRecord> records = new ConcurrentLinkedDeque<>();

    public ReconciliationRecordStore(ExecutionProperties executionProperties) {
        this.capacity = executionProperties.getReconciliation().getHistorySize();
    }

    public void add(ReconciliationRecord record) {
        records.addFirst(record);
        while (records.size() > capacity) {
            records.pollLast();
        }
    }

    public List<ReconciliationRecord> recent(int limit) {
        return records.stream().limit(limit).toList();
    }

    public List<ReconciliationRecord> forVenue(String venue, int limit) {
        return records.stream().filter(r -> r.getVenue().equals(venue)).limit(limit).toList();
    }

    public Optional<ReconciliationRecord> latestFlagged() {
        return records.stream().filter(ReconciliationRecord::isFlagged).findFirst();
    }

    public int size() {
        return records.size();
    }
}

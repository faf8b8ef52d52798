package com.example.kitscanner.service.history;

import com.example.kitscanner.model.ActivityType;
import com.example.kitscanner.model.ScanHistoryItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded in-memory {@link ScanHistory}. The oldest item of an activity is dropped once it holds
 * {@code maxSize} items.
 */
public class InMemoryScanHistory implements ScanHistory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScanHistory.class);

    private final int maxSize;
    private final Map<ActivityType, Deque<ScanHistoryItem>> items = new EnumMap<>(ActivityType.class);

    public InMemoryScanHistory(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("History size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    @Override
    public synchronized void record(ScanHistoryItem item) {
        if (item == null || item.activityType() == null) {
            return;
        }
        Deque<ScanHistoryItem> deque = items.computeIfAbsent(item.activityType(), type -> new ArrayDeque<>());
        deque.addFirst(item);
        while (deque.size() > maxSize) {
            deque.removeLast();
        }
        log.debug("Recorded {} scan {} from {}", item.activityType(), item.shortValue(20), item.scanSource());
    }

    @Override
    public synchronized List<ScanHistoryItem> recent(ActivityType activityType) {
        Deque<ScanHistoryItem> deque = items.get(activityType);
        return deque == null ? List.of() : List.copyOf(deque);
    }

    @Override
    public synchronized void clear(ActivityType activityType) {
        items.remove(activityType);
    }
}

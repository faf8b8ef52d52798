package com.example.kitscanner.service.history;

import com.example.kitscanner.model.ActivityType;
import com.example.kitscanner.model.ScanHistoryItem;

import java.util.List;

/**
 * Log of accepted scans, per activity. Injected into each engine.
 */
public interface ScanHistory {

    void record(ScanHistoryItem item);

    /**
     * @return the retained items for the activity, most recent first
     */
    List<ScanHistoryItem> recent(ActivityType activityType);

    void clear(ActivityType activityType);
}

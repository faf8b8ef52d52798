package com.example.kitscanner.service.inventory;

import com.example.kitscanner.config.KitScannerProperties;
import com.example.kitscanner.model.ActivityType;
import com.example.kitscanner.model.RecordType;
import com.example.kitscanner.model.ScanCandidate;
import com.example.kitscanner.model.ScanHistoryItem;
import com.example.kitscanner.model.ScanResult;
import com.example.kitscanner.model.ScanResult.Outcome;
import com.example.kitscanner.model.inventory.InventoryComponentType;
import com.example.kitscanner.model.inventory.InventoryRecord;
import com.example.kitscanner.model.inventory.InventoryStatus;
import com.example.kitscanner.model.inventory.InventorySummary;
import com.example.kitscanner.service.SettleTimer;
import com.example.kitscanner.service.classification.IdentifierClassifier;
import com.example.kitscanner.service.history.ScanHistory;
import com.example.kitscanner.service.storage.RecordStore;
import com.example.kitscanner.util.ScanInputValidator;
import com.example.kitscanner.util.ScanInputValidator.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts devices of an operator-selected category. Each scan is saved as its own {@link InventoryRecord};
 * a device id already counted in the current session is refused until the session is cleared.
 * <p>
 * Every public method is synchronized and reports through {@link ScanResult}; none of them throw.
 */
public class InventoryEngine {

    private static final Logger log = LoggerFactory.getLogger(InventoryEngine.class);

    static final String START_MESSAGE = "Select component type and start scanning";

    private final IdentifierClassifier classifier;
    private final RecordStore<InventoryRecord> recordStore;
    private final ScanHistory scanHistory;
    private final SettleTimer settleTimer;
    private final Clock clock;
    private final Duration settleDelay;
    private final String locationId;

    private final List<InventoryRecord> session = new ArrayList<>();
    private InventoryComponentType componentType = InventoryComponentType.GLASSES;
    private String statusMessage = START_MESSAGE;
    private boolean accepting = true;
    private SettleTimer.Handle settleHandle;

    public InventoryEngine(IdentifierClassifier classifier, RecordStore<InventoryRecord> recordStore,
            ScanHistory scanHistory, SettleTimer settleTimer, Clock clock, KitScannerProperties properties) {
        this.classifier = classifier;
        this.recordStore = recordStore;
        this.scanHistory = scanHistory;
        this.settleTimer = settleTimer;
        this.clock = clock;
        this.settleDelay = properties.getScan().getSettleDelay();
        this.locationId = properties.getStorage().getLocationId();
    }

    public synchronized ScanResult selectComponentType(InventoryComponentType type) {
        if (type == null) {
            return ScanResult.of(Outcome.REJECTED, "Select a component type");
        }
        componentType = type;
        statusMessage = scanningMessage();
        log.debug("Inventory category set to {}", type);
        return ScanResult.of(Outcome.ACCEPTED, statusMessage);
    }

    public ScanResult processScan(String raw) {
        return processScan(ScanCandidate.barcode(raw));
    }

    public synchronized ScanResult processScan(ScanCandidate candidate) {
        if (!accepting) {
            log.debug("Inventory scan dropped while not accepting input");
            return ScanResult.of(Outcome.DROPPED, statusMessage);
        }
        ValidationOutcome validation = ScanInputValidator.validate(candidate == null ? null : candidate.text());
        if (!validation.valid()) {
            log.warn("Inventory scan rejected: {}", validation.error());
            return ScanResult.of(Outcome.REJECTED, validation.error());
        }

        accepting = false;
        String deviceId = validation.sanitized();
        scanHistory.record(ScanHistoryItem.of(deviceId, candidate.source(), ActivityType.INVENTORY, clock));

        if (isAlreadyScanned(deviceId)) {
            statusMessage = "✗ Device already scanned: " + deviceId;
            log.warn("Device {} already counted in this inventory session", deviceId);
            return settled(ScanResult.of(Outcome.DUPLICATE_IDENTIFIER, statusMessage));
        }

        InventoryRecord record = InventoryRecord.create(deviceId, componentType, candidate.source(), clock);
        if (!append(record)) {
            statusMessage = "✗ Failed to save device";
            return settled(ScanResult.of(Outcome.PERSISTENCE_FAILED, statusMessage));
        }
        session.add(record);
        statusMessage = "✓ " + componentType.displayName() + ": " + deviceId + categoryWarning(deviceId);
        log.info("Counted {} {} ({} in session)", componentType, deviceId, session.size());
        return settled(ScanResult.recorded(statusMessage, record));
    }

    /**
     * Removes the last device of the session and its saved record.
     */
    public synchronized ScanResult undoLast() {
        if (session.isEmpty()) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, "Nothing to undo");
        }
        InventoryRecord undone = session.get(session.size() - 1);
        if (!deleteMostRecent()) {
            statusMessage = "✗ Failed to undo inventory scan";
            return ScanResult.of(Outcome.PERSISTENCE_FAILED, statusMessage);
        }
        session.remove(session.size() - 1);
        statusMessage = "✓ Undid " + undone.componentType().displayName() + ": " + undone.deviceId();
        log.info("Undid inventory scan of {}", undone.deviceId());
        return new ScanResult(Outcome.UNDONE, statusMessage, null, null, null, null, undone);
    }

    /**
     * Starts a new session. Records already saved are kept.
     */
    public synchronized ScanResult clearInventory() {
        int cleared = session.size();
        session.clear();
        statusMessage = "Inventory cleared";
        accepting = false;
        log.info("Inventory session cleared ({} devices)", cleared);
        return settled(ScanResult.of(Outcome.CANCELLED, statusMessage));
    }

    public synchronized InventorySummary summary() {
        Map<String, Integer> byType = new LinkedHashMap<>();
        StringBuilder text = new StringBuilder("Inventory Summary:\n");
        for (InventoryComponentType type : InventoryComponentType.values()) {
            int count = countOf(type);
            byType.put(type.displayName(), count);
            text.append(type.pluralName()).append(": ").append(count).append('\n');
        }
        text.append("Total: ").append(session.size());
        List<InventoryRecord> devices = session.stream()
                .sorted(Comparator.comparing(InventoryRecord::componentType)
                        .thenComparing(InventoryRecord::timestamp))
                .toList();
        return new InventorySummary(locationId, session.size(), byType, devices, text.toString());
    }

    public synchronized InventoryStatus status() {
        return new InventoryStatus(componentType, statusMessage, accepting, session.size(), !session.isEmpty());
    }

    private boolean isAlreadyScanned(String deviceId) {
        return session.stream().anyMatch(record -> record.deviceId().equals(deviceId));
    }

    private int countOf(InventoryComponentType type) {
        return (int) session.stream().filter(record -> record.componentType() == type).count();
    }

    private String categoryWarning(String deviceId) {
        InventoryComponentType inferred = InventoryComponentType.of(
                classifier.inferComponentType(deviceId).componentType());
        if (inferred == null || inferred == componentType) {
            return "";
        }
        log.warn("Device {} counted as {} but looks like {}", deviceId, componentType, inferred);
        return "\n⚠ Looks like " + inferred.displayName() + ", check the selected type";
    }

    private String scanningMessage() {
        return "Scanning " + componentType.displayName();
    }

    private boolean append(InventoryRecord record) {
        try {
            return recordStore.appendRecord(record);
        } catch (RuntimeException ex) {
            log.error("Record store failed to append inventory record {}", record.deviceId(), ex);
            return false;
        }
    }

    private boolean deleteMostRecent() {
        try {
            return recordStore.deleteMostRecent(RecordType.INVENTORY);
        } catch (RuntimeException ex) {
            log.error("Record store failed to delete the most recent inventory record", ex);
            return false;
        }
    }

    private ScanResult settled(ScanResult result) {
        if (settleHandle != null) {
            settleHandle.cancel();
        }
        settleHandle = settleTimer.schedule(this::settle, settleDelay);
        return result;
    }

    private synchronized void settle() {
        settleHandle = null;
        accepting = true;
        statusMessage = scanningMessage();
    }
}

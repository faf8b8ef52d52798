package com.example.kitscanner.service.kit;

import com.example.kitscanner.config.KitScannerProperties;
import com.example.kitscanner.model.ActivityType;
import com.example.kitscanner.model.ConfidenceTier;
import com.example.kitscanner.model.RecordType;
import com.example.kitscanner.model.ScanCandidate;
import com.example.kitscanner.model.ScanHistoryItem;
import com.example.kitscanner.model.ScanResult;
import com.example.kitscanner.model.ScanResult.Outcome;
import com.example.kitscanner.model.ScanSource;
import com.example.kitscanner.model.kit.ComponentDetectionResult;
import com.example.kitscanner.model.kit.ComponentType;
import com.example.kitscanner.model.kit.DuplicateComponentConflict;
import com.example.kitscanner.model.kit.KitAssemblyPhase;
import com.example.kitscanner.model.kit.KitAssemblyState;
import com.example.kitscanner.model.kit.KitAssemblyStatus;
import com.example.kitscanner.model.kit.KitRecord;
import com.example.kitscanner.model.kit.RequirementStatus;
import com.example.kitscanner.model.kit.ScannedComponent;
import com.example.kitscanner.model.kit.SlotId;
import com.example.kitscanner.service.SettleTimer;
import com.example.kitscanner.service.classification.IdentifierClassifier;
import com.example.kitscanner.service.classification.IdentifierClassifier.ComponentInference;
import com.example.kitscanner.service.classification.IdentifierClassifier.ManualEntryValidation;
import com.example.kitscanner.service.history.ScanHistory;
import com.example.kitscanner.service.storage.RecordStore;
import com.example.kitscanner.util.ScanInputValidator;
import com.example.kitscanner.util.ScanInputValidator.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Kit bundling state machine. The first valid scan names the kit; every later scan is a component DSN that
 * is classified, checked for duplicates and either assigned to a slot straight away (high confidence) or
 * handed to the operator for confirmation (medium) or slot selection (low).
 * <p>
 * While a detection or slot conflict is waiting for a decision the engine does not accept scans. Exactly
 * one of {@link #confirmComponentAssignment}, {@link #ignoreDuplicateComponent},
 * {@link #reassignDuplicateComponent} or {@link #cancelComponentDetection} ends the wait.
 * <p>
 * Every public method is synchronized and reports through {@link ScanResult}; none of them throw.
 */
public class KitAssemblyEngine {

    private static final Logger log = LoggerFactory.getLogger(KitAssemblyEngine.class);

    static final String SCAN_KIT_MESSAGE = "Scan Kit QR Code";
    static final String SCAN_KIT_INSTRUCTION = "Position the kit QR code within the frame";
    static final String FIRST_COMPONENT_INSTRUCTION = "Now scan any component (glasses, controller, or battery)";
    static final String REQUIREMENTS_MET_INSTRUCTION = "✓ Minimum requirements met - scan more or save kit";
    static final String DUPLICATE_MESSAGE = "⚠️ Duplicate DSN - already scanned in this kit";

    private final IdentifierClassifier classifier;
    private final DuplicateAndSlotResolver resolver;
    private final RecordStore<KitRecord> recordStore;
    private final ScanHistory scanHistory;
    private final SettleTimer settleTimer;
    private final Clock clock;
    private final Duration settleDelay;
    private final Duration undoTimeout;

    private KitAssemblyState state;
    private KitAssemblyPhase phase = KitAssemblyPhase.AWAITING_KIT_CODE;
    private ComponentDetectionResult pendingDetection;
    private DuplicateComponentConflict pendingConflict;
    private String statusMessage = SCAN_KIT_MESSAGE;
    private String instruction = SCAN_KIT_INSTRUCTION;
    private boolean accepting = true;

    private KitRecord lastSaved;
    private SettleTimer.Handle settleHandle;
    private SettleTimer.Handle undoHandle;

    public KitAssemblyEngine(IdentifierClassifier classifier, DuplicateAndSlotResolver resolver,
            RecordStore<KitRecord> recordStore, ScanHistory scanHistory, SettleTimer settleTimer, Clock clock,
            KitScannerProperties properties) {
        this.classifier = classifier;
        this.resolver = resolver;
        this.recordStore = recordStore;
        this.scanHistory = scanHistory;
        this.settleTimer = settleTimer;
        this.clock = clock;
        this.settleDelay = properties.getScan().getSettleDelay();
        this.undoTimeout = properties.getScan().getUndoTimeout();
    }

    public ScanResult processScan(String raw) {
        return processScan(ScanCandidate.barcode(raw));
    }

    public synchronized ScanResult processScan(ScanCandidate candidate) {
        if (!accepting) {
            log.debug("Kit scan dropped in phase {}", phase);
            return ScanResult.of(Outcome.DROPPED, statusMessage);
        }
        ValidationOutcome validation = ScanInputValidator.validate(candidate == null ? null : candidate.text());
        if (!validation.valid()) {
            log.warn("Kit scan rejected: {}", validation.error());
            return ScanResult.of(Outcome.REJECTED, validation.error());
        }

        accepting = false;
        String value = validation.sanitized();
        scanHistory.record(ScanHistoryItem.of(value, candidate.source(), ActivityType.KIT_BUNDLE, clock));

        if (state == null) {
            return startKit(value);
        }
        return handleComponent(value, candidate.source(), candidate.ocrConfidence());
    }

    /**
     * Accepts a DSN typed by the operator when scanning and OCR both failed. The normalized DSN is then
     * treated as a barcode-confidence component scan.
     */
    public synchronized ScanResult submitManualEntry(String text) {
        if (state == null) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, "Scan a kit code before entering components");
        }
        if (hasPendingDecision()) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, "Resolve the pending component first");
        }
        ManualEntryValidation manual = classifier.validateManualEntry(text);
        if (!manual.valid()) {
            log.warn("Manual DSN entry rejected: {}", manual.error());
            return ScanResult.of(Outcome.REJECTED, manual.error());
        }
        ValidationOutcome validation = ScanInputValidator.validate(manual.normalizedDsn());
        if (!validation.valid()) {
            log.warn("Manual DSN entry rejected: {}", validation.error());
            return ScanResult.of(Outcome.REJECTED, validation.error());
        }

        cancel(settleHandle);
        accepting = false;
        String value = validation.sanitized();
        scanHistory.record(ScanHistoryItem.of(value, ScanSource.MANUAL, ActivityType.KIT_BUNDLE, clock));
        return handleComponent(value, ScanSource.MANUAL, 1.0);
    }

    public synchronized ScanResult confirmComponentAssignment(String rawIdentifier, SlotId slot) {
        if (state == null || rawIdentifier == null) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, statusMessage);
        }
        boolean matchesDetection = pendingDetection != null
                && pendingDetection.rawIdentifier().equals(rawIdentifier);
        boolean matchesConflict = pendingConflict != null
                && pendingConflict.conflictingRawIdentifier().equals(rawIdentifier);
        if (!matchesDetection && !matchesConflict) {
            log.debug("No pending component {} to assign", rawIdentifier);
            return ScanResult.of(Outcome.NOTHING_TO_DO, "No pending component " + rawIdentifier);
        }
        if (slot == null) {
            return ScanResult.of(Outcome.REJECTED, "Select a slot for " + shortForm(rawIdentifier));
        }
        ComponentType inferredType = matchesDetection
                ? pendingDetection.componentType()
                : pendingConflict.componentType();
        pendingDetection = null;
        pendingConflict = null;
        return assign(rawIdentifier, inferredType, slot, "");
    }

    public synchronized ScanResult ignoreDuplicateComponent() {
        if (pendingConflict == null) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, statusMessage);
        }
        log.info("Ignored scan {} conflicting with {} in {}", pendingConflict.conflictingRawIdentifier(),
                pendingConflict.existingRawIdentifier(), pendingConflict.slot().id());
        pendingConflict = null;
        resumeAssembling("Scan ignored");
        return ScanResult.of(Outcome.IGNORED, statusMessage);
    }

    /**
     * Moves the current occupant of the contested slot out of the kit and puts the new scan in its place.
     */
    public synchronized ScanResult reassignDuplicateComponent() {
        if (pendingConflict == null) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, statusMessage);
        }
        DuplicateComponentConflict conflict = pendingConflict;
        pendingConflict = null;
        SlotId slot = conflict.slot();
        Optional<ScannedComponent> evicted = state.evict(slot);
        state.install(new ScannedComponent(conflict.conflictingRawIdentifier(), conflict.componentType(), slot,
                clock.instant()));
        log.info("Reassigned {} to {}, evicting {}", conflict.conflictingRawIdentifier(), slot.id(),
                evicted.map(ScannedComponent::rawIdentifier).orElse(null));

        phase = KitAssemblyPhase.ASSEMBLING_COMPONENTS;
        statusMessage = slot.displayName() + ": " + shortForm(conflict.conflictingRawIdentifier()) + " ✓"
                + evicted.map(previous -> " (replaced " + shortForm(previous.rawIdentifier()) + ")").orElse("");
        refreshInstruction();
        return settled(ScanResult.of(Outcome.ACCEPTED, statusMessage));
    }

    public synchronized ScanResult cancelComponentDetection() {
        if (pendingDetection == null && pendingConflict == null) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, statusMessage);
        }
        pendingDetection = null;
        pendingConflict = null;
        resumeAssembling("Component detection cancelled");
        return ScanResult.of(Outcome.CANCELLED, statusMessage);
    }

    /**
     * Persists the kit as it stands. Saving a partial kit is allowed; callers gate on
     * {@link KitAssemblyStatus#readyToSave()}. On failure all scanned components are kept.
     */
    public synchronized ScanResult saveKitBundle() {
        if (state == null || state.isEmpty()) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, "Scan at least one component before saving");
        }
        if (hasPendingDecision()) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, "Resolve the pending component first");
        }
        KitRecord record = KitRecord.from(state, clock);
        if (!append(record)) {
            statusMessage = "✗ Failed to save kit bundle";
            log.warn("Failed to save kit bundle {}", record.kitId());
            return ScanResult.of(Outcome.PERSISTENCE_FAILED, statusMessage);
        }

        log.info("Saved kit bundle {} with {} components", record.kitId(), record.filledComponentCount());
        resetToKitCode();
        statusMessage = "Kit Bundle Complete\n\nKit ID: " + record.kitId()
                + "\nComponents: " + record.filledComponentCount();
        showUndo(record);
        accepting = false;
        return settled(ScanResult.recorded(statusMessage, record));
    }

    public synchronized ScanResult undoLastKitBundle() {
        if (lastSaved == null) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, "Nothing to undo");
        }
        KitRecord undone = lastSaved;
        hideUndo();
        if (deleteMostRecent()) {
            statusMessage = "✓ Undid kit bundle " + undone.kitId();
            log.info("Undid kit bundle {}", undone.kitId());
            return new ScanResult(Outcome.UNDONE, statusMessage, null, undone, null, null, null);
        }
        statusMessage = "✗ Failed to undo kit bundle";
        return ScanResult.of(Outcome.PERSISTENCE_FAILED, statusMessage);
    }

    /**
     * Discards the kit in progress, including any pending decision, and waits for a new kit code.
     */
    public synchronized ScanResult clearState() {
        resetToKitCode();
        return ScanResult.of(Outcome.CANCELLED, statusMessage);
    }

    synchronized Optional<ScannedComponent> componentIn(SlotId slot) {
        return state == null ? Optional.empty() : state.occupant(slot);
    }

    public synchronized KitAssemblyStatus status() {
        RequirementStatus requirements = state == null ? RequirementStatus.of(0, 0, 0) : state.requirementStatus();
        Map<String, String> components = new LinkedHashMap<>();
        if (state != null) {
            state.scannedComponents().forEach((slot, component) -> components.put(slot.id(), component.rawIdentifier()));
        }
        return new KitAssemblyStatus(
                phase,
                state == null ? null : state.baseKitCode(),
                components,
                requirements,
                state != null && requirements.complete(),
                statusMessage,
                instruction,
                state == null ? "" : requirements.progressMessage(),
                componentSummary(),
                accepting,
                lastSaved != null,
                pendingDetection,
                pendingConflict,
                resolver.availableSlots(state));
    }

    private ScanResult startKit(String kitCode) {
        state = new KitAssemblyState(kitCode);
        phase = KitAssemblyPhase.ASSEMBLING_COMPONENTS;
        statusMessage = "Kit scanned: " + kitCode + existingKitWarning(kitCode);
        instruction = FIRST_COMPONENT_INSTRUCTION;
        log.info("Started kit bundle for {}", kitCode);
        return settled(ScanResult.of(Outcome.ACCEPTED, statusMessage));
    }

    private ScanResult handleComponent(String dsn, ScanSource source, double ocrConfidence) {
        if (resolver.isDuplicate(state, dsn)) {
            statusMessage = DUPLICATE_MESSAGE;
            log.warn("Duplicate DSN {} in kit {}", dsn, state.baseKitCode());
            return settled(ScanResult.of(Outcome.DUPLICATE_IDENTIFIER, statusMessage));
        }

        ComponentInference inference = classifier.inferComponentType(dsn);
        ConfidenceTier tier = classifier.getDetectionConfidence(dsn, ocrConfidence);
        SlotId suggested = resolver.suggestSlot(inference.componentType(), state);
        String similarity = source == ScanSource.OCR ? similarityWarning(dsn) : "";
        log.debug("DSN {} inferred as {} ({} tier), suggested slot {}", dsn, inference.componentType(), tier,
                suggested);

        if (tier == ConfidenceTier.HIGH && suggested != null) {
            return assign(dsn, inference.componentType(), suggested, similarity);
        }

        boolean confirm = tier == ConfidenceTier.MEDIUM && suggested != null;
        pendingDetection = new ComponentDetectionResult(dsn, inference.correctedDsn(), inference.componentType(),
                tier, confirm, !confirm, suggested, resolver.availableSlots(state));
        if (confirm) {
            phase = KitAssemblyPhase.AWAITING_CONFIRMATION;
            statusMessage = "Confirm " + inference.componentType().displayName() + ": " + shortForm(dsn) + similarity;
            return ScanResult.detection(Outcome.CONFIRMATION_REQUIRED, statusMessage, pendingDetection);
        }
        phase = KitAssemblyPhase.AWAITING_SLOT_SELECTION;
        statusMessage = "Select a slot for " + shortForm(dsn) + similarity;
        return ScanResult.detection(Outcome.MANUAL_SELECTION_REQUIRED, statusMessage, pendingDetection);
    }

    /**
     * Puts a DSN into a slot. The component keeps the type inferred from its DSN, which may differ from the
     * slot's own type or be {@code null} when an unrecognised DSN was placed by hand.
     */
    private ScanResult assign(String dsn, ComponentType inferredType, SlotId slot, String similarity) {
        if (state.contains(dsn)) {
            phase = KitAssemblyPhase.ASSEMBLING_COMPONENTS;
            statusMessage = DUPLICATE_MESSAGE;
            return settled(ScanResult.of(Outcome.DUPLICATE_IDENTIFIER, statusMessage));
        }
        Optional<ScannedComponent> occupant = state.occupant(slot);
        if (occupant.isPresent()) {
            ScannedComponent existing = occupant.get();
            pendingConflict = new DuplicateComponentConflict(dsn, inferredType, slot, slot.displayName(),
                    existing.rawIdentifier(), resolver.suggestAlternate(slot.componentType(), state));
            phase = KitAssemblyPhase.AWAITING_CONFLICT_RESOLUTION;
            statusMessage = slot.displayName() + " already holds " + shortForm(existing.rawIdentifier())
                    + "\nIgnore " + shortForm(dsn) + " or reassign it";
            log.warn("Slot conflict on {}: {} scanned while {} is assigned", slot.id(), dsn, existing.rawIdentifier());
            return ScanResult.conflict(statusMessage, pendingConflict);
        }

        state.install(new ScannedComponent(dsn, inferredType, slot, clock.instant()));
        phase = KitAssemblyPhase.ASSEMBLING_COMPONENTS;
        statusMessage = slot.displayName() + ": " + shortForm(dsn) + " ✓" + similarity;
        refreshInstruction();
        log.debug("Assigned {} to {} in kit {}", dsn, slot.id(), state.baseKitCode());
        return settled(ScanResult.of(Outcome.ACCEPTED, statusMessage));
    }

    private void resumeAssembling(String message) {
        cancel(settleHandle);
        settleHandle = null;
        phase = KitAssemblyPhase.ASSEMBLING_COMPONENTS;
        statusMessage = message;
        accepting = true;
    }

    private void resetToKitCode() {
        cancel(settleHandle);
        settleHandle = null;
        state = null;
        pendingDetection = null;
        pendingConflict = null;
        phase = KitAssemblyPhase.AWAITING_KIT_CODE;
        statusMessage = SCAN_KIT_MESSAGE;
        instruction = SCAN_KIT_INSTRUCTION;
        accepting = true;
    }

    private void refreshInstruction() {
        String missing = state.requirementStatus().missingComponentsMessage();
        instruction = missing != null ? missing : REQUIREMENTS_MET_INSTRUCTION;
    }

    private boolean hasPendingDecision() {
        return pendingDetection != null || pendingConflict != null;
    }

    private String componentSummary() {
        if (state == null) {
            return "";
        }
        StringJoiner summary = new StringJoiner("\n");
        state.scannedComponents().forEach((slot, component) ->
                summary.add(slot.displayName() + ": ..." + component.shortIdentifier()));
        return summary.toString();
    }

    private String similarityWarning(String dsn) {
        for (String existing : state.scannedRawIdentifiers()) {
            if (classifier.isSimilar(existing, dsn)) {
                return "\n⚠ Similar to " + shortForm(existing) + ", check the label";
            }
        }
        return "";
    }

    private String existingKitWarning(String kitCode) {
        String kitId = KitRecord.generateKitId(kitCode, LocalDate.now(clock));
        List<KitRecord> today;
        try {
            today = recordStore.recordsForToday();
        } catch (RuntimeException ex) {
            log.error("Could not read today's kit bundles", ex);
            return "";
        }
        boolean exists = today.stream().anyMatch(record -> kitId.equals(record.kitId()));
        if (exists) {
            log.warn("Kit {} was already bundled today", kitId);
            return "\n⚠ Kit " + kitId + " was already bundled today";
        }
        return "";
    }

    private boolean append(KitRecord record) {
        try {
            return recordStore.appendRecord(record);
        } catch (RuntimeException ex) {
            log.error("Record store failed to append kit bundle {}", record.kitId(), ex);
            return false;
        }
    }

    private boolean deleteMostRecent() {
        try {
            return recordStore.deleteMostRecent(RecordType.KIT_BUNDLE);
        } catch (RuntimeException ex) {
            log.error("Record store failed to delete the most recent kit bundle", ex);
            return false;
        }
    }

    private ScanResult settled(ScanResult result) {
        cancel(settleHandle);
        settleHandle = settleTimer.schedule(this::settle, settleDelay);
        return result;
    }

    private synchronized void settle() {
        settleHandle = null;
        if (!hasPendingDecision()) {
            accepting = true;
        }
    }

    private void showUndo(KitRecord record) {
        cancel(undoHandle);
        lastSaved = record;
        undoHandle = settleTimer.schedule(this::expireUndo, undoTimeout);
    }

    private synchronized void expireUndo() {
        undoHandle = null;
        lastSaved = null;
    }

    private void hideUndo() {
        cancel(undoHandle);
        undoHandle = null;
        lastSaved = null;
    }

    private static String shortForm(String dsn) {
        return dsn.length() > 8 ? "..." + dsn.substring(dsn.length() - 8) : dsn;
    }

    private static void cancel(SettleTimer.Handle handle) {
        if (handle != null) {
            handle.cancel();
        }
    }
}

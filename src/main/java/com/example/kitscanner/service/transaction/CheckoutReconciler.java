package com.example.kitscanner.service.transaction;

import com.example.kitscanner.config.KitScannerProperties;
import com.example.kitscanner.model.ActivityType;
import com.example.kitscanner.model.BarcodeFormat;
import com.example.kitscanner.model.CheckoutState;
import com.example.kitscanner.model.CheckoutStatus;
import com.example.kitscanner.model.IdentifierClass;
import com.example.kitscanner.model.RecordType;
import com.example.kitscanner.model.ScanCandidate;
import com.example.kitscanner.model.ScanHistoryItem;
import com.example.kitscanner.model.ScanResult;
import com.example.kitscanner.model.ScanResult.Outcome;
import com.example.kitscanner.model.TransactionRecord;
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

/**
 * Dual-scan state machine pairing one user id with one kit id, in either order, into a single checkout or
 * check-in record. A check-in station can instead run kit-only: every valid scan is taken as the kit id and
 * checked in straight away, with no user, classification or review.
 * <p>
 * A scan of the kind already pending replaces it. Scans classified as {@link IdentifierClass#OTHER} are
 * saved on their own without touching the pending pair. With review enabled a completed pair waits in
 * {@link CheckoutState#REVIEW_PENDING} until {@link #confirmReview()} or {@link #cancelReview()}; scans made
 * during review replace the user or kit id under review.
 * <p>
 * After each processed scan the reconciler stops accepting input until the settle delay has passed.
 * Every public method is synchronized and reports through {@link ScanResult}; none of them throw.
 */
public class CheckoutReconciler {

    private static final Logger log = LoggerFactory.getLogger(CheckoutReconciler.class);

    static final String READY_MESSAGE = "Ready to scan";
    static final String KIT_READY_MESSAGE = "Ready to scan kit";

    private final RecordType transactionType;
    private final ActivityType activityType;
    private final IdentifierClassifier classifier;
    private final RecordStore<TransactionRecord> recordStore;
    private final ScanHistory scanHistory;
    private final SettleTimer settleTimer;
    private final Clock clock;
    private final boolean userRequired;
    private final boolean reviewEnabled;
    private final Duration settleDelay;
    private final Duration undoTimeout;

    private CheckoutState state = CheckoutState.IDLE;
    private String pendingUserId;
    private String pendingKitId;
    private String statusMessage;
    private boolean accepting = true;

    private TransactionRecord lastRecord;
    private SettleTimer.Handle settleHandle;
    private SettleTimer.Handle undoHandle;

    public CheckoutReconciler(RecordType transactionType, IdentifierClassifier classifier,
            RecordStore<TransactionRecord> recordStore, ScanHistory scanHistory, SettleTimer settleTimer,
            Clock clock, KitScannerProperties properties) {
        this.activityType = switch (transactionType) {
            case CHECKOUT -> ActivityType.CHECKOUT;
            case CHECKIN -> ActivityType.CHECKIN;
            default -> throw new IllegalArgumentException("Not a transaction type: " + transactionType);
        };
        this.transactionType = transactionType;
        this.classifier = classifier;
        this.recordStore = recordStore;
        this.scanHistory = scanHistory;
        this.settleTimer = settleTimer;
        this.clock = clock;
        this.userRequired = transactionType == RecordType.CHECKOUT || properties.getCheckin().isRequireUser();
        this.reviewEnabled = userRequired && properties.getCheckout().isReviewEnabled();
        this.statusMessage = readyMessage();
        this.settleDelay = properties.getScan().getSettleDelay();
        this.undoTimeout = properties.getScan().getUndoTimeout();
    }

    public ScanResult processScan(String raw) {
        return processScan(ScanCandidate.barcode(raw));
    }

    public synchronized ScanResult processScan(ScanCandidate candidate) {
        if (!accepting) {
            log.debug("{} scan dropped while not accepting input", transactionType);
            return ScanResult.of(Outcome.DROPPED, statusMessage);
        }
        ValidationOutcome validation = ScanInputValidator.validate(candidate == null ? null : candidate.text());
        if (!validation.valid()) {
            log.warn("{} scan rejected: {}", transactionType, validation.error());
            return ScanResult.of(Outcome.REJECTED, validation.error());
        }

        accepting = false;
        String value = validation.sanitized();
        BarcodeFormat reported = BarcodeFormat.fromTag(candidate.format());
        String formatName = (reported != null ? reported : validation.format()).displayName();
        scanHistory.record(ScanHistoryItem.of(value, candidate.source(), activityType, clock));

        if (!userRequired) {
            pendingKitId = value;
            return commit();
        }

        IdentifierClass identifierClass = classifier.classify(value);
        log.debug("{} scan {} classified as {} in state {}", transactionType, value, identifierClass, state);

        if (identifierClass == IdentifierClass.OTHER) {
            return saveOther(value, formatName);
        }

        if (identifierClass == IdentifierClass.USER) {
            boolean replacing = pendingUserId != null;
            pendingUserId = value;
            if (pendingKitId == null) {
                state = CheckoutState.USER_SCANNED;
                statusMessage = (replacing ? "User updated (" : "User scanned (") + formatName + "): " + value
                        + "\nScan kit barcode";
                return settled(ScanResult.of(Outcome.ACCEPTED, statusMessage));
            }
        } else {
            boolean replacing = pendingKitId != null;
            pendingKitId = value;
            if (pendingUserId == null) {
                state = CheckoutState.KIT_SCANNED;
                statusMessage = (replacing ? "Kit updated (" : "Kit scanned (") + formatName + "): " + value
                        + "\nScan user barcode";
                return settled(ScanResult.of(Outcome.ACCEPTED, statusMessage));
            }
        }
        return completePair();
    }

    /**
     * Replaces the pending ids while a pair is under review. A {@code null} value keeps the current one.
     */
    public synchronized ScanResult updateReview(String userId, String kitId) {
        if (state != CheckoutState.REVIEW_PENDING) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, statusMessage);
        }
        String newUser = pendingUserId;
        String newKit = pendingKitId;
        if (userId != null) {
            ValidationOutcome validation = ScanInputValidator.validate(userId);
            if (!validation.valid()) {
                return ScanResult.of(Outcome.REJECTED, "User ID: " + validation.error());
            }
            newUser = validation.sanitized();
        }
        if (kitId != null) {
            ValidationOutcome validation = ScanInputValidator.validate(kitId);
            if (!validation.valid()) {
                return ScanResult.of(Outcome.REJECTED, "Kit ID: " + validation.error());
            }
            newKit = validation.sanitized();
        }
        pendingUserId = newUser;
        pendingKitId = newKit;
        statusMessage = reviewMessage();
        return ScanResult.of(Outcome.REVIEW_PENDING, statusMessage);
    }

    public synchronized ScanResult confirmReview() {
        if (state != CheckoutState.REVIEW_PENDING) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, statusMessage);
        }
        return commit();
    }

    public synchronized ScanResult cancelReview() {
        if (state != CheckoutState.REVIEW_PENDING) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, statusMessage);
        }
        log.info("{} review cancelled for user {} and kit {}", transactionType, pendingUserId, pendingKitId);
        resetToReady();
        return ScanResult.of(Outcome.CANCELLED, statusMessage);
    }

    /**
     * Discards any pending ids and makes the station ready for the next scan straight away.
     */
    public synchronized ScanResult clearState() {
        resetToReady();
        return ScanResult.of(Outcome.CANCELLED, statusMessage);
    }

    /**
     * Deletes the most recent record of this reconciler's type, while the undo action is still offered.
     */
    public synchronized ScanResult undoLast() {
        if (lastRecord == null) {
            return ScanResult.of(Outcome.NOTHING_TO_DO, "Nothing to undo");
        }
        TransactionRecord undone = lastRecord;
        hideUndo();
        if (deleteMostRecent()) {
            statusMessage = undone.userId() == null
                    ? "✓ Undid " + noun() + ": Kit " + undone.kitId()
                    : "✓ Undid " + noun() + ": User " + undone.userId() + " / Kit " + undone.kitId();
            log.info("Undid {} for user {} and kit {}", transactionType, undone.userId(), undone.kitId());
            return new ScanResult(Outcome.UNDONE, statusMessage, undone, null, null, null, null);
        }
        statusMessage = "✗ Failed to undo " + noun();
        return ScanResult.of(Outcome.PERSISTENCE_FAILED, statusMessage);
    }

    public synchronized CheckoutStatus status() {
        return new CheckoutStatus(transactionType, state, pendingUserId, pendingKitId, statusMessage, accepting,
                lastRecord != null, reviewEnabled, userRequired);
    }

    private ScanResult completePair() {
        if (reviewEnabled) {
            state = CheckoutState.REVIEW_PENDING;
            statusMessage = reviewMessage();
            log.debug("{} pair held for review: user {} kit {}", transactionType, pendingUserId, pendingKitId);
            return settled(ScanResult.of(Outcome.REVIEW_PENDING, statusMessage));
        }
        return commit();
    }

    private ScanResult commit() {
        String userId = pendingUserId;
        String kitId = pendingKitId;
        TransactionRecord record = transactionType == RecordType.CHECKOUT
                ? TransactionRecord.checkout(userId, kitId, clock)
                : TransactionRecord.checkIn(userId, kitId, clock);

        pendingUserId = null;
        pendingKitId = null;
        state = CheckoutState.IDLE;
        accepting = false;

        if (append(record)) {
            statusMessage = userId == null
                    ? "✓ Kit " + kitId + " " + verb()
                    : "✓ User " + userId + " " + verb() + " kit " + kitId;
            log.info("Recorded {} for user {} and kit {}", transactionType, userId, kitId);
            showUndo(record);
            return settled(ScanResult.recorded(statusMessage, record));
        }
        statusMessage = "✗ Failed to save " + noun();
        log.warn("Failed to save {} for user {} and kit {}", transactionType, userId, kitId);
        return settled(ScanResult.of(Outcome.PERSISTENCE_FAILED, statusMessage));
    }

    private ScanResult saveOther(String value, String formatName) {
        TransactionRecord record = TransactionRecord.other(ScanInputValidator.sanitizeForRecord(value), clock);
        if (append(record)) {
            statusMessage = "✓ Other entry saved (" + formatName + "): " + record.value();
            log.info("Recorded other entry {} alongside {} state {}", record.value(), transactionType, state);
            return settled(ScanResult.recorded(statusMessage, record));
        }
        statusMessage = "✗ Failed to save other entry";
        return settled(ScanResult.of(Outcome.PERSISTENCE_FAILED, statusMessage));
    }

    private boolean append(TransactionRecord record) {
        try {
            return recordStore.appendRecord(record);
        } catch (RuntimeException ex) {
            log.error("Record store failed to append {} record", record.type(), ex);
            return false;
        }
    }

    private boolean deleteMostRecent() {
        try {
            return recordStore.deleteMostRecent(transactionType);
        } catch (RuntimeException ex) {
            log.error("Record store failed to delete the most recent {} record", transactionType, ex);
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
        accepting = true;
        if (state == CheckoutState.IDLE) {
            statusMessage = readyMessage();
        }
    }

    private void resetToReady() {
        cancel(settleHandle);
        settleHandle = null;
        pendingUserId = null;
        pendingKitId = null;
        state = CheckoutState.IDLE;
        statusMessage = readyMessage();
        accepting = true;
    }

    private void showUndo(TransactionRecord record) {
        cancel(undoHandle);
        lastRecord = record;
        undoHandle = settleTimer.schedule(this::expireUndo, undoTimeout);
    }

    private synchronized void expireUndo() {
        undoHandle = null;
        lastRecord = null;
    }

    private void hideUndo() {
        cancel(undoHandle);
        undoHandle = null;
        lastRecord = null;
    }

    private String readyMessage() {
        return userRequired ? READY_MESSAGE : KIT_READY_MESSAGE;
    }

    private String reviewMessage() {
        return "Review " + noun() + "\nUser: " + pendingUserId + "\nKit: " + pendingKitId;
    }

    private String verb() {
        return transactionType == RecordType.CHECKOUT ? "checked out" : "checked in";
    }

    private String noun() {
        return transactionType == RecordType.CHECKOUT ? "checkout" : "check-in";
    }

    private static void cancel(SettleTimer.Handle handle) {
        if (handle != null) {
            handle.cancel();
        }
    }
}

package com.example.kitscanner.service.transaction;

import com.example.kitscanner.config.KitScannerProperties;
import com.example.kitscanner.model.ActivityType;
import com.example.kitscanner.model.CheckoutState;
import com.example.kitscanner.model.CheckoutStatus;
import com.example.kitscanner.model.RecordType;
import com.example.kitscanner.model.ScanCandidate;
import com.example.kitscanner.model.ScanHistoryItem;
import com.example.kitscanner.model.ScanResult;
import com.example.kitscanner.model.ScanResult.Outcome;
import com.example.kitscanner.model.ScanSource;
import com.example.kitscanner.model.TransactionRecord;
import com.example.kitscanner.service.ManualSettleTimer;
import com.example.kitscanner.service.classification.IdentifierClassifier;
import com.example.kitscanner.service.history.InMemoryScanHistory;
import com.example.kitscanner.service.storage.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CheckoutReconcilerTest {

    private static final Duration SETTLE = Duration.ofMillis(1500);

    private final Clock clock = Clock.fixed(Instant.parse("2024-08-30T10:15:30Z"), ZoneOffset.UTC);
    private final IdentifierClassifier classifier = new IdentifierClassifier(new KitScannerProperties());

    @Mock
    private RecordStore<TransactionRecord> store;

    private ManualSettleTimer timer;
    private InMemoryScanHistory history;

    @BeforeEach
    void setUp() {
        timer = new ManualSettleTimer();
        history = new InMemoryScanHistory(50);
        lenient().when(store.appendRecord(any())).thenReturn(true);
    }

    private CheckoutReconciler reconciler(RecordType type, boolean reviewEnabled) {
        KitScannerProperties properties = new KitScannerProperties();
        properties.getCheckout().setReviewEnabled(reviewEnabled);
        return new CheckoutReconciler(type, classifier, store, history, timer, clock, properties);
    }

    private ScanResult scanAndSettle(CheckoutReconciler reconciler, String raw) {
        ScanResult result = reconciler.processScan(raw);
        timer.advance(SETTLE);
        return result;
    }

    @Nested
    @DisplayName("without review")
    class ImmediateCommit {

        private CheckoutReconciler reconciler;

        @BeforeEach
        void setUp() {
            reconciler = reconciler(RecordType.CHECKOUT, false);
        }

        @Test
        void userThenKitPersistsExactlyOneCheckout() {
            assertThat(scanAndSettle(reconciler, "USER123").outcome()).isEqualTo(Outcome.ACCEPTED);
            assertThat(reconciler.status().state()).isEqualTo(CheckoutState.USER_SCANNED);

            ScanResult result = reconciler.processScan("KIT456");

            assertThat(result.outcome()).isEqualTo(Outcome.RECORDED);
            assertThat(result.message()).isEqualTo("✓ User USER123 checked out kit KIT456");
            ArgumentCaptor<TransactionRecord> captor = ArgumentCaptor.forClass(TransactionRecord.class);
            verify(store, times(1)).appendRecord(captor.capture());
            TransactionRecord record = captor.getValue();
            assertThat(record.userId()).isEqualTo("USER123");
            assertThat(record.kitId()).isEqualTo("KIT456");
            assertThat(record.type()).isEqualTo(RecordType.CHECKOUT);
            assertThat(record.value()).isEqualTo("User USER123 checked out Kit KIT456");

            CheckoutStatus status = reconciler.status();
            assertThat(status.state()).isEqualTo(CheckoutState.IDLE);
            assertThat(status.pendingUserId()).isNull();
            assertThat(status.pendingKitId()).isNull();
        }

        @Test
        void pairingIsSymmetric() {
            scanAndSettle(reconciler, "USER123");
            TransactionRecord userFirst = scanAndSettle(reconciler, "KIT456").transaction();

            scanAndSettle(reconciler, "KIT456");
            TransactionRecord kitFirst = scanAndSettle(reconciler, "USER123").transaction();

            assertThat(kitFirst).isEqualTo(userFirst);
        }

        @Test
        void secondUserReplacesFirst() {
            scanAndSettle(reconciler, "USER123");
            ScanResult result = scanAndSettle(reconciler, "USER789");

            assertThat(result.message()).isEqualTo("User updated (Code 39): USER789\nScan kit barcode");
            assertThat(reconciler.status().state()).isEqualTo(CheckoutState.USER_SCANNED);
            assertThat(reconciler.status().pendingUserId()).isEqualTo("USER789");
            verify(store, never()).appendRecord(any());
        }

        @Test
        void emptyInputIsRejectedWithoutChangingState() {
            ScanResult rejected = reconciler.processScan("");

            assertThat(rejected.outcome()).isEqualTo(Outcome.REJECTED);
            assertThat(rejected.message()).isEqualTo("Empty barcode data");
            CheckoutStatus status = reconciler.status();
            assertThat(status.state()).isEqualTo(CheckoutState.IDLE);
            assertThat(status.accepting()).isTrue();

            assertThat(reconciler.processScan("USER123").outcome()).isEqualTo(Outcome.ACCEPTED);
        }

        @Test
        void injectionAttemptIsRejectedMidPair() {
            scanAndSettle(reconciler, "USER123");

            assertThat(reconciler.processScan("K1<script>").outcome()).isEqualTo(Outcome.REJECTED);
            assertThat(reconciler.status().pendingUserId()).isEqualTo("USER123");
            assertThat(reconciler.status().pendingKitId()).isNull();
        }

        @Test
        void otherScanIsSavedWithoutDisturbingPendingUser() {
            scanAndSettle(reconciler, "USER123");

            ScanResult result = scanAndSettle(reconciler, "ABC-99");

            assertThat(result.outcome()).isEqualTo(Outcome.RECORDED);
            assertThat(result.transaction().type()).isEqualTo(RecordType.OTHER);
            assertThat(result.transaction().value()).isEqualTo("ABC-99");
            assertThat(result.message()).isEqualTo("✓ Other entry saved (Code 39): ABC-99");
            assertThat(reconciler.status().state()).isEqualTo(CheckoutState.USER_SCANNED);
            assertThat(reconciler.status().pendingUserId()).isEqualTo("USER123");
        }

        @Test
        void scansAreDroppedUntilTheSettleDelayHasPassed() {
            reconciler.processScan("USER123");

            assertThat(reconciler.processScan("KIT456").outcome()).isEqualTo(Outcome.DROPPED);
            timer.advance(SETTLE.minusMillis(1));
            assertThat(reconciler.status().accepting()).isFalse();
            timer.advance(Duration.ofMillis(1));
            assertThat(reconciler.status().accepting()).isTrue();
            assertThat(reconciler.processScan("KIT456").outcome()).isEqualTo(Outcome.RECORDED);
        }

        @Test
        void persistenceFailureStillResetsToIdle() {
            when(store.appendRecord(any())).thenReturn(false);
            scanAndSettle(reconciler, "USER123");

            ScanResult result = reconciler.processScan("KIT456");

            assertThat(result.outcome()).isEqualTo(Outcome.PERSISTENCE_FAILED);
            assertThat(result.message()).isEqualTo("✗ Failed to save checkout");
            assertThat(reconciler.status().state()).isEqualTo(CheckoutState.IDLE);
            assertThat(reconciler.status().pendingUserId()).isNull();
            assertThat(reconciler.status().undoAvailable()).isFalse();

            timer.advance(SETTLE);
            assertThat(reconciler.status().accepting()).isTrue();
            assertThat(reconciler.status().statusMessage()).isEqualTo("Ready to scan");
        }

        @Test
        void throwingStoreIsReportedAsPersistenceFailure() {
            when(store.appendRecord(any())).thenThrow(new IllegalStateException("disk unavailable"));
            scanAndSettle(reconciler, "KIT456");

            assertThat(reconciler.processScan("USER123").outcome()).isEqualTo(Outcome.PERSISTENCE_FAILED);
        }

        @Test
        void undoDeletesMostRecentCheckoutOnce() {
            when(store.deleteMostRecent(RecordType.CHECKOUT)).thenReturn(true);
            scanAndSettle(reconciler, "USER123");
            scanAndSettle(reconciler, "KIT456");
            assertThat(reconciler.status().undoAvailable()).isTrue();

            ScanResult undone = reconciler.undoLast();

            assertThat(undone.outcome()).isEqualTo(Outcome.UNDONE);
            assertThat(undone.message()).isEqualTo("✓ Undid checkout: User USER123 / Kit KIT456");
            verify(store).deleteMostRecent(RecordType.CHECKOUT);
            assertThat(reconciler.status().undoAvailable()).isFalse();
            assertThat(reconciler.undoLast().outcome()).isEqualTo(Outcome.NOTHING_TO_DO);
        }

        @Test
        void undoIsOnlyOfferedUntilTimeout() {
            scanAndSettle(reconciler, "USER123");
            scanAndSettle(reconciler, "KIT456");

            timer.advance(Duration.ofSeconds(10));

            assertThat(reconciler.status().undoAvailable()).isFalse();
            assertThat(reconciler.undoLast().outcome()).isEqualTo(Outcome.NOTHING_TO_DO);
            verify(store, never()).deleteMostRecent(any());
        }

        @Test
        void clearStateDiscardsPendingIds() {
            reconciler.processScan("USER123");

            reconciler.clearState();

            CheckoutStatus status = reconciler.status();
            assertThat(status.state()).isEqualTo(CheckoutState.IDLE);
            assertThat(status.pendingUserId()).isNull();
            assertThat(status.accepting()).isTrue();
        }

        @Test
        void acceptedScansAreRecordedInHistory() {
            scanAndSettle(reconciler, "USER123");
            reconciler.processScan("");

            assertThat(history.recent(ActivityType.CHECKOUT))
                    .extracting(ScanHistoryItem::value)
                    .containsExactly("USER123");
        }
    }

    @Nested
    @DisplayName("with review")
    class Review {

        private CheckoutReconciler reconciler;

        @BeforeEach
        void setUp() {
            reconciler = reconciler(RecordType.CHECKOUT, true);
        }

        @Test
        void completedPairWaitsForConfirmation() {
            scanAndSettle(reconciler, "USER123");

            ScanResult result = reconciler.processScan("KIT456");

            assertThat(result.outcome()).isEqualTo(Outcome.REVIEW_PENDING);
            assertThat(result.message()).isEqualTo("Review checkout\nUser: USER123\nKit: KIT456");
            assertThat(reconciler.status().state()).isEqualTo(CheckoutState.REVIEW_PENDING);
            verify(store, never()).appendRecord(any());

            ScanResult confirmed = reconciler.confirmReview();

            assertThat(confirmed.outcome()).isEqualTo(Outcome.RECORDED);
            verify(store, times(1)).appendRecord(any());
            assertThat(reconciler.status().state()).isEqualTo(CheckoutState.IDLE);
        }

        @Test
        void userScannedDuringReviewReplacesPendingUser() {
            scanAndSettle(reconciler, "KIT456");
            scanAndSettle(reconciler, "USER123");

            ScanResult result = scanAndSettle(reconciler, "USER789");

            assertThat(result.outcome()).isEqualTo(Outcome.REVIEW_PENDING);
            assertThat(reconciler.status().pendingUserId()).isEqualTo("USER789");
            assertThat(reconciler.status().pendingKitId()).isEqualTo("KIT456");
            verify(store, never()).appendRecord(any());
        }

        @Test
        void cancelDiscardsPairAndAcceptsImmediately() {
            scanAndSettle(reconciler, "USER123");
            reconciler.processScan("KIT456");

            ScanResult cancelled = reconciler.cancelReview();

            assertThat(cancelled.outcome()).isEqualTo(Outcome.CANCELLED);
            CheckoutStatus status = reconciler.status();
            assertThat(status.state()).isEqualTo(CheckoutState.IDLE);
            assertThat(status.pendingUserId()).isNull();
            assertThat(status.pendingKitId()).isNull();
            assertThat(status.accepting()).isTrue();
            verify(store, never()).appendRecord(any());
        }

        @Test
        void pendingIdsCanBeEditedBeforeConfirming() {
            scanAndSettle(reconciler, "USER123");
            reconciler.processScan("KIT456");

            assertThat(reconciler.updateReview(null, "KIT999").outcome()).isEqualTo(Outcome.REVIEW_PENDING);
            ScanResult invalid = reconciler.updateReview("", null);
            assertThat(invalid.outcome()).isEqualTo(Outcome.REJECTED);
            assertThat(invalid.message()).isEqualTo("User ID: Empty barcode data");

            assertThat(reconciler.confirmReview().transaction().kitId()).isEqualTo("KIT999");
        }

        @Test
        void reviewActionsOutsideReviewDoNothing() {
            assertThat(reconciler.confirmReview().outcome()).isEqualTo(Outcome.NOTHING_TO_DO);
            assertThat(reconciler.cancelReview().outcome()).isEqualTo(Outcome.NOTHING_TO_DO);
            assertThat(reconciler.updateReview("USER1", null).outcome()).isEqualTo(Outcome.NOTHING_TO_DO);
        }
    }

    @Test
    void reportedFormatTagIsPreferredOverDetectedFormat() {
        CheckoutReconciler reconciler = reconciler(RecordType.CHECKOUT, false);

        ScanResult result = reconciler.processScan(new ScanCandidate("USER123", 1.0, "QR_CODE", ScanSource.BARCODE));

        assertThat(result.message()).isEqualTo("User scanned (QR): USER123\nScan kit barcode");
    }

    @Test
    void unknownFormatTagFallsBackToDetectedFormat() {
        CheckoutReconciler reconciler = reconciler(RecordType.CHECKOUT, false);

        ScanResult result = reconciler.processScan(new ScanCandidate("USER123", 1.0, "PDF_417", ScanSource.BARCODE));

        assertThat(result.message()).doesNotContain("PDF").startsWith("User scanned (");
    }

    @Nested
    @DisplayName("check-in, kit only")
    class KitOnlyCheckIn {

        private CheckoutReconciler checkIn;

        @BeforeEach
        void setUp() {
            checkIn = reconciler(RecordType.CHECKIN, true);
        }

        @Test
        void singleKitScanCompletesCheckIn() {
            assertThat(checkIn.status().statusMessage()).isEqualTo("Ready to scan kit");
            assertThat(checkIn.status().userRequired()).isFalse();
            assertThat(checkIn.status().reviewEnabled()).isFalse();

            ScanResult result = checkIn.processScan("KIT456");

            assertThat(result.outcome()).isEqualTo(Outcome.RECORDED);
            assertThat(result.message()).isEqualTo("✓ Kit KIT456 checked in");
            assertThat(result.transaction().userId()).isNull();
            assertThat(result.transaction().kitId()).isEqualTo("KIT456");
            assertThat(result.transaction().type()).isEqualTo(RecordType.CHECKIN);
            assertThat(result.transaction().value()).isEqualTo("Kit KIT456 checked in");
            verify(store).appendRecord(result.transaction());
            assertThat(history.recent(ActivityType.CHECKIN)).hasSize(1);
        }

        @Test
        void anyValidScanIsTakenAsTheKit() {
            ScanResult result = checkIn.processScan("ABC123");

            assertThat(result.transaction().type()).isEqualTo(RecordType.CHECKIN);
            assertThat(result.transaction().kitId()).isEqualTo("ABC123");
            ArgumentCaptor<TransactionRecord> captor = ArgumentCaptor.forClass(TransactionRecord.class);
            verify(store).appendRecord(captor.capture());
            assertThat(captor.getValue().type()).isNotEqualTo(RecordType.OTHER);
        }

        @Test
        void userLikeScanIsStillCheckedInAsKit() {
            ScanResult result = checkIn.processScan("USER123");

            assertThat(result.outcome()).isEqualTo(Outcome.RECORDED);
            assertThat(result.transaction().kitId()).isEqualTo("USER123");
            assertThat(result.transaction().userId()).isNull();
        }

        @Test
        void undoNamesOnlyTheKit() {
            when(store.deleteMostRecent(RecordType.CHECKIN)).thenReturn(true);
            checkIn.processScan("KIT456");

            ScanResult result = checkIn.undoLast();

            assertThat(result.outcome()).isEqualTo(Outcome.UNDONE);
            assertThat(result.message()).isEqualTo("✓ Undid check-in: Kit KIT456");
        }

        @Test
        void nextKitIsAcceptedAfterSettleDelay() {
            checkIn.processScan("KIT456");
            assertThat(checkIn.processScan("KIT789").outcome()).isEqualTo(Outcome.DROPPED);

            timer.advance(SETTLE);

            assertThat(checkIn.status().statusMessage()).isEqualTo("Ready to scan kit");
            assertThat(checkIn.processScan("KIT789").outcome()).isEqualTo(Outcome.RECORDED);
        }
    }

    @Test
    void checkInWithUserRequiredPairsUserAndKit() {
        KitScannerProperties properties = new KitScannerProperties();
        properties.getCheckout().setReviewEnabled(false);
        properties.getCheckin().setRequireUser(true);
        CheckoutReconciler checkIn = new CheckoutReconciler(RecordType.CHECKIN, classifier, store, history, timer,
                clock, properties);
        assertThat(checkIn.status().userRequired()).isTrue();
        scanAndSettle(checkIn, "KIT456");

        ScanResult result = checkIn.processScan("USER123");

        assertThat(result.message()).isEqualTo("✓ User USER123 checked in kit KIT456");
        assertThat(result.transaction().type()).isEqualTo(RecordType.CHECKIN);
        assertThat(result.transaction().value()).isEqualTo("User USER123 checked in Kit KIT456");
        assertThat(history.recent(ActivityType.CHECKIN)).hasSize(2);
    }
}

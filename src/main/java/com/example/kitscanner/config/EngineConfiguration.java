package com.example.kitscanner.config;

import com.example.kitscanner.model.RecordType;
import com.example.kitscanner.model.TransactionRecord;
import com.example.kitscanner.model.inventory.InventoryRecord;
import com.example.kitscanner.model.kit.KitRecord;
import com.example.kitscanner.service.ScheduledSettleTimer;
import com.example.kitscanner.service.SettleTimer;
import com.example.kitscanner.service.classification.IdentifierClassifier;
import com.example.kitscanner.service.history.InMemoryScanHistory;
import com.example.kitscanner.service.history.ScanHistory;
import com.example.kitscanner.service.inventory.InventoryEngine;
import com.example.kitscanner.service.kit.DuplicateAndSlotResolver;
import com.example.kitscanner.service.kit.KitAssemblyEngine;
import com.example.kitscanner.service.storage.JsonFileRecordStore;
import com.example.kitscanner.service.storage.RecordStore;
import com.example.kitscanner.service.transaction.CheckoutReconciler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires one reconciler per transaction type, the kit bundling engine and the inventory station, each with its
 * own record store.
 * Any of these beans can be replaced by declaring a bean with the same name.
 */
@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    static final String CHECKOUT_PREFIX = "qr_checkouts";
    static final String CHECKIN_PREFIX = "qr_checkins";
    static final String KIT_PREFIX = "qr_kits";
    static final String INVENTORY_PREFIX = "qr_inventory";

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ScanHistory scanHistory(KitScannerProperties properties) {
        return new InMemoryScanHistory(properties.getHistory().getMaxSize());
    }

    @Bean(destroyMethod = "close")
    public ScheduledSettleTimer settleTimer() {
        return new ScheduledSettleTimer();
    }

    @Bean
    public RecordStore<TransactionRecord> checkoutRecordStore(KitScannerProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        return transactionStore(CHECKOUT_PREFIX, properties, objectMapper, clock);
    }

    @Bean
    public RecordStore<TransactionRecord> checkInRecordStore(KitScannerProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        return transactionStore(CHECKIN_PREFIX, properties, objectMapper, clock);
    }

    @Bean
    public RecordStore<KitRecord> kitRecordStore(KitScannerProperties properties, ObjectMapper objectMapper,
            Clock clock) {
        return new JsonFileRecordStore<>(storageDirectory(properties), KIT_PREFIX,
                properties.getStorage().getLocationId(), KitRecord.class, objectMapper, clock);
    }

    @Bean
    public RecordStore<InventoryRecord> inventoryRecordStore(KitScannerProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        return new JsonFileRecordStore<>(storageDirectory(properties), INVENTORY_PREFIX,
                properties.getStorage().getLocationId(), InventoryRecord.class, objectMapper, clock);
    }

    @Bean
    public CheckoutReconciler checkoutReconciler(IdentifierClassifier classifier,
            @Qualifier("checkoutRecordStore") RecordStore<TransactionRecord> checkoutRecordStore,
            ScanHistory scanHistory, SettleTimer settleTimer, Clock clock, KitScannerProperties properties) {
        return new CheckoutReconciler(RecordType.CHECKOUT, classifier, checkoutRecordStore, scanHistory,
                settleTimer, clock, properties);
    }

    @Bean
    public CheckoutReconciler checkInReconciler(IdentifierClassifier classifier,
            @Qualifier("checkInRecordStore") RecordStore<TransactionRecord> checkInRecordStore,
            ScanHistory scanHistory, SettleTimer settleTimer, Clock clock, KitScannerProperties properties) {
        return new CheckoutReconciler(RecordType.CHECKIN, classifier, checkInRecordStore, scanHistory,
                settleTimer, clock, properties);
    }

    @Bean
    public KitAssemblyEngine kitAssemblyEngine(IdentifierClassifier classifier, DuplicateAndSlotResolver resolver,
            @Qualifier("kitRecordStore") RecordStore<KitRecord> kitRecordStore, ScanHistory scanHistory,
            SettleTimer settleTimer, Clock clock, KitScannerProperties properties) {
        return new KitAssemblyEngine(classifier, resolver, kitRecordStore, scanHistory, settleTimer, clock,
                properties);
    }

    @Bean
    public InventoryEngine inventoryEngine(IdentifierClassifier classifier,
            @Qualifier("inventoryRecordStore") RecordStore<InventoryRecord> inventoryRecordStore,
            ScanHistory scanHistory, SettleTimer settleTimer, Clock clock, KitScannerProperties properties) {
        return new InventoryEngine(classifier, inventoryRecordStore, scanHistory, settleTimer, clock, properties);
    }

    private static RecordStore<TransactionRecord> transactionStore(String prefix, KitScannerProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        return new JsonFileRecordStore<>(storageDirectory(properties), prefix,
                properties.getStorage().getLocationId(), TransactionRecord.class, objectMapper, clock);
    }

    private static Path storageDirectory(KitScannerProperties properties) {
        Path directory = Path.of(properties.getStorage().getDirectory()).toAbsolutePath();
        log.info("Storing scan records under {}", directory);
        return directory;
    }
}

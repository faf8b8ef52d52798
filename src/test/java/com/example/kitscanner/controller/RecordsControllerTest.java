package com.example.kitscanner.controller;

import com.example.kitscanner.model.ActivityType;
import com.example.kitscanner.model.ScanHistoryItem;
import com.example.kitscanner.model.ScanSource;
import com.example.kitscanner.model.TransactionRecord;
import com.example.kitscanner.model.inventory.InventoryComponentType;
import com.example.kitscanner.model.inventory.InventoryRecord;
import com.example.kitscanner.model.kit.KitRecord;
import com.example.kitscanner.service.history.ScanHistory;
import com.example.kitscanner.service.storage.RecordStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "kit-scanner.storage.directory=target/test-data")
@AutoConfigureMockMvc
class RecordsControllerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-08-30T10:15:30Z"), ZoneOffset.UTC);

    @Autowired
    private MockMvc mockMvc;

    @MockBean(name = "checkoutRecordStore")
    private RecordStore<TransactionRecord> checkoutRecordStore;

    @MockBean(name = "kitRecordStore")
    private RecordStore<KitRecord> kitRecordStore;

    @MockBean(name = "inventoryRecordStore")
    private RecordStore<InventoryRecord> inventoryRecordStore;

    @MockBean
    private ScanHistory scanHistory;

    @Test
    void todaysCheckoutsAreListed() throws Exception {
        when(checkoutRecordStore.recordsForToday())
                .thenReturn(List.of(TransactionRecord.checkout("USER123", "KIT456", clock)));

        mockMvc.perform(get("/api/records/checkouts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].user").value("USER123"))
                .andExpect(jsonPath("$[0].type").value("CHECKOUT"))
                .andExpect(jsonPath("$[0].timestamp").value("2024-08-30T10:15:30Z"));
    }

    @Test
    void kitsOfGivenDayAreListed() throws Exception {
        when(kitRecordStore.recordsForDate(LocalDate.of(2024, 8, 29))).thenReturn(List.of(new KitRecord(
                "K100-08/29", "K100", "08/29", "G0G348025246001", null, null, null, null, null, null, null,
                "2024-08-29T16:00:00Z")));

        mockMvc.perform(get("/api/records/kits").param("date", "2024-08-29"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kitId").value("K100-08/29"))
                .andExpect(jsonPath("$[0].glasses").value("G0G348025246001"));
    }

    @Test
    void todaysInventoryIsListed() throws Exception {
        when(inventoryRecordStore.recordsForToday()).thenReturn(List.of(InventoryRecord.create("G0G4NU015166001",
                InventoryComponentType.BATTERY, ScanSource.BARCODE, clock)));

        mockMvc.perform(get("/api/records/inventory"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].device_id").value("G0G4NU015166001"))
                .andExpect(jsonPath("$[0].component_type").value("BATTERY"));
    }

    @Test
    void unknownFamilyIsNotFound() throws Exception {
        mockMvc.perform(get("/api/records/loans"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown record family: loans"));
    }

    @Test
    void historyAcceptsDashedActivityName() throws Exception {
        when(scanHistory.recent(ActivityType.KIT_BUNDLE)).thenReturn(List.of(
                ScanHistoryItem.of("K100", ScanSource.BARCODE, ActivityType.KIT_BUNDLE, clock)));

        mockMvc.perform(get("/api/history/kit-bundle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].value").value("K100"))
                .andExpect(jsonPath("$[0].scanSource").value("BARCODE"));
    }

    @Test
    void inventoryHistoryIsListed() throws Exception {
        when(scanHistory.recent(ActivityType.INVENTORY)).thenReturn(List.of(
                ScanHistoryItem.of("G0G4NU015166001", ScanSource.OCR, ActivityType.INVENTORY, clock)));

        mockMvc.perform(get("/api/history/inventory"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].activityType").value("INVENTORY"));
    }

    @Test
    void unknownActivityIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/history/loans"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }
}

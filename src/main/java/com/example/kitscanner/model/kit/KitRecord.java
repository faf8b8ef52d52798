package com.example.kitscanner.model.kit;

import com.example.kitscanner.model.RecordType;
import com.example.kitscanner.model.StoredRecord;
import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Finalized kit bundle. The kit id is the base kit code followed by the creation date,
 * e.g. {@code K123-08/30}.
 */
@Schema(description = "Saved kit bundle")
public record KitRecord(
        @Schema(example = "K100-08/30") String kitId,
        @Schema(example = "K100") String baseKitCode,
        @Schema(example = "08/30") String creationDate,
        String glasses,
        String controller,
        String battery01,
        String battery02,
        String battery03,
        String pads,
        String unused01,
        String unused02,
        @Schema(description = "ISO-8601 creation instant") String timestamp) implements StoredRecord {

    private static final DateTimeFormatter KIT_DATE = DateTimeFormatter.ofPattern("MM/dd");

    public static KitRecord from(KitAssemblyState state, Clock clock) {
        Objects.requireNonNull(state, "state");
        String kitId = generateKitId(state.baseKitCode(), LocalDate.now(clock));
        Map<SlotId, ScannedComponent> components = state.scannedComponents();
        return new KitRecord(
                kitId,
                state.baseKitCode(),
                extractCreationDate(kitId),
                identifier(components, SlotId.GLASSES),
                identifier(components, SlotId.CONTROLLER),
                identifier(components, SlotId.BATTERY_01),
                identifier(components, SlotId.BATTERY_02),
                identifier(components, SlotId.BATTERY_03),
                identifier(components, SlotId.PADS),
                identifier(components, SlotId.UNUSED_01),
                identifier(components, SlotId.UNUSED_02),
                clock.instant().toString());
    }

    public static String generateKitId(String baseKitCode, LocalDate date) {
        return baseKitCode + "-" + date.format(KIT_DATE);
    }

    /**
     * @return the text after the last {@code -}; the creation date for ids built by {@link #generateKitId}
     */
    public static String extractCreationDate(String kitId) {
        int index = kitId.lastIndexOf('-');
        return index < 0 ? "" : kitId.substring(index + 1);
    }

    /**
     * @return the text before the last {@code -}, or the whole id when it has none
     */
    public static String extractBaseKitCode(String kitId) {
        int index = kitId.lastIndexOf('-');
        return index < 0 ? kitId : kitId.substring(0, index);
    }

    @Override
    @JsonIgnore
    public RecordType type() {
        return RecordType.KIT_BUNDLE;
    }

    public Map<SlotId, String> components() {
        Map<SlotId, String> components = new LinkedHashMap<>();
        components.put(SlotId.GLASSES, glasses);
        components.put(SlotId.CONTROLLER, controller);
        components.put(SlotId.BATTERY_01, battery01);
        components.put(SlotId.BATTERY_02, battery02);
        components.put(SlotId.BATTERY_03, battery03);
        components.put(SlotId.PADS, pads);
        components.put(SlotId.UNUSED_01, unused01);
        components.put(SlotId.UNUSED_02, unused02);
        return components;
    }

    public int filledComponentCount() {
        return (int) components().values().stream().filter(Objects::nonNull).count();
    }

    @JsonIgnore
    public boolean isValid() {
        return filledComponentCount() > 0;
    }

    private static String identifier(Map<SlotId, ScannedComponent> components, SlotId slot) {
        ScannedComponent component = components.get(slot);
        return component == null ? null : component.rawIdentifier();
    }
}

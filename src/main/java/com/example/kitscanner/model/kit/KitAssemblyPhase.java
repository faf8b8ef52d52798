package com.example.kitscanner.model.kit;

public enum KitAssemblyPhase {
    AWAITING_KIT_CODE,
    ASSEMBLING_COMPONENTS,
    /** Medium-confidence detection shown to the operator for confirmation. */
    AWAITING_CONFIRMATION,
    /** Low-confidence or slotless detection; the operator picks a slot. */
    AWAITING_SLOT_SELECTION,
    AWAITING_CONFLICT_RESOLUTION
}

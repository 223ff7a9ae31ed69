package com.ai.clinic.exception;

public class DuplicateSlotException extends ClinicException {

    public DuplicateSlotException(Long doctorId, Long slotId) {
        super("DUPLICATE_SLOT", "Slot " + slotId + " already exists for doctor " + doctorId);
    }
}

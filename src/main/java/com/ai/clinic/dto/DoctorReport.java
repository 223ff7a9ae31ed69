package com.ai.clinic.dto;

public record DoctorReport(Long doctorId, String doctorName, int pendingBookedSlots, Long nextFreeSlotId) {
}

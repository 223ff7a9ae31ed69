package com.ai.clinic.dto;

import com.ai.clinic.entity.AppointmentSlot;

/**
 * Point-in-time copy of a slot. Status changes only go through the clinic service.
 */
public record SlotView(Long id, Long doctorId, String startTime, String endTime, AppointmentSlot.Status status) {

    public static SlotView of(AppointmentSlot slot) {
        return new SlotView(slot.getId(), slot.getDoctorId(), slot.getStartTime(), slot.getEndTime(), slot.getStatus());
    }
}

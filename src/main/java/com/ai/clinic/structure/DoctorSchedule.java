package com.ai.clinic.structure;

import com.ai.clinic.entity.AppointmentSlot;
import com.ai.clinic.entity.Doctor;
import com.ai.clinic.exception.DuplicateSlotException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Slot ledger for one doctor. Slots are scanned most-recently-added first,
 * so the last slot added is the first one booked.
 */
public class DoctorSchedule {

    private final Doctor doctor;
    private final List<AppointmentSlot> slots = new ArrayList<>();
    private final Map<Long, AppointmentSlot> slotIndex = new HashMap<>();

    public DoctorSchedule(Doctor doctor) {
        this.doctor = doctor;
    }

    public Doctor getDoctor() {
        return doctor;
    }

    public AppointmentSlot addSlot(Long slotId, String startTime, String endTime) {
        if (slotIndex.containsKey(slotId)) {
            throw new DuplicateSlotException(doctor.getId(), slotId);
        }
        AppointmentSlot slot = AppointmentSlot.builder()
                .id(slotId)
                .doctorId(doctor.getId())
                .startTime(startTime)
                .endTime(endTime)
                .status(AppointmentSlot.Status.FREE)
                .build();
        slots.add(slot);
        slotIndex.put(slotId, slot);
        return slot;
    }

    public Optional<AppointmentSlot> bookNextFree() {
        Optional<AppointmentSlot> free = nextFreeSlot();
        free.ifPresent(s -> s.setStatus(AppointmentSlot.Status.BOOKED));
        return free;
    }

    /**
     * BOOKED -> FREE. False when the slot is unknown or already free.
     */
    public boolean cancelSlot(Long slotId) {
        AppointmentSlot slot = slotIndex.get(slotId);
        if (slot == null || slot.isFree()) {
            return false;
        }
        slot.setStatus(AppointmentSlot.Status.FREE);
        return true;
    }

    /**
     * FREE -> BOOKED for a specific slot. False when the slot is unknown or already booked.
     */
    public boolean bookSlot(Long slotId) {
        AppointmentSlot slot = slotIndex.get(slotId);
        if (slot == null || !slot.isFree()) {
            return false;
        }
        slot.setStatus(AppointmentSlot.Status.BOOKED);
        return true;
    }

    public Optional<AppointmentSlot> findSlot(Long slotId) {
        return Optional.ofNullable(slotIndex.get(slotId));
    }

    public Optional<AppointmentSlot> nextFreeSlot() {
        for (int i = slots.size() - 1; i >= 0; i--) {
            if (slots.get(i).isFree()) {
                return Optional.of(slots.get(i));
            }
        }
        return Optional.empty();
    }

    public int pendingCount() {
        int booked = 0;
        for (AppointmentSlot slot : slots) {
            if (!slot.isFree()) booked++;
        }
        return booked;
    }

    /** Slots in scan order, newest first. */
    public List<AppointmentSlot> getSlots() {
        List<AppointmentSlot> ordered = new ArrayList<>(slots);
        Collections.reverse(ordered);
        return ordered;
    }
}

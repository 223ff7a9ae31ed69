package com.ai.clinic.service;

import com.ai.clinic.config.ClinicProperties;
import com.ai.clinic.dto.SlotView;
import com.ai.clinic.dto.UndoResult;
import com.ai.clinic.entity.AppointmentSlot;
import com.ai.clinic.entity.Doctor;
import com.ai.clinic.entity.Patient;
import com.ai.clinic.entity.Token;
import com.ai.clinic.exception.DuplicateDoctorException;
import com.ai.clinic.exception.InvalidActionException;
import com.ai.clinic.exception.NoCapacityException;
import com.ai.clinic.exception.NotFoundException;
import com.ai.clinic.structure.DoctorSchedule;
import com.ai.clinic.structure.TriageEntry;
import com.ai.clinic.structure.UndoAction;
import com.ai.clinic.structure.UndoRecord;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Booking, cancellation, triage, service and undo over the routine queue,
 * triage heap and slot ledgers. Each public call holds one lock for its whole
 * duration because every mutation spans more than one structure.
 */
@Service
public class ClinicService {

    private static final Logger log = LoggerFactory.getLogger(ClinicService.class);

    private final ClinicState state;
    private final ReentrantLock lock = new ReentrantLock();

    public ClinicService(ClinicProperties properties) {
        this.state = new ClinicState(properties.queueCapacity(), properties.firstTokenId());
        log.info("Clinic ready: routineQueueCapacity={} firstTokenId={}",
                properties.queueCapacity(), properties.firstTokenId());
    }

    // =========================================================
    // REGISTRATION
    // =========================================================
    public Patient registerPatient(Long id, String name, int age, int severity) {
        if (id == null) throw new IllegalArgumentException("Patient id is required");
        return locked(() -> {
            Patient patient = Patient.builder()
                    .id(id)
                    .name(StringUtils.defaultIfBlank(name, "Unknown"))
                    .age(age)
                    .severity(severity)
                    .build();
            // Re-registration replaces the record but keeps what the clinic already knew
            state.patients().findById(id).ifPresent(existing -> patient.getHistory().addAll(existing.getHistory()));
            state.patients().save(patient);
            log.info("Registered patient {} ({})", id, patient.getName());
            return detached(patient);
        });
    }

    public Optional<Patient> getPatient(Long id) {
        return locked(() -> state.patients().findById(id).map(ClinicService::detached));
    }

    public boolean removePatient(Long id) {
        return locked(() -> {
            boolean removed = state.patients().deleteById(id);
            if (removed) log.info("Removed patient {}", id);
            return removed;
        });
    }

    public Doctor addDoctor(Long id, String name, String specialization) {
        if (id == null) throw new IllegalArgumentException("Doctor id is required");
        return locked(() -> {
            if (state.doctors().existsById(id)) {
                throw new DuplicateDoctorException(id);
            }
            Doctor doctor = state.doctors().save(Doctor.builder()
                    .id(id)
                    .name(name)
                    .specialization(specialization)
                    .build());
            state.putSchedule(new DoctorSchedule(doctor));
            log.info("Added doctor {} ({}, {})", id, name, specialization);
            return doctor;
        });
    }

    public Optional<Doctor> getDoctor(Long id) {
        return locked(() -> state.doctors().findById(id));
    }

    public List<Doctor> listDoctors() {
        return locked(() -> state.doctors().findAll());
    }

    public SlotView addSlot(Long doctorId, Long slotId, String startTime, String endTime) {
        return locked(() -> {
            DoctorSchedule schedule = requireSchedule(doctorId);
            AppointmentSlot slot = schedule.addSlot(slotId, startTime, endTime);
            log.info("Added slot {} {}-{} for doctor {}", slotId, startTime, endTime, doctorId);
            return SlotView.of(slot);
        });
    }

    public List<SlotView> getSlots(Long doctorId) {
        return locked(() -> requireSchedule(doctorId).getSlots().stream()
                .map(SlotView::of)
                .toList());
    }

    // =========================================================
    // ROUTINE BOOKING
    // =========================================================
    public Token bookRoutine(Long patientId, Long doctorId) {
        return locked(() -> {
            if (!state.patients().existsById(patientId)) {
                throw NotFoundException.patient(patientId);
            }
            DoctorSchedule schedule = requireSchedule(doctorId);

            AppointmentSlot slot = schedule.bookNextFree().orElse(null);
            if (slot == null) {
                log.warn("No free slot for doctor {} (patient {})", doctorId, patientId);
                throw new NoCapacityException(NoCapacityException.Reason.NO_FREE_SLOT,
                        "No free slot for doctor " + doctorId);
            }

            Token token = Token.builder()
                    .tokenId(state.issueTokenId())
                    .patientId(patientId)
                    .doctorId(doctorId)
                    .slotId(slot.getId())
                    .type(Token.Type.ROUTINE)
                    .build();

            if (!state.routineQueue().enqueue(token)) {
                schedule.cancelSlot(slot.getId());
                log.warn("Routine queue full ({}); released slot {} of doctor {}",
                        state.routineQueue().capacity(), slot.getId(), doctorId);
                throw new NoCapacityException(NoCapacityException.Reason.QUEUE_FULL,
                        "Routine queue is full");
            }

            state.undoLog().push(UndoRecord.of(UndoAction.BOOK, token));
            log.info("Booked token {}: patient={} doctor={} slot={}",
                    token.getTokenId(), patientId, doctorId, slot.getId());
            return token;
        });
    }

    /**
     * Removes a waiting routine token and frees its slot.
     *
     * @return false when the token is not in the routine queue
     */
    public boolean cancelBooking(long tokenId) {
        return locked(() -> {
            Token removed = state.routineQueue().removeById(tokenId).orElse(null);
            if (removed == null) {
                log.info("Cancel ignored: token {} is not waiting in the routine queue", tokenId);
                return false;
            }
            releaseSlot(removed);
            state.undoLog().push(UndoRecord.of(UndoAction.CANCEL, removed));
            log.info("Cancelled token {} (slot {} freed)", tokenId, removed.getSlotId());
            return true;
        });
    }

    // =========================================================
    // TRIAGE
    // =========================================================
    public Token triageInsert(Long patientId, int severity, Long doctorId) {
        return locked(() -> {
            Token token = Token.builder()
                    .tokenId(state.issueTokenId())
                    .patientId(patientId)
                    .doctorId(doctorId != null ? doctorId : Token.UNASSIGNED_DOCTOR)
                    .type(Token.Type.EMERGENCY)
                    .build();
            TriageEntry entry = state.triage().insert(token, severity);
            state.undoLog().push(UndoRecord.triage(UndoAction.TRIAGE_INSERT, entry));
            log.info("Triage token {}: patient={} severity={} doctor={}",
                    token.getTokenId(), patientId, severity, token.getDoctorId());
            return token;
        });
    }

    // =========================================================
    // SERVICE
    // =========================================================

    /**
     * Emergencies first; the routine queue is only served when the triage heap is empty.
     */
    public Optional<Token> serveNext() {
        return locked(() -> {
            Optional<TriageEntry> emergency = state.triage().extractMin();
            if (emergency.isPresent()) {
                TriageEntry entry = emergency.get();
                state.served().add(entry.token());
                state.undoLog().push(UndoRecord.triage(UndoAction.SERVE_TRIAGE, entry));
                log.info("Served triage token {} (severity {})", entry.token().getTokenId(), entry.severity());
                return Optional.of(entry.token());
            }

            Optional<Token> routine = state.routineQueue().dequeue();
            routine.ifPresent(token -> {
                state.served().add(token);
                state.undoLog().push(UndoRecord.of(UndoAction.SERVE_ROUTINE, token));
                log.info("Served routine token {} (slot {})", token.getTokenId(), token.getSlotId());
            });
            return routine;
        });
    }

    public Optional<Token> peekNext() {
        return locked(() -> {
            Optional<Token> emergency = state.triage().peek();
            return emergency.isPresent() ? emergency : state.routineQueue().peek();
        });
    }

    // =========================================================
    // UNDO
    // =========================================================
    public UndoResult undoLast() {
        return locked(() -> {
            Optional<UndoRecord> popped = state.undoLog().pop();
            if (popped.isEmpty()) {
                return UndoResult.nothingToUndo();
            }
            UndoRecord record = popped.get();
            UndoResult result = invert(record);
            log.info("Undo {}: {}", record.action(), result.message());
            return result;
        });
    }

    private UndoResult invert(UndoRecord record) {
        Token token = record.token();
        long tokenId = token.getTokenId();
        switch (record.action()) {
            case BOOK: {
                boolean removed = state.routineQueue().removeById(tokenId).isPresent();
                if (!removed) {
                    return UndoResult.of(record.action(), tokenId, "Could not find token to undo");
                }
                releaseSlot(token);
                return UndoResult.of(record.action(), tokenId, "Undid booking token " + tokenId);
            }
            case CANCEL: {
                if (!state.routineQueue().enqueue(token)) {
                    state.undoLog().push(record);
                    throw new NoCapacityException(NoCapacityException.Reason.QUEUE_FULL,
                            "Routine queue is full; cannot restore token " + tokenId);
                }
                rebookSlot(token);
                return UndoResult.of(record.action(), tokenId, "Undid cancellation: rebooked token " + tokenId);
            }
            case SERVE_ROUTINE: {
                if (!state.routineQueue().enqueueFront(token)) {
                    state.undoLog().push(record);
                    throw new NoCapacityException(NoCapacityException.Reason.QUEUE_FULL,
                            "Routine queue is full; cannot restore token " + tokenId);
                }
                removeServed(tokenId);
                return UndoResult.of(record.action(), tokenId, "Undid serving of routine token " + tokenId);
            }
            case SERVE_TRIAGE: {
                state.triage().restore(record.triageEntry());
                removeServed(tokenId);
                return UndoResult.of(record.action(), tokenId, "Undid serving of triage token " + tokenId);
            }
            case TRIAGE_INSERT: {
                boolean removed = state.triage().removeById(tokenId).isPresent();
                return UndoResult.of(record.action(), tokenId, removed
                        ? "Undid triage insert " + tokenId
                        : "Could not find triage token to undo");
            }
            default:
                log.error("Unrecognised undo record {} for token {}", record.action(), tokenId);
                throw new InvalidActionException("Unknown action to undo: " + record.action());
        }
    }

    // =========================================================
    // INTERNALS
    // =========================================================

    /** Runs a read-only view over the state under the same lock as mutations. */
    <T> T read(Function<ClinicState, T> view) {
        return locked(() -> view.apply(state));
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private DoctorSchedule requireSchedule(Long doctorId) {
        return state.schedule(doctorId).orElseThrow(() -> NotFoundException.doctor(doctorId));
    }

    /** Callers get a copy; the registry's record is only changed by registration. */
    private static Patient detached(Patient patient) {
        return patient.toBuilder()
                .history(new ArrayList<>(patient.getHistory()))
                .build();
    }

    private void releaseSlot(Token token) {
        if (!token.hasSlot()) return;
        state.schedule(token.getDoctorId()).ifPresent(s -> s.cancelSlot(token.getSlotId()));
    }

    private void rebookSlot(Token token) {
        if (!token.hasSlot()) return;
        state.schedule(token.getDoctorId()).ifPresent(s -> s.bookSlot(token.getSlotId()));
    }

    private void removeServed(long tokenId) {
        List<Token> served = state.served();
        for (int i = served.size() - 1; i >= 0; i--) {
            if (served.get(i).getTokenId() == tokenId) {
                served.remove(i);
                return;
            }
        }
    }
}

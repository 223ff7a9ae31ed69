package com.ai.clinic.service;

import com.ai.clinic.entity.Token;
import com.ai.clinic.repository.DoctorRepository;
import com.ai.clinic.repository.PatientRepository;
import com.ai.clinic.structure.DoctorSchedule;
import com.ai.clinic.structure.RoutineQueue;
import com.ai.clinic.structure.TriageHeap;
import com.ai.clinic.structure.UndoLog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the clinic knows, held in one place. Only {@link ClinicService}
 * mutates it, and only while holding its lock.
 */
public class ClinicState {

    private final PatientRepository patients = new PatientRepository();
    private final DoctorRepository doctors = new DoctorRepository();
    private final Map<Long, DoctorSchedule> schedules = new LinkedHashMap<>();
    private final RoutineQueue routineQueue;
    private final TriageHeap triage = new TriageHeap();
    private final UndoLog undoLog = new UndoLog();
    private final List<Token> served = new ArrayList<>();
    private long nextTokenId;

    public ClinicState(int queueCapacity, long firstTokenId) {
        this.routineQueue = new RoutineQueue(queueCapacity);
        this.nextTokenId = firstTokenId;
    }

    long issueTokenId() {
        return nextTokenId++;
    }

    PatientRepository patients() { return patients; }
    DoctorRepository doctors() { return doctors; }
    RoutineQueue routineQueue() { return routineQueue; }
    TriageHeap triage() { return triage; }
    UndoLog undoLog() { return undoLog; }

    Optional<DoctorSchedule> schedule(Long doctorId) {
        return Optional.ofNullable(schedules.get(doctorId));
    }

    void putSchedule(DoctorSchedule schedule) {
        schedules.put(schedule.getDoctor().getId(), schedule);
    }

    Iterable<DoctorSchedule> schedules() {
        return schedules.values();
    }

    List<Token> served() {
        return served;
    }
}

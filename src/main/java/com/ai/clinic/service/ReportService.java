package com.ai.clinic.service;

import com.ai.clinic.dto.DoctorReport;
import com.ai.clinic.dto.PatientVisitCount;
import com.ai.clinic.dto.ServedPendingReport;
import com.ai.clinic.dto.TriageTokenView;
import com.ai.clinic.entity.AppointmentSlot;
import com.ai.clinic.entity.Token;
import com.ai.clinic.structure.DoctorSchedule;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views over the clinic state. Nothing here mutates.
 */
@Service
public class ReportService {

    private final ClinicService clinicService;

    public ReportService(ClinicService clinicService) {
        this.clinicService = clinicService;
    }

    /** One row per doctor, in registration order. */
    public List<DoctorReport> reportPerDoctor() {
        return clinicService.read(state -> {
            List<DoctorReport> rows = new ArrayList<>();
            for (DoctorSchedule schedule : state.schedules()) {
                rows.add(new DoctorReport(
                        schedule.getDoctor().getId(),
                        schedule.getDoctor().getName(),
                        schedule.pendingCount(),
                        schedule.nextFreeSlot().map(AppointmentSlot::getId).orElse(null)));
            }
            return rows;
        });
    }

    public ServedPendingReport reportServedVsPending() {
        return clinicService.read(state -> new ServedPendingReport(
                state.served().size(),
                state.routineQueue().size() + state.triage().size()));
    }

    /**
     * Most frequently served patients. Equal counts keep the order in which the
     * patient first appears in the served history.
     */
    public List<PatientVisitCount> topKFrequentPatients(int k) {
        if (k <= 0) return List.of();
        return clinicService.read(state -> {
            Map<Long, Integer> counts = new LinkedHashMap<>();
            for (Token t : state.served()) {
                counts.merge(t.getPatientId(), 1, Integer::sum);
            }
            return counts.entrySet().stream()
                    .sorted(Map.Entry.<Long, Integer>comparingByValue(Comparator.reverseOrder()))
                    .limit(k)
                    .map(e -> new PatientVisitCount(e.getKey(), e.getValue()))
                    .toList();
        });
    }

    public List<Token> routineQueueSnapshot() {
        return clinicService.read(state -> state.routineQueue().snapshot());
    }

    /** Waiting emergencies in the order they will be served. */
    public List<TriageTokenView> triageSnapshot() {
        return clinicService.read(state -> state.triage().snapshot().stream()
                .map(e -> new TriageTokenView(e.token(), e.severity()))
                .toList());
    }

    public List<Token> servedHistory() {
        return clinicService.read(state -> List.copyOf(state.served()));
    }
}

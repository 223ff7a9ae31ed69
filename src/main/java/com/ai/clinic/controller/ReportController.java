package com.ai.clinic.controller;

import com.ai.clinic.dto.DoctorReport;
import com.ai.clinic.dto.PatientVisitCount;
import com.ai.clinic.dto.ServedPendingReport;
import com.ai.clinic.dto.TriageTokenView;
import com.ai.clinic.entity.Token;
import com.ai.clinic.service.ReportService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/clinic")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/reports/doctors")
    public List<DoctorReport> perDoctor() {
        return reportService.reportPerDoctor();
    }

    @GetMapping("/reports/served-vs-pending")
    public ServedPendingReport servedVsPending() {
        return reportService.reportServedVsPending();
    }

    @GetMapping("/reports/top-patients")
    public List<PatientVisitCount> topPatients(@RequestParam(defaultValue = "3") int k) {
        return reportService.topKFrequentPatients(k);
    }

    @GetMapping("/queue")
    public List<Token> routineQueue() {
        return reportService.routineQueueSnapshot();
    }

    @GetMapping("/triage")
    public List<TriageTokenView> triageQueue() {
        return reportService.triageSnapshot();
    }

    @GetMapping("/served")
    public List<Token> served() {
        return reportService.servedHistory();
    }
}

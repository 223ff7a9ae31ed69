package com.ai.clinic.controller;

import com.ai.clinic.dto.AddDoctorRequest;
import com.ai.clinic.dto.AddSlotRequest;
import com.ai.clinic.dto.BookingRequest;
import com.ai.clinic.dto.RegisterPatientRequest;
import com.ai.clinic.dto.SlotView;
import com.ai.clinic.dto.TriageRequest;
import com.ai.clinic.dto.UndoResult;
import com.ai.clinic.entity.Doctor;
import com.ai.clinic.entity.Patient;
import com.ai.clinic.entity.Token;
import com.ai.clinic.exception.NotFoundException;
import com.ai.clinic.service.ClinicService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/clinic")
public class ClinicController {

    private static final Logger log = LoggerFactory.getLogger(ClinicController.class);

    private final ClinicService clinicService;

    public ClinicController(ClinicService clinicService) {
        this.clinicService = clinicService;
    }

    @PostMapping("/patients")
    @ResponseStatus(HttpStatus.CREATED)
    public Patient registerPatient(@Valid @RequestBody RegisterPatientRequest request) {
        return clinicService.registerPatient(request.getId(), request.getName(), request.getAge(), request.getSeverity());
    }

    @GetMapping("/patients/{id}")
    public Patient getPatient(@PathVariable Long id) {
        return clinicService.getPatient(id).orElseThrow(() -> NotFoundException.patient(id));
    }

    @DeleteMapping("/patients/{id}")
    public ResponseEntity<Void> removePatient(@PathVariable Long id) {
        if (!clinicService.removePatient(id)) {
            throw NotFoundException.patient(id);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/doctors")
    @ResponseStatus(HttpStatus.CREATED)
    public Doctor addDoctor(@Valid @RequestBody AddDoctorRequest request) {
        return clinicService.addDoctor(request.getId(), request.getName(), request.getSpecialization());
    }

    @GetMapping("/doctors")
    public List<Doctor> listDoctors() {
        return clinicService.listDoctors();
    }

    @GetMapping("/doctors/{id}")
    public Doctor getDoctor(@PathVariable Long id) {
        return clinicService.getDoctor(id).orElseThrow(() -> NotFoundException.doctor(id));
    }

    @PostMapping("/doctors/{doctorId}/slots")
    @ResponseStatus(HttpStatus.CREATED)
    public SlotView addSlot(@PathVariable Long doctorId, @Valid @RequestBody AddSlotRequest request) {
        return clinicService.addSlot(doctorId, request.getSlotId(), request.getStartTime(), request.getEndTime());
    }

    @GetMapping("/doctors/{doctorId}/slots")
    public List<SlotView> getSlots(@PathVariable Long doctorId) {
        return clinicService.getSlots(doctorId);
    }

    @PostMapping("/bookings")
    @ResponseStatus(HttpStatus.CREATED)
    public Token book(@Valid @RequestBody BookingRequest request) {
        return clinicService.bookRoutine(request.getPatientId(), request.getDoctorId());
    }

    @DeleteMapping("/bookings/{tokenId}")
    public Map<String, Boolean> cancel(@PathVariable long tokenId) {
        return Map.of("cancelled", clinicService.cancelBooking(tokenId));
    }

    @PostMapping("/triage")
    @ResponseStatus(HttpStatus.CREATED)
    public Token triage(@Valid @RequestBody TriageRequest request) {
        return clinicService.triageInsert(request.getPatientId(), request.getSeverity(), request.getDoctorId());
    }

    @PostMapping("/serve")
    public ResponseEntity<Token> serveNext() {
        return clinicService.serveNext()
                .map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.info("Serve requested with nobody waiting");
                    return ResponseEntity.noContent().build();
                });
    }

    @GetMapping("/next")
    public ResponseEntity<Token> peekNext() {
        return clinicService.peekNext()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/undo")
    public UndoResult undo() {
        return clinicService.undoLast();
    }
}

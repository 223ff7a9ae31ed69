package com.ai.clinic.repository;

import com.ai.clinic.entity.Patient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory patient registry keyed by patient id.
 */
public class PatientRepository {

    private final Map<Long, Patient> patients = new LinkedHashMap<>();

    public Patient save(Patient patient) {
        patients.put(patient.getId(), patient);
        return patient;
    }

    public Optional<Patient> findById(Long id) {
        return Optional.ofNullable(patients.get(id));
    }

    public boolean existsById(Long id) {
        return patients.containsKey(id);
    }

    public boolean deleteById(Long id) {
        return patients.remove(id) != null;
    }
}

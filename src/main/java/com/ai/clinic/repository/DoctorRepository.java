package com.ai.clinic.repository;

import com.ai.clinic.entity.Doctor;

import java.util.List;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory doctor registry. Iteration follows registration order.
 */
public class DoctorRepository {

    private final Map<Long, Doctor> doctors = new LinkedHashMap<>();

    public Doctor save(Doctor doctor) {
        doctors.put(doctor.getId(), doctor);
        return doctor;
    }

    public Optional<Doctor> findById(Long id) {
        return Optional.ofNullable(doctors.get(id));
    }

    public boolean existsById(Long id) {
        return doctors.containsKey(id);
    }

    public List<Doctor> findAll() {
        return List.copyOf(doctors.values());
    }
}

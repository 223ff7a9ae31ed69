package com.ai.clinic.exception;

public class DuplicateDoctorException extends ClinicException {

    public DuplicateDoctorException(Long doctorId) {
        super("DUPLICATE_DOCTOR", "Doctor already registered: " + doctorId);
    }
}

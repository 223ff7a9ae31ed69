package com.ai.clinic.exception;

/**
 * A required patient, doctor, slot or token does not exist.
 */
public class NotFoundException extends ClinicException {

    private final String entity;

    public NotFoundException(String entity, Object id) {
        super(entity.toUpperCase() + "_NOT_FOUND", entity + " not found: " + id);
        this.entity = entity;
    }

    public static NotFoundException patient(Long id) {
        return new NotFoundException("Patient", id);
    }

    public static NotFoundException doctor(Long id) {
        return new NotFoundException("Doctor", id);
    }

    public String getEntity() { return entity; }
}

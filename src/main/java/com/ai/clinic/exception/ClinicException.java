package com.ai.clinic.exception;

public abstract class ClinicException extends RuntimeException {

    private final String errorCode;

    protected ClinicException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}

package com.ai.clinic.exception;

public class InvalidActionException extends ClinicException {

    public InvalidActionException(String message) {
        super("INVALID_ACTION", message);
    }
}

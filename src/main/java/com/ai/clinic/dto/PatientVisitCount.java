package com.ai.clinic.dto;

public record PatientVisitCount(Long patientId, int count) {
}

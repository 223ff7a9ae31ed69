package com.ai.clinic.dto;

/**
 * {@code pending} counts tokens waiting in the routine queue plus the triage heap.
 */
public record ServedPendingReport(int served, int pending) {
}

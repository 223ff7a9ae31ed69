package com.ai.clinic.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Lower severity is more urgent. {@code doctorId} may be left out.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TriageRequest {

    @NotNull
    private Long patientId;

    @NotNull
    private Integer severity;

    private Long doctorId;
}

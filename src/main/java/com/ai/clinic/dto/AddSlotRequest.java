package com.ai.clinic.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AddSlotRequest {

    @NotNull
    private Long slotId;

    @NotBlank
    private String startTime;

    @NotBlank
    private String endTime;
}

package com.ai.clinic.entity;

import lombok.*;

@Getter
@ToString
@AllArgsConstructor
@Builder
public class Doctor {

    private final Long id;

    private final String name;

    private final String specialization;
}

package com.ai.clinic.entity;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Patient {

    private Long id;

    private String name;

    private int age;

    /** Severity hint given at registration; triage uses the severity passed with each insert. */
    private int severity;

    @Builder.Default
    private List<String> history = new ArrayList<>();
}

package com.ai.clinic.entity;

import lombok.*;

/**
 * A bookable interval on one doctor's schedule. Start and end are kept as the
 * caller supplied them; no overlap checking is done.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentSlot {

    public enum Status { FREE, BOOKED }

    private Long id;

    private Long doctorId;

    private String startTime;

    private String endTime;

    @Builder.Default
    private Status status = Status.FREE;

    public boolean isFree() {
        return status == Status.FREE;
    }
}

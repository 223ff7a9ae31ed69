package com.ai.clinic.entity;

import lombok.*;

import java.time.Instant;

/**
 * One visit request. Fields never change after issue; the token only moves
 * between the routine queue, the triage heap and the served list.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "tokenId")
@AllArgsConstructor
@Builder
public class Token {

    public enum Type { ROUTINE, EMERGENCY }

    public static final long UNASSIGNED_DOCTOR = -1L;

    private final long tokenId;

    private final Long patientId;

    private final long doctorId;

    /** Only routine bookings carry a slot. */
    private final Long slotId;

    private final Type type;

    @Builder.Default
    private final Instant createdAt = Instant.now();

    public boolean hasSlot() {
        return slotId != null;
    }
}

package com.ai.clinic.structure;

import com.ai.clinic.entity.Token;

/**
 * One heap slot: the token together with the severity and the insertion
 * sequence it was ordered by.
 */
public record TriageEntry(int severity, long sequence, Token token) {
}

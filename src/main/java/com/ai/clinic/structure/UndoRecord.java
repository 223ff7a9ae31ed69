package com.ai.clinic.structure;

import com.ai.clinic.entity.Token;

/**
 * One logged mutation. Triage actions also carry the heap entry so the
 * severity and tie-break sequence can be put back exactly.
 */
public record UndoRecord(UndoAction action, Token token, TriageEntry triageEntry) {

    public static UndoRecord of(UndoAction action, Token token) {
        return new UndoRecord(action, token, null);
    }

    public static UndoRecord triage(UndoAction action, TriageEntry entry) {
        return new UndoRecord(action, entry.token(), entry);
    }
}

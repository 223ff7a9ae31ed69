package com.ai.clinic.structure;

public enum UndoAction {
    BOOK,
    CANCEL,
    SERVE_ROUTINE,
    SERVE_TRIAGE,
    TRIAGE_INSERT
}

package com.ai.clinic.dto;

import com.ai.clinic.structure.UndoAction;

/**
 * Outcome of one undo call. {@code action} and {@code tokenId} are null when the log was empty.
 */
public record UndoResult(UndoAction action, Long tokenId, String message) {

    public static final String NOTHING_TO_UNDO = "Nothing to undo";

    public static UndoResult of(UndoAction action, long tokenId, String message) {
        return new UndoResult(action, tokenId, message);
    }

    public static UndoResult nothingToUndo() {
        return new UndoResult(null, null, NOTHING_TO_UNDO);
    }

    public boolean applied() {
        return action != null;
    }
}

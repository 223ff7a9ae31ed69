package com.ai.clinic.dto;

import com.ai.clinic.entity.Token;

public record TriageTokenView(Token token, int severity) {
}

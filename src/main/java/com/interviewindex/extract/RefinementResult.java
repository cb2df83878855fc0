package com.interviewindex.extract;

import java.util.List;

public record RefinementResult(List<String> questions, int inputTokens, int outputTokens) {

    public RefinementResult {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}

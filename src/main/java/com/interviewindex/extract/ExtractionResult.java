package com.interviewindex.extract;

import java.util.List;

/**
 * @param candidateCount Stage 1 candidates across all sources
 * @param degraded       true when at least one refinement batch fell back to heuristics
 */
public record ExtractionResult(List<ExtractedQuestion> questions, int candidateCount, boolean degraded) {

    public ExtractionResult {
        questions = List.copyOf(questions);
    }
}

package com.interviewindex.retrieval;

import com.interviewindex.index.QuestionRecord;

/**
 * Why a query did or did not match. {@code closest} and {@code closestScore} are set whenever
 * the subject has at least one record.
 */
public record NoMatchExplanation(
        Reason reason,
        String message,
        QuestionRecord closest,
        Float closestScore,
        double threshold) {

    public enum Reason {
        NO_INDEX,
        EMPTY_INDEX,
        BELOW_THRESHOLD,
        MATCHED
    }
}

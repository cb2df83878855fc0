package com.interviewindex.index;

public record ScoredRecord(QuestionRecord record, float score) {
}

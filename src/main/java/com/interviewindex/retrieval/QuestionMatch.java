package com.interviewindex.retrieval;

import com.interviewindex.index.QuestionRecord;

public record QuestionMatch(QuestionRecord record, float score) {
}

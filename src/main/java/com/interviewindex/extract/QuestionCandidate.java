package com.interviewindex.extract;

import com.interviewindex.source.InterviewSource;

public record QuestionCandidate(String text, InterviewSource source, Double mediaTimestampSeconds) {
}

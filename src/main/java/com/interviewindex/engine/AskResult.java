package com.interviewindex.engine;

import java.util.List;

import com.interviewindex.ingest.IngestionReport;
import com.interviewindex.policy.Decision;
import com.interviewindex.retrieval.QuestionMatch;

/**
 * @param ingestion the run {@code decision} triggered, or {@code null} when it was RETRIEVE
 */
public record AskResult(Decision decision, IngestionReport ingestion, List<QuestionMatch> matches) {
}

package com.interviewindex.retrieval;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.interviewindex.index.ScoredRecord;
import com.interviewindex.index.SubjectIndex;
import com.interviewindex.ingest.EmbeddingService;

/**
 * Threshold-gated similarity search over one subject's partition.
 *
 * <p>The index is over-fetched by {@code overFetchFactor * topK}, capped at
 * {@link Integer#MAX_VALUE}, hits under the threshold are
 * dropped, and what is left is cut to {@code topK}. Fewer than {@code topK} results, including
 * none, is a normal answer; results are never padded.
 */
public class RetrievalService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final EmbeddingService embeddingService;
    private final int overFetchFactor;

    public RetrievalService(EmbeddingService embeddingService, int overFetchFactor) {
        if (overFetchFactor < 1) {
            throw new IllegalArgumentException("overFetchFactor must be at least 1");
        }
        this.embeddingService = embeddingService;
        this.overFetchFactor = overFetchFactor;
    }

    public List<QuestionMatch> retrieve(SubjectIndex index, String query, int topK, double threshold) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        if (index == null || index.count() == 0) {
            return List.of();
        }
        float[] queryVector = embedQuery(query, index.dimension());
        List<QuestionMatch> matches = index.search(queryVector, overFetchCount(topK)).stream()
                .filter(hit -> hit.score() >= threshold)
                .limit(topK)
                .map(hit -> new QuestionMatch(hit.record(), hit.score()))
                .toList();
        log.debug("retrieval.completed subject={} topK={} threshold={} matches={}",
                index.subjectId(), topK, threshold, matches.size());
        return matches;
    }

    int overFetchCount(int topK) {
        return (int) Math.min(Integer.MAX_VALUE, (long) overFetchFactor * topK);
    }

    public NoMatchExplanation explain(SubjectIndex index, String query, double threshold) {
        if (index == null) {
            return new NoMatchExplanation(NoMatchExplanation.Reason.NO_INDEX,
                    "subject has never been indexed", null, null, threshold);
        }
        if (index.count() == 0) {
            return new NoMatchExplanation(NoMatchExplanation.Reason.EMPTY_INDEX,
                    "subject is indexed but no questions were found in its sources", null, null, threshold);
        }
        List<ScoredRecord> best = index.search(embedQuery(query, index.dimension()), 1);
        if (best.isEmpty()) {
            return new NoMatchExplanation(NoMatchExplanation.Reason.EMPTY_INDEX,
                    "subject index returned no candidates", null, null, threshold);
        }
        ScoredRecord closest = best.get(0);
        if (closest.score() < threshold) {
            return new NoMatchExplanation(NoMatchExplanation.Reason.BELOW_THRESHOLD,
                    "closest question scored %.3f, below threshold %.2f".formatted(closest.score(), threshold),
                    closest.record(), closest.score(), threshold);
        }
        return new NoMatchExplanation(NoMatchExplanation.Reason.MATCHED,
                "closest question scored %.3f".formatted(closest.score()),
                closest.record(), closest.score(), threshold);
    }

    private float[] embedQuery(String query, int expectedDimension) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        float[] vector;
        try {
            vector = embeddingService.embed(query);
        } catch (RuntimeException e) {
            throw new QueryEmbeddingException("Failed to embed query: " + e.getMessage(), e);
        }
        if (vector == null || vector.length != expectedDimension) {
            throw new QueryEmbeddingException("Query embedding has dimension "
                    + (vector == null ? 0 : vector.length) + ", index expects " + expectedDimension);
        }
        return vector;
    }
}

package com.interviewindex.extract;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.interviewindex.index.QuestionSource;
import com.interviewindex.ingest.EmbeddingService;
import com.interviewindex.source.SourceText;

/**
 * Turns raw source text into questions: Stage 1 heuristics, optional Stage 2 refinement in
 * fixed-size batches per source, then optional run-wide deduplication.
 *
 * <p>A refinement batch that fails, or that returns more strings than it was given, falls
 * back to its Stage 1 candidates and marks the run as degraded. The rest of the run is
 * unaffected.
 */
public class ExtractionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final HeuristicQuestionExtractor heuristics;
    private final QuestionRefiner refiner;
    private final int batchSize;
    private final RefinementUsageSink usageSink;
    private final DedupPolicy dedupPolicy;
    private final QuestionDeduplicator deduplicator;
    private final Clock clock;

    /**
     * @param refiner Stage 2 collaborator, or {@code null} to run heuristics only
     */
    public ExtractionPipeline(
            HeuristicQuestionExtractor heuristics,
            QuestionRefiner refiner,
            int batchSize,
            RefinementUsageSink usageSink,
            DedupPolicy dedupPolicy,
            EmbeddingService embeddingService,
            Clock clock) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.heuristics = heuristics;
        this.refiner = refiner;
        this.batchSize = batchSize;
        this.usageSink = usageSink == null ? RefinementUsageSink.NONE : usageSink;
        this.dedupPolicy = dedupPolicy;
        this.deduplicator = dedupPolicy.enabled()
                ? new QuestionDeduplicator(embeddingService, dedupPolicy.similarityThreshold())
                : null;
        this.clock = clock;
    }

    public DedupPolicy dedupPolicy() {
        return dedupPolicy;
    }

    public boolean refinementEnabled() {
        return refiner != null;
    }

    public ExtractionResult run(String subject, List<SourceText> sourceTexts) {
        List<ExtractedQuestion> questions = new ArrayList<>();
        int candidateCount = 0;
        boolean degraded = false;

        for (SourceText sourceText : sourceTexts) {
            List<QuestionCandidate> candidates = heuristics.extract(sourceText);
            candidateCount += candidates.size();
            log.debug("extraction.stage1 subject={} source={} candidates={}",
                    subject, sourceText.source().url(), candidates.size());
            if (refiner == null) {
                questions.addAll(asQuestions(candidates));
                continue;
            }
            for (int start = 0; start < candidates.size(); start += batchSize) {
                List<QuestionCandidate> batch = candidates.subList(start, Math.min(candidates.size(), start + batchSize));
                BatchOutcome outcome = refineBatch(subject, sourceText.source().url(), batch);
                degraded |= outcome.degraded();
                questions.addAll(outcome.questions());
            }
        }

        int beforeDedup = questions.size();
        if (deduplicator != null) {
            questions = deduplicator.merge(questions);
        }
        log.info("extraction.completed subject={} sources={} candidates={} questions={} dedup={} merged={} degraded={}",
                subject, sourceTexts.size(), candidateCount, questions.size(), dedupPolicy.enabled(),
                beforeDedup - questions.size(), degraded);
        return new ExtractionResult(questions, candidateCount, degraded);
    }

    private BatchOutcome refineBatch(String subject, String sourceUrl, List<QuestionCandidate> batch) {
        List<String> texts = batch.stream().map(QuestionCandidate::text).toList();
        RefinementResult result;
        try {
            result = refiner.refine(texts);
        } catch (RefinementException | RuntimeException e) {
            log.warn("refinement.fallback subject={} source={} batch={} reason={}",
                    subject, sourceUrl, batch.size(), e.getMessage());
            usageSink.record(usage(subject, sourceUrl, batch.size(), 0, 0, 0, "FALLBACK"));
            return new BatchOutcome(asQuestions(batch), true);
        }

        if (result.questions().size() > batch.size()) {
            log.warn("refinement.rejected subject={} source={} batch={} returned={}",
                    subject, sourceUrl, batch.size(), result.questions().size());
            usageSink.record(usage(subject, sourceUrl, batch.size(), result.questions().size(),
                    result.inputTokens(), result.outputTokens(), "REJECTED"));
            return new BatchOutcome(asQuestions(batch), true);
        }

        List<ExtractedQuestion> refined = new ArrayList<>();
        for (String question : result.questions()) {
            if (question == null || question.isBlank()) {
                continue;
            }
            String text = question.strip();
            QuestionCandidate origin = closestCandidate(text, batch);
            refined.add(new ExtractedQuestion(text,
                    List.of(QuestionSource.of(origin.source(), origin.mediaTimestampSeconds()))));
        }
        usageSink.record(usage(subject, sourceUrl, batch.size(), refined.size(),
                result.inputTokens(), result.outputTokens(), "REFINED"));
        return new BatchOutcome(refined, false);
    }

    /**
     * The batch member a refined string came from: an exact (case-insensitive) match, else
     * the member sharing the most words, earliest on ties.
     */
    static QuestionCandidate closestCandidate(String refined, List<QuestionCandidate> batch) {
        for (QuestionCandidate candidate : batch) {
            if (candidate.text().strip().equalsIgnoreCase(refined)) {
                return candidate;
            }
        }
        Set<String> refinedWords = words(refined);
        QuestionCandidate best = batch.get(0);
        double bestOverlap = -1d;
        for (QuestionCandidate candidate : batch) {
            Set<String> candidateWords = words(candidate.text());
            Set<String> union = new HashSet<>(candidateWords);
            union.addAll(refinedWords);
            Set<String> intersection = new HashSet<>(candidateWords);
            intersection.retainAll(refinedWords);
            double overlap = union.isEmpty() ? 0d : (double) intersection.size() / union.size();
            if (overlap > bestOverlap) {
                bestOverlap = overlap;
                best = candidate;
            }
        }
        return best;
    }

    private static Set<String> words(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(word -> !word.isBlank())
                .collect(Collectors.toSet());
    }

    private static List<ExtractedQuestion> asQuestions(List<QuestionCandidate> candidates) {
        return candidates.stream()
                .map(candidate -> new ExtractedQuestion(candidate.text(),
                        List.of(QuestionSource.of(candidate.source(), candidate.mediaTimestampSeconds()))))
                .toList();
    }

    private RefinementUsageEntry usage(String subject, String sourceUrl, int batchSize, int outputSize,
            int inputTokens, int outputTokens, String outcome) {
        return new RefinementUsageEntry(clock.instant(), subject, sourceUrl, batchSize, outputSize,
                inputTokens, outputTokens, outcome);
    }

    private record BatchOutcome(List<ExtractedQuestion> questions, boolean degraded) {
    }
}

package com.interviewindex.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Test;

import com.interviewindex.index.QuestionSource;
import com.interviewindex.ingest.EmbeddingService;
import com.interviewindex.ingest.HashingEmbeddingService;
import com.interviewindex.source.ArticleSource;
import com.interviewindex.source.SourceText;
import com.interviewindex.source.TextSegment;
import com.interviewindex.source.VideoSource;

class ExtractionPipelineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private final HeuristicQuestionExtractor heuristics = new HeuristicQuestionExtractor(3, 200);
    private final List<RefinementUsageEntry> usage = new ArrayList<>();

    @Test
    void shouldRunHeuristicsOnlyWhenNoRefinerConfigured() {
        ExtractionPipeline pipeline = pipeline(null, 30, DedupPolicy.disabled());

        ExtractionResult result = pipeline.run("subject", List.of(article("What inspired you? I love movies. How do you prepare?")));

        assertEquals(2, result.candidateCount());
        assertEquals(List.of("What inspired you?", "How do you prepare?"), texts(result));
        assertFalse(result.degraded());
        assertTrue(usage.isEmpty());
    }

    @Test
    void shouldSendCandidatesInBatchesAndMapProvenance() {
        RecordingRefiner refiner = new RecordingRefiner(batch -> batch.stream()
                .map(text -> text.toUpperCase(Locale.ROOT))
                .toList());
        ExtractionPipeline pipeline = pipeline(refiner, 2, DedupPolicy.disabled());
        VideoSource video = new VideoSource("https://video.example/1", "Chat show", "2021-03-04");
        SourceText text = new SourceText(video, List.of(
                new TextSegment(5.0, "What inspired you?"),
                new TextSegment(65.0, "How do you prepare?"),
                new TextSegment(125.0, "Who taught you the cover drive?")));

        ExtractionResult result = pipeline.run("subject", List.of(text));

        assertEquals(List.of(2, 1), refiner.batchSizes);
        assertEquals(3, result.questions().size());
        assertEquals(65.0, result.questions().get(1).sources().get(0).mediaTimestampSeconds());
        assertEquals("2021-03-04", result.questions().get(2).sources().get(0).publishedDate());
        assertFalse(result.degraded());
        assertEquals(List.of("REFINED", "REFINED"), usage.stream().map(RefinementUsageEntry::outcome).toList());
    }

    @Test
    void shouldFallBackToHeuristicsWhenRefinerFails() {
        QuestionRefiner failing = batch -> {
            throw new RefinementException("provider unavailable");
        };
        ExtractionPipeline pipeline = pipeline(failing, 30, DedupPolicy.disabled());

        ExtractionResult result = pipeline.run("subject", List.of(article("What inspired you? How do you prepare?")));

        assertEquals(List.of("What inspired you?", "How do you prepare?"), texts(result));
        assertTrue(result.degraded());
        assertEquals("FALLBACK", usage.get(0).outcome());
    }

    @Test
    void shouldRejectRefinementThatReturnsMoreThanItReceived() {
        RecordingRefiner inflating = new RecordingRefiner(batch -> {
            List<String> out = new ArrayList<>(batch);
            out.add("Invented question about something else?");
            return out;
        });
        ExtractionPipeline pipeline = pipeline(inflating, 30, DedupPolicy.disabled());

        ExtractionResult result = pipeline.run("subject", List.of(article("What inspired you? How do you prepare?")));

        assertEquals(List.of("What inspired you?", "How do you prepare?"), texts(result));
        assertTrue(result.degraded());
        assertEquals("REJECTED", usage.get(0).outcome());
    }

    @Test
    void shouldDropBlankRefinedQuestions() {
        RecordingRefiner refiner = new RecordingRefiner(batch -> List.of(" ", "How do you prepare for a match?"));
        ExtractionPipeline pipeline = pipeline(refiner, 30, DedupPolicy.disabled());

        ExtractionResult result = pipeline.run("subject", List.of(article("What inspired you? How do you prepare?")));

        assertEquals(List.of("How do you prepare for a match?"), texts(result));
        assertEquals(1, usage.get(0).outputSize());
    }

    @Test
    void shouldMergeParaphrasesOnlyWhenDedupEnabled() {
        String transcript = "Why do you love cricket? What draws you to cricket? How did cricket become your passion?";

        ExtractionResult kept = pipeline(null, 30, DedupPolicy.disabled()).run("subject",
                List.of(article(transcript), article2(transcript)));
        assertEquals(6, kept.questions().size());
        assertTrue(kept.questions().stream().allMatch(question -> question.sources().size() == 1));

        ExtractionResult merged = pipeline(null, 30, DedupPolicy.mergeAbove(0.85)).run("subject",
                List.of(article(transcript), article2(transcript)));
        assertEquals(1, merged.questions().size());
        assertEquals("Why do you love cricket?", merged.questions().get(0).text());
        assertEquals(6, merged.questions().get(0).sources().size());
    }

    @Test
    void shouldKeepOneRecordPerSourceOrMergeAllThreeDependingOnDedup() {
        List<SourceText> sources = List.of(
                article("https://news.example/1", "What inspired you to play cricket?"),
                article("https://news.example/2", "What made you want to play cricket?"),
                article("https://news.example/3", "Why did you choose cricket?"));

        ExtractionResult kept = pipeline(null, 30, DedupPolicy.disabled()).run("subject", sources);
        assertEquals(List.of("What inspired you to play cricket?", "What made you want to play cricket?",
                "Why did you choose cricket?"), texts(kept));
        assertTrue(kept.questions().stream().allMatch(question -> question.sources().size() == 1));

        ExtractionResult merged = pipeline(null, 30, DedupPolicy.mergeAbove(0.85)).run("subject", sources);
        assertEquals(1, merged.questions().size());
        assertEquals(List.of("https://news.example/1", "https://news.example/2", "https://news.example/3"),
                merged.questions().get(0).sources().stream().map(QuestionSource::sourceUrl).toList());
    }

    @Test
    void shouldPreferExactMatchThenWordOverlapForProvenance() {
        ArticleSource source = new ArticleSource("https://news.example/a", "Profile", null);
        List<QuestionCandidate> batch = List.of(
                new QuestionCandidate("What inspired you?", source, 1.0),
                new QuestionCandidate("How do you prepare for a final?", source, 2.0));

        assertEquals(1.0, ExtractionPipeline.closestCandidate("what inspired you?", batch).mediaTimestampSeconds());
        assertEquals(2.0, ExtractionPipeline.closestCandidate("How do you prepare before a final?", batch).mediaTimestampSeconds());
    }

    private ExtractionPipeline pipeline(QuestionRefiner refiner, int batchSize, DedupPolicy dedup) {
        EmbeddingService embedding = dedup.enabled() ? new TopicEmbeddingService() : new HashingEmbeddingService(32);
        return new ExtractionPipeline(heuristics, refiner, batchSize, usage::add, dedup, embedding, CLOCK);
    }

    private static SourceText article(String text) {
        return new SourceText(new ArticleSource("https://news.example/a", "Interview A", null),
                List.of(new TextSegment(null, text)));
    }

    private static SourceText article(String url, String text) {
        return new SourceText(new ArticleSource(url, "Interview", null), List.of(new TextSegment(null, text)));
    }

    private static SourceText article2(String text) {
        return new SourceText(new ArticleSource("https://news.example/b", "Interview B", null),
                List.of(new TextSegment(null, text)));
    }

    private static List<String> texts(ExtractionResult result) {
        return result.questions().stream().map(ExtractedQuestion::text).toList();
    }

    private interface Refinement {
        List<String> apply(List<String> batch);
    }

    private static final class RecordingRefiner implements QuestionRefiner {
        private final Refinement refinement;
        private final List<Integer> batchSizes = new ArrayList<>();

        private RecordingRefiner(Refinement refinement) {
            this.refinement = refinement;
        }

        @Override
        public RefinementResult refine(List<String> batch) {
            batchSizes.add(batch.size());
            return new RefinementResult(refinement.apply(batch), batch.size() * 5, batch.size() * 4);
        }
    }

    /**
     * Maps every question mentioning cricket onto the same unit vector.
     */
    private static final class TopicEmbeddingService implements EmbeddingService {
        @Override
        public float[] embed(String text) {
            float[] vector = new float[4];
            vector[text.toLowerCase(Locale.ROOT).contains("cricket") ? 0 : 1] = 1f;
            return vector;
        }

        @Override
        public int dimension() {
            return 4;
        }
    }
}

package com.interviewindex.ingest;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.interviewindex.extract.ExtractedQuestion;
import com.interviewindex.extract.ExtractionPipeline;
import com.interviewindex.extract.ExtractionResult;
import com.interviewindex.index.IndexWriteException;
import com.interviewindex.index.QuestionRecord;
import com.interviewindex.index.QuestionSource;
import com.interviewindex.index.SubjectIndex;
import com.interviewindex.index.SubjectIndexRepository;
import com.interviewindex.policy.IngestAction;
import com.interviewindex.registry.EntityRegistry;
import com.interviewindex.registry.SourceCounts;
import com.interviewindex.source.InterviewSource;
import com.interviewindex.source.SourceCollaborators;
import com.interviewindex.source.SourceText;
import com.interviewindex.source.SourceType;

/**
 * Runs one ingestion for a subject: fetch sources, extract questions, append them to the
 * subject's index, then flush the index, the source ledger and the registry.
 *
 * <p>Callers serialize runs per subject. A source that fails or times out is skipped; a
 * question that cannot be written is rolled back and skipped, and its source is left out of the
 * ledger so the next incremental run reads it again. Incremental runs never append a question
 * already recorded for the same source. Only persistence failures abort the run.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final SourceCollaborators collaborators;
    private final ExtractionPipeline pipeline;
    private final EmbeddingService embeddingService;
    private final SubjectIndexRepository repository;
    private final EntityRegistry registry;
    private final SourceStateStore stateStore;
    private final ExecutorService fetchPool;
    private final long sourceTimeoutMs;
    private final Clock clock;

    public IngestionService(
            SourceCollaborators collaborators,
            ExtractionPipeline pipeline,
            EmbeddingService embeddingService,
            SubjectIndexRepository repository,
            EntityRegistry registry,
            SourceStateStore stateStore,
            ExecutorService fetchPool,
            long sourceTimeoutMs,
            Clock clock) {
        this.collaborators = collaborators;
        this.pipeline = pipeline;
        this.embeddingService = embeddingService;
        this.repository = repository;
        this.registry = registry;
        this.stateStore = stateStore;
        this.fetchPool = fetchPool;
        this.sourceTimeoutMs = sourceTimeoutMs;
        this.clock = clock;
    }

    public IngestionReport ingest(String subjectKey, String displayName, List<InterviewSource> sources, IngestAction action)
            throws IOException {
        if (!action.requiresIngestion()) {
            throw new IllegalArgumentException("ingest called with " + action);
        }
        // a corrupt registry entry must fail the run before anything is appended
        registry.get(subjectKey);
        SubjectIndex index = repository.open(subjectKey);
        Map<String, String> ledger = stateStore.load(subjectKey);
        log.info("ingestion.started subject={} action={} sources={}", subjectKey, action, sources.size());

        List<String> skipped = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        List<SourceText> toExtract = new ArrayList<>();
        Map<SourceType, Integer> countsByType = new EnumMap<>(SourceType.class);
        Map<String, String> readFingerprints = new LinkedHashMap<>();

        for (Map.Entry<InterviewSource, Future<SourceText>> fetch : submitFetches(sources).entrySet()) {
            InterviewSource source = fetch.getKey();
            SourceText text = await(source, fetch.getValue());
            if (text == null) {
                skipped.add(source.url());
                continue;
            }
            String fingerprint = text.fingerprint();
            if (action == IngestAction.INCREMENTAL_INGEST && fingerprint.equals(ledger.get(source.url()))) {
                unchanged.add(source.url());
                log.debug("ingestion.source.unchanged subject={} url={}", subjectKey, source.url());
                continue;
            }
            readFingerprints.put(source.url(), fingerprint);
            toExtract.add(text);
            if (!text.fullText().isBlank()) {
                countsByType.merge(source.type(), 1, Integer::sum);
            }
        }

        ExtractionResult extraction = pipeline.run(subjectKey, toExtract);
        Instant capturedAt = clock.instant();
        int added = 0;
        int failedWrites = 0;
        Set<String> incompleteSources = new HashSet<>();
        Set<String> committed = action == IngestAction.INCREMENTAL_INGEST ? committedPairs(index) : Set.of();
        for (ExtractedQuestion question : extraction.questions()) {
            if (alreadyIndexed(committed, question)) {
                log.debug("ingestion.record.present subject={} question=\"{}\"", subjectKey, question.text());
                continue;
            }
            try {
                float[] vector = embeddingService.embed(question.text());
                index.append(question.text(), question.sources(), vector, capturedAt);
                added++;
            } catch (IndexWriteException e) {
                failedWrites++;
                markIncomplete(incompleteSources, question);
                log.error("ingestion.record.failed subject={} id={} question=\"{}\"", subjectKey, e.id(), question.text(), e);
            } catch (RuntimeException e) {
                failedWrites++;
                markIncomplete(incompleteSources, question);
                log.error("ingestion.embedding.failed subject={} question=\"{}\"", subjectKey, question.text(), e);
            }
        }

        // sources with a lost question stay out of the ledger so the next incremental run reads them again
        readFingerprints.forEach((url, fingerprint) -> {
            if (incompleteSources.contains(url)) {
                ledger.remove(url);
                log.warn("ingestion.source.incomplete subject={} url={}", subjectKey, url);
            } else {
                ledger.put(url, fingerprint);
            }
        });

        index.flush();
        stateStore.save(subjectKey, ledger);
        registry.upsert(subjectKey, displayName, SourceCounts.of(countsByType), added, extraction.degraded(), clock.instant());

        IngestionReport report = new IngestionReport(subjectKey, action, countsByType, added, index.count(),
                skipped, unchanged, failedWrites, extraction.degraded());
        log.info("ingestion.completed subject={} action={} added={} total={} skipped={} unchanged={} failedWrites={} degraded={}",
                subjectKey, action, added, report.totalQuestions(), skipped.size(), unchanged.size(), failedWrites,
                extraction.degraded());
        return report;
    }

    private static Set<String> committedPairs(SubjectIndex index) {
        Set<String> pairs = new HashSet<>();
        for (QuestionRecord record : index.records()) {
            for (QuestionSource source : record.sources()) {
                pairs.add(pair(record.text(), source.sourceUrl()));
            }
        }
        return pairs;
    }

    private static boolean alreadyIndexed(Set<String> committed, ExtractedQuestion question) {
        if (committed.isEmpty()) {
            return false;
        }
        return question.sources().stream().allMatch(source -> committed.contains(pair(question.text(), source.sourceUrl())));
    }

    private static String pair(String text, String sourceUrl) {
        return sourceUrl + '\n' + text;
    }

    private static void markIncomplete(Set<String> incompleteSources, ExtractedQuestion question) {
        for (QuestionSource source : question.sources()) {
            incompleteSources.add(source.sourceUrl());
        }
    }

    private Map<InterviewSource, Future<SourceText>> submitFetches(List<InterviewSource> sources) {
        Map<InterviewSource, Future<SourceText>> futures = new LinkedHashMap<>();
        for (InterviewSource source : sources) {
            if (futures.containsKey(source)) {
                continue;
            }
            futures.put(source, fetchPool.submit(() -> source.load(collaborators)));
        }
        return futures;
    }

    private SourceText await(InterviewSource source, Future<SourceText> future) {
        try {
            return future.get(sourceTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("ingestion.source.timeout url={} timeoutMs={}", source.url(), sourceTimeoutMs);
        } catch (ExecutionException e) {
            log.warn("ingestion.source.skipped url={} type={} reason={}", source.url(), source.type(),
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("ingestion.source.interrupted url={}", source.url());
        }
        return null;
    }
}

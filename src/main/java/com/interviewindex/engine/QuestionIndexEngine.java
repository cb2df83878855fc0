package com.interviewindex.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.interviewindex.extract.DedupPolicy;
import com.interviewindex.extract.ExternalProviderQuestionRefiner;
import com.interviewindex.extract.ExtractionPipeline;
import com.interviewindex.extract.HeuristicQuestionExtractor;
import com.interviewindex.extract.QuestionRefiner;
import com.interviewindex.extract.RefinementUsageLedger;
import com.interviewindex.index.QuestionRecord;
import com.interviewindex.index.SubjectIndex;
import com.interviewindex.index.SubjectIndexRepository;
import com.interviewindex.index.Subjects;
import com.interviewindex.ingest.EmbeddingService;
import com.interviewindex.ingest.EmbeddingServices;
import com.interviewindex.ingest.IngestionReport;
import com.interviewindex.ingest.IngestionService;
import com.interviewindex.ingest.SourceStateStore;
import com.interviewindex.policy.Decision;
import com.interviewindex.policy.DecisionPolicy;
import com.interviewindex.policy.FreshnessDecisionPolicy;
import com.interviewindex.policy.IngestAction;
import com.interviewindex.registry.EntityRegistry;
import com.interviewindex.registry.RegistryEntry;
import com.interviewindex.retrieval.NoMatchExplanation;
import com.interviewindex.retrieval.QuestionMatch;
import com.interviewindex.retrieval.RetrievalService;
import com.interviewindex.runtime.AppConfig;
import com.interviewindex.source.ExternalProviderTranscriber;
import com.interviewindex.source.HttpSourceFetcher;
import com.interviewindex.source.InterviewSource;
import com.interviewindex.source.SourceCatalog;
import com.interviewindex.source.SourceCollaborators;
import com.interviewindex.source.Transcriber;
import com.interviewindex.source.UnavailableTranscriber;

import okhttp3.OkHttpClient;

/**
 * Entry point for callers: decide, ingest, retrieve and the operations built on them.
 *
 * <p>Ingestion and reset are serialized per subject; different subjects proceed in parallel.
 * Retrieval takes no subject lock and runs concurrently with everything but the write step
 * of an append.
 */
public class QuestionIndexEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QuestionIndexEngine.class);

    private final Map<String, ReentrantLock> subjectLocks = new ConcurrentHashMap<>();
    private final AppConfig config;
    private final SourceCatalog catalog;
    private final EntityRegistry registry;
    private final SubjectIndexRepository repository;
    private final SourceStateStore stateStore;
    private final DecisionPolicy policy;
    private final RetrievalService retrievalService;
    private final IngestionService ingestionService;
    private final ExecutorService fetchPool;
    private final Clock clock;

    public QuestionIndexEngine(
            AppConfig config,
            Path dataDir,
            SourceCatalog catalog,
            EmbeddingService embeddingService,
            SourceCollaborators collaborators,
            QuestionRefiner refiner,
            DecisionPolicy policy,
            Clock clock) throws IOException {
        this.config = config;
        this.catalog = catalog;
        this.policy = policy;
        this.clock = clock;
        this.registry = EntityRegistry.load(dataDir.resolve("registry.json"));
        this.repository = new SubjectIndexRepository(dataDir.resolve("index"), embeddingService.dimension(),
                embeddingService.version(), config.getIndex().getMetadataWriteRetries());
        this.stateStore = new SourceStateStore(dataDir.resolve("sources"));
        this.retrievalService = new RetrievalService(embeddingService, config.getRetrieval().getOverFetchFactor());
        this.fetchPool = Executors.newFixedThreadPool(Math.max(1, config.getIngestion().getParallelism()), fetchThreads());

        AppConfig.DedupConfig dedup = config.getDedup();
        ExtractionPipeline pipeline = new ExtractionPipeline(
                new HeuristicQuestionExtractor(config.getExtraction().getMinTokens(), config.getExtraction().getMaxTokens()),
                config.getRefinement().isEnabled() ? refiner : null,
                config.getRefinement().getBatchSize(),
                new RefinementUsageLedger(dataDir.resolve("refinement-usage.jsonl")),
                dedup.isEnabled() ? DedupPolicy.mergeAbove(dedup.getSimilarityThreshold()) : DedupPolicy.disabled(),
                embeddingService,
                clock);
        this.ingestionService = new IngestionService(collaborators, pipeline, embeddingService, repository, registry,
                stateStore, fetchPool, config.getIngestion().getSourceTimeoutMs(), clock);
        log.info("engine.started dataDir={} embedding={} refinement={} dedup={}", dataDir, embeddingService.version(),
                pipeline.refinementEnabled(), dedup.isEnabled());
    }

    /**
     * Builds an engine whose external providers are chosen from environment variables.
     */
    public static QuestionIndexEngine fromEnvironment(AppConfig config, Path dataDir, SourceCatalog catalog) throws IOException {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(config.getIngestion().getSourceTimeoutMs()))
                .build();
        String apiKey = System.getenv("INTERVIEW_INDEX_API_KEY");

        String transcribeUrl = System.getenv("INTERVIEW_INDEX_TRANSCRIBE_URL");
        Transcriber transcriber = transcribeUrl == null || transcribeUrl.isBlank()
                ? new UnavailableTranscriber()
                : new ExternalProviderTranscriber(httpClient, transcribeUrl, apiKey);

        String refineUrl = System.getenv("INTERVIEW_INDEX_REFINE_URL");
        QuestionRefiner refiner = refineUrl == null || refineUrl.isBlank()
                ? null
                : new ExternalProviderQuestionRefiner(httpClient.newBuilder()
                        .callTimeout(Duration.ofMillis(config.getRefinement().getTimeoutMs()))
                        .build(), refineUrl, apiKey);
        if (config.getRefinement().isEnabled() && refiner == null) {
            log.warn("refinement.unconfigured reason=\"INTERVIEW_INDEX_REFINE_URL not set\" mode=heuristics-only");
        }

        EmbeddingService embeddingService = EmbeddingServices.fromEnvironment(httpClient, config.getEmbedding().getDimension());
        return new QuestionIndexEngine(config, dataDir, catalog, embeddingService,
                new SourceCollaborators(transcriber, new HttpSourceFetcher(httpClient)), refiner,
                new FreshnessDecisionPolicy(), Clock.systemUTC());
    }

    public Decision decide(String subject, boolean force) throws IOException {
        String key = Subjects.key(subject);
        Optional<RegistryEntry> entry = registry.get(key);
        Decision decision = policy.decide(entry, force, freshnessWindow(), clock.instant());
        log.info("policy.decision subject={} action={} reason=\"{}\"", key, decision.action(), decision.reason());
        return decision;
    }

    /**
     * Ingests the sources the catalog lists for {@code subject}.
     */
    public IngestionReport ingest(String subject, IngestAction action) throws IOException {
        return ingest(subject, catalog.sourcesFor(subject), action);
    }

    public IngestionReport ingest(String subject, List<InterviewSource> sources, IngestAction action) throws IOException {
        String key = Subjects.key(subject);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return ingestionService.ingest(key, subject.strip(), sources, action);
        } finally {
            lock.unlock();
        }
    }

    public List<QuestionMatch> retrieve(String subject, String query) throws IOException {
        return retrieve(subject, query, config.getRetrieval().getDefaultTopK(), config.getRetrieval().getSimilarityThreshold());
    }

    public List<QuestionMatch> retrieve(String subject, String query, int topK, double threshold) throws IOException {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        return retrievalService.retrieve(existingIndex(Subjects.key(subject)).orElse(null), query, topK, threshold);
    }

    /**
     * Decides, ingests if the decision calls for it, then retrieves. Concurrent asks for the
     * same subject trigger at most one ingestion.
     */
    public AskResult ask(String subject, String query, boolean force, int topK, double threshold) throws IOException {
        String key = Subjects.key(subject);
        Decision decision;
        IngestionReport ingestion = null;
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            decision = decide(subject, force);
            if (decision.action().requiresIngestion()) {
                ingestion = ingestionService.ingest(key, subject.strip(), catalog.sourcesFor(subject), decision.action());
            }
        } finally {
            lock.unlock();
        }
        return new AskResult(decision, ingestion, retrieve(subject, query, topK, threshold));
    }

    public AskResult ask(String subject, String query, boolean force) throws IOException {
        return ask(subject, query, force, config.getRetrieval().getDefaultTopK(), config.getRetrieval().getSimilarityThreshold());
    }

    public NoMatchExplanation explain(String subject, String query, double threshold) throws IOException {
        return retrievalService.explain(existingIndex(Subjects.key(subject)).orElse(null), query, threshold);
    }

    public SubjectStatus status(String subject) throws IOException {
        String key = Subjects.key(subject);
        Optional<RegistryEntry> entry = registry.get(key);
        int records = existingIndex(key).map(SubjectIndex::count).orElse(0);
        return new SubjectStatus(key, entry, records);
    }

    public List<QuestionRecord> records(String subject) throws IOException {
        return existingIndex(Subjects.key(subject)).map(SubjectIndex::records).orElse(List.of());
    }

    /**
     * Removes everything stored for the subject: both index files, the source ledger and the
     * registry entry. The next decision for it is INGEST.
     */
    public void reset(String subject) throws IOException {
        String key = Subjects.key(subject);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            repository.reset(key);
            stateStore.delete(key);
            registry.remove(key);
            log.info("engine.reset subject={}", key);
        } finally {
            lock.unlock();
        }
    }

    public Duration freshnessWindow() {
        return Duration.ofDays(config.getPolicy().getFreshnessDays());
    }

    @Override
    public void close() throws IOException {
        fetchPool.shutdown();
        try {
            if (!fetchPool.awaitTermination(5, TimeUnit.SECONDS)) {
                fetchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        repository.flushAll();
        registry.flush();
        log.debug("engine.closed");
    }

    private Optional<SubjectIndex> existingIndex(String key) throws IOException {
        if (!repository.exists(key)) {
            return Optional.empty();
        }
        return Optional.of(repository.open(key));
    }

    private ReentrantLock lockFor(String key) {
        return subjectLocks.computeIfAbsent(key, ignored -> new ReentrantLock());
    }

    private static ThreadFactory fetchThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "source-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

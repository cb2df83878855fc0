package com.interviewindex;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.interviewindex.engine.AskResult;
import com.interviewindex.engine.QuestionIndexEngine;
import com.interviewindex.engine.SubjectStatus;
import com.interviewindex.index.QuestionSource;
import com.interviewindex.ingest.IngestionReport;
import com.interviewindex.policy.Decision;
import com.interviewindex.policy.IngestAction;
import com.interviewindex.registry.RegistryEntry;
import com.interviewindex.report.MarkdownQuestionReport;
import com.interviewindex.retrieval.NoMatchExplanation;
import com.interviewindex.retrieval.QuestionMatch;
import com.interviewindex.runtime.AppConfig;
import com.interviewindex.source.SourceCatalog;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "interview-index",
        mixinStandardHelpOptions = true,
        version = "interview-index 0.1.0",
        description = "Indexes questions asked to a subject in interviews and finds previously-asked similar ones.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_RUNTIME_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "ask")
    Mode mode;

    @Option(names = { "-s", "--subject" }, description = "Subject (interviewee) name")
    String subject;

    @Option(names = { "-q", "--query" }, description = "Question to look up in ask, retrieve and explain modes")
    String query;

    @Option(names = "--top-k", description = "Maximum matches to return (default from config)")
    Integer topK;

    @Option(names = "--threshold", description = "Minimum similarity score (default from config)")
    Double threshold;

    @Option(names = "--force", description = "Re-extract every source even when the index is fresh", defaultValue = "false")
    boolean force;

    @Option(names = "--sources", description = "Source catalog (YAML) listing each subject's interviews (default from config)")
    Path sourcesPath;

    @Option(names = "--data-dir", description = "Directory holding the registry and indexes (default from config)")
    Path dataDir;

    @Option(names = "--output", description = "File to write the report to; printed when omitted")
    Path outputPath;

    enum Mode {
        decide,
        ingest,
        retrieve,
        ask,
        explain,
        status,
        reset,
        report
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (subject == null || subject.isBlank()) {
            log.error("--subject is required");
            return EXIT_USAGE_ERROR;
        }
        if (needsQuery() && (query == null || query.isBlank())) {
            log.error("--query is required in {} mode", mode);
            return EXIT_USAGE_ERROR;
        }

        AppConfig config;
        try {
            config = loadConfig(Path.of(configPath));
        } catch (IOException e) {
            log.error("Unable to read config file {}", configPath, e);
            return EXIT_USAGE_ERROR;
        }
        Path resolvedDataDir = dataDir != null ? dataDir : Path.of(config.getStorage().getDataDir());
        Path resolvedSources = sourcesPath != null ? sourcesPath : Path.of(config.getStorage().getCatalogPath());
        int k = topK != null ? topK : config.getRetrieval().getDefaultTopK();
        double minScore = threshold != null ? threshold : config.getRetrieval().getSimilarityThreshold();
        if (k <= 0) {
            log.error("--top-k must be positive, got {}", k);
            return EXIT_USAGE_ERROR;
        }

        log.info("Starting interview-index in {} mode", mode);
        log.info("Using config file: {} dataDir={} sources={}", configPath, resolvedDataDir, resolvedSources);

        try (QuestionIndexEngine engine = createEngine(config, resolvedDataDir, SourceCatalog.load(resolvedSources))) {
            run(engine, k, minScore);
            return EXIT_SUCCESS;
        } catch (IllegalArgumentException e) {
            log.error("Invalid request: {}", e.getMessage());
            return EXIT_USAGE_ERROR;
        } catch (IOException | RuntimeException e) {
            log.error("{} failed for subject={}", mode, subject, e);
            return EXIT_RUNTIME_FAILURE;
        }
    }

    protected QuestionIndexEngine createEngine(AppConfig config, Path resolvedDataDir, SourceCatalog catalog) throws IOException {
        return QuestionIndexEngine.fromEnvironment(config, resolvedDataDir, catalog);
    }

    private void run(QuestionIndexEngine engine, int k, double minScore) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        switch (mode) {
            case decide -> print(out, engine.decide(subject, force));
            case ingest -> {
                Decision decision = engine.decide(subject, force);
                IngestAction action = decision.action() == IngestAction.RETRIEVE
                        ? IngestAction.INCREMENTAL_INGEST
                        : decision.action();
                print(out, engine.ingest(subject, action));
            }
            case retrieve -> print(out, engine.retrieve(subject, query, k, minScore));
            case ask -> {
                AskResult result = engine.ask(subject, query, force, k, minScore);
                print(out, result.decision());
                if (result.ingestion() != null) {
                    print(out, result.ingestion());
                }
                print(out, result.matches());
            }
            case explain -> {
                NoMatchExplanation explanation = engine.explain(subject, query, minScore);
                out.printf("%s: %s%n", explanation.reason(), explanation.message());
                if (explanation.closest() != null) {
                    out.printf("closest: %s%n", explanation.closest().text());
                }
            }
            case status -> print(out, engine.status(subject));
            case reset -> {
                engine.reset(subject);
                out.printf("reset %s%n", subject);
            }
            case report -> {
                String markdown = new MarkdownQuestionReport().render(subject.strip(), engine.records(subject));
                if (outputPath == null) {
                    out.print(markdown);
                } else {
                    if (outputPath.getParent() != null) {
                        Files.createDirectories(outputPath.getParent());
                    }
                    Files.writeString(outputPath, markdown);
                    log.info("Wrote report to {}", outputPath);
                }
            }
        }
        out.flush();
    }

    private boolean needsQuery() {
        return mode == Mode.ask || mode == Mode.retrieve || mode == Mode.explain;
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    private static void print(PrintWriter out, Decision decision) {
        out.printf("decision: %s (%s)%n", decision.action(), decision.reason());
    }

    private static void print(PrintWriter out, IngestionReport report) {
        out.printf("ingested %s: action=%s added=%d total=%d skipped=%d unchanged=%d degraded=%s%n",
                report.subject(), report.action(), report.questionsAdded(), report.totalQuestions(),
                report.skippedSources().size(), report.unchangedSources().size(), report.degraded());
    }

    private static void print(PrintWriter out, List<QuestionMatch> matches) {
        if (matches.isEmpty()) {
            out.println("no previously-asked similar questions");
            return;
        }
        for (int i = 0; i < matches.size(); i++) {
            QuestionMatch match = matches.get(i);
            QuestionSource source = match.record().primarySource();
            out.printf("#%d %.4f %s%n    %s %s%s%n", i + 1, match.score(), match.record().text(),
                    source.sourceType(), source.sourceUrl(),
                    source.mediaTimestampSeconds() == null ? "" : " @" + Math.round(source.mediaTimestampSeconds()) + "s");
        }
    }

    private static void print(PrintWriter out, SubjectStatus status) {
        if (status.entry().isEmpty()) {
            out.printf("%s: never indexed%n", status.subjectId());
            return;
        }
        RegistryEntry entry = status.entry().get();
        out.printf("%s (%s): status=%s questions=%d records=%d videos=%d audio=%d articles=%d lastIndexedAt=%s%n",
                entry.subjectId(), entry.displayName(), entry.status(), entry.questionCount(), status.recordCount(),
                entry.sourceCounts().video(), entry.sourceCounts().audio(), entry.sourceCounts().article(),
                entry.lastIndexedAt());
    }
}

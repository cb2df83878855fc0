package com.interviewindex.extract;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewindex.runtime.JsonFiles;

/**
 * Append-only JSON-lines log of refinement token usage.
 */
public class RefinementUsageLedger implements RefinementUsageSink {
    private static final Logger log = LoggerFactory.getLogger(RefinementUsageLedger.class);

    private final ObjectMapper mapper = JsonFiles.mapper();
    private final Path ledgerPath;

    public RefinementUsageLedger(Path ledgerPath) {
        this.ledgerPath = ledgerPath;
    }

    @Override
    public synchronized void record(RefinementUsageEntry entry) {
        log.info("refinement.usage subject={} source={} batch={} kept={} inputTokens={} outputTokens={} outcome={}",
                entry.subject(), entry.sourceUrl(), entry.batchSize(), entry.outputSize(),
                entry.inputTokens(), entry.outputTokens(), entry.outcome());
        try {
            append(entry);
        } catch (IOException e) {
            log.warn("Unable to persist refinement usage to {}", ledgerPath, e);
        }
    }

    void append(RefinementUsageEntry entry) throws IOException {
        if (ledgerPath.getParent() != null) {
            Files.createDirectories(ledgerPath.getParent());
        }
        String line = mapper.writeValueAsString(entry) + System.lineSeparator();
        Files.writeString(ledgerPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public long totalTokens() throws IOException {
        return readAll().stream()
                .mapToLong(entry -> (long) entry.inputTokens() + entry.outputTokens())
                .sum();
    }

    public List<RefinementUsageEntry> readAll() throws IOException {
        if (!Files.exists(ledgerPath)) {
            return List.of();
        }
        List<String> lines = Files.readAllLines(ledgerPath);
        List<RefinementUsageEntry> entries = new ArrayList<>();
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            entries.add(mapper.readValue(line, RefinementUsageEntry.class));
        }
        return entries;
    }
}

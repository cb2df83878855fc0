package com.interviewindex.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Settings read from {@code application.yml}. Every field has a default, so a missing file or
 * section still yields a usable configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StorageConfig storage = new StorageConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private ExtractionConfig extraction = new ExtractionConfig();
    private RefinementConfig refinement = new RefinementConfig();
    private DedupConfig dedup = new DedupConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private PolicyConfig policy = new PolicyConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private IndexConfig index = new IndexConfig();

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public ExtractionConfig getExtraction() {
        return extraction;
    }

    public void setExtraction(ExtractionConfig extraction) {
        this.extraction = extraction == null ? new ExtractionConfig() : extraction;
    }

    public RefinementConfig getRefinement() {
        return refinement;
    }

    public void setRefinement(RefinementConfig refinement) {
        this.refinement = refinement == null ? new RefinementConfig() : refinement;
    }

    public DedupConfig getDedup() {
        return dedup;
    }

    public void setDedup(DedupConfig dedup) {
        this.dedup = dedup == null ? new DedupConfig() : dedup;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public PolicyConfig getPolicy() {
        return policy;
    }

    public void setPolicy(PolicyConfig policy) {
        this.policy = policy == null ? new PolicyConfig() : policy;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String dataDir = ".interview-index";
        private String catalogPath = "sources.yml";

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public String getCatalogPath() {
            return catalogPath;
        }

        public void setCatalogPath(String catalogPath) {
            this.catalogPath = catalogPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private int dimension = 384;

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtractionConfig {
        private int minTokens = 3;
        private int maxTokens = 200;

        public int getMinTokens() {
            return minTokens;
        }

        public void setMinTokens(int minTokens) {
            this.minTokens = minTokens;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RefinementConfig {
        private boolean enabled = false;
        private int batchSize = 30;
        private int timeoutMs = 60000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DedupConfig {
        private boolean enabled = false;
        private double similarityThreshold = 0.85;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private double similarityThreshold = 0.5;
        private int overFetchFactor = 4;
        private int defaultTopK = 5;

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getOverFetchFactor() {
            return overFetchFactor;
        }

        public void setOverFetchFactor(int overFetchFactor) {
            this.overFetchFactor = overFetchFactor;
        }

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PolicyConfig {
        private int freshnessDays = 30;

        public int getFreshnessDays() {
            return freshnessDays;
        }

        public void setFreshnessDays(int freshnessDays) {
            this.freshnessDays = freshnessDays;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private long sourceTimeoutMs = 120000;
        private int parallelism = 4;

        public long getSourceTimeoutMs() {
            return sourceTimeoutMs;
        }

        public void setSourceTimeoutMs(long sourceTimeoutMs) {
            this.sourceTimeoutMs = sourceTimeoutMs;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private int metadataWriteRetries = 2;

        public int getMetadataWriteRetries() {
            return metadataWriteRetries;
        }

        public void setMetadataWriteRetries(int metadataWriteRetries) {
            this.metadataWriteRetries = metadataWriteRetries;
        }
    }
}

package com.interviewindex.extract;

import java.util.ArrayList;
import java.util.List;

import com.interviewindex.index.QuestionSource;
import com.interviewindex.ingest.EmbeddingService;

/**
 * Greedy single-pass clustering in arrival order: each question joins the first cluster whose
 * representative is at least {@code threshold} similar, otherwise it opens a new cluster.
 * The representative text is the first member's.
 */
public class QuestionDeduplicator {
    private final EmbeddingService embeddingService;
    private final double threshold;

    public QuestionDeduplicator(EmbeddingService embeddingService, double threshold) {
        this.embeddingService = embeddingService;
        this.threshold = threshold;
    }

    public List<ExtractedQuestion> merge(List<ExtractedQuestion> questions) {
        List<Cluster> clusters = new ArrayList<>();
        for (ExtractedQuestion question : questions) {
            float[] vector = embeddingService.embed(question.text());
            Cluster target = null;
            for (Cluster cluster : clusters) {
                if (dot(cluster.representative, vector) >= threshold) {
                    target = cluster;
                    break;
                }
            }
            if (target == null) {
                clusters.add(new Cluster(question.text(), vector, new ArrayList<>(question.sources())));
            } else {
                target.sources.addAll(question.sources());
            }
        }
        return clusters.stream()
                .map(cluster -> new ExtractedQuestion(cluster.text, cluster.sources))
                .toList();
    }

    private static double dot(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        double sum = 0d;
        for (int i = 0; i < len; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static final class Cluster {
        private final String text;
        private final float[] representative;
        private final List<QuestionSource> sources;

        private Cluster(String text, float[] representative, List<QuestionSource> sources) {
            this.text = text;
            this.representative = representative;
            this.sources = sources;
        }
    }
}

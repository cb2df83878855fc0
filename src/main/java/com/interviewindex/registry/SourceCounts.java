package com.interviewindex.registry;

import java.util.Map;

import com.interviewindex.source.SourceType;

public record SourceCounts(int video, int audio, int article) {
    public static final SourceCounts NONE = new SourceCounts(0, 0, 0);

    public static SourceCounts of(Map<SourceType, Integer> countsByType) {
        return new SourceCounts(
                countsByType.getOrDefault(SourceType.VIDEO, 0),
                countsByType.getOrDefault(SourceType.AUDIO, 0),
                countsByType.getOrDefault(SourceType.ARTICLE, 0));
    }

    public SourceCounts plus(SourceCounts other) {
        return new SourceCounts(video + other.video, audio + other.audio, article + other.article);
    }

    public int total() {
        return video + audio + article;
    }
}

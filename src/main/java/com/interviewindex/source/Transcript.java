package com.interviewindex.source;

import java.util.List;

public record Transcript(List<TextSegment> segments) {

    public Transcript {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }
}

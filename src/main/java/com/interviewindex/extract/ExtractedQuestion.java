package com.interviewindex.extract;

import java.util.List;

import com.interviewindex.index.QuestionSource;

/**
 * Output of the extraction pipeline, ready to be embedded and indexed.
 */
public record ExtractedQuestion(String text, List<QuestionSource> sources) {

    public ExtractedQuestion {
        sources = List.copyOf(sources);
    }
}

package com.interviewindex.source;

import java.util.List;

public record ArticleSource(String url, String title, String publishedDate) implements InterviewSource {

    public ArticleSource {
        SourceText.requireUrl(url);
    }

    @Override
    public SourceType type() {
        return SourceType.ARTICLE;
    }

    @Override
    public SourceText load(SourceCollaborators collaborators) throws SourceUnavailableException {
        String raw = collaborators.fetcher().fetch(url);
        return new SourceText(this, List.of(new TextSegment(null, raw)));
    }
}

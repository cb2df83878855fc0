package com.interviewindex.source;

/**
 * One interview a subject gave. The set of variants is closed; each knows how to turn
 * itself into raw text plus provenance using the external collaborators.
 */
public sealed interface InterviewSource permits VideoSource, AudioSource, ArticleSource {
    SourceType type();

    String url();

    String title();

    /** Publication date as given by the catalog, or {@code null}. */
    String publishedDate();

    SourceText load(SourceCollaborators collaborators) throws SourceUnavailableException;
}

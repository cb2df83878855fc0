package com.interviewindex.source;

public record VideoSource(String url, String title, String publishedDate) implements InterviewSource {

    public VideoSource {
        SourceText.requireUrl(url);
    }

    @Override
    public SourceType type() {
        return SourceType.VIDEO;
    }

    @Override
    public SourceText load(SourceCollaborators collaborators) throws SourceUnavailableException {
        Transcript transcript = collaborators.transcriber().transcribe(new AudioReference(url, SourceType.VIDEO));
        return new SourceText(this, transcript.segments());
    }
}

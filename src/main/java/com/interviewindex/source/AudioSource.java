package com.interviewindex.source;

/**
 * A podcast episode or other audio-only interview. {@code url} points at the episode
 * media or the feed item the transcriber understands.
 */
public record AudioSource(String url, String title, String publishedDate) implements InterviewSource {

    public AudioSource {
        SourceText.requireUrl(url);
    }

    @Override
    public SourceType type() {
        return SourceType.AUDIO;
    }

    @Override
    public SourceText load(SourceCollaborators collaborators) throws SourceUnavailableException {
        Transcript transcript = collaborators.transcriber().transcribe(new AudioReference(url, SourceType.AUDIO));
        return new SourceText(this, transcript.segments());
    }
}

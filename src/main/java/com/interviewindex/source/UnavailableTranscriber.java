package com.interviewindex.source;

import java.util.Locale;

/**
 * Used when no transcription endpoint is configured. Every media source is reported as
 * unavailable and skipped by ingestion.
 */
public class UnavailableTranscriber implements Transcriber {
    @Override
    public Transcript transcribe(AudioReference audio) throws SourceUnavailableException {
        throw new SourceUnavailableException(audio.url(),
                "No transcription endpoint configured; set INTERVIEW_INDEX_TRANSCRIBE_URL to ingest "
                        + audio.mediaType().name().toLowerCase(Locale.ROOT) + " sources");
    }
}

package com.interviewindex.source;

public interface Transcriber {
    Transcript transcribe(AudioReference audio) throws SourceUnavailableException;
}

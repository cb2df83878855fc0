package com.interviewindex.source;

public enum SourceType {
    VIDEO,
    AUDIO,
    ARTICLE
}

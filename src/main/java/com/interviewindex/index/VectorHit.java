package com.interviewindex.index;

public record VectorHit(long id, float score) {
}

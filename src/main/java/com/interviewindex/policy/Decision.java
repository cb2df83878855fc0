package com.interviewindex.policy;

public record Decision(IngestAction action, String reason) {
}

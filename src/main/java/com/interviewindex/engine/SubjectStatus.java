package com.interviewindex.engine;

import java.util.Optional;

import com.interviewindex.registry.RegistryEntry;

public record SubjectStatus(String subjectId, Optional<RegistryEntry> entry, int recordCount) {
}

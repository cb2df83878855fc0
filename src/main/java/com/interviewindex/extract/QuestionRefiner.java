package com.interviewindex.extract;

import java.util.List;

/**
 * Stage 2 collaborator. Sees candidate strings only, never the surrounding source text.
 * Must return at most as many strings as it received.
 */
public interface QuestionRefiner {
    RefinementResult refine(List<String> batch) throws RefinementException;
}

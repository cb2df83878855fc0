package com.interviewindex.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.interviewindex.source.SourceText;
import com.interviewindex.source.TextSegment;

/**
 * Stage 1: cheap, recall-oriented candidate generation with no external calls.
 */
public class HeuristicQuestionExtractor {
    static final Set<String> INTERROGATIVES = Set.of(
            "what", "why", "how", "when", "where", "who", "which",
            "would", "could", "can", "do", "does", "did", "is", "are");

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\R+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!…]+$");

    private final int minTokens;
    private final int maxTokens;

    public HeuristicQuestionExtractor(int minTokens, int maxTokens) {
        if (minTokens < 1 || maxTokens < minTokens) {
            throw new IllegalArgumentException("invalid token window [" + minTokens + ", " + maxTokens + "]");
        }
        this.minTokens = minTokens;
        this.maxTokens = maxTokens;
    }

    public List<QuestionCandidate> extract(SourceText sourceText) {
        List<QuestionCandidate> candidates = new ArrayList<>();
        for (TextSegment segment : sourceText.segments()) {
            for (String question : candidates(segment.text())) {
                candidates.add(new QuestionCandidate(question, sourceText.source(), segment.startSeconds()));
            }
        }
        return candidates;
    }

    /**
     * Candidate questions in {@code text}, in order of appearance.
     */
    public List<String> candidates(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String raw : SENTENCE_BOUNDARY.split(text.strip())) {
            String sentence = WHITESPACE.matcher(raw.strip()).replaceAll(" ");
            if (sentence.isEmpty()) {
                continue;
            }
            String[] tokens = sentence.split(" ");
            if (tokens.length < minTokens || tokens.length > maxTokens) {
                continue;
            }
            boolean endsWithQuestionMark = sentence.endsWith("?");
            if (endsWithQuestionMark || INTERROGATIVES.contains(leadingWord(tokens[0]))) {
                out.add(endsWithQuestionMark ? sentence : asQuestion(sentence));
            }
        }
        return out;
    }

    static String leadingWord(String token) {
        String word = token.toLowerCase(Locale.ROOT).replaceAll("^[^\\p{L}]+", "");
        int apostrophe = indexOfApostrophe(word);
        if (apostrophe > 0) {
            word = word.substring(0, apostrophe);
        }
        return word.replaceAll("[^\\p{L}]+$", "");
    }

    private static int indexOfApostrophe(String word) {
        int straight = word.indexOf('\'');
        int curly = word.indexOf('’');
        if (straight < 0) {
            return curly;
        }
        return curly < 0 ? straight : Math.min(straight, curly);
    }

    private static String asQuestion(String sentence) {
        return TRAILING_PUNCTUATION.matcher(sentence).replaceAll("") + "?";
    }
}

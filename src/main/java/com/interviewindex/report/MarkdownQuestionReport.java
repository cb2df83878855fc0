package com.interviewindex.report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.interviewindex.index.QuestionRecord;
import com.interviewindex.index.QuestionSource;

/**
 * Renders a subject's questions as Markdown, one section per source in first-seen order.
 * A question merged from several sources is listed under each of them.
 */
public class MarkdownQuestionReport {

    public String render(String displayName, List<QuestionRecord> records) {
        Map<String, Section> sections = new LinkedHashMap<>();
        for (QuestionRecord record : records) {
            for (QuestionSource source : record.sources()) {
                sections.computeIfAbsent(source.sourceUrl(), url -> new Section(source)).lines
                        .add(line(record.text(), source));
            }
        }

        StringBuilder markdown = new StringBuilder();
        markdown.append("# Interview questions: ").append(displayName).append("\n\n");
        markdown.append("_").append(records.size()).append(" questions from ")
                .append(sections.size()).append(" sources_\n");
        if (sections.isEmpty()) {
            markdown.append("\nNo questions indexed.\n");
            return markdown.toString();
        }
        for (Section section : sections.values()) {
            QuestionSource source = section.source;
            markdown.append("\n## ").append(title(source)).append("\n\n");
            markdown.append("Source: <").append(source.sourceUrl()).append("> (").append(source.sourceType());
            if (source.publishedDate() != null && !source.publishedDate().isBlank()) {
                markdown.append(", ").append(source.publishedDate());
            }
            markdown.append(")\n\n");
            for (String line : section.lines) {
                markdown.append(line).append('\n');
            }
        }
        return markdown.toString();
    }

    static String timestamp(double seconds) {
        long total = (long) Math.max(0d, Math.floor(seconds));
        return "%02d:%02d".formatted(total / 60, total % 60);
    }

    private static String line(String question, QuestionSource source) {
        if (source.mediaTimestampSeconds() == null) {
            return "- " + question;
        }
        return "- [" + timestamp(source.mediaTimestampSeconds()) + "] " + question;
    }

    private static String title(QuestionSource source) {
        return source.sourceTitle() == null || source.sourceTitle().isBlank() ? source.sourceUrl() : source.sourceTitle();
    }

    private static final class Section {
        private final QuestionSource source;
        private final List<String> lines = new ArrayList<>();

        private Section(QuestionSource source) {
            this.source = source;
        }
    }
}

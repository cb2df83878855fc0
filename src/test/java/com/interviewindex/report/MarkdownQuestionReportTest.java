package com.interviewindex.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.interviewindex.index.QuestionRecord;
import com.interviewindex.index.QuestionSource;
import com.interviewindex.source.SourceType;

class MarkdownQuestionReportTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void shouldGroupQuestionsBySourceWithTimestamps() {
        QuestionSource video = new QuestionSource(SourceType.VIDEO, "https://video.example/1", "Press conference", 75.4, "2023-11-20");
        QuestionSource article = new QuestionSource(SourceType.ARTICLE, "https://news.example/a", "Profile", null, null);
        List<QuestionRecord> records = List.of(
                new QuestionRecord(0L, "virat_kohli", "What inspired you?", List.of(video), NOW),
                new QuestionRecord(1L, "virat_kohli", "Who was your hero?", List.of(article), NOW),
                new QuestionRecord(2L, "virat_kohli", "How do you handle pressure?", List.of(video, article), NOW));

        String markdown = new MarkdownQuestionReport().render("Virat Kohli", records);

        assertTrue(markdown.startsWith("# Interview questions: Virat Kohli\n"));
        assertTrue(markdown.contains("_3 questions from 2 sources_"));
        assertTrue(markdown.contains("## Press conference\n\nSource: <https://video.example/1> (VIDEO, 2023-11-20)"));
        assertTrue(markdown.contains("- [01:15] What inspired you?\n- [01:15] How do you handle pressure?\n"));
        assertTrue(markdown.contains("## Profile\n\nSource: <https://news.example/a> (ARTICLE)\n\n- Who was your hero?\n- How do you handle pressure?\n"));
    }

    @Test
    void shouldFormatTimestampsAsMinutesAndSeconds() {
        assertEquals("00:00", MarkdownQuestionReport.timestamp(0.4));
        assertEquals("02:05", MarkdownQuestionReport.timestamp(125.9));
        assertEquals("75:03", MarkdownQuestionReport.timestamp(4503));
    }

    @Test
    void shouldSayWhenNothingIsIndexed() {
        assertTrue(new MarkdownQuestionReport().render("Nobody", List.of()).contains("No questions indexed."));
    }
}

package com.interviewindex.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Per-subject list of interviews to ingest, read from YAML (or JSON, which YAML accepts):
 *
 * <pre>
 * subjects:
 *   Virat Kohli:
 *     videos:
 *       - url: https://www.youtube.com/watch?v=abc
 *         title: Press conference
 *     articles:
 *       - url: https://example.com/interview
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SourceCatalog {
    private Map<String, SubjectSources> subjects = new LinkedHashMap<>();

    public static SourceCatalog load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return new SourceCatalog();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        SourceCatalog catalog = mapper.readValue(path.toFile(), SourceCatalog.class);
        return catalog == null ? new SourceCatalog() : catalog;
    }

    /**
     * Sources listed for {@code subjectName}, matched case-insensitively; empty when the
     * subject is not catalogued.
     */
    public List<InterviewSource> sourcesFor(String subjectName) {
        SubjectSources entry = subjects.get(subjectName);
        if (entry == null) {
            entry = subjects.entrySet().stream()
                    .filter(candidate -> candidate.getKey().equalsIgnoreCase(subjectName.strip()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null);
        }
        if (entry == null) {
            return List.of();
        }
        List<InterviewSource> sources = new ArrayList<>();
        for (SourceEntry video : entry.getVideos()) {
            sources.add(new VideoSource(video.getUrl(), video.titleOrUrl(), video.getDate()));
        }
        for (SourceEntry audio : entry.getAudio()) {
            sources.add(new AudioSource(audio.getUrl(), audio.titleOrUrl(), audio.getDate()));
        }
        for (SourceEntry article : entry.getArticles()) {
            sources.add(new ArticleSource(article.getUrl(), article.titleOrUrl(), article.getDate()));
        }
        return sources;
    }

    public Map<String, SubjectSources> getSubjects() {
        return subjects;
    }

    public void setSubjects(Map<String, SubjectSources> subjects) {
        this.subjects = subjects == null ? new LinkedHashMap<>() : subjects;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SubjectSources {
        private List<SourceEntry> videos = new ArrayList<>();
        private List<SourceEntry> audio = new ArrayList<>();
        private List<SourceEntry> articles = new ArrayList<>();

        public List<SourceEntry> getVideos() {
            return videos;
        }

        public void setVideos(List<SourceEntry> videos) {
            this.videos = videos == null ? new ArrayList<>() : videos;
        }

        public List<SourceEntry> getAudio() {
            return audio;
        }

        public void setAudio(List<SourceEntry> audio) {
            this.audio = audio == null ? new ArrayList<>() : audio;
        }

        public List<SourceEntry> getArticles() {
            return articles;
        }

        public void setArticles(List<SourceEntry> articles) {
            this.articles = articles == null ? new ArrayList<>() : articles;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SourceEntry {
        private String url;
        private String title;
        private String date;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getDate() {
            return date;
        }

        public void setDate(String date) {
            this.date = date;
        }

        String titleOrUrl() {
            return title == null || title.isBlank() ? url : title;
        }
    }
}

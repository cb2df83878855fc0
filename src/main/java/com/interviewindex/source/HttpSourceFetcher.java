package com.interviewindex.source;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Fetches article text over HTTP(S), or from disk for {@code file:} URLs. HTML bodies are
 * reduced to their visible text.
 */
public class HttpSourceFetcher implements SourceFetcher {
    private static final String USER_AGENT = "interview-index/0.1";
    private static final String BLOCKS = "p, div, li, br, h1, h2, h3, h4, h5, h6, blockquote, tr";

    private final OkHttpClient httpClient;

    public HttpSourceFetcher(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String fetch(String urlOrFeed) throws SourceUnavailableException {
        if (urlOrFeed.startsWith("file:")) {
            return readLocal(urlOrFeed);
        }
        Request request = new Request.Builder()
                .url(urlOrFeed)
                .header("User-Agent", USER_AGENT)
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new SourceUnavailableException(urlOrFeed, "HTTP " + response.code() + " fetching " + urlOrFeed);
            }
            String body = response.body().string();
            String contentType = response.header("Content-Type", "");
            return contentType.contains("html") ? toText(body) : body;
        } catch (IOException | IllegalArgumentException e) {
            throw new SourceUnavailableException(urlOrFeed, "Unable to fetch " + urlOrFeed, e);
        }
    }

    private String readLocal(String fileUrl) throws SourceUnavailableException {
        try {
            Path path = Path.of(URI.create(fileUrl));
            String content = Files.readString(path);
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            return name.endsWith(".html") || name.endsWith(".htm") ? toText(content) : content;
        } catch (IOException | IllegalArgumentException e) {
            throw new SourceUnavailableException(fileUrl, "Unable to read " + fileUrl, e);
        }
    }

    /**
     * Visible text of an HTML page with one line per block element, so sentence splitting
     * does not run paragraphs together.
     */
    static String toText(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);
        document.select("script, style, noscript").remove();
        for (Element block : document.select(BLOCKS)) {
            block.after(new TextNode("\n"));
        }
        Element body = document.body();
        String text = body == null ? document.wholeText() : body.wholeText();
        return text.replaceAll("[ \\t\\x0B\\f]+", " ")
                .replaceAll(" *\\n\\s*", "\n")
                .trim();
    }
}

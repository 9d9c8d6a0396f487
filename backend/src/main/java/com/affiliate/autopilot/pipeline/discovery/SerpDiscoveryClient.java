package com.affiliate.autopilot.pipeline.discovery;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.http.PlatformHttpClient;
import com.affiliate.autopilot.pipeline.http.PlatformHttpResult;
import com.affiliate.autopilot.pipeline.model.DiscoveredThread;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds platform threads through a search engine result page restricted to the platform
 * site, parsed with jsoup.
 */
@Service
public class SerpDiscoveryClient implements DiscoveryClient {
    private static final Logger log = LoggerFactory.getLogger(SerpDiscoveryClient.class);
    private static final Pattern THREAD_URL = Pattern.compile(
        "^https?://([a-z0-9-]+\\.)?reddit\\.com/r/[^/]+/comments/[a-z0-9]+.*",
        Pattern.CASE_INSENSITIVE
    );
    private static final String SNIPPET_SELECTOR = "div.VwiC3b, span.st, div.s, div[data-sncf], div.snippet";

    private final PlatformHttpClient httpClient;
    private final AutopilotProperties properties;

    public SerpDiscoveryClient(PlatformHttpClient httpClient, AutopilotProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public List<DiscoveredThread> search(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return List.of();
        }
        AutopilotProperties.Discovery discovery = properties.getDiscovery();
        String query = "site:" + discovery.getSiteFilter() + " " + keyword.trim();
        String url = discovery.getSearchUrl()
            + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
            + "&num=" + discovery.getResultsPerKeyword();
        PlatformHttpResult result = httpClient.get(url, "text/html", Map.of());
        if (!result.isSuccessful() || result.body() == null) {
            log.warn("Search for keyword '{}' failed: {}", keyword, result.failureCode());
            return List.of();
        }
        return parseResults(result.body(), discovery.getSearchUrl(), discovery.getResultsPerKeyword());
    }

    List<DiscoveredThread> parseResults(String html, String baseUri, int limit) {
        Document document = Jsoup.parse(html, baseUri);
        Set<String> seen = new LinkedHashSet<>();
        List<DiscoveredThread> threads = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            if (threads.size() >= limit) {
                break;
            }
            String target = unwrapRedirect(anchor.attr("href"));
            if (target == null || !THREAD_URL.matcher(target).matches() || !seen.add(stripQuery(target))) {
                continue;
            }
            String title = titleOf(anchor);
            if (title.isEmpty()) {
                continue;
            }
            threads.add(new DiscoveredThread(stripQuery(target), title, snippetOf(anchor, title), threads.size() + 1));
        }
        return threads;
    }

    static String unwrapRedirect(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String value = href.trim();
        if (value.startsWith("/url?")) {
            for (String pair : value.substring("/url?".length()).split("&")) {
                if (pair.startsWith("q=") || pair.startsWith("url=")) {
                    return URLDecoder.decode(pair.substring(pair.indexOf('=') + 1), StandardCharsets.UTF_8);
                }
            }
            return null;
        }
        return value;
    }

    private static String stripQuery(String url) {
        int cut = url.indexOf('?');
        if (cut < 0) {
            cut = url.indexOf('#');
        }
        return cut < 0 ? url : url.substring(0, cut);
    }

    private static String titleOf(Element anchor) {
        Element heading = anchor.selectFirst("h3");
        String title = heading != null ? heading.text() : anchor.text();
        return title == null ? "" : title.trim();
    }

    private static String snippetOf(Element anchor, String title) {
        Element container = anchor.closest("div.g");
        if (container == null) {
            container = anchor.parent() != null && anchor.parent().parent() != null
                ? anchor.parent().parent()
                : anchor.parent();
        }
        if (container == null) {
            return "";
        }
        Element snippet = container.selectFirst(SNIPPET_SELECTOR);
        if (snippet != null) {
            return snippet.text().trim();
        }
        String text = container.text();
        return text.replace(title, "").replace(anchor.text(), "").trim();
    }
}

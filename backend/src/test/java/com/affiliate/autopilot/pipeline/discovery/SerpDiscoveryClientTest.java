package com.affiliate.autopilot.pipeline.discovery;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.http.PlatformHttpClient;
import com.affiliate.autopilot.pipeline.model.DiscoveredThread;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SerpDiscoveryClientTest {
    private static final String RESULTS_PAGE = """
        <html><body>
          <div class="g">
            <a href="/url?q=https://www.reddit.com/r/Fitness/comments/abc123/best_tracker/%3Futm_source%3Dx&amp;sa=U">
              <h3>Best fitness tracker for running?</h3>
            </a>
            <div class="VwiC3b">I run 30km a week and want something accurate.</div>
          </div>
          <div class="g">
            <a href="https://www.reddit.com/r/Fitness/">
              <h3>r/Fitness community page</h3>
            </a>
            <div class="VwiC3b">Not a thread.</div>
          </div>
          <div class="g">
            <a href="https://old.reddit.com/r/running/comments/xyz789/garmin_vs_polar/">
              <h3>Garmin vs Polar</h3>
            </a>
            <div class="VwiC3b">Which one has better GPS?</div>
          </div>
          <div class="g">
            <a href="https://www.reddit.com/r/Fitness/comments/abc123/best_tracker/">
              <h3>Best fitness tracker for running? (duplicate)</h3>
            </a>
          </div>
          <div class="g">
            <a href="https://example.com/blog/trackers"><h3>Blog post</h3></a>
          </div>
        </body></html>
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private AutopilotProperties properties;
    private SerpDiscoveryClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new AutopilotProperties();
        properties.getDiscovery().setSearchUrl(server.url("/search").toString());
        properties.getDiscovery().setSiteFilter("reddit.com");
        properties.getDiscovery().setResultsPerKeyword(10);
        properties.getPlatform().setRequestTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(1);
        client = new SerpDiscoveryClient(new PlatformHttpClient(properties, executor), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void keepsOnlyThreadLinksRankedInPageOrder() {
        List<DiscoveredThread> threads = client.parseResults(RESULTS_PAGE, "https://www.google.com/search", 10);

        assertThat(threads).hasSize(2);
        DiscoveredThread first = threads.get(0);
        assertThat(first.url()).isEqualTo("https://www.reddit.com/r/Fitness/comments/abc123/best_tracker/");
        assertThat(first.title()).isEqualTo("Best fitness tracker for running?");
        assertThat(first.snippet()).isEqualTo("I run 30km a week and want something accurate.");
        assertThat(first.rank()).isEqualTo(1);
        assertThat(threads.get(1).url()).isEqualTo("https://old.reddit.com/r/running/comments/xyz789/garmin_vs_polar/");
        assertThat(threads.get(1).rank()).isEqualTo(2);
    }

    @Test
    void respectsResultLimit() {
        List<DiscoveredThread> threads = client.parseResults(RESULTS_PAGE, "https://www.google.com/search", 1);

        assertThat(threads).extracting(DiscoveredThread::rank).containsExactly(1);
    }

    @Test
    void searchRestrictsQueryToConfiguredSite() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(RESULTS_PAGE));

        List<DiscoveredThread> threads = client.search("fitness tracker");

        assertThat(threads).hasSize(2);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getRequestUrl().queryParameter("q")).isEqualTo("site:reddit.com fitness tracker");
        assertThat(request.getRequestUrl().queryParameter("num")).isEqualTo("10");
    }

    @Test
    void failedSearchYieldsNoThreads() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThat(client.search("fitness tracker")).isEmpty();
    }

    @Test
    void unwrapsSearchRedirects() {
        assertThat(SerpDiscoveryClient.unwrapRedirect("/url?q=https%3A%2F%2Fwww.reddit.com%2Fr%2Fa%2Fcomments%2F1%2Fx&sa=U"))
            .isEqualTo("https://www.reddit.com/r/a/comments/1/x");
        assertThat(SerpDiscoveryClient.unwrapRedirect("/url?sa=U")).isNull();
        assertThat(SerpDiscoveryClient.unwrapRedirect("https://example.com")).isEqualTo("https://example.com");
    }
}

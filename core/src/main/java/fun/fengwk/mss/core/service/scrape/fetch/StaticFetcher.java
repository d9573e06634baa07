package fun.fengwk.mss.core.service.scrape.fetch;

import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.error.FetchException;
import fun.fengwk.mss.core.service.scrape.model.ErrorRecord;
import fun.fengwk.mss.core.service.scrape.model.PageSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Single plain http GET of the target page, without retries.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class StaticFetcher {

    private final ScrapeProperties scrapeProperties;
    private final HttpClient httpClient;

    public StaticFetcher(ScrapeProperties scrapeProperties) {
        this.scrapeProperties = scrapeProperties;
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(resolveTimeoutMs()))
            .build();
    }

    public PageSnapshot fetch(String url) {
        long startAt = System.currentTimeMillis();
        try {
            String html = doFetch(url);
            log.debug("static fetch done, url={}, length={}, elapsedMs={}",
                url, html.length(), System.currentTimeMillis() - startAt);
            return PageSnapshot.success(url, html);
        } catch (FetchException ex) {
            log.debug("static fetch failed, url={}, elapsedMs={}, error={}",
                url, System.currentTimeMillis() - startAt, ex.getMessage());
            return PageSnapshot.failed(url, ErrorRecord.from(ex));
        }
    }

    private String doFetch(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                .GET()
                .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
                .header("User-Agent", scrapeProperties.getUserAgent())
                .timeout(Duration.ofMillis(resolveTimeoutMs()))
                .build();
        } catch (IllegalArgumentException ex) {
            throw new FetchException("static fetch failed: invalid url " + url, ex);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException ex) {
            throw new FetchException("static fetch timed out after " + resolveTimeoutMs() + "ms", ex);
        } catch (IOException ex) {
            throw new FetchException("static fetch failed: " + describe(ex), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FetchException("static fetch interrupted", ex);
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            throw new FetchException("static fetch failed: http status " + statusCode);
        }
        return response.body() == null ? "" : response.body();
    }

    private int resolveTimeoutMs() {
        return Math.max(1, scrapeProperties.getStaticFetchTimeoutMs());
    }

    private String describe(IOException ex) {
        String message = ex.getMessage();
        return StringUtils.hasText(message) ? message : ex.getClass().getSimpleName();
    }

}

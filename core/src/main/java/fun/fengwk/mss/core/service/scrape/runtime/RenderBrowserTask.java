package fun.fengwk.mss.core.service.scrape.runtime;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.mss.core.service.browser.runtime.BrowserRuntimeContext;
import fun.fengwk.mss.core.service.browser.runtime.BrowserTask;
import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.error.RenderException;
import fun.fengwk.mss.core.service.scrape.error.ScrapeStageException;
import fun.fengwk.mss.core.service.scrape.model.PageSnapshot;
import fun.fengwk.mss.core.service.scrape.model.SnapshotStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Browser task that renders one url and runs the interactive crawl on it.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class RenderBrowserTask implements BrowserTask<RenderOutcome> {

    private final String url;
    private final ScrapeProperties scrapeProperties;
    private final InteractionController interactionController;

    @Override
    public RenderOutcome execute(BrowserRuntimeContext context) {
        Page page = context.getPage();
        navigate(page);

        PageDriver driver = createDriver(page);
        try {
            driver.awaitSettled(scrapeProperties.getSettleDelayMs());
        } catch (ScrapeStageException ex) {
            // Settling is best-effort, the page is already loaded.
            log.debug("render settle failed, url={}, error={}", url, ex.getMessage());
        }

        CrawlOutcome crawl = interactionController.crawl(driver);
        boolean captured = crawl.captures().stream().anyMatch(PageSnapshot::isSuccess);
        SnapshotStatus status;
        if (!captured) {
            status = SnapshotStatus.FAILED;
        } else if (crawl.issues().isEmpty()) {
            status = SnapshotStatus.SUCCESS;
        } else {
            status = SnapshotStatus.PARTIAL;
        }

        return RenderOutcome.builder()
            .url(url)
            .status(status)
            .captures(crawl.captures())
            .interactions(crawl.summary())
            .issues(crawl.issues())
            .build();
    }

    protected PageDriver createDriver(Page page) {
        return new PlaywrightPageDriver(page, scrapeProperties);
    }

    private void navigate(Page page) {
        Response response;
        try {
            response = page.navigate(url,
                new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.NETWORKIDLE)
                    .setTimeout((double) scrapeProperties.getNavigateTimeoutMs())
            );
        } catch (TimeoutError ex) {
            throw new RenderException("navigation timed out after " + scrapeProperties.getNavigateTimeoutMs() + "ms", ex);
        } catch (PlaywrightException ex) {
            throw new RenderException("navigation failed: " + ex.getMessage(), ex);
        }
        // An error page is not a render of the requested url.
        if (response != null && !PlaywrightPageDriver.isSuccessStatus(response.status())) {
            throw new RenderException("navigation failed: http status " + response.status());
        }
    }

}
